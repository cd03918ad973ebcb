/*
 * This file is part of EthFacade
 * Copyright (C) 2026 EthFacade contributors
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.ethfacade.rpc.modules.eth;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Node information exposed under the eth namespace.
 */
public interface EthInfoModule {

    String protocolVersion();

    /**
     * @return the chain id as a quantity, or null when the node has none configured.
     */
    String chainId();

    List<String> accounts();

    String gasPrice();

    /**
     * Completes with {@code false} when the node is not syncing, or with a
     * {@link co.ethfacade.rpc.dto.SyncingResult} otherwise.
     */
    CompletableFuture<Object> syncing();
}
