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

import co.ethfacade.core.CallRequest;
import co.ethfacade.core.TransactionRequest;
import co.ethfacade.rpc.BlockRef;

import java.util.concurrent.CompletableFuture;

/**
 * Write path of the eth namespace: transaction submission and sandboxed execution.
 */
public interface EthWriteModule {

    CompletableFuture<String> sendTransaction(TransactionRequest request);

    CompletableFuture<String> sendRawTransaction(byte[] rawData);

    CompletableFuture<String> call(CallRequest call, BlockRef blockRef);

    CompletableFuture<String> estimateGas(CallRequest call, BlockRef blockRef);
}
