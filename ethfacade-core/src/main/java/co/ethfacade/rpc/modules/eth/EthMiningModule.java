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

import co.ethfacade.core.Keccak256;

import java.math.BigInteger;

/**
 * Mining namespace of eth. Answers immediately, without worker dispatch.
 */
public interface EthMiningModule {

    String hashrate();

    boolean submitHashrate(BigInteger hashrate, Keccak256 clientId);

    /**
     * @return the current work package as [powHash, seedHash, target], or null when no job is available.
     */
    String[] getWork();

    boolean submitWork(byte[] nonce, Keccak256 powHash, Keccak256 mixDigest);

    boolean mining();

    String coinbase();
}
