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

package co.ethfacade.backend;

import co.ethfacade.core.Address;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.Work;

import java.math.BigInteger;
import java.util.Optional;

public interface MiningCoordinator {

    BigInteger getHashrate();

    boolean submitHashrate(BigInteger hashrate, Keccak256 clientId);

    /**
     * @return the job miners should work on now, empty when the node isn't mining.
     */
    Optional<Work> getWork();

    /**
     * @return true only if the solution is valid for the current job.
     */
    boolean submitWork(byte[] nonce, Keccak256 powHash, Keccak256 mixDigest);

    boolean isMining();

    Address getCoinbase();
}
