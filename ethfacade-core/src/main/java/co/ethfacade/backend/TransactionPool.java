/*
 * This file is part of EthFacade
 * Copyright (C) 2017 RSK Labs Ltd.
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
import co.ethfacade.core.Transaction;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

public interface TransactionPool {

    List<Transaction> getPendingTransactions();

    Optional<Transaction> getPendingTransaction(Keccak256 hash);

    /**
     * @return the next nonce for the sender, counting its pooled transactions.
     */
    BigInteger getPendingNonce(Address sender);

    PoolAdmission addTransaction(Transaction transaction);

    /**
     * Decodes, validates and admits a signed transaction. The bytes are never altered.
     */
    PoolAdmission addRawTransaction(byte[] rawTransaction);
}
