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

import co.ethfacade.core.Block;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.SyncStatus;
import co.ethfacade.core.TransactionInfo;
import co.ethfacade.core.TransactionReceipt;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the chain history kept by the node.
 *
 * Implementations may block on storage. Failures other than absence are reported with
 * {@link BackendException}.
 */
public interface ChainHistory {

    /**
     * @return the current canonical head.
     */
    Block getBestBlock();

    /**
     * @return the canonical block at the given height, if any.
     */
    Optional<Block> getBlockByNumber(long number);

    /**
     * @return any known block with the given hash, canonical or not.
     */
    Optional<Block> getBlockByHash(Keccak256 hash);

    /**
     * @return the block under construction, if the node builds one.
     */
    Optional<Block> getPendingBlock();

    /**
     * @return the lowest block height whose body and state are still retained.
     */
    long getLowestRetainedNumber();

    /**
     * @return where the transaction was included on the canonical chain, if it was.
     */
    Optional<TransactionInfo> getTransactionInfo(Keccak256 transactionHash);

    /**
     * @return the receipts of the block transactions, in transaction order.
     */
    List<TransactionReceipt> getReceipts(Block block);

    SyncStatus getSyncStatus();
}
