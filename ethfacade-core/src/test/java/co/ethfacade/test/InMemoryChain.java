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

package co.ethfacade.test;

import co.ethfacade.backend.AccountStateSnapshot;
import co.ethfacade.backend.ChainHistory;
import co.ethfacade.backend.ChainState;
import co.ethfacade.core.Block;
import co.ethfacade.core.BlockHeader;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.SyncStatus;
import co.ethfacade.core.Transaction;
import co.ethfacade.core.TransactionInfo;
import co.ethfacade.core.TransactionReceipt;
import co.ethfacade.test.builders.BlockBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A chain backend kept in memory for tests. It starts with a genesis block whose state is empty.
 */
public class InMemoryChain implements ChainHistory, ChainState {

    private final List<Block> canonical = new ArrayList<>();
    private final Map<Keccak256, Block> blocks = new HashMap<>();
    private final Map<Keccak256, List<TransactionReceipt>> receipts = new HashMap<>();
    private final Map<Keccak256, AccountStateSnapshot> states = new HashMap<>();

    private Block pendingBlock;
    private AccountStateSnapshot pendingState;
    private long lowestRetainedNumber;
    private SyncStatus syncStatus = SyncStatus.notSyncing();

    public InMemoryChain() {
        appendBlock(new BlockBuilder().build(), Collections.emptyList(), InMemoryAccountState.empty());
    }

    public synchronized Block appendBlock(Block block, List<TransactionReceipt> blockReceipts, AccountStateSnapshot state) {
        canonical.add(block);
        blocks.put(block.getHash(), block);
        receipts.put(block.getHash(), blockReceipts);
        if (state != null) {
            states.put(block.getHash(), state);
        }
        return block;
    }

    /**
     * Builds and appends an empty block on top of the current head, keeping the head state.
     */
    public synchronized Block appendEmptyBlock() {
        Block best = getBestBlock();
        Block block = new BlockBuilder().parent(best).build();
        return appendBlock(block, Collections.emptyList(), states.get(best.getHash()));
    }

    public synchronized void addSideBlock(Block block, List<TransactionReceipt> blockReceipts, AccountStateSnapshot state) {
        blocks.put(block.getHash(), block);
        receipts.put(block.getHash(), blockReceipts);
        if (state != null) {
            states.put(block.getHash(), state);
        }
    }

    public synchronized void removeState(Block block) {
        states.remove(block.getHash());
    }

    public synchronized void setPending(Block block, AccountStateSnapshot state) {
        this.pendingBlock = block;
        this.pendingState = state;
    }

    public synchronized void setLowestRetainedNumber(long lowestRetainedNumber) {
        this.lowestRetainedNumber = lowestRetainedNumber;
    }

    public synchronized void setSyncStatus(SyncStatus syncStatus) {
        this.syncStatus = syncStatus;
    }

    public synchronized Block getGenesis() {
        return canonical.get(0);
    }

    @Override
    public synchronized Block getBestBlock() {
        return canonical.get(canonical.size() - 1);
    }

    @Override
    public synchronized Optional<Block> getBlockByNumber(long number) {
        if (number < 0 || number >= canonical.size()) {
            return Optional.empty();
        }
        return Optional.of(canonical.get((int) number));
    }

    @Override
    public synchronized Optional<Block> getBlockByHash(Keccak256 hash) {
        return Optional.ofNullable(blocks.get(hash));
    }

    @Override
    public synchronized Optional<Block> getPendingBlock() {
        return Optional.ofNullable(pendingBlock);
    }

    @Override
    public synchronized long getLowestRetainedNumber() {
        return lowestRetainedNumber;
    }

    @Override
    public synchronized Optional<TransactionInfo> getTransactionInfo(Keccak256 transactionHash) {
        for (Block block : canonical) {
            List<Transaction> txs = block.getTransactionsList();
            for (int i = 0; i < txs.size(); i++) {
                if (txs.get(i).getHash().equals(transactionHash)) {
                    TransactionReceipt receipt = receipts.get(block.getHash()).get(i);
                    return Optional.of(new TransactionInfo(receipt, block.getHash(), i));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<TransactionReceipt> getReceipts(Block block) {
        return receipts.getOrDefault(block.getHash(), Collections.emptyList());
    }

    @Override
    public synchronized SyncStatus getSyncStatus() {
        return syncStatus;
    }

    @Override
    public synchronized Optional<AccountStateSnapshot> snapshotAt(BlockHeader header) {
        return Optional.ofNullable(states.get(header.getHash()));
    }

    @Override
    public synchronized Optional<AccountStateSnapshot> getPendingSnapshot() {
        return Optional.ofNullable(pendingState);
    }
}
