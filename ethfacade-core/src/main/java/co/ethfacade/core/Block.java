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

package co.ethfacade.core;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * A block: its header, its transactions in execution order and its uncle headers.
 * A pending block may carry no stable hash.
 */
public class Block {

    private final BlockHeader header;
    private final List<Transaction> transactions;
    private final List<BlockHeader> uncles;
    private final long size;
    @Nullable
    private final BigInteger totalDifficulty;

    public Block(BlockHeader header, List<Transaction> transactions, List<BlockHeader> uncles, long size, @Nullable BigInteger totalDifficulty) {
        this.header = header;
        this.transactions = Collections.unmodifiableList(transactions);
        this.uncles = Collections.unmodifiableList(uncles);
        this.size = size;
        this.totalDifficulty = totalDifficulty;
    }

    public BlockHeader getHeader() {
        return header;
    }

    public long getNumber() {
        return header.getNumber();
    }

    public Keccak256 getHash() {
        return header.getHash();
    }

    public Keccak256 getParentHash() {
        return header.getParentHash();
    }

    public List<Transaction> getTransactionsList() {
        return transactions;
    }

    public List<BlockHeader> getUncleList() {
        return uncles;
    }

    public long getSize() {
        return size;
    }

    @Nullable
    public BigInteger getTotalDifficulty() {
        return totalDifficulty;
    }

    public String getHashJsonString() {
        return header.getHash().toJsonString();
    }

    @Override
    public String toString() {
        return "Block{number=" + getNumber() + ", hash=" + getHash() + ", txs=" + transactions.size() + '}';
    }
}
