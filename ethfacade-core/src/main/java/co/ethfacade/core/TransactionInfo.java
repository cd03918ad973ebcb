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

/**
 * Locates a transaction receipt inside the block that included it.
 */
public class TransactionInfo {

    private final TransactionReceipt receipt;
    private final Keccak256 blockHash;
    private final int index;

    public TransactionInfo(TransactionReceipt receipt, Keccak256 blockHash, int index) {
        this.receipt = receipt;
        this.blockHash = blockHash;
        this.index = index;
    }

    public TransactionReceipt getReceipt() {
        return receipt;
    }

    public Keccak256 getBlockHash() {
        return blockHash;
    }

    public int getIndex() {
        return index;
    }
}
