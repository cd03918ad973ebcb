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
import java.util.Collections;
import java.util.List;

/**
 * The outcome of executing a transaction included in a block.
 */
public class TransactionReceipt {

    private final Transaction transaction;
    private final boolean successful;
    private final long cumulativeGas;
    private final long gasUsed;
    private final List<LogInfo> logInfoList;
    private final byte[] bloomFilter;
    @Nullable
    private final Address contractAddress;

    public TransactionReceipt(Transaction transaction, boolean successful, long cumulativeGas, long gasUsed,
                              List<LogInfo> logInfoList, byte[] bloomFilter, @Nullable Address contractAddress) {
        this.transaction = transaction;
        this.successful = successful;
        this.cumulativeGas = cumulativeGas;
        this.gasUsed = gasUsed;
        this.logInfoList = Collections.unmodifiableList(logInfoList);
        this.bloomFilter = bloomFilter;
        this.contractAddress = contractAddress;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public long getCumulativeGas() {
        return cumulativeGas;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public List<LogInfo> getLogInfoList() {
        return logInfoList;
    }

    public byte[] getBloomFilter() {
        return bloomFilter;
    }

    @Nullable
    public Address getContractAddress() {
        return contractAddress;
    }
}
