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

package co.ethfacade.rpc.dto;

import co.ethfacade.core.Block;
import co.ethfacade.core.LogInfo;
import co.ethfacade.core.Transaction;
import co.ethfacade.util.HexUtils;

import java.util.Arrays;

/**
 * Log object. logIndex is the position of the log in the block, transactionLogIndex its position in the transaction.
 */
public class LogFilterElement {
    public final String logIndex;
    public final String transactionLogIndex;
    public final String blockNumber;
    public final String blockHash;
    public final String transactionHash;
    public final String transactionIndex;
    public final String address;
    public final String data;
    public final String[] topics;
    public final boolean removed;

    public LogFilterElement(LogInfo logInfo, Block b, int txIndex, Transaction tx, int blockLogIdx, int txLogIdx) {
        logIndex = HexUtils.toQuantityJsonHex(blockLogIdx);
        transactionLogIndex = HexUtils.toQuantityJsonHex(txLogIdx);
        blockNumber = b == null ? null : HexUtils.toQuantityJsonHex(b.getNumber());
        blockHash = b == null ? null : b.getHashJsonString();
        transactionIndex = b == null ? null : HexUtils.toQuantityJsonHex(txIndex);
        transactionHash = tx.getHash().toJsonString();
        address = logInfo.getAddress().toJsonString();
        data = HexUtils.toUnformattedJsonHex(logInfo.getData());
        topics = new String[logInfo.getTopics().size()];
        for (int i = 0; i < topics.length; i++) {
            topics[i] = logInfo.getTopics().get(i).toJsonString();
        }
        removed = false;
    }

    @Override
    public String toString() {
        return "LogFilterElement{" +
                "logIndex='" + logIndex + '\'' +
                ", transactionLogIndex='" + transactionLogIndex + '\'' +
                ", blockNumber='" + blockNumber + '\'' +
                ", blockHash='" + blockHash + '\'' +
                ", transactionHash='" + transactionHash + '\'' +
                ", transactionIndex='" + transactionIndex + '\'' +
                ", address='" + address + '\'' +
                ", data='" + data + '\'' +
                ", topics=" + Arrays.toString(topics) +
                '}';
    }
}
