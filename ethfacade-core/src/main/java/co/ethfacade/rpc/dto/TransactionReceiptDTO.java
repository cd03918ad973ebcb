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

import co.ethfacade.core.Address;
import co.ethfacade.core.Block;
import co.ethfacade.core.LogInfo;
import co.ethfacade.core.TransactionInfo;
import co.ethfacade.core.TransactionReceipt;
import co.ethfacade.util.HexUtils;

public class TransactionReceiptDTO {
    private static final String TRANSACTION_TYPE = "0x0";

    private final String transactionHash;      // hash of the transaction.
    private final String transactionIndex;     // integer of the transactions index position in the block.
    private final String blockHash;            // hash of the block where this transaction was in.
    private final String blockNumber;          // block number where this transaction was in.
    private final String cumulativeGasUsed;    // The total amount of gas used when this transaction was executed in the block.
    private final String gasUsed;              // The amount of gas used by this specific transaction alone.
    private final String effectiveGasPrice;    // The price paid per unit of gas.
    private final String contractAddress;      // The contract address created, if the transaction was a contract creation, otherwise null.
    private final LogFilterElement[] logs;     // Array of log objects, which this transaction generated.
    private final String from;                 // address of the sender.
    private final String to;                   // address of the receiver. null when it's a contract creation transaction.
    private final String status;               // either 1 (success) or 0 (failure)
    private final String logsBloom;            // Bloom filter for light clients to quickly retrieve related logs.
    private final String type = TRANSACTION_TYPE; // is a positive unsigned 8-bit number that represents the type of the transaction.

    /**
     * @param firstLogIndex position in the block of the first log of this transaction
     */
    public TransactionReceiptDTO(Block block, TransactionInfo txInfo, int firstLogIndex) {
        TransactionReceipt receipt = txInfo.getReceipt();

        status = receipt.isSuccessful() ? "0x1" : "0x0";
        blockHash = txInfo.getBlockHash().toJsonString();
        blockNumber = HexUtils.toQuantityJsonHex(block.getNumber());

        Address createdContract = receipt.getContractAddress();
        contractAddress = createdContract != null ? createdContract.toJsonString() : null;

        cumulativeGasUsed = HexUtils.toQuantityJsonHex(receipt.getCumulativeGas());
        from = receipt.getTransaction().getSender().toJsonString();
        gasUsed = HexUtils.toQuantityJsonHex(receipt.getGasUsed());
        effectiveGasPrice = HexUtils.toQuantityJsonHex(receipt.getTransaction().getGasPrice().asBigInteger());

        logs = new LogFilterElement[receipt.getLogInfoList().size()];
        for (int i = 0; i < logs.length; i++) {
            LogInfo logInfo = receipt.getLogInfoList().get(i);
            logs[i] = new LogFilterElement(logInfo, block, txInfo.getIndex(), receipt.getTransaction(), firstLogIndex + i, i);
        }

        to = receipt.getTransaction().getReceiveAddress().toJsonString();
        transactionHash = receipt.getTransaction().getHash().toJsonString();
        transactionIndex = HexUtils.toQuantityJsonHex(txInfo.getIndex());
        logsBloom = HexUtils.toUnformattedJsonHex(receipt.getBloomFilter());
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public String getTransactionIndex() {
        return transactionIndex;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public String getBlockNumber() {
        return blockNumber;
    }

    public String getCumulativeGasUsed() {
        return cumulativeGasUsed;
    }

    public String getGasUsed() {
        return gasUsed;
    }

    public String getEffectiveGasPrice() {
        return effectiveGasPrice;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public LogFilterElement[] getLogs() {
        return logs.clone();
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getStatus() {
        return status;
    }

    public String getLogsBloom() {
        return logsBloom;
    }

    public String getType() {
        return type;
    }
}
