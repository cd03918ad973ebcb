/*
 * This file is part of EthFacade
 * Copyright (C) 2019 RSK Labs Ltd.
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
import co.ethfacade.core.BlockHeader;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.Transaction;
import co.ethfacade.util.HexUtils;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class BlockResultDTO {
    private final String number; // QUANTITY - the block number.
    private final String hash; // DATA, 32 Bytes - hash of the block. null when its pending block.
    private final String parentHash; // DATA, 32 Bytes - hash of the parent block.
    private final String nonce; // DATA, 8 Bytes - hash of the generated proof-of-work. null when its pending block.
    private final String mixHash; // DATA, 32 Bytes - mix digest of the proof-of-work.
    private final String sha3Uncles; // DATA, 32 Bytes - SHA3 of the uncles data in the block.
    private final String logsBloom; // DATA, 256 Bytes - the bloom filter for the logs of the block.
    private final String transactionsRoot; // DATA, 32 Bytes - the root of the transaction trie of the block.
    private final String stateRoot; // DATA, 32 Bytes - the root of the final state trie of the block.
    private final String receiptsRoot; // DATA, 32 Bytes - the root of the receipts trie of the block.
    private final String miner; // DATA, 20 Bytes - the address of the beneficiary to whom the mining rewards were given. null when its pending block.
    private final String difficulty; // QUANTITY - integer of the difficulty for this block.
    private final String totalDifficulty; // QUANTITY - integer of the total difficulty of the chain until this block.
    private final String extraData; // DATA - the "extra data" field of this block
    private final String size; // QUANTITY - integer the size of this block in bytes.
    private final String gasLimit; // QUANTITY - the maximum gas allowed in this block.
    private final String gasUsed; // QUANTITY - the total used gas by all transactions in this block.
    private final String timestamp; // QUANTITY - the unix timestamp for when the block was collated.
    private final List<Object> transactions; // Collection of transaction objects, or 32 Bytes transaction hashes depending on the last given parameter.
    private final List<String> uncles; // Collection of uncle hashes.

    private BlockResultDTO(BlockHeader header, boolean pending, BigInteger totalDifficulty, Long size,
                           List<Object> transactions, List<String> uncles) {
        this.number = HexUtils.toQuantityJsonHex(header.getNumber());
        this.hash = pending ? null : header.getHash().toJsonString();
        this.parentHash = header.getParentHash().toJsonString();
        this.nonce = pending ? null : HexUtils.toUnformattedJsonHex(header.getNonce());
        this.mixHash = header.getMixHash().toJsonString();
        this.sha3Uncles = header.getUnclesHash().toJsonString();
        this.logsBloom = HexUtils.toUnformattedJsonHex(header.getLogsBloom());
        this.transactionsRoot = header.getTxTrieRoot().toJsonString();
        this.stateRoot = header.getStateRoot().toJsonString();
        this.receiptsRoot = header.getReceiptTrieRoot().toJsonString();
        this.miner = pending ? null : header.getCoinbase().toJsonString();
        this.difficulty = HexUtils.toQuantityJsonHex(header.getDifficulty());
        this.totalDifficulty = totalDifficulty != null ? HexUtils.toQuantityJsonHex(totalDifficulty) : null;
        this.extraData = HexUtils.toUnformattedJsonHex(header.getExtraData());
        this.size = size != null ? HexUtils.toQuantityJsonHex(size) : null;
        this.gasLimit = HexUtils.toQuantityJsonHex(header.getGasLimit());
        this.gasUsed = HexUtils.toQuantityJsonHex(header.getGasUsed());
        this.timestamp = HexUtils.toQuantityJsonHex(header.getTimestamp());
        this.transactions = Collections.unmodifiableList(transactions);
        this.uncles = Collections.unmodifiableList(uncles);
    }

    public static BlockResultDTO fromBlock(Block b, boolean fullTx, boolean pending) {
        if (b == null) {
            return null;
        }

        List<Transaction> blockTransactions = b.getTransactionsList();
        // For full tx will present as TransactionResultDTO otherwise just as transaction hash
        List<Object> transactions = IntStream.range(0, blockTransactions.size())
                .mapToObj(txIndex -> toTransactionResult(txIndex, b, fullTx, pending))
                .collect(Collectors.toList());

        List<String> uncles = b.getUncleList().stream()
                .map(BlockHeader::getHash)
                .map(Keccak256::toJsonString)
                .collect(Collectors.toList());

        return new BlockResultDTO(b.getHeader(), pending, b.getTotalDifficulty(), b.getSize(), transactions, uncles);
    }

    /**
     * Uncles are rendered from their header only: no transactions, no uncles and no size.
     */
    public static BlockResultDTO fromUncleHeader(BlockHeader uncle) {
        return new BlockResultDTO(uncle, false, null, null, Collections.emptyList(), Collections.emptyList());
    }

    private static Object toTransactionResult(int transactionIndex, Block block, boolean fullTx, boolean pending) {
        Transaction tx = block.getTransactionsList().get(transactionIndex);

        if (fullTx) {
            return pending ? TransactionResultDTO.pooled(tx) : new TransactionResultDTO(block, transactionIndex, tx);
        }

        return tx.getHash().toJsonString();
    }

    public String getNumber() {
        return number;
    }

    public String getHash() {
        return hash;
    }

    public String getParentHash() {
        return parentHash;
    }

    public String getNonce() {
        return nonce;
    }

    public String getMixHash() {
        return mixHash;
    }

    public String getSha3Uncles() {
        return sha3Uncles;
    }

    public String getLogsBloom() {
        return logsBloom;
    }

    public String getTransactionsRoot() {
        return transactionsRoot;
    }

    public String getStateRoot() {
        return stateRoot;
    }

    public String getReceiptsRoot() {
        return receiptsRoot;
    }

    public String getMiner() {
        return miner;
    }

    public String getDifficulty() {
        return difficulty;
    }

    public String getTotalDifficulty() {
        return totalDifficulty;
    }

    public String getExtraData() {
        return extraData;
    }

    public String getSize() {
        return size;
    }

    public String getGasLimit() {
        return gasLimit;
    }

    public String getGasUsed() {
        return gasUsed;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public List<Object> getTransactions() {
        return transactions;
    }

    public List<String> getUncles() {
        return uncles;
    }
}
