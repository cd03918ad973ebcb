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

package co.ethfacade.rpc.modules.eth;

import co.ethfacade.backend.AccountStateSnapshot;
import co.ethfacade.backend.ChainHistory;
import co.ethfacade.backend.TransactionPool;
import co.ethfacade.core.Address;
import co.ethfacade.core.Block;
import co.ethfacade.core.BlockHeader;
import co.ethfacade.core.Coin;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.Transaction;
import co.ethfacade.core.TransactionInfo;
import co.ethfacade.core.TransactionReceipt;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.ResolvedState;
import co.ethfacade.rpc.dto.BlockResultDTO;
import co.ethfacade.rpc.dto.LogFilterElement;
import co.ethfacade.rpc.dto.TransactionReceiptDTO;
import co.ethfacade.rpc.dto.TransactionResultDTO;
import co.ethfacade.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

public class EthReadModuleImpl implements EthReadModule {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final ChainHistory chainHistory;
    private final TransactionPool transactionPool;
    private final BlockRefResolver blockRefResolver;
    private final LogRetriever logRetriever;
    private final Executor executor;

    public EthReadModuleImpl(ChainHistory chainHistory, TransactionPool transactionPool,
                             BlockRefResolver blockRefResolver, LogRetriever logRetriever, Executor executor) {
        this.chainHistory = chainHistory;
        this.transactionPool = transactionPool;
        this.blockRefResolver = blockRefResolver;
        this.logRetriever = logRetriever;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> blockNumber() {
        return async(() -> {
            long b = chainHistory.getBestBlock().getNumber();

            logger.debug("eth_blockNumber(): {}", b);

            return HexUtils.toQuantityJsonHex(b);
        });
    }

    @Override
    public CompletableFuture<String> getBalance(Address address, BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                Optional<ResolvedState> resolved = blockRefResolver.resolveState(blockRef);
                if (!resolved.isPresent()) {
                    return null;
                }

                Coin balance = resolved.get().getState().getBalance(address);
                s = HexUtils.toQuantityJsonHex(balance == null ? BigInteger.ZERO : balance.asBigInteger());
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getBalance({}, {}): {}", address, blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getStorageAt(Address address, DataWord key, BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                Optional<ResolvedState> resolved = blockRefResolver.resolveState(blockRef);
                if (!resolved.isPresent()) {
                    return null;
                }

                DataWord sv = resolved.get().getState().getStorageValue(address, key);
                s = (sv == null ? DataWord.ZERO : sv).toJsonString();
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getStorageAt({}, {}, {}): {}", address, key, blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getTransactionCount(Address address, BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                Optional<ResolvedState> resolved = blockRefResolver.resolveState(blockRef);
                if (!resolved.isPresent()) {
                    return null;
                }

                BigInteger nonce = resolved.get().getState().getNonce(address);
                s = HexUtils.toQuantityJsonHex(nonce == null ? BigInteger.ZERO : nonce);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getTransactionCount({}, {}): {}", address, blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getCode(Address address, BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                Optional<ResolvedState> resolved = blockRefResolver.resolveState(blockRef);
                if (!resolved.isPresent()) {
                    return null;
                }

                AccountStateSnapshot state = resolved.get().getState();
                s = HexUtils.toUnformattedJsonHex(state.getCode(address));
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getCode({}, {}): {}", address, blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<BlockResultDTO> getBlockByHash(Keccak256 blockHash, boolean fullTransactionObjects) {
        return async(() -> {
            BlockResultDTO s = null;
            try {
                s = blockRefResolver.resolveBlock(BlockRef.hash(blockHash))
                        .map(b -> BlockResultDTO.fromBlock(b, fullTransactionObjects, false))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getBlockByHash({}, {}): {}", blockHash, fullTransactionObjects, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<BlockResultDTO> getBlockByNumber(BlockRef blockRef, boolean fullTransactionObjects) {
        return async(() -> {
            BlockResultDTO s = null;
            try {
                s = blockRefResolver.resolveBlock(blockRef)
                        .map(b -> BlockResultDTO.fromBlock(b, fullTransactionObjects, isPendingBlock(blockRef, b)))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getBlockByNumber({}, {}): {}", blockRef, fullTransactionObjects, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getBlockTransactionCountByHash(Keccak256 blockHash) {
        return async(() -> {
            String s = null;
            try {
                s = blockRefResolver.resolveBlock(BlockRef.hash(blockHash))
                        .map(b -> HexUtils.toQuantityJsonHex(b.getTransactionsList().size()))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getBlockTransactionCountByHash({}): {}", blockHash, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getBlockTransactionCountByNumber(BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                s = blockRefResolver.resolveBlock(blockRef)
                        .map(b -> HexUtils.toQuantityJsonHex(b.getTransactionsList().size()))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getBlockTransactionCountByNumber({}): {}", blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getUncleCountByBlockHash(Keccak256 blockHash) {
        return async(() -> {
            String s = null;
            try {
                s = blockRefResolver.resolveBlock(BlockRef.hash(blockHash))
                        .map(b -> HexUtils.toQuantityJsonHex(b.getUncleList().size()))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getUncleCountByBlockHash({}): {}", blockHash, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> getUncleCountByBlockNumber(BlockRef blockRef) {
        return async(() -> {
            String s = null;
            try {
                s = blockRefResolver.resolveBlock(blockRef)
                        .map(b -> HexUtils.toQuantityJsonHex(b.getUncleList().size()))
                        .orElse(null);
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getUncleCountByBlockNumber({}): {}", blockRef, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<TransactionResultDTO> getTransactionByHash(Keccak256 transactionHash) {
        return async(() -> {
            TransactionResultDTO s = null;
            try {
                Optional<TransactionInfo> txInfo = chainHistory.getTransactionInfo(transactionHash);

                if (txInfo.isPresent()) {
                    Optional<Block> block = getCanonicalBlock(txInfo.get().getBlockHash());
                    if (block.isPresent()) {
                        int index = txInfo.get().getIndex();
                        return s = new TransactionResultDTO(block.get(), index, block.get().getTransactionsList().get(index));
                    }
                }

                s = transactionPool.getPendingTransaction(transactionHash)
                        .map(TransactionResultDTO::pooled)
                        .orElse(null);
                return s;
            } finally {
                logger.debug("eth_getTransactionByHash({}): {}", transactionHash, s);
            }
        });
    }

    @Override
    public CompletableFuture<TransactionResultDTO> getTransactionByBlockHashAndIndex(Keccak256 blockHash, int index) {
        return async(() -> {
            TransactionResultDTO s = null;
            try {
                Optional<Block> block = blockRefResolver.resolveBlock(BlockRef.hash(blockHash));
                if (!block.isPresent()) {
                    return null;
                }

                return s = toTransactionResult(block.get(), index, false);
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getTransactionByBlockHashAndIndex({}, {}): {}", blockHash, index, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<TransactionResultDTO> getTransactionByBlockNumberAndIndex(BlockRef blockRef, int index) {
        return async(() -> {
            TransactionResultDTO s = null;
            try {
                Optional<Block> block = blockRefResolver.resolveBlock(blockRef);
                if (!block.isPresent()) {
                    return null;
                }

                return s = toTransactionResult(block.get(), index, isPendingBlock(blockRef, block.get()));
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getTransactionByBlockNumberAndIndex({}, {}): {}", blockRef, index, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<TransactionReceiptDTO> getTransactionReceipt(Keccak256 transactionHash) {
        return async(() -> {
            logger.trace("eth_getTransactionReceipt({})", transactionHash);

            Optional<TransactionInfo> txInfo = chainHistory.getTransactionInfo(transactionHash);
            if (!txInfo.isPresent()) {
                logger.trace("No transaction info for {}", transactionHash);
                return null;
            }

            Optional<Block> block = getCanonicalBlock(txInfo.get().getBlockHash());
            if (!block.isPresent()) {
                logger.trace("Transaction {} is not included in the canonical chain", transactionHash);
                return null;
            }

            int firstLogIndex = countLogsBefore(block.get(), txInfo.get().getIndex());
            return new TransactionReceiptDTO(block.get(), txInfo.get(), firstLogIndex);
        });
    }

    @Override
    public CompletableFuture<BlockResultDTO> getUncleByBlockHashAndIndex(Keccak256 blockHash, int index) {
        return async(() -> {
            BlockResultDTO s = null;
            try {
                Optional<Block> block = blockRefResolver.resolveBlock(BlockRef.hash(blockHash));
                if (!block.isPresent()) {
                    return null;
                }

                s = getUncleResultDTO(index, block.get());
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getUncleByBlockHashAndIndex({}, {}): {}", blockHash, index, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<BlockResultDTO> getUncleByBlockNumberAndIndex(BlockRef blockRef, int index) {
        return async(() -> {
            BlockResultDTO s = null;
            try {
                Optional<Block> block = blockRefResolver.resolveBlock(blockRef);
                if (!block.isPresent()) {
                    return null;
                }

                s = getUncleResultDTO(index, block.get());
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getUncleByBlockNumberAndIndex({}, {}): {}", blockRef, index, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<List<LogFilterElement>> getLogs(LogFilter filter) {
        return async(() -> {
            List<LogFilterElement> logs = null;
            try {
                logs = logRetriever.getLogs(filter);
                return logs;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_getLogs({}): {} logs", filter, logs == null ? null : logs.size());
                }
            }
        });
    }

    private BlockResultDTO getUncleResultDTO(int idx, Block block) {
        List<BlockHeader> uncles = block.getUncleList();

        if (idx < 0 || idx >= uncles.size()) {
            return null;
        }

        return BlockResultDTO.fromUncleHeader(uncles.get(idx));
    }

    private static TransactionResultDTO toTransactionResult(Block block, int idx, boolean pending) {
        List<Transaction> txs = block.getTransactionsList();

        if (idx < 0 || idx >= txs.size()) {
            return null;
        }

        return pending ? TransactionResultDTO.pooled(txs.get(idx)) : new TransactionResultDTO(block, idx, txs.get(idx));
    }

    private Optional<Block> getCanonicalBlock(Keccak256 blockHash) {
        return chainHistory.getBlockByHash(blockHash).filter(blockRefResolver::isCanonical);
    }

    private int countLogsBefore(Block block, int txIndex) {
        List<TransactionReceipt> receipts = chainHistory.getReceipts(block);
        int count = 0;
        for (int i = 0; i < txIndex && i < receipts.size(); i++) {
            count += receipts.get(i).getLogInfoList().size();
        }
        return count;
    }

    private boolean isPendingBlock(BlockRef blockRef, Block block) {
        return blockRef.isPending() && !blockRefResolver.isCanonical(block);
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }
}
