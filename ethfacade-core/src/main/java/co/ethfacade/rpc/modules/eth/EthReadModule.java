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

import co.ethfacade.core.Address;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.Keccak256;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.dto.BlockResultDTO;
import co.ethfacade.rpc.dto.LogFilterElement;
import co.ethfacade.rpc.dto.TransactionReceiptDTO;
import co.ethfacade.rpc.dto.TransactionResultDTO;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read path of the eth namespace: accounts, blocks, transactions, receipts, uncles and logs.
 * Every method completes with null when the requested item does not exist.
 */
public interface EthReadModule {

    CompletableFuture<String> blockNumber();

    CompletableFuture<String> getBalance(Address address, BlockRef blockRef);

    CompletableFuture<String> getStorageAt(Address address, DataWord key, BlockRef blockRef);

    CompletableFuture<String> getTransactionCount(Address address, BlockRef blockRef);

    CompletableFuture<String> getCode(Address address, BlockRef blockRef);

    CompletableFuture<BlockResultDTO> getBlockByHash(Keccak256 blockHash, boolean fullTransactionObjects);

    CompletableFuture<BlockResultDTO> getBlockByNumber(BlockRef blockRef, boolean fullTransactionObjects);

    CompletableFuture<String> getBlockTransactionCountByHash(Keccak256 blockHash);

    CompletableFuture<String> getBlockTransactionCountByNumber(BlockRef blockRef);

    CompletableFuture<String> getUncleCountByBlockHash(Keccak256 blockHash);

    CompletableFuture<String> getUncleCountByBlockNumber(BlockRef blockRef);

    CompletableFuture<TransactionResultDTO> getTransactionByHash(Keccak256 transactionHash);

    CompletableFuture<TransactionResultDTO> getTransactionByBlockHashAndIndex(Keccak256 blockHash, int index);

    CompletableFuture<TransactionResultDTO> getTransactionByBlockNumberAndIndex(BlockRef blockRef, int index);

    CompletableFuture<TransactionReceiptDTO> getTransactionReceipt(Keccak256 transactionHash);

    CompletableFuture<BlockResultDTO> getUncleByBlockHashAndIndex(Keccak256 blockHash, int index);

    CompletableFuture<BlockResultDTO> getUncleByBlockNumberAndIndex(BlockRef blockRef, int index);

    CompletableFuture<List<LogFilterElement>> getLogs(LogFilter filter);
}
