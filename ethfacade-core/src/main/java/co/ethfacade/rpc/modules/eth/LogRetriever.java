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

import co.ethfacade.backend.ChainHistory;
import co.ethfacade.core.Block;
import co.ethfacade.core.LogInfo;
import co.ethfacade.core.Transaction;
import co.ethfacade.core.TransactionReceipt;
import co.ethfacade.rpc.AddressesTopicsFilter;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.dto.LogFilterElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.blockNotFound;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.resolutionError;

/**
 * Collects the logs of canonical blocks matching a {@link LogFilter}, in block order,
 * then transaction order, then log order.
 */
public class LogRetriever {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final ChainHistory chainHistory;
    private final BlockRefResolver blockRefResolver;

    public LogRetriever(ChainHistory chainHistory, BlockRefResolver blockRefResolver) {
        this.chainHistory = chainHistory;
        this.blockRefResolver = blockRefResolver;
    }

    public List<LogFilterElement> getLogs(LogFilter filter) {
        AddressesTopicsFilter matcher = filter.toAddressesTopicsFilter();

        if (filter.getBlockHash() != null) {
            Block block = blockRefResolver.resolveBlock(BlockRef.hash(filter.getBlockHash()))
                    .orElseThrow(() -> blockNotFound(String.format("Block with hash %s not found", filter.getBlockHash())));
            List<LogFilterElement> result = new ArrayList<>();
            collectLogs(block, matcher, result);
            return result;
        }

        // one head for the whole range
        Block head = chainHistory.getBestBlock();
        long fromNumber = toBlockNumber(filter.getFromBlock(), head);
        long toNumber = toBlockNumber(filter.getToBlock(), head);

        if (Long.compareUnsigned(toNumber, head.getNumber()) > 0) {
            toNumber = head.getNumber();
        }

        if (Long.compareUnsigned(fromNumber, toNumber) > 0) {
            logger.trace("Empty log range [{}, {}]", fromNumber, toNumber);
            return Collections.emptyList();
        }

        long lowest = blockRefResolver.getLowestRetainedNumber();
        if (Long.compareUnsigned(fromNumber, lowest) < 0) {
            throw resolutionError(String.format("Logs before block %d have been pruned", lowest));
        }

        List<LogFilterElement> result = new ArrayList<>();
        for (long number = fromNumber; Long.compareUnsigned(number, toNumber) <= 0; number++) {
            Optional<Block> block = number == head.getNumber() ? Optional.of(head) : chainHistory.getBlockByNumber(number);
            if (!block.isPresent()) {
                throw resolutionError(String.format("Block %d is not available", number));
            }
            collectLogs(block.get(), matcher, result);
            if (number == toNumber) {
                break;
            }
        }

        return result;
    }

    private long toBlockNumber(BlockRef ref, Block head) {
        switch (ref.getKind()) {
            case EARLIEST:
                return 0;
            case NUMBER:
                return ref.getNumber();
            case LATEST:
            case PENDING:
            default:
                return head.getNumber();
        }
    }

    private void collectLogs(Block block, AddressesTopicsFilter matcher, List<LogFilterElement> result) {
        List<Transaction> txs = block.getTransactionsList();
        List<TransactionReceipt> receipts = chainHistory.getReceipts(block);

        int blockLogIndex = 0;
        for (int txIndex = 0; txIndex < receipts.size(); txIndex++) {
            TransactionReceipt receipt = receipts.get(txIndex);
            Transaction tx = txIndex < txs.size() ? txs.get(txIndex) : receipt.getTransaction();
            List<LogInfo> logs = receipt.getLogInfoList();

            for (int txLogIndex = 0; txLogIndex < logs.size(); txLogIndex++, blockLogIndex++) {
                LogInfo logInfo = logs.get(txLogIndex);
                if (matcher.matchesExactly(logInfo)) {
                    result.add(new LogFilterElement(logInfo, block, txIndex, tx, blockLogIndex, txLogIndex));
                }
            }
        }
    }
}
