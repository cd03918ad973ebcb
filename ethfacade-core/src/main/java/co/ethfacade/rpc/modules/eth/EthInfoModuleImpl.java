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
import co.ethfacade.backend.NodeInformation;
import co.ethfacade.backend.TransactionSigner;
import co.ethfacade.core.Address;
import co.ethfacade.core.SyncStatus;
import co.ethfacade.rpc.dto.SyncingResult;
import co.ethfacade.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

public class EthInfoModuleImpl implements EthInfoModule {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final NodeInformation nodeInformation;
    private final TransactionSigner transactionSigner;
    private final ChainHistory chainHistory;
    private final Executor executor;

    public EthInfoModuleImpl(NodeInformation nodeInformation, TransactionSigner transactionSigner,
                             ChainHistory chainHistory, Executor executor) {
        this.nodeInformation = nodeInformation;
        this.transactionSigner = transactionSigner;
        this.chainHistory = chainHistory;
        this.executor = executor;
    }

    @Override
    public String protocolVersion() {
        String s = null;
        try {
            s = nodeInformation.getProtocolVersion();
            return s;
        } finally {
            logger.debug("eth_protocolVersion(): {}", s);
        }
    }

    @Override
    public String chainId() {
        String s = nodeInformation.getChainId().map(id -> HexUtils.toQuantityJsonHex(id.longValue())).orElse(null);
        logger.debug("eth_chainId(): {}", s);
        return s;
    }

    @Override
    public List<String> accounts() {
        List<String> s = null;
        try {
            s = transactionSigner.getAccounts().stream()
                    .map(Address::toJsonString)
                    .collect(Collectors.toList());
            return s;
        } finally {
            logger.debug("eth_accounts(): {}", s);
        }
    }

    @Override
    public String gasPrice() {
        String gasPrice = HexUtils.toQuantityJsonHex(nodeInformation.getGasPrice().asBigInteger());
        logger.debug("eth_gasPrice(): {}", gasPrice);
        return gasPrice;
    }

    @Override
    public CompletableFuture<Object> syncing() {
        return CompletableFuture.supplyAsync(() -> {
            SyncStatus status = chainHistory.getSyncStatus();
            logger.debug("eth_syncing(): {}", status);
            if (!status.isSyncing()) {
                return false;
            }
            return new SyncingResult(status);
        }, executor);
    }
}
