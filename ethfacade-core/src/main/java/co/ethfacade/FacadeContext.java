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

package co.ethfacade;

import co.ethfacade.backend.EthBackend;
import co.ethfacade.config.FacadeProperties;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.CorsConfiguration;
import co.ethfacade.rpc.EthJsonRpcRouter;
import co.ethfacade.rpc.EthMethodBindings;
import co.ethfacade.rpc.JacksonBasedRpcSerializer;
import co.ethfacade.rpc.modules.eth.EthInfoModule;
import co.ethfacade.rpc.modules.eth.EthInfoModuleImpl;
import co.ethfacade.rpc.modules.eth.EthMiningModule;
import co.ethfacade.rpc.modules.eth.EthMiningModuleImpl;
import co.ethfacade.rpc.modules.eth.EthReadModule;
import co.ethfacade.rpc.modules.eth.EthReadModuleImpl;
import co.ethfacade.rpc.modules.eth.EthWriteModule;
import co.ethfacade.rpc.modules.eth.EthWriteModuleImpl;
import co.ethfacade.rpc.modules.eth.GasEstimator;
import co.ethfacade.rpc.modules.eth.LogRetriever;
import co.ethfacade.rpc.netty.JsonRpcWeb3ServerHandler;
import co.ethfacade.rpc.netty.Web3HttpServer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Creates the facade components over a backend and manages their lifecycle.
 * Components are built lazily on first access.
 */
public class FacadeContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FacadeContext.class);

    private final FacadeProperties properties;
    private final EthBackend backend;

    private ExecutorService rpcExecutor;
    private BlockRefResolver blockRefResolver;
    private EthReadModule ethReadModule;
    private EthWriteModule ethWriteModule;
    private EthMiningModule ethMiningModule;
    private EthInfoModule ethInfoModule;
    private EthJsonRpcRouter ethJsonRpcRouter;
    private Web3HttpServer web3HttpServer;

    private boolean started;
    private boolean closed;

    public FacadeContext(FacadeProperties properties, EthBackend backend) {
        this.properties = properties;
        this.backend = backend;
    }

    public synchronized void start() throws InterruptedException {
        checkIfNotClosed();

        if (started) {
            logger.warn("The facade has already been started. Ignoring");
            return;
        }
        started = true;

        if (properties.isRpcHttpEnabled()) {
            getWeb3HttpServer().start();
        } else {
            logger.info("HTTP JSON-RPC transport disabled");
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            logger.warn("The context has already been closed. Ignoring");
            return;
        }

        closed = true;

        if (web3HttpServer != null) {
            web3HttpServer.stop();
        }

        if (rpcExecutor != null) {
            rpcExecutor.shutdown();
            try {
                if (!rpcExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    rpcExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                rpcExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public synchronized EthJsonRpcRouter getEthJsonRpcRouter() {
        checkIfNotClosed();

        if (ethJsonRpcRouter == null) {
            ethJsonRpcRouter = new EthJsonRpcRouter(
                    new JacksonBasedRpcSerializer(),
                    EthMethodBindings.bind(getEthReadModule(), getEthWriteModule(), getEthMiningModule(), getEthInfoModule()),
                    properties.ethModuleDescription(),
                    properties.rpcMaxBatchRequestsSize()
            );
        }

        return ethJsonRpcRouter;
    }

    public synchronized EthReadModule getEthReadModule() {
        checkIfNotClosed();

        if (ethReadModule == null) {
            ethReadModule = new EthReadModuleImpl(
                    backend.getChainHistory(),
                    backend.getTransactionPool(),
                    getBlockRefResolver(),
                    new LogRetriever(backend.getChainHistory(), getBlockRefResolver()),
                    getRpcExecutor()
            );
        }

        return ethReadModule;
    }

    public synchronized EthWriteModule getEthWriteModule() {
        checkIfNotClosed();

        if (ethWriteModule == null) {
            GasEstimator gasEstimator = new GasEstimator(
                    backend.getCallExecutor(),
                    properties.estimateGasRevertPolicy(),
                    properties.estimateGasCap()
            );
            ethWriteModule = new EthWriteModuleImpl(
                    backend.getTransactionPool(),
                    backend.getTransactionSigner(),
                    backend.getNodeInformation(),
                    backend.getCallExecutor(),
                    getBlockRefResolver(),
                    gasEstimator,
                    getRpcExecutor()
            );
        }

        return ethWriteModule;
    }

    public synchronized EthMiningModule getEthMiningModule() {
        checkIfNotClosed();

        if (ethMiningModule == null) {
            ethMiningModule = new EthMiningModuleImpl(backend.getMiningCoordinator());
        }

        return ethMiningModule;
    }

    public synchronized EthInfoModule getEthInfoModule() {
        checkIfNotClosed();

        if (ethInfoModule == null) {
            ethInfoModule = new EthInfoModuleImpl(
                    backend.getNodeInformation(),
                    backend.getTransactionSigner(),
                    backend.getChainHistory(),
                    getRpcExecutor()
            );
        }

        return ethInfoModule;
    }

    public synchronized Web3HttpServer getWeb3HttpServer() {
        checkIfNotClosed();

        if (web3HttpServer == null) {
            web3HttpServer = new Web3HttpServer(
                    properties.rpcHttpBindAddress(),
                    properties.rpcHttpPort(),
                    properties.soLingerTime(),
                    properties.rpcHttpReuseAddress(),
                    properties.rpcHttpMaxAggregatedFrameSize(),
                    new CorsConfiguration(properties.corsDomains()),
                    new JsonRpcWeb3ServerHandler(getEthJsonRpcRouter())
            );
        }

        return web3HttpServer;
    }

    private BlockRefResolver getBlockRefResolver() {
        if (blockRefResolver == null) {
            blockRefResolver = new BlockRefResolver(backend.getChainHistory(), backend.getChainState());
        }

        return blockRefResolver;
    }

    private ExecutorService getRpcExecutor() {
        if (rpcExecutor == null) {
            int workers = properties.rpcWorkers();
            rpcExecutor = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                    .setNameFormat("eth-rpc-worker-%d")
                    .setDaemon(true)
                    .build());
            logger.info("JSON-RPC worker pool started with {} threads", workers);
        }

        return rpcExecutor;
    }

    private void checkIfNotClosed() {
        if (closed) {
            throw new IllegalStateException("Facade context is closed and cannot be in use anymore");
        }
    }
}
