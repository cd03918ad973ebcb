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

package co.ethfacade.backend;

import java.util.Objects;

/**
 * The chain backend collaborators handed to the facade.
 */
public class EthBackend {

    private final ChainHistory chainHistory;
    private final ChainState chainState;
    private final TransactionPool transactionPool;
    private final CallExecutor callExecutor;
    private final MiningCoordinator miningCoordinator;
    private final TransactionSigner transactionSigner;
    private final NodeInformation nodeInformation;

    public EthBackend(ChainHistory chainHistory, ChainState chainState, TransactionPool transactionPool,
                      CallExecutor callExecutor, MiningCoordinator miningCoordinator,
                      TransactionSigner transactionSigner, NodeInformation nodeInformation) {
        this.chainHistory = Objects.requireNonNull(chainHistory);
        this.chainState = Objects.requireNonNull(chainState);
        this.transactionPool = Objects.requireNonNull(transactionPool);
        this.callExecutor = Objects.requireNonNull(callExecutor);
        this.miningCoordinator = Objects.requireNonNull(miningCoordinator);
        this.transactionSigner = Objects.requireNonNull(transactionSigner);
        this.nodeInformation = Objects.requireNonNull(nodeInformation);
    }

    public ChainHistory getChainHistory() {
        return chainHistory;
    }

    public ChainState getChainState() {
        return chainState;
    }

    public TransactionPool getTransactionPool() {
        return transactionPool;
    }

    public CallExecutor getCallExecutor() {
        return callExecutor;
    }

    public MiningCoordinator getMiningCoordinator() {
        return miningCoordinator;
    }

    public TransactionSigner getTransactionSigner() {
        return transactionSigner;
    }

    public NodeInformation getNodeInformation() {
        return nodeInformation;
    }
}
