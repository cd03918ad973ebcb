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

import co.ethfacade.backend.CallExecutor;
import co.ethfacade.backend.ExecutionResult;
import co.ethfacade.backend.NodeInformation;
import co.ethfacade.backend.PoolAdmission;
import co.ethfacade.backend.SandboxExecutionException;
import co.ethfacade.backend.SignerException;
import co.ethfacade.backend.TransactionPool;
import co.ethfacade.backend.TransactionSigner;
import co.ethfacade.core.CallRequest;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.Transaction;
import co.ethfacade.core.TransactionRequest;
import co.ethfacade.crypto.HashUtil;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.ResolvedState;
import co.ethfacade.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.executionCannotStart;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.invalidParamError;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.outOfGasExecutionError;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.stateNotFound;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.transactionError;

public class EthWriteModuleImpl implements EthWriteModule {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final TransactionPool transactionPool;
    private final TransactionSigner transactionSigner;
    private final NodeInformation nodeInformation;
    private final CallExecutor callExecutor;
    private final BlockRefResolver blockRefResolver;
    private final GasEstimator gasEstimator;
    private final Executor executor;

    public EthWriteModuleImpl(TransactionPool transactionPool, TransactionSigner transactionSigner,
                              NodeInformation nodeInformation, CallExecutor callExecutor,
                              BlockRefResolver blockRefResolver, GasEstimator gasEstimator, Executor executor) {
        this.transactionPool = transactionPool;
        this.transactionSigner = transactionSigner;
        this.nodeInformation = nodeInformation;
        this.callExecutor = callExecutor;
        this.blockRefResolver = blockRefResolver;
        this.gasEstimator = gasEstimator;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> sendTransaction(TransactionRequest request) {
        return async(() -> {
            String s = null;
            try {
                if (!transactionSigner.manages(request.getFrom())) {
                    throw transactionError(String.format("Could not find account %s to sign the transaction", request.getFrom().toJsonString()));
                }

                TransactionRequest complete = fillDefaults(request);

                Transaction signed;
                try {
                    signed = transactionSigner.sign(complete);
                } catch (SignerException e) {
                    throw transactionError(e.getMessage());
                }

                PoolAdmission admission = transactionPool.addTransaction(signed);
                checkAdmission(admission);

                s = signed.getHash().toJsonString();
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_sendTransaction({}): {}", request, s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> sendRawTransaction(byte[] rawData) {
        return async(() -> {
            String s = null;
            try {
                if (rawData == null || rawData.length == 0) {
                    throw invalidParamError("Empty raw transaction");
                }

                Keccak256 hash = HashUtil.keccak256Hash(rawData);
                PoolAdmission admission = transactionPool.addRawTransaction(rawData);
                if (admission.getStatus() == PoolAdmission.Status.ALREADY_KNOWN) {
                    logger.debug("Transaction {} was already in the pool", hash);
                }
                checkAdmission(admission);

                s = hash.toJsonString();
                return s;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_sendRawTransaction({}): {}", HexUtils.toUnformattedJsonHex(rawData), s);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> call(CallRequest call, BlockRef blockRef) {
        return async(() -> {
            String hReturn = null;
            try {
                Optional<ResolvedState> resolved = blockRefResolver.resolveState(blockRef);
                if (!resolved.isPresent()) {
                    return null;
                }

                long gasLimit = call.getGas() != null && call.getGas().signum() > 0
                        ? call.getGas().min(BigInteger.valueOf(Long.MAX_VALUE)).longValue()
                        : resolved.get().getBlock().getHeader().getGasLimit().longValue();

                ExecutionResult res = execute(call, resolved.get(), gasLimit);
                if (res.getStatus() == ExecutionResult.Status.OUT_OF_GAS) {
                    throw outOfGasExecutionError(gasLimit);
                }

                // reverted calls answer with their revert output
                hReturn = HexUtils.toUnformattedJsonHex(res.getOutput());
                return hReturn;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_call({}, {}): {}", call, blockRef, hReturn);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> estimateGas(CallRequest call, BlockRef blockRef) {
        return async(() -> {
            String estimation = null;
            try {
                ResolvedState resolved = blockRefResolver.resolveState(blockRef)
                        .orElseThrow(() -> stateNotFound(String.format("Block %s not found", blockRef)));

                estimation = HexUtils.toQuantityJsonHex(gasEstimator.estimate(call, resolved));
                return estimation;
            } finally {
                if (logger.isDebugEnabled()) {
                    logger.debug("eth_estimateGas({}, {}): {}", call, blockRef, estimation);
                }
            }
        });
    }

    private TransactionRequest fillDefaults(TransactionRequest request) {
        TransactionRequest complete = request;

        if (complete.getNonce() == null) {
            complete = complete.withNonce(transactionPool.getPendingNonce(request.getFrom()));
        }
        if (complete.getGasPrice() == null) {
            complete = complete.withGasPrice(nodeInformation.getGasPrice());
        }
        if (complete.getChainId() == null) {
            complete = complete.withChainId(nodeInformation.getChainId().orElse(null));
        }
        if (complete.getGas() == null) {
            ResolvedState latest = blockRefResolver.resolveState(BlockRef.latest())
                    .orElseThrow(() -> stateNotFound("Latest state not found"));
            long gas = gasEstimator.estimate(complete.toCallRequest(), latest);
            complete = complete.withGas(BigInteger.valueOf(gas));
        }

        return complete;
    }

    private ExecutionResult execute(CallRequest call, ResolvedState resolved, long gasLimit) {
        try {
            return callExecutor.execute(call, resolved.getBlock().getHeader(), resolved.getState(), gasLimit);
        } catch (SandboxExecutionException e) {
            throw executionCannotStart(e.getMessage(), e);
        }
    }

    private static void checkAdmission(PoolAdmission admission) {
        switch (admission.getStatus()) {
            case ACCEPTED:
            case ALREADY_KNOWN:
                return;
            case INVALID:
                throw invalidParamError(String.format("Invalid transaction: %s", admission.getReason()));
            case REJECTED:
            default:
                throw transactionError(admission.getReason());
        }
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }
}
