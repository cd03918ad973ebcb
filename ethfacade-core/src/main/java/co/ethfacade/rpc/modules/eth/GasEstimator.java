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
import co.ethfacade.backend.SandboxExecutionException;
import co.ethfacade.config.EstimateGasRevertPolicy;
import co.ethfacade.core.CallRequest;
import co.ethfacade.rpc.ResolvedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.executionCannotStart;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.outOfGasExecutionError;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.transactionRevertedExecutionError;

/**
 * Finds the smallest gas limit a call succeeds with, by bisection between the gas used by a
 * trial run at the cap and the cap itself.
 */
public class GasEstimator {

    public static final long TX_BASE_GAS = 21_000L;

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final CallExecutor callExecutor;
    private final EstimateGasRevertPolicy revertPolicy;
    private final long configuredCap;

    /**
     * @param configuredCap upper bound used when the request carries no gas, 0 to use the block gas limit.
     */
    public GasEstimator(CallExecutor callExecutor, EstimateGasRevertPolicy revertPolicy, long configuredCap) {
        this.callExecutor = callExecutor;
        this.revertPolicy = revertPolicy;
        this.configuredCap = configuredCap;
    }

    public long estimate(CallRequest call, ResolvedState resolved) {
        long cap = gasCap(call, resolved);

        ExecutionResult trial = execute(call, resolved, cap);
        switch (trial.getStatus()) {
            case REVERTED:
                if (revertPolicy == EstimateGasRevertPolicy.BEST_EFFORT) {
                    logger.debug("Call reverted at gas cap {}, answering with the cap", cap);
                    return cap;
                }
                throw transactionRevertedExecutionError(trial.getOutput());
            case OUT_OF_GAS:
                throw outOfGasExecutionError(cap);
            case SUCCESS:
            default:
                break;
        }

        // lo always fails (or is below the intrinsic cost), hi always succeeds
        long lo = Math.max(TX_BASE_GAS, trial.getGasUsed()) - 1;
        long hi = cap;
        int iterations = 0;
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            if (execute(call, resolved, mid).isSuccessful()) {
                hi = mid;
            } else {
                lo = mid;
            }
            iterations++;
        }

        logger.trace("Gas estimation converged to {} after {} executions", hi, iterations + 1);
        return hi;
    }

    long gasCap(CallRequest call, ResolvedState resolved) {
        if (call.getGas() != null && call.getGas().signum() > 0) {
            return call.getGas().min(BigInteger.valueOf(Long.MAX_VALUE)).longValue();
        }
        if (configuredCap > 0) {
            return configuredCap;
        }
        return resolved.getBlock().getHeader().getGasLimit().longValue();
    }

    private ExecutionResult execute(CallRequest call, ResolvedState resolved, long gasLimit) {
        try {
            return callExecutor.execute(call, resolved.getBlock().getHeader(), resolved.getState(), gasLimit);
        } catch (SandboxExecutionException e) {
            throw executionCannotStart(e.getMessage(), e);
        }
    }
}
