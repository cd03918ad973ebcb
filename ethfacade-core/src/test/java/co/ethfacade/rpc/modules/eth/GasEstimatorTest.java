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
import co.ethfacade.backend.CallExecutor;
import co.ethfacade.backend.ExecutionResult;
import co.ethfacade.backend.SandboxExecutionException;
import co.ethfacade.config.EstimateGasRevertPolicy;
import co.ethfacade.core.Address;
import co.ethfacade.core.Block;
import co.ethfacade.core.CallRequest;
import co.ethfacade.rpc.ResolvedState;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import co.ethfacade.test.InMemoryAccountState;
import co.ethfacade.test.builders.BlockBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GasEstimatorTest {

    private static final Address TO = new Address("0x00000000000000000000000000000000000000c1");

    private ResolvedState resolved;
    private CallRequest call;

    @BeforeEach
    void setUp() {
        Block block = new BlockBuilder().gasLimit(6_800_000L).build();
        resolved = new ResolvedState(block, InMemoryAccountState.empty(), false);
        call = new CallRequest(null, TO, null, null, null, new byte[]{1});
    }

    @Test
    void findsTheSmallestSuccessfulLimit() {
        AtomicInteger executions = new AtomicInteger();
        CallExecutor executor = (c, header, state, gasLimit) -> {
            executions.incrementAndGet();
            return gasLimit >= 53_000
                    ? ExecutionResult.success(new byte[0], 50_000)
                    : ExecutionResult.outOfGas(gasLimit);
        };

        long estimation = new GasEstimator(executor, EstimateGasRevertPolicy.ERROR, 0).estimate(call, resolved);

        assertEquals(53_000, estimation);
        assertTrue(executions.get() < 40);
    }

    @Test
    void plainTransferCostsTheIntrinsicGas() {
        CallExecutor executor = (c, header, state, gasLimit) -> gasLimit >= 21_000
                ? ExecutionResult.success(new byte[0], 21_000)
                : ExecutionResult.outOfGas(gasLimit);

        assertEquals(21_000, new GasEstimator(executor, EstimateGasRevertPolicy.ERROR, 0).estimate(call, resolved));
    }

    @Test
    void capPrecedence() {
        GasEstimator noCap = new GasEstimator(mock(CallExecutor.class), EstimateGasRevertPolicy.ERROR, 0);
        GasEstimator withCap = new GasEstimator(mock(CallExecutor.class), EstimateGasRevertPolicy.ERROR, 1_000_000);

        assertEquals(6_800_000L, noCap.gasCap(call, resolved));
        assertEquals(1_000_000L, withCap.gasCap(call, resolved));
        assertEquals(30_000L, withCap.gasCap(call.withGas(BigInteger.valueOf(30_000)), resolved));
        assertEquals(Long.MAX_VALUE, noCap.gasCap(call.withGas(BigInteger.ONE.shiftLeft(70)), resolved));
    }

    @Test
    void outOfGasAtTheCap() {
        CallExecutor executor = (c, header, state, gasLimit) -> ExecutionResult.outOfGas(gasLimit);

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> new GasEstimator(executor, EstimateGasRevertPolicy.ERROR, 100_000).estimate(call, resolved));

        assertEquals(-32015, (int) e.getCode());
        assertTrue(e.getMessage().contains("(100000)"));
    }

    @Test
    void revertIsAnErrorWithRevertData() {
        byte[] revertData = new byte[]{0x08, (byte) 0xc3, 0x79, (byte) 0xa0};
        CallExecutor executor = (c, header, state, gasLimit) -> ExecutionResult.reverted(revertData, 30_000);

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> new GasEstimator(executor, EstimateGasRevertPolicy.ERROR, 0).estimate(call, resolved));

        assertEquals(-32015, (int) e.getCode());
        assertArrayEquals(revertData, e.getRevertData());
    }

    @Test
    void bestEffortAnswersTheCapOnRevert() {
        CallExecutor executor = (c, header, state, gasLimit) -> ExecutionResult.reverted(new byte[0], 30_000);

        assertEquals(500_000L, new GasEstimator(executor, EstimateGasRevertPolicy.BEST_EFFORT, 500_000).estimate(call, resolved));
    }

    @Test
    void executionThatCannotStart() throws SandboxExecutionException {
        CallExecutor executor = mock(CallExecutor.class);
        when(executor.execute(any(), any(), any(AccountStateSnapshot.class), anyLong()))
                .thenThrow(new SandboxExecutionException("insufficient funds for gas * price + value"));

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> new GasEstimator(executor, EstimateGasRevertPolicy.ERROR, 0).estimate(call, resolved));

        assertEquals(-32015, (int) e.getCode());
        assertTrue(e.getMessage().contains("insufficient funds"));
    }
}
