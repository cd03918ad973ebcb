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

import co.ethfacade.util.ByteUtil;

import javax.annotation.concurrent.Immutable;

/**
 * Outcome of a sandboxed execution.
 */
@Immutable
public final class ExecutionResult {

    public enum Status {
        SUCCESS,
        REVERTED,
        OUT_OF_GAS
    }

    private final Status status;
    private final byte[] output;
    private final long gasUsed;

    public ExecutionResult(Status status, byte[] output, long gasUsed) {
        this.status = status;
        this.output = output == null ? ByteUtil.EMPTY_BYTE_ARRAY : output;
        this.gasUsed = gasUsed;
    }

    public static ExecutionResult success(byte[] output, long gasUsed) {
        return new ExecutionResult(Status.SUCCESS, output, gasUsed);
    }

    public static ExecutionResult reverted(byte[] revertData, long gasUsed) {
        return new ExecutionResult(Status.REVERTED, revertData, gasUsed);
    }

    public static ExecutionResult outOfGas(long gasUsed) {
        return new ExecutionResult(Status.OUT_OF_GAS, ByteUtil.EMPTY_BYTE_ARRAY, gasUsed);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS;
    }

    /**
     * @return the returned bytes, or the revert data when the execution reverted.
     */
    public byte[] getOutput() {
        return ByteUtil.cloneBytes(output);
    }

    public long getGasUsed() {
        return gasUsed;
    }

    @Override
    public String toString() {
        return "ExecutionResult{status=" + status + ", gasUsed=" + gasUsed + ", output=" + ByteUtil.toHexString(output) + '}';
    }
}
