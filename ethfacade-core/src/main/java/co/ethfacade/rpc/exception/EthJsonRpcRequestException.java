/*
 * This file is part of EthFacade
 * Copyright (C) 2017 RSK Labs Ltd.
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

package co.ethfacade.rpc.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public class EthJsonRpcRequestException extends RuntimeException {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int RESOURCE_NOT_FOUND = -32001;
    public static final int RESOLUTION_ERROR = -32002;
    public static final int TRANSACTION_REJECTED = -32010;
    public static final int TIMEOUT = -32011;
    public static final int EXECUTION_ERROR = -32015;

    private final Integer code;

    @Nullable
    private final byte[] revertData;

    protected EthJsonRpcRequestException(Integer code, @Nullable byte[] revertData, String message, Exception e) {
        super(message, e);
        this.code = code;
        this.revertData = revertData;
    }

    protected EthJsonRpcRequestException(Integer code, String message, Exception e) {
        this(code, null, message, e);
    }

    public EthJsonRpcRequestException(Integer code, @Nullable byte[] revertData, String message) {
        super(message);
        this.code = code;
        this.revertData = revertData;
    }

    public EthJsonRpcRequestException(Integer code, String message) {
        this(code, null, message);
    }

    public Integer getCode() {
        return code;
    }

    @Nullable
    public byte[] getRevertData() {
        return revertData;
    }

    public static EthJsonRpcRequestException transactionRevertedExecutionError(@Nonnull byte[] revertData) {
        return executionError("transaction reverted", revertData);
    }

    public static EthJsonRpcRequestException outOfGasExecutionError(long gasCap) {
        return executionError(String.format("out of gas, gas required exceeds allowance (%d)", gasCap), null);
    }

    public static EthJsonRpcRequestException executionCannotStart(String message, Exception e) {
        return new EthJsonRpcRequestException(EXECUTION_ERROR, null, String.format("VM Exception while processing transaction: %s", message), e);
    }

    private static EthJsonRpcRequestException executionError(String message, @Nullable byte[] revertData) {
        return new EthJsonRpcRequestException(EXECUTION_ERROR, revertData, String.format("VM Exception while processing transaction: %s", message));
    }

    public static EthJsonRpcRequestException transactionError(String message) {
        return new EthJsonRpcRequestException(TRANSACTION_REJECTED, message);
    }

    public static EthJsonRpcRequestException invalidParamError(String message) {
        return new EthJsonRpcRequestException(INVALID_PARAMS, message);
    }

    public static EthJsonRpcRequestException invalidParamError(String message, Exception e) {
        return new EthJsonRpcRequestException(INVALID_PARAMS, message, e);
    }

    public static EthJsonRpcRequestException invalidRequest(String message) {
        return new EthJsonRpcRequestException(INVALID_REQUEST, message);
    }

    public static EthJsonRpcRequestException parseError(String message) {
        return new EthJsonRpcRequestException(PARSE_ERROR, message);
    }

    public static EthJsonRpcRequestException methodNotFound(String methodName) {
        return new EthJsonRpcRequestException(METHOD_NOT_FOUND, "the method " + methodName + " does not exist/is not available");
    }

    public static EthJsonRpcRequestException blockNotFound(String message) {
        return new EthJsonRpcRequestException(RESOURCE_NOT_FOUND, message);
    }

    public static EthJsonRpcRequestException resourceNotFound(String message) {
        return new EthJsonRpcRequestException(RESOURCE_NOT_FOUND, message);
    }

    public static EthJsonRpcRequestException stateNotFound(String message) {
        return new EthJsonRpcRequestException(RESOLUTION_ERROR, message);
    }

    public static EthJsonRpcRequestException resolutionError(String message) {
        return new EthJsonRpcRequestException(RESOLUTION_ERROR, message);
    }

    public static EthJsonRpcRequestException timeout(String methodName, long timeoutMillis) {
        return new EthJsonRpcRequestException(TIMEOUT, String.format("%s timed out after %d ms", methodName, timeoutMillis));
    }

    public static EthJsonRpcRequestException internalError(String message, Exception e) {
        return new EthJsonRpcRequestException(INTERNAL_ERROR, message, e);
    }

    public static EthJsonRpcRequestException unimplemented(String message) {
        return new EthJsonRpcRequestException(METHOD_NOT_FOUND, message);
    }
}
