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

import co.ethfacade.backend.BackendException;
import co.ethfacade.core.exception.InvalidAddressException;
import co.ethfacade.jsonrpc.JsonRpcError;
import co.ethfacade.util.HexUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure raised while serving a call to the JSON-RPC error sent back to the client.
 */
public class EthErrorResolver {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    public JsonRpcError resolveError(Throwable throwable, String methodName, JsonNode arguments) {
        Throwable t = unwrap(throwable);

        if (t instanceof EthJsonRpcRequestException) {
            EthJsonRpcRequestException e = (EthJsonRpcRequestException) t;
            byte[] revertData = e.getRevertData();
            String data = revertData == null ? null : HexUtils.toUnformattedJsonHex(revertData);
            return new JsonRpcError(e.getCode(), e.getMessage(), data);
        }

        if (t instanceof InvalidAddressException) {
            return new JsonRpcError(EthJsonRpcRequestException.INVALID_PARAMS, "Invalid address: " + t.getMessage());
        }

        if (t instanceof JsonProcessingException) {
            return new JsonRpcError(EthJsonRpcRequestException.INVALID_PARAMS, "Invalid parameters");
        }

        if (t instanceof TimeoutException) {
            logger.warn("Call to {} timed out", methodName);
            return new JsonRpcError(EthJsonRpcRequestException.TIMEOUT, String.format("%s: call timed out", methodName));
        }

        if (t instanceof UnsupportedOperationException) {
            return new JsonRpcError(EthJsonRpcRequestException.METHOD_NOT_FOUND,
                    "the method " + methodName + " does not exist/is not available");
        }

        if (t instanceof BackendException) {
            logger.error("Backend failure for method {} with arguments {}", methodName, arguments, t);
            String detail = t.getMessage();
            return new JsonRpcError(EthJsonRpcRequestException.INTERNAL_ERROR,
                    detail == null ? "Internal server error" : "Internal server error: " + detail);
        }

        logger.error("JsonRPC error when for method {} with arguments {}", methodName, arguments, t);
        return new JsonRpcError(EthJsonRpcRequestException.INTERNAL_ERROR, "Internal server error");
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
