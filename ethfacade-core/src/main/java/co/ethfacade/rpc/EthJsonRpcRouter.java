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

package co.ethfacade.rpc;

import co.ethfacade.jsonrpc.JsonRpcError;
import co.ethfacade.jsonrpc.JsonRpcErrorResponse;
import co.ethfacade.jsonrpc.JsonRpcIdentifiableMessage;
import co.ethfacade.jsonrpc.JsonRpcResultResponse;
import co.ethfacade.jsonrpc.JsonRpcVersion;
import co.ethfacade.rpc.exception.EthErrorResolver;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for JSON-RPC payloads: validates the envelope, dispatches each request to the module
 * bound to its method and assembles the response. Responses complete asynchronously, so no caller
 * thread waits on backend I/O.
 */
public class EthJsonRpcRouter {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc");

    private static final String JSONRPC = "jsonrpc";
    private static final String ID = "id";
    private static final String METHOD = "method";
    private static final String PARAMS = "params";

    private final JacksonBasedRpcSerializer serializer;
    private final Map<EthMethod, EthMethodHandler> handlers;
    private final EthModuleDescription moduleDescription;
    private final int maxBatchRequestsSize;
    private final AbsenceNormalizer normalizer;
    private final EthErrorResolver errorResolver;

    public EthJsonRpcRouter(JacksonBasedRpcSerializer serializer, Map<EthMethod, EthMethodHandler> handlers,
                            EthModuleDescription moduleDescription, int maxBatchRequestsSize) {
        for (EthMethod method : EthMethod.values()) {
            Preconditions.checkArgument(handlers.containsKey(method), "No handler bound for %s", method.getName());
        }
        Preconditions.checkArgument(maxBatchRequestsSize > 0, "maxBatchRequestsSize must be positive");

        this.serializer = serializer;
        this.handlers = handlers;
        this.moduleDescription = moduleDescription;
        this.maxBatchRequestsSize = maxBatchRequestsSize;
        this.normalizer = new AbsenceNormalizer();
        this.errorResolver = new EthErrorResolver();
    }

    /**
     * @param body the raw request payload, a single request object or a batch array.
     * @return the serialized response.
     */
    public CompletableFuture<String> handle(byte[] body) {
        JsonNode request;
        try {
            request = serializer.deserializeRequest(body);
        } catch (IOException e) {
            logger.debug("Unparseable request body", e);
            return CompletableFuture.completedFuture(write(errorTree(NullNode.getInstance(),
                    EthJsonRpcRequestException.PARSE_ERROR, "Parse error")));
        }

        if (request == null || request.isMissingNode()) {
            return CompletableFuture.completedFuture(write(errorTree(NullNode.getInstance(),
                    EthJsonRpcRequestException.PARSE_ERROR, "Parse error")));
        }

        if (request.isArray()) {
            return handleBatch((ArrayNode) request).thenApply(this::write);
        }

        return handleRequest(request).thenApply(this::write);
    }

    private CompletableFuture<JsonNode> handleBatch(ArrayNode batch) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(errorTree(NullNode.getInstance(),
                    EthJsonRpcRequestException.INVALID_REQUEST, "Empty batch request"));
        }

        if (batch.size() > maxBatchRequestsSize) {
            logger.debug("Rejected batch of {} requests, max is {}", batch.size(), maxBatchRequestsSize);
            return CompletableFuture.completedFuture(errorTree(NullNode.getInstance(),
                    EthJsonRpcRequestException.INVALID_REQUEST,
                    String.format("Cannot dispatch batch requests. %d is the max number of supported batch requests", maxBatchRequestsSize)));
        }

        List<CompletableFuture<JsonNode>> responses = new ArrayList<>(batch.size());
        for (JsonNode request : batch) {
            responses.add(handleRequest(request));
        }

        return CompletableFuture.allOf(responses.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    ArrayNode result = JsonNodeFactory.instance.arrayNode(responses.size());
                    responses.forEach(r -> result.add(r.join()));
                    return result;
                });
    }

    private CompletableFuture<JsonNode> handleRequest(JsonNode request) {
        if (!request.isObject()) {
            return invalidRequest(NullNode.getInstance(), "Invalid request");
        }

        JsonNode id = request.get(ID);
        if (id != null && !id.isTextual() && !id.isNumber() && !id.isNull()) {
            return invalidRequest(NullNode.getInstance(), "Invalid request id");
        }
        if (id == null) {
            id = NullNode.getInstance();
        }

        JsonNode version = request.get(JSONRPC);
        if (version == null || !version.isTextual() || !JsonRpcVersion.V2_0.getLabel().equals(version.textValue())) {
            return invalidRequest(id, "Invalid JSON-RPC version");
        }

        JsonNode methodNode = request.get(METHOD);
        if (methodNode == null || !methodNode.isTextual()) {
            return invalidRequest(id, "Invalid method");
        }
        String methodName = methodNode.textValue();

        JsonNode paramsNode = request.get(PARAMS);
        ArrayNode params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = JsonNodeFactory.instance.arrayNode();
        } else if (paramsNode.isArray()) {
            params = (ArrayNode) paramsNode;
        } else {
            return CompletableFuture.completedFuture(errorTree(id, EthJsonRpcRequestException.INVALID_PARAMS,
                    "Invalid params: positional params expected"));
        }

        Optional<EthMethod> method = EthMethod.fromName(methodName)
                .filter(m -> moduleDescription.methodIsEnabled(m.getName()));
        if (!method.isPresent()) {
            logger.debug("Method {} not found or disabled", methodName);
            return CompletableFuture.completedFuture(errorTree(id, EthJsonRpcRequestException.METHOD_NOT_FOUND,
                    String.format("the method %s does not exist/is not available", methodName)));
        }

        return dispatch(id, method.get(), params);
    }

    private CompletableFuture<JsonNode> dispatch(JsonNode id, EthMethod method, ArrayNode params) {
        logger.trace("Dispatching {} with params {}", method.getName(), params);

        CompletableFuture<?> result;
        if (!method.acceptsParamCount(params.size())) {
            result = failed(EthJsonRpcRequestException.invalidParamError(String.format(
                    "%s expects between %d and %d params, got %d",
                    method.getName(), method.getMinParams(), method.getMaxParams(), params.size())));
        } else {
            try {
                result = handlers.get(method).invoke(new ParamsReader(serializer, params));
            } catch (RuntimeException e) {
                result = failed(e);
            }
        }

        long timeout = moduleDescription.getTimeout(method.getName());
        if (method.isSuspending() && timeout > 0) {
            result = result.orTimeout(timeout, TimeUnit.MILLISECONDS);
        }

        return result
                .thenApply(r -> normalizer.normalize(method, r))
                .handle((r, t) -> {
                    if (t != null) {
                        JsonRpcError error = errorResolver.resolveError(t, method.getName(), params);
                        return toTree(new JsonRpcErrorResponse(id, error), id);
                    }
                    return toTree(new JsonRpcResultResponse(id, r), id);
                });
    }

    private JsonNode toTree(JsonRpcIdentifiableMessage message, JsonNode id) {
        try {
            return serializer.toTree(message);
        } catch (IllegalArgumentException e) {
            logger.error("Could not serialize response for request {}", id, e);
            return errorTree(id, EthJsonRpcRequestException.INTERNAL_ERROR, "Internal server error");
        }
    }

    private CompletableFuture<JsonNode> invalidRequest(JsonNode id, String message) {
        return CompletableFuture.completedFuture(errorTree(id, EthJsonRpcRequestException.INVALID_REQUEST, message));
    }

    private JsonNode errorTree(JsonNode id, int code, String message) {
        return serializer.toTree(new JsonRpcErrorResponse(id, new JsonRpcError(code, message)));
    }

    private String write(JsonNode response) {
        try {
            return serializer.serializeMessage(response);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(t);
        return future;
    }
}
