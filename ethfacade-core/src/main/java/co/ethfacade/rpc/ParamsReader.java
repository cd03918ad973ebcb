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

import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Optional;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.invalidParamError;

/**
 * Positional access to the params array of a request, converting each element to its {@code *Param} type.
 * A JSON null in a position counts as an omitted argument.
 */
public class ParamsReader {

    private final JacksonBasedRpcSerializer serializer;
    private final ArrayNode params;

    public ParamsReader(JacksonBasedRpcSerializer serializer, ArrayNode params) {
        this.serializer = serializer;
        this.params = params;
    }

    public int size() {
        return params.size();
    }

    public <T> T required(int index, Class<T> type) {
        return optional(index, type).orElseThrow(() ->
                invalidParamError(String.format("missing value for required argument %d", index)));
    }

    public <T> Optional<T> optional(int index, Class<T> type) {
        JsonNode node = params.get(index);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(serializer.deserializeParam(node, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw asInvalidParam(index, e);
        }
    }

    public boolean requiredBoolean(int index) {
        JsonNode node = params.get(index);
        if (node == null || !node.isBoolean()) {
            throw invalidParamError(String.format("invalid argument %d: expected a boolean", index));
        }
        return node.booleanValue();
    }

    private static EthJsonRpcRequestException asInvalidParam(int index, Exception e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof EthJsonRpcRequestException) {
                return (EthJsonRpcRequestException) cause;
            }
        }
        return invalidParamError(String.format("invalid argument %d", index), e);
    }
}
