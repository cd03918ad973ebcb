/*
 * This file is part of EthFacade
 * Copyright (C) 2018 RSK Labs Ltd.
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * This implements basic JSON-RPC serialization using Jackson.
 */
public class JacksonBasedRpcSerializer {
    // ObjectMapper is thread-safe as long as the config methods are not called after the serialization begins.
    private final ObjectMapper mapper;

    public JacksonBasedRpcSerializer() {
        this(new ObjectMapper());
    }

    public JacksonBasedRpcSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode deserializeRequest(byte[] source) throws IOException {
        return mapper.readTree(source);
    }

    public <T> T deserializeParam(JsonNode node, Class<T> type) throws JsonProcessingException {
        return mapper.treeToValue(node, type);
    }

    /**
     * @throws IllegalArgumentException if the value cannot be converted.
     */
    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public String serializeMessage(JsonNode message) throws JsonProcessingException {
        return mapper.writeValueAsString(message);
    }
}
