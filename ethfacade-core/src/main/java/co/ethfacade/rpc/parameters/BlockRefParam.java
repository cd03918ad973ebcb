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

package co.ethfacade.rpc.parameters;

import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.io.IOException;
import java.io.Serializable;
import java.util.Iterator;
import java.util.Map;

/**
 * Block reference of state methods: a block identifier string, or an EIP-1898 object
 * with either a "blockHash" or a "blockNumber" key.
 */
@JsonDeserialize(using = BlockRefParam.Deserializer.class)
public class BlockRefParam implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final String REQUIRE_CANONICAL_KEY = "requireCanonical";
    private static final String BLOCK_HASH_KEY = "blockHash";
    private static final String BLOCK_NUMBER_KEY = "blockNumber";

    private final transient BlockRef blockRef;

    public BlockRefParam(String identifier) {
        this.blockRef = new BlockIdentifierParam(identifier).toBlockRef();
    }

    public BlockRefParam(BlockRef blockRef) {
        this.blockRef = blockRef;
    }

    public BlockRef toBlockRef() {
        return blockRef;
    }

    static BlockRef fromInputs(JsonNode inputs) {
        BlockRef result = null;
        Iterator<Map.Entry<String, JsonNode>> fields = inputs.fields();

        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();

            switch (field.getKey()) {
                case REQUIRE_CANONICAL_KEY:
                    validateRequireCanonical(value);
                    break;
                case BLOCK_HASH_KEY:
                    if (result != null) {
                        throw EthJsonRpcRequestException.invalidParamError("Invalid block input: blockHash and blockNumber are mutually exclusive");
                    }
                    result = BlockRef.hash(new BlockHashParam(value.asText()).getHash());
                    break;
                case BLOCK_NUMBER_KEY:
                    if (result != null) {
                        throw EthJsonRpcRequestException.invalidParamError("Invalid block input: blockHash and blockNumber are mutually exclusive");
                    }
                    result = new BlockIdentifierParam(value.asText()).toBlockRef();
                    break;
                default:
                    throw EthJsonRpcRequestException.invalidParamError(String.format("Invalid block input: unknown key \"%s\"", field.getKey()));
            }
        }

        if (result == null) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid block input");
        }

        return result;
    }

    private static void validateRequireCanonical(JsonNode value) {
        if (value.isBoolean()) {
            return;
        }

        String text = value.asText();
        if (!text.equalsIgnoreCase("true") && !text.equalsIgnoreCase("false")) {
            throw EthJsonRpcRequestException.invalidParamError(String
                    .format("Invalid input: %s must be a String \"true\" or \"false\"", REQUIRE_CANONICAL_KEY));
        }
    }

    public static class Deserializer extends StdDeserializer<BlockRefParam> {
        private static final long serialVersionUID = 1L;

        public Deserializer() { this(null); }

        public Deserializer(Class<?> vc) { super(vc); }

        @Override
        public BlockRefParam deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            JsonNode node = jp.getCodec().readTree(jp);
            JsonNodeType nodeType = node.getNodeType();

            if (nodeType == JsonNodeType.STRING) {
                return new BlockRefParam(node.asText());
            } else if (nodeType == JsonNodeType.OBJECT) {
                return new BlockRefParam(fromInputs(node));
            } else {
                throw EthJsonRpcRequestException.invalidParamError("Invalid input");
            }
        }
    }
}
