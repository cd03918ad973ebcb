/*
 * This file is part of EthFacade
 * Copyright (C) 2023 RSK Labs Ltd.
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

import co.ethfacade.core.Address;
import co.ethfacade.core.DataWord;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@JsonDeserialize(using = FilterRequestParam.Deserializer.class)
public class FilterRequestParam {

    private final BlockIdentifierParam fromBlock;
    private final BlockIdentifierParam toBlock;
    private final HexAddressParam[] address;
    private final TopicParam[][] topics;
    private final BlockHashParam blockHash;

    public FilterRequestParam(BlockIdentifierParam fromBlock, BlockIdentifierParam toBlock, HexAddressParam[] address, TopicParam[][] topics, BlockHashParam blockHash) {
        if (blockHash != null && (fromBlock != null || toBlock != null)) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid filter: blockHash can't be combined with fromBlock or toBlock");
        }

        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
        this.address = address;
        this.topics = topics;
        this.blockHash = blockHash;
    }

    public BlockIdentifierParam getFromBlock() {
        return fromBlock;
    }

    public BlockIdentifierParam getToBlock() {
        return toBlock;
    }

    public HexAddressParam[] getAddress() {
        return address;
    }

    public TopicParam[][] getTopics() {
        return topics;
    }

    public BlockHashParam getBlockHash() {
        return blockHash;
    }

    public LogFilter toLogFilter() {
        return new LogFilter(
                fromBlock == null ? null : fromBlock.toBlockRef(),
                toBlock == null ? null : toBlock.toBlockRef(),
                blockHash == null ? null : blockHash.getHash(),
                parseAddressArray(),
                parseTopicArray());
    }

    private List<Address> parseAddressArray() {
        List<Address> result = new ArrayList<>();
        if (this.address == null) {
            return result;
        }

        for (HexAddressParam addressParam : this.address) {
            result.add(addressParam.getAddress());
        }
        return result;
    }

    private List<List<DataWord>> parseTopicArray() {
        List<List<DataWord>> result = new ArrayList<>();
        if (this.topics == null) {
            return result;
        }

        for (TopicParam[] topicArray : this.topics) {
            if (topicArray == null) {
                result.add(null);
                continue;
            }

            List<DataWord> orTopics = new ArrayList<>();
            boolean wildcard = false;
            for (TopicParam topicParam : topicArray) {
                if (topicParam == null) {
                    wildcard = true;
                } else {
                    orTopics.add(topicParam.toDataWord());
                }
            }
            result.add(wildcard ? null : orTopics);
        }
        return result;
    }

    public static class Deserializer extends StdDeserializer<FilterRequestParam> {
        private static final long serialVersionUID = -72304400913233552L;

        public Deserializer() {
            this(null);
        }

        public Deserializer(Class<?> vc) {
            super(vc);
        }

        @Override
        public FilterRequestParam deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            JsonNode node = jp.getCodec().readTree(jp);

            if (!node.isObject()) {
                throw EthJsonRpcRequestException.invalidParamError("Invalid filter: expected an object");
            }

            BlockIdentifierParam fromBlock = node.hasNonNull("fromBlock") ? new BlockIdentifierParam(node.get("fromBlock").asText()) : null;
            BlockIdentifierParam toBlock = node.hasNonNull("toBlock") ? new BlockIdentifierParam(node.get("toBlock").asText()) : null;
            HexAddressParam[] address = node.has("address") ? getAddressParam(node.get("address")) : null;
            BlockHashParam blockHash = node.hasNonNull("blockHash") ? new BlockHashParam(node.get("blockHash").asText()) : null;
            TopicParam[][] topics = node.has("topics") ? getTopicArray(node.get("topics")) : null;

            return new FilterRequestParam(fromBlock, toBlock, address, topics, blockHash);
        }

        private HexAddressParam[] getAddressParam(JsonNode node) {
            if (node == null || node.isNull()) {
                return null;
            }

            if (node.isArray()) {
                HexAddressParam[] addresses = new HexAddressParam[node.size()];
                for (int i = 0; i < node.size(); i++) {
                    JsonNode subNode = node.get(i);
                    addresses[i] = new HexAddressParam(subNode.asText());
                }
                return addresses;
            }
            return new HexAddressParam[]{new HexAddressParam(node.asText())};
        }

        private TopicParam[][] getTopicArray(JsonNode node) {
            if (node == null || node.isNull()) {
                return new TopicParam[0][0];
            }

            if (!node.isArray()) {
                throw EthJsonRpcRequestException.invalidParamError("Invalid filter: topics must be an array");
            }

            TopicParam[][] topics = new TopicParam[node.size()][];
            for (int i = 0; i < node.size(); i++) {
                JsonNode subNode = node.get(i);
                if (subNode.isNull()) {
                    topics[i] = null;
                } else if (subNode.isArray()) {
                    topics[i] = getTopics(subNode);
                } else {
                    topics[i] = new TopicParam[]{new TopicParam(subNode.asText())};
                }
            }
            return topics;
        }

        private TopicParam[] getTopics(JsonNode jsonNode) {
            TopicParam[] topicParams = new TopicParam[jsonNode.size()];
            for (int j = 0; j < jsonNode.size(); j++) {
                JsonNode subNode = jsonNode.get(j);
                topicParams[j] = subNode.isNull() ? null : new TopicParam(subNode.asText());
            }
            return topicParams;
        }
    }
}
