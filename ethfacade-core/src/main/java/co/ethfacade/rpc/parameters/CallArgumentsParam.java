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

package co.ethfacade.rpc.parameters;

import co.ethfacade.core.Address;
import co.ethfacade.core.CallRequest;
import co.ethfacade.core.Coin;
import co.ethfacade.core.TransactionRequest;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Call and transaction object of eth_call, eth_estimateGas and eth_sendTransaction.
 * "input" is accepted as an alias of "data".
 */
@JsonDeserialize(using = CallArgumentsParam.Deserializer.class)
public class CallArgumentsParam {

    private final HexAddressParam from;
    private final HexAddressParam to;
    private final HexNumberParam gas;
    private final HexNumberParam gasPrice;
    private final HexNumberParam nonce;
    private final HexNumberParam chainId;
    private final HexNumberParam value;
    private final HexDataParam data;

    public CallArgumentsParam(HexAddressParam from, HexAddressParam to, HexNumberParam gas,
                              HexNumberParam gasPrice, HexNumberParam nonce,
                              HexNumberParam chainId, HexNumberParam value, HexDataParam data) {
        this.from = from;
        this.to = to;
        this.gas = gas;
        this.gasPrice = gasPrice;
        this.nonce = nonce;
        this.chainId = chainId;
        this.value = value;
        this.data = data;
    }

    public HexAddressParam getFrom() {
        return from;
    }

    public HexAddressParam getTo() {
        return to;
    }

    public HexNumberParam getGas() {
        return gas;
    }

    public HexNumberParam getGasPrice() {
        return gasPrice;
    }

    public HexNumberParam getNonce() {
        return nonce;
    }

    public HexNumberParam getChainId() {
        return chainId;
    }

    public HexNumberParam getValue() {
        return value;
    }

    public HexDataParam getData() {
        return data;
    }

    public CallRequest toCallRequest() {
        return new CallRequest(
                from == null ? null : from.getAddress(),
                to == null ? null : to.getAddress(),
                gas == null ? null : gas.toBigInteger(),
                gasPrice == null ? null : new Coin(gasPrice.toBigInteger()),
                value == null ? null : new Coin(value.toBigInteger()),
                data == null ? null : data.getRawDataBytes());
    }

    /**
     * @throws EthJsonRpcRequestException if the sender is missing.
     */
    public TransactionRequest toTransactionRequest() {
        if (from == null) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid transaction: from is required");
        }

        Address sender = from.getAddress();
        BigInteger txNonce = nonce == null ? null : nonce.toBigInteger();
        Long txChainId = chainId == null ? null : chainId.toLong();

        return new TransactionRequest(
                sender,
                to == null ? null : to.getAddress(),
                gas == null ? null : gas.toBigInteger(),
                gasPrice == null ? null : new Coin(gasPrice.toBigInteger()),
                value == null ? null : new Coin(value.toBigInteger()),
                data == null ? null : data.getRawDataBytes(),
                txNonce,
                txChainId);
    }

    public static class Deserializer extends StdDeserializer<CallArgumentsParam> {
        private static final long serialVersionUID = 1L;

        public Deserializer() { this(null); }

        public Deserializer(Class<?> vc) { super(vc); }

        @Override
        public CallArgumentsParam deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            JsonNode node = jp.getCodec().readTree(jp);

            if (!node.isObject()) {
                throw EthJsonRpcRequestException.invalidParamError("Invalid call arguments: expected an object");
            }

            HexAddressParam from = node.hasNonNull("from") ? new HexAddressParam(node.get("from").asText()) : null;
            HexAddressParam to = node.hasNonNull("to") ? new HexAddressParam(node.get("to").asText()) : null;
            HexNumberParam gas = node.hasNonNull("gas") ? new HexNumberParam(node.get("gas").asText()) : null;
            HexNumberParam gasPrice = node.hasNonNull("gasPrice") ? new HexNumberParam(node.get("gasPrice").asText()) : null;
            HexNumberParam nonce = node.hasNonNull("nonce") ? new HexNumberParam(node.get("nonce").asText()) : null;
            HexNumberParam chainId = node.hasNonNull("chainId") ? new HexNumberParam(node.get("chainId").asText()) : null;
            HexNumberParam value = node.hasNonNull("value") ? new HexNumberParam(node.get("value").asText()) : null;
            HexDataParam data = null;
            if (node.hasNonNull("data")) {
                data = new HexDataParam(node.get("data").asText());
            } else if (node.hasNonNull("input")) {
                data = new HexDataParam(node.get("input").asText());
            }

            return new CallArgumentsParam(from, to, gas, gasPrice, nonce, chainId, value, data);
        }
    }
}
