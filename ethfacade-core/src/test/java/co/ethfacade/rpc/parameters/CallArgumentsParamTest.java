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

package co.ethfacade.rpc.parameters;

import co.ethfacade.core.Address;
import co.ethfacade.core.CallRequest;
import co.ethfacade.core.Coin;
import co.ethfacade.core.TransactionRequest;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class CallArgumentsParamTest {

    private static final String FROM = "0x0000000000000000000000000000000000000001";
    private static final String TO = "0x0000000000000000000000000000000000000002";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toCallRequest() throws IOException {
        CallArgumentsParam args = read("{\"from\": \"" + FROM + "\", \"to\": \"" + TO + "\", \"gas\": \"0x5208\", " +
                "\"gasPrice\": \"0x1\", \"value\": \"0xa\", \"data\": \"0x1234\"}");

        CallRequest call = args.toCallRequest();

        assertEquals(new Address(FROM), call.getFrom());
        assertEquals(new Address(TO), call.getTo());
        assertEquals(BigInteger.valueOf(21000), call.getGas());
        assertEquals(Coin.valueOf(1), call.getGasPrice());
        assertEquals(Coin.valueOf(10), call.getValue());
        assertArrayEquals(new byte[]{0x12, 0x34}, call.getData());
    }

    @Test
    void inputIsAnAliasOfData() throws IOException {
        CallRequest call = read("{\"to\": \"" + TO + "\", \"input\": \"0xab\"}").toCallRequest();

        assertNull(call.getFrom());
        assertNull(call.getGas());
        assertArrayEquals(new byte[]{(byte) 0xab}, call.getData());
    }

    @Test
    void dataWinsOverInput() throws IOException {
        CallRequest call = read("{\"data\": \"0x01\", \"input\": \"0x02\"}").toCallRequest();

        assertArrayEquals(new byte[]{0x01}, call.getData());
    }

    @Test
    void toTransactionRequest() throws IOException {
        TransactionRequest request = read("{\"from\": \"" + FROM + "\", \"nonce\": \"0x3\", \"chainId\": \"0x21\"}")
                .toTransactionRequest();

        assertEquals(new Address(FROM), request.getFrom());
        assertNull(request.getTo());
        assertEquals(BigInteger.valueOf(3), request.getNonce());
        assertEquals(Long.valueOf(33), request.getChainId());
        assertNull(request.getGas());
    }

    @Test
    void transactionRequestNeedsASender() throws IOException {
        CallArgumentsParam args = read("{\"to\": \"" + TO + "\"}");

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class, args::toTransactionRequest);
        assertEquals(-32602, (int) e.getCode());
    }

    @Test
    void rejectsNonObjects() {
        assertThrows(Exception.class, () -> read("\"0x12\""));
    }

    private CallArgumentsParam read(String json) throws IOException {
        return mapper.readValue(json, CallArgumentsParam.class);
    }
}
