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
import co.ethfacade.rpc.parameters.HexAddressParam;
import co.ethfacade.rpc.parameters.HexIndexParam;
import co.ethfacade.rpc.parameters.TxHashParam;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ParamsReaderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JacksonBasedRpcSerializer serializer = new JacksonBasedRpcSerializer(mapper);

    @Test
    void readsPositionalParams() throws IOException {
        ParamsReader reader = reader("[\"0x00000000000000000000000000000000000000aa\", \"0x2\", true]");

        assertEquals(3, reader.size());
        assertEquals("00000000000000000000000000000000000000aa", reader.required(0, HexAddressParam.class).getAddress().toHexString());
        assertEquals(2, (int) reader.required(1, HexIndexParam.class).getIndex());
        assertTrue(reader.requiredBoolean(2));
    }

    @Test
    void nullAndMissingAreAbsent() throws IOException {
        ParamsReader reader = reader("[null]");

        assertFalse(reader.optional(0, HexIndexParam.class).isPresent());
        assertFalse(reader.optional(1, HexIndexParam.class).isPresent());

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> reader.required(0, HexIndexParam.class));
        assertEquals(-32602, (int) e.getCode());
        assertEquals("missing value for required argument 0", e.getMessage());
    }

    @Test
    void keepsTheParamValidationMessage() throws IOException {
        ParamsReader reader = reader("[\"0x12\"]");

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> reader.required(0, HexAddressParam.class));
        assertEquals(-32602, (int) e.getCode());
        assertTrue(e.getMessage().contains("want 40 for address"));
    }

    @Test
    void hashesMustBeJsonStrings() throws IOException {
        String hash = "0x" + "ab".repeat(32);
        ParamsReader reader = reader("[12345, \"" + hash + "\", {\"hash\": \"" + hash + "\"}]");

        EthJsonRpcRequestException number = assertThrows(EthJsonRpcRequestException.class,
                () -> reader.required(0, TxHashParam.class));
        assertEquals(-32602, (int) number.getCode());
        assertEquals("Invalid transaction hash: expected a hex string", number.getMessage());
        assertEquals(hash, reader.required(1, TxHashParam.class).getHash().toJsonString());
        assertThrows(EthJsonRpcRequestException.class, () -> reader.required(2, TxHashParam.class));
    }

    @Test
    void booleanMustBeAJsonBoolean() throws IOException {
        ParamsReader reader = reader("[\"true\"]");

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class, () -> reader.requiredBoolean(0));
        assertEquals(-32602, (int) e.getCode());
    }

    private ParamsReader reader(String json) throws IOException {
        return new ParamsReader(serializer, (ArrayNode) mapper.readTree(json));
    }
}
