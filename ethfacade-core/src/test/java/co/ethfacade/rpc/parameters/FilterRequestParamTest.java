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
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FilterRequestParamTest {

    private static final String ADDRESS = "0x00000000000000000000000000000000000000c1";
    private static final String TOPIC = "0x" + "0a".repeat(32);
    private static final String HASH = "0x" + "0b".repeat(32);

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void emptyFilterScansLatest() throws IOException {
        LogFilter filter = read("{}").toLogFilter();

        assertEquals(BlockRef.latest(), filter.getFromBlock());
        assertEquals(BlockRef.latest(), filter.getToBlock());
        assertFalse(filter.hasBlockRange());
        assertTrue(filter.getAddresses().isEmpty());
        assertTrue(filter.getTopics().isEmpty());
    }

    @Test
    void singleAddressOrList() throws IOException {
        assertEquals(new Address(ADDRESS), read("{\"address\": \"" + ADDRESS + "\"}").toLogFilter().getAddresses().get(0));
        assertEquals(1, read("{\"address\": [\"" + ADDRESS + "\"]}").toLogFilter().getAddresses().size());
    }

    @Test
    void topicsKeepPositionsAndWildcards() throws IOException {
        LogFilter filter = read("{\"fromBlock\": \"0x1\", \"toBlock\": \"latest\", " +
                "\"topics\": [null, \"" + TOPIC + "\", [\"" + TOPIC + "\", \"" + HASH + "\"], [\"" + TOPIC + "\", null]]}")
                .toLogFilter();

        assertEquals(BlockRef.number(1), filter.getFromBlock());
        assertEquals(4, filter.getTopics().size());
        assertNull(filter.getTopics().get(0));
        assertEquals(1, filter.getTopics().get(1).size());
        assertEquals(2, filter.getTopics().get(2).size());
        assertNull(filter.getTopics().get(3));
    }

    @Test
    void blockHashFilter() throws IOException {
        LogFilter filter = read("{\"blockHash\": \"" + HASH + "\"}").toLogFilter();

        assertEquals(HASH, filter.getBlockHash().toJsonString());
    }

    @Test
    void blockHashExcludesRange() {
        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> new FilterRequestParam(new BlockIdentifierParam("0x1"), null, null, null, new BlockHashParam(HASH)));
        assertEquals(-32602, (int) e.getCode());
    }

    private FilterRequestParam read(String json) throws IOException {
        return mapper.readValue(json, FilterRequestParam.class);
    }
}
