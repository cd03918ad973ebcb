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

package co.ethfacade.rpc.modules.eth;

import co.ethfacade.core.Address;
import co.ethfacade.core.Block;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.LogInfo;
import co.ethfacade.core.Transaction;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.dto.LogFilterElement;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import co.ethfacade.test.InMemoryAccountState;
import co.ethfacade.test.InMemoryChain;
import co.ethfacade.test.builders.BlockBuilder;
import co.ethfacade.test.builders.ReceiptBuilder;
import co.ethfacade.test.builders.TransactionBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogRetrieverTest {

    private static final Address CONTRACT_A = new Address("0x00000000000000000000000000000000000000c1");
    private static final Address CONTRACT_B = new Address("0x00000000000000000000000000000000000000c2");
    private static final DataWord TRANSFER = DataWord.valueFromHex("aa");
    private static final DataWord APPROVAL = DataWord.valueFromHex("bb");

    private InMemoryChain chain;
    private LogRetriever retriever;

    @BeforeEach
    void setUp() {
        chain = new InMemoryChain();
        // blocks 1..4, block n holds one transaction with a log of A and a log of B
        for (int n = 1; n <= 4; n++) {
            Transaction tx = new TransactionBuilder().nonce(n).build();
            Block block = new BlockBuilder().parent(chain.getBestBlock())
                    .transactions(Collections.singletonList(tx)).build();
            chain.appendBlock(block, Collections.singletonList(new ReceiptBuilder(tx).logs(
                    new LogInfo(CONTRACT_A, Collections.singletonList(TRANSFER), new byte[]{(byte) n}),
                    new LogInfo(CONTRACT_B, Collections.singletonList(APPROVAL), new byte[]{(byte) n})).build()),
                    InMemoryAccountState.empty());
        }
        retriever = new LogRetriever(chain, new BlockRefResolver(chain, chain));
    }

    @Test
    void defaultsToTheLatestBlock() {
        List<LogFilterElement> logs = retriever.getLogs(filter(null, null));

        assertEquals(2, logs.size());
        assertEquals("0x4", logs.get(0).blockNumber);
    }

    @Test
    void logsAreInBlockThenLogOrder() {
        List<LogFilterElement> logs = retriever.getLogs(filter(BlockRef.number(2), BlockRef.number(3)));

        assertEquals(4, logs.size());
        assertEquals("0x2", logs.get(0).blockNumber);
        assertEquals(CONTRACT_A.toJsonString(), logs.get(0).address);
        assertEquals("0x0", logs.get(0).logIndex);
        assertEquals("0x1", logs.get(1).logIndex);
        assertEquals("0x3", logs.get(3).blockNumber);
        assertFalse(logs.get(3).removed);
    }

    @Test
    void filtersByAddressAndTopic() {
        List<LogFilterElement> byAddress = retriever.getLogs(new LogFilter(BlockRef.earliest(), BlockRef.latest(), null,
                Collections.singletonList(CONTRACT_B), null));
        List<LogFilterElement> byTopic = retriever.getLogs(new LogFilter(BlockRef.earliest(), BlockRef.latest(), null,
                null, Collections.singletonList(Collections.singletonList(TRANSFER))));

        assertEquals(4, byAddress.size());
        assertEquals("0x1", byAddress.get(0).logIndex);
        assertEquals(4, byTopic.size());
        assertEquals(CONTRACT_A.toJsonString(), byTopic.get(3).address);
    }

    @Test
    void toBlockIsClampedToTheHead() {
        List<LogFilterElement> logs = retriever.getLogs(filter(BlockRef.number(3), BlockRef.number(100)));

        assertEquals(4, logs.size());
    }

    @Test
    void invertedRangeIsEmpty() {
        assertTrue(retriever.getLogs(filter(BlockRef.number(3), BlockRef.number(2))).isEmpty());
        assertTrue(retriever.getLogs(filter(BlockRef.number(50), BlockRef.latest())).isEmpty());
    }

    @Test
    void blockHashFilter() {
        Block block2 = chain.getBlockByNumber(2).get();

        List<LogFilterElement> logs = retriever.getLogs(new LogFilter(null, null, block2.getHash(), null, null));

        assertEquals(2, logs.size());
        assertEquals(block2.getHashJsonString(), logs.get(1).blockHash);
    }

    @Test
    void unknownBlockHashIsNotFound() {
        LogFilter filter = new LogFilter(null, null, new Keccak256(new byte[32]), null, null);

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class, () -> retriever.getLogs(filter));
        assertEquals(-32001, (int) e.getCode());
    }

    @Test
    void prunedRangeIsAResolutionError() {
        chain.setLowestRetainedNumber(2);

        EthJsonRpcRequestException e = assertThrows(EthJsonRpcRequestException.class,
                () -> retriever.getLogs(filter(BlockRef.number(1), BlockRef.latest())));
        assertEquals(-32002, (int) e.getCode());
        assertEquals(6, retriever.getLogs(filter(BlockRef.number(2), BlockRef.latest())).size());
    }

    @Test
    void emptyBlocksHaveNoLogs() {
        chain.appendEmptyBlock();

        assertTrue(retriever.getLogs(filter(BlockRef.latest(), BlockRef.latest())).isEmpty());
        assertEquals(8, retriever.getLogs(filter(BlockRef.earliest(), BlockRef.pending())).size());
    }

    private static LogFilter filter(BlockRef from, BlockRef to) {
        return new LogFilter(from, to, null, Collections.emptyList(), Collections.emptyList());
    }
}
