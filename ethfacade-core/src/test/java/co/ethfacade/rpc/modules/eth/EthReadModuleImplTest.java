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
import co.ethfacade.core.BlockHeader;
import co.ethfacade.core.Coin;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.LogInfo;
import co.ethfacade.core.Transaction;
import co.ethfacade.rpc.BlockRef;
import co.ethfacade.rpc.BlockRefResolver;
import co.ethfacade.rpc.LogFilter;
import co.ethfacade.rpc.dto.BlockResultDTO;
import co.ethfacade.rpc.dto.LogFilterElement;
import co.ethfacade.rpc.dto.TransactionReceiptDTO;
import co.ethfacade.rpc.dto.TransactionResultDTO;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import co.ethfacade.test.InMemoryAccountState;
import co.ethfacade.test.InMemoryChain;
import co.ethfacade.test.InMemoryTransactionPool;
import co.ethfacade.test.builders.BlockBuilder;
import co.ethfacade.test.builders.ReceiptBuilder;
import co.ethfacade.test.builders.TransactionBuilder;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class EthReadModuleImplTest {

    private static final Address ACCOUNT = new Address("0x00000000000000000000000000000000000000aa");
    private static final Address CONTRACT = new Address("0x00000000000000000000000000000000000000c1");
    private static final Address UNKNOWN = new Address("0x00000000000000000000000000000000000000ff");
    private static final DataWord KEY = DataWord.valueFromHex("01");
    private static final DataWord VALUE = DataWord.valueFromHex("2a");

    private InMemoryChain chain;
    private InMemoryTransactionPool pool;
    private EthReadModule module;

    private Block block1;
    private Transaction tx1;
    private Transaction tx2;
    private BlockHeader uncle;

    @BeforeEach
    void setUp() {
        chain = new InMemoryChain();
        pool = new InMemoryTransactionPool();

        tx1 = new TransactionBuilder().sender(ACCOUNT).nonce(0).build();
        tx2 = new TransactionBuilder().sender(ACCOUNT).receiver(CONTRACT).nonce(1).build();
        uncle = BlockBuilder.uncleHeader(0, 99);
        block1 = new BlockBuilder().parent(chain.getGenesis())
                .transactions(Arrays.asList(tx1, tx2))
                .uncles(Collections.singletonList(uncle))
                .build();

        LogInfo log1 = new LogInfo(CONTRACT, Collections.singletonList(VALUE), new byte[]{1});
        LogInfo log2 = new LogInfo(CONTRACT, Collections.emptyList(), new byte[]{2});
        LogInfo log3 = new LogInfo(CONTRACT, Collections.emptyList(), new byte[]{3});

        chain.appendBlock(block1, Arrays.asList(
                new ReceiptBuilder(tx1).logs(log1).build(),
                new ReceiptBuilder(tx2).cumulativeGas(42000).logs(log2, log3).build()),
                InMemoryAccountState.empty()
                        .withBalance(ACCOUNT, Coin.valueOf(1000))
                        .withNonce(ACCOUNT, 2)
                        .withCode(CONTRACT, new byte[]{0x60, 0x01})
                        .withStorage(CONTRACT, KEY, VALUE));

        BlockRefResolver resolver = new BlockRefResolver(chain, chain);
        module = new EthReadModuleImpl(chain, pool, resolver, new LogRetriever(chain, resolver), MoreExecutors.directExecutor());
    }

    @Test
    void blockNumber() {
        assertEquals("0x1", module.blockNumber().join());
    }

    @Test
    void getBalance() {
        assertEquals("0x3e8", module.getBalance(ACCOUNT, BlockRef.latest()).join());
        assertEquals("0x0", module.getBalance(UNKNOWN, BlockRef.latest()).join());
        assertEquals("0x0", module.getBalance(ACCOUNT, BlockRef.earliest()).join());
        assertNull(module.getBalance(ACCOUNT, BlockRef.number(2)).join());
    }

    @Test
    void getBalanceByCanonicalHash() {
        assertEquals("0x3e8", module.getBalance(ACCOUNT, BlockRef.hash(block1.getHash())).join());
        assertNull(module.getBalance(ACCOUNT, BlockRef.hash(new Keccak256(new byte[32]))).join());
    }

    @Test
    void getStorageAt() {
        assertEquals(VALUE.toJsonString(), module.getStorageAt(CONTRACT, KEY, BlockRef.latest()).join());
        assertEquals("0x" + "00".repeat(32), module.getStorageAt(CONTRACT, VALUE, BlockRef.latest()).join());
    }

    @Test
    void getTransactionCount() {
        assertEquals("0x2", module.getTransactionCount(ACCOUNT, BlockRef.latest()).join());
        assertEquals("0x0", module.getTransactionCount(UNKNOWN, BlockRef.latest()).join());
    }

    @Test
    void getCode() {
        assertEquals("0x6001", module.getCode(CONTRACT, BlockRef.latest()).join());
        assertEquals("0x", module.getCode(UNKNOWN, BlockRef.latest()).join());
    }

    @Test
    void missingStateFailsTheCall() {
        chain.removeState(block1);

        CompletionException e = assertThrows(CompletionException.class,
                () -> module.getBalance(ACCOUNT, BlockRef.latest()).join());
        assertTrue(e.getCause() instanceof EthJsonRpcRequestException);
        assertEquals(-32002, (int) ((EthJsonRpcRequestException) e.getCause()).getCode());
    }

    @Test
    void getBlockByHash() {
        BlockResultDTO result = module.getBlockByHash(block1.getHash(), false).join();

        assertEquals("0x1", result.getNumber());
        assertEquals(block1.getHashJsonString(), result.getHash());
        assertEquals(Arrays.asList(tx1.getHash().toJsonString(), tx2.getHash().toJsonString()), result.getTransactions());
        assertEquals(Collections.singletonList(uncle.getHash().toJsonString()), result.getUncles());
        assertNull(module.getBlockByHash(new Keccak256(new byte[32]), false).join());
    }

    @Test
    void genesisOnlyChainServesGenesisAsLatest() {
        InMemoryChain genesisOnly = new InMemoryChain();
        BlockRefResolver resolver = new BlockRefResolver(genesisOnly, genesisOnly);
        EthReadModule genesisModule = new EthReadModuleImpl(genesisOnly, new InMemoryTransactionPool(), resolver,
                new LogRetriever(genesisOnly, resolver), MoreExecutors.directExecutor());

        BlockResultDTO latest = genesisModule.getBlockByNumber(BlockRef.latest(), false).join();

        assertEquals("0x0", latest.getNumber());
        assertEquals(genesisOnly.getGenesis().getHashJsonString(), latest.getHash());
        assertTrue(latest.getTransactions().isEmpty());
        assertEquals("0x0", genesisModule.blockNumber().join());
        assertTrue(genesisModule.getLogs(new LogFilter(BlockRef.earliest(), BlockRef.latest(), null, null, null)).join().isEmpty());
    }

    @Test
    void getBlockByNumberWithFullTransactions() {
        BlockResultDTO result = module.getBlockByNumber(BlockRef.number(1), true).join();

        TransactionResultDTO second = (TransactionResultDTO) result.getTransactions().get(1);
        assertEquals(tx2.getHash().toJsonString(), second.getHash());
        assertEquals("0x1", second.getTransactionIndex());
        assertEquals(block1.getHashJsonString(), second.getBlockHash());
        assertNull(module.getBlockByNumber(BlockRef.number(5), true).join());
    }

    @Test
    void pendingBlockHasNoHashNorMiner() {
        Transaction pendingTx = new TransactionBuilder().nonce(7).build();
        Block pending = new BlockBuilder().parent(block1).transactions(Collections.singletonList(pendingTx)).build();
        chain.setPending(pending, InMemoryAccountState.empty());

        BlockResultDTO result = module.getBlockByNumber(BlockRef.pending(), true).join();

        assertEquals("0x2", result.getNumber());
        assertNull(result.getHash());
        assertNull(result.getNonce());
        assertNull(result.getMiner());
        assertNull(((TransactionResultDTO) result.getTransactions().get(0)).getBlockHash());
    }

    @Test
    void pendingWithoutPendingBlockIsLatest() {
        BlockResultDTO result = module.getBlockByNumber(BlockRef.pending(), false).join();

        assertEquals(block1.getHashJsonString(), result.getHash());
    }

    @Test
    void transactionAndUncleCounts() {
        assertEquals("0x2", module.getBlockTransactionCountByHash(block1.getHash()).join());
        assertEquals("0x2", module.getBlockTransactionCountByNumber(BlockRef.latest()).join());
        assertEquals("0x0", module.getBlockTransactionCountByNumber(BlockRef.earliest()).join());
        assertEquals("0x1", module.getUncleCountByBlockHash(block1.getHash()).join());
        assertEquals("0x1", module.getUncleCountByBlockNumber(BlockRef.number(1)).join());
        assertNull(module.getUncleCountByBlockNumber(BlockRef.number(9)).join());
        assertNull(module.getBlockTransactionCountByHash(new Keccak256(new byte[32])).join());
    }

    @Test
    void getTransactionByHash() {
        TransactionResultDTO mined = module.getTransactionByHash(tx2.getHash()).join();

        assertEquals(block1.getHashJsonString(), mined.getBlockHash());
        assertEquals("0x1", mined.getBlockNumber());
        assertEquals("0x1", mined.getTransactionIndex());
        assertEquals(CONTRACT.toJsonString(), mined.getTo());
    }

    @Test
    void getPooledTransactionByHash() {
        Transaction pooled = new TransactionBuilder().nonce(9).build();
        pool.addTransaction(pooled);

        TransactionResultDTO result = module.getTransactionByHash(pooled.getHash()).join();

        assertEquals(pooled.getHash().toJsonString(), result.getHash());
        assertNull(result.getBlockHash());
        assertNull(result.getBlockNumber());
        assertNull(result.getTransactionIndex());
        assertNull(module.getTransactionByHash(new Keccak256(new byte[32])).join());
    }

    @Test
    void transactionOfAForkBlockIsNotFound() {
        Transaction forkTx = new TransactionBuilder().nonce(50).build();
        Block fork = new BlockBuilder().parent(chain.getGenesis()).salt(3)
                .transactions(Collections.singletonList(forkTx)).build();
        chain.addSideBlock(fork, Collections.singletonList(new ReceiptBuilder(forkTx).build()), InMemoryAccountState.empty());

        assertNull(module.getTransactionByHash(forkTx.getHash()).join());
        assertNull(module.getTransactionReceipt(forkTx.getHash()).join());
        assertNull(module.getBlockByHash(fork.getHash(), false).join());
    }

    @Test
    void transactionByBlockAndIndex() {
        assertEquals(tx1.getHash().toJsonString(),
                module.getTransactionByBlockHashAndIndex(block1.getHash(), 0).join().getHash());
        assertEquals(tx2.getHash().toJsonString(),
                module.getTransactionByBlockNumberAndIndex(BlockRef.latest(), 1).join().getHash());
        assertNull(module.getTransactionByBlockNumberAndIndex(BlockRef.latest(), 2).join());
        assertNull(module.getTransactionByBlockHashAndIndex(block1.getHash(), -1).join());
    }

    @Test
    void getTransactionReceipt() {
        TransactionReceiptDTO receipt = module.getTransactionReceipt(tx2.getHash()).join();

        assertEquals(tx2.getHash().toJsonString(), receipt.getTransactionHash());
        assertEquals("0x1", receipt.getTransactionIndex());
        assertEquals("0x1", receipt.getBlockNumber());
        assertEquals("0xa410", receipt.getCumulativeGasUsed());
        assertEquals("0x1", receipt.getStatus());
        assertNull(receipt.getContractAddress());
        assertEquals(2, receipt.getLogs().length);
        assertEquals("0x1", receipt.getLogs()[0].logIndex);
        assertEquals("0x0", receipt.getLogs()[0].transactionLogIndex);
        assertEquals("0x2", receipt.getLogs()[1].logIndex);
    }

    @Test
    void pooledTransactionHasNoReceipt() {
        Transaction pooled = new TransactionBuilder().nonce(9).build();
        pool.addTransaction(pooled);

        assertNull(module.getTransactionReceipt(pooled.getHash()).join());
    }

    @Test
    void uncleByBlockAndIndex() {
        BlockResultDTO result = module.getUncleByBlockHashAndIndex(block1.getHash(), 0).join();

        assertEquals(uncle.getHash().toJsonString(), result.getHash());
        assertTrue(result.getTransactions().isEmpty());
        assertNull(result.getSize());
        assertNull(module.getUncleByBlockNumberAndIndex(BlockRef.latest(), 1).join());
        assertNull(module.getUncleByBlockNumberAndIndex(BlockRef.number(3), 0).join());
    }

    @Test
    void getLogs() {
        List<LogFilterElement> logs = module.getLogs(new LogFilter(BlockRef.earliest(), BlockRef.latest(), null,
                Collections.singletonList(CONTRACT), null)).join();

        assertEquals(3, logs.size());
        assertEquals("0x0", logs.get(0).logIndex);
        assertEquals("0x2", logs.get(2).logIndex);
        assertEquals("0x1", logs.get(2).transactionLogIndex);
    }
}
