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

package co.ethfacade;

import co.ethfacade.backend.CallExecutor;
import co.ethfacade.backend.EthBackend;
import co.ethfacade.backend.ExecutionResult;
import co.ethfacade.backend.MiningCoordinator;
import co.ethfacade.backend.NodeInformation;
import co.ethfacade.backend.TransactionSigner;
import co.ethfacade.config.FacadeProperties;
import co.ethfacade.core.Coin;
import co.ethfacade.test.InMemoryChain;
import co.ethfacade.test.InMemoryTransactionPool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FacadeContextTest {

    private FacadeContext context;

    @BeforeEach
    void setUp() {
        FacadeProperties properties = new FacadeProperties(ConfigFactory.parseString(
                "rpc.providers.web.http.enabled = false\n"
                        + "rpc.workers = 2\n"
                        + "rpc.disabledMethods = [eth_gasPrice]")
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve());

        InMemoryChain chain = new InMemoryChain();
        chain.appendEmptyBlock();
        chain.appendEmptyBlock();

        NodeInformation nodeInformation = mock(NodeInformation.class);
        when(nodeInformation.getChainId()).thenReturn(Optional.of(31L));
        when(nodeInformation.getGasPrice()).thenReturn(Coin.valueOf(1));
        CallExecutor callExecutor = (call, header, state, gasLimit) -> ExecutionResult.success(new byte[0], 21_000);

        EthBackend backend = new EthBackend(chain, chain, new InMemoryTransactionPool(), callExecutor,
                mock(MiningCoordinator.class), mock(TransactionSigner.class), nodeInformation);
        context = new FacadeContext(properties, backend);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void routerServesCallsThroughTheWorkerPool() throws Exception {
        JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"eth_blockNumber\",\"params\":[]}");

        assertEquals(7, response.get("id").asInt());
        assertEquals("0x2", response.get("result").asText());
    }

    @Test
    void configuredDisabledMethodsAreNotAvailable() throws Exception {
        JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_gasPrice\",\"params\":[]}");

        assertEquals(-32601, response.get("error").get("code").asInt());
    }

    @Test
    void componentsAreCreatedOnce() {
        assertSame(context.getEthJsonRpcRouter(), context.getEthJsonRpcRouter());
        assertSame(context.getEthReadModule(), context.getEthReadModule());
    }

    @Test
    void startWithHttpDisabledDoesNotOpenTheServer() throws Exception {
        context.start();
        context.start();

        assertNotNull(context.getEthInfoModule());
    }

    @Test
    void closedContextCannotBeUsed() {
        context.close();

        assertThrows(IllegalStateException.class, () -> context.getEthJsonRpcRouter());
        assertThrows(IllegalStateException.class, () -> context.start());
    }

    private JsonNode call(String request) throws Exception {
        String response = context.getEthJsonRpcRouter()
                .handle(request.getBytes(StandardCharsets.UTF_8))
                .get(5, TimeUnit.SECONDS);
        return new ObjectMapper().readTree(response);
    }
}
