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

package co.ethfacade.rpc.netty;

import co.ethfacade.rpc.CorsConfiguration;
import co.ethfacade.rpc.EthJsonRpcRouter;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JsonRpcWeb3ServerHandlerTest {

    private static final String REQUEST = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_blockNumber\",\"params\":[]}";
    private static final String RESPONSE = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}";

    private EthJsonRpcRouter router;

    @BeforeEach
    void setUp() {
        router = mock(EthJsonRpcRouter.class);
    }

    @Test
    void postRequestIsAnsweredWithTheRouterResponse() {
        when(router.handle(any())).thenReturn(CompletableFuture.completedFuture(RESPONSE));
        EmbeddedChannel channel = handlerChannel();

        channel.writeInbound(post(REQUEST));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.OK, response.status());
            assertEquals("application/json", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
            assertEquals(RESPONSE.length(), response.headers().getInt(HttpHeaderNames.CONTENT_LENGTH));
            assertEquals(RESPONSE, response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
        verify(router).handle(REQUEST.getBytes(StandardCharsets.UTF_8));
        assertFalse(channel.isOpen());
    }

    @Test
    void responseIsSentWhenTheRouterCompletesLater() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(router.handle(any())).thenReturn(pending);
        EmbeddedChannel channel = handlerChannel();

        channel.writeInbound(post(REQUEST));
        channel.runPendingTasks();
        assertNull(channel.readOutbound());

        pending.complete(RESPONSE);
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        assertEquals(RESPONSE, response.content().toString(StandardCharsets.UTF_8));
        response.release();
    }

    @Test
    void routerFailureIsReportedAsInternalError() {
        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("boom"));
        when(router.handle(any())).thenReturn(failed);
        EmbeddedChannel channel = handlerChannel();

        channel.writeInbound(post(REQUEST));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        String body = response.content().toString(StandardCharsets.UTF_8);
        response.release();
        assertEquals(HttpResponseStatus.OK, response.status());
        assertTrue(body.contains("\"code\":-32603"));
        assertTrue(body.contains("\"id\":null"));
    }

    @Test
    void nonPostRequestIsRejected() {
        EmbeddedChannel channel = handlerChannel();

        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/"));

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, response.status());
        assertEquals("POST", response.headers().get(HttpHeaderNames.ALLOW));
        response.release();
        verifyNoInteractions(router);
        assertFalse(channel.isOpen());
    }

    @Test
    void fullPipelineServesRawHttpWithCorsHeader() {
        when(router.handle(any())).thenReturn(CompletableFuture.completedFuture(RESPONSE));
        Web3HttpServer server = new Web3HttpServer(InetAddress.getLoopbackAddress(), 0, -1, true, 65536,
                new CorsConfiguration("https://wallet.example"), new JsonRpcWeb3ServerHandler(router));
        try {
            EmbeddedChannel channel = new EmbeddedChannel();
            server.initPipeline(channel.pipeline());

            String raw = "POST / HTTP/1.1\r\n"
                    + "Host: localhost\r\n"
                    + "Origin: https://wallet.example\r\n"
                    + "Content-Type: application/json\r\n"
                    + "Content-Length: " + REQUEST.length() + "\r\n"
                    + "\r\n"
                    + REQUEST;
            channel.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.UTF_8));
            channel.runPendingTasks();

            String written = readAll(channel);
            assertTrue(written.startsWith("HTTP/1.1 200 OK"));
            assertTrue(written.toLowerCase().contains("access-control-allow-origin: https://wallet.example"));
            assertTrue(written.endsWith(RESPONSE));
        } finally {
            server.stop();
        }
    }

    private EmbeddedChannel handlerChannel() {
        return new EmbeddedChannel(
                new Web3HttpMethodFilterHandler(),
                new JsonRpcWeb3ServerHandler(router),
                new Web3ResultHttpResponseHandler());
    }

    private static DefaultFullHttpRequest post(String body) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/",
                Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
    }

    private static String readAll(EmbeddedChannel channel) {
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }
}
