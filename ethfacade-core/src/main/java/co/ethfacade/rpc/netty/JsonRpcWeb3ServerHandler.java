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

package co.ethfacade.rpc.netty;

import co.ethfacade.rpc.EthJsonRpcRouter;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufHolder;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Hands request payloads to the router and forwards the response once the router completes it,
 * back on the channel's event loop.
 */
@ChannelHandler.Sharable
public class JsonRpcWeb3ServerHandler extends SimpleChannelInboundHandler<ByteBufHolder> {

    private static final Logger LOGGER = LoggerFactory.getLogger("jsonrpc");

    private static final String UNEXPECTED_ERROR_CONTENT = String.format(
            "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":%d,\"message\":\"Unexpected error\"}}",
            EthJsonRpcRequestException.INTERNAL_ERROR);

    private final EthJsonRpcRouter router;

    public JsonRpcWeb3ServerHandler(EthJsonRpcRouter router) {
        this.router = router;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBufHolder request) {
        // the request is released when this method returns, before the response is ready
        byte[] body = ByteBufUtil.getBytes(request.content());

        router.handle(body).whenComplete((response, t) -> {
            String content;
            if (t != null) {
                LOGGER.error("Unexpected error", t);
                content = UNEXPECTED_ERROR_CONTENT;
            } else {
                content = response;
            }

            ByteBuf responseContent = Unpooled.copiedBuffer(content, StandardCharsets.UTF_8);
            ctx.executor().execute(() -> ctx.fireChannelRead(new Web3Result(responseContent, HttpResponseStatus.OK.code())));
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("Unexpected exception", cause);
        ctx.close();
    }
}
