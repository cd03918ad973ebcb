/*
 * This file is part of EthFacade
 * Copyright (C) 2017 RSK Labs Ltd.
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
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequestDecoder;
import io.netty.handler.codec.http.HttpResponseEncoder;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;

public class Web3HttpServer {

    private static final Logger logger = LoggerFactory.getLogger("jsonrpc");

    private final InetAddress bindAddress;
    private final int port;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final int socketLinger;
    private final boolean reuseAddress;
    private final int maxAggregatedFrameSize;
    private final CorsConfiguration corsConfiguration;
    private final JsonRpcWeb3ServerHandler jsonRpcWeb3ServerHandler;

    private Channel serverChannel;

    public Web3HttpServer(InetAddress bindAddress,
                          int port,
                          int socketLinger,
                          boolean reuseAddress,
                          int maxAggregatedFrameSize,
                          CorsConfiguration corsConfiguration,
                          JsonRpcWeb3ServerHandler jsonRpcWeb3ServerHandler) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.socketLinger = socketLinger;
        this.reuseAddress = reuseAddress;
        this.maxAggregatedFrameSize = maxAggregatedFrameSize;
        this.corsConfiguration = corsConfiguration;
        this.jsonRpcWeb3ServerHandler = jsonRpcWeb3ServerHandler;
        this.bossGroup = new NioEventLoopGroup();
        this.workerGroup = new NioEventLoopGroup();
    }

    public void start() throws InterruptedException {
        ServerBootstrap b = new ServerBootstrap();
        b.option(ChannelOption.SO_LINGER, socketLinger);
        b.option(ChannelOption.SO_REUSEADDR, reuseAddress);
        b.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .handler(new LoggingHandler(LogLevel.INFO))
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    initPipeline(ch.pipeline());
                }
            });
        serverChannel = b.bind(bindAddress, port).sync().channel();
        logger.info("JSON-RPC HTTP server listening on {}", serverChannel.localAddress());
    }

    /**
     * @return the port actually bound, useful when configured with port 0.
     */
    public int getBoundPort() {
        return serverChannel == null ? port : ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    void initPipeline(ChannelPipeline p) {
        p.addLast(new HttpRequestDecoder());
        p.addLast(new HttpResponseEncoder());
        p.addLast(new HttpObjectAggregator(maxAggregatedFrameSize));
        if (corsConfiguration.hasOrigins()) {
            CorsConfigBuilder corsConfigBuilder = corsConfiguration.isAnyOrigin()
                    ? CorsConfigBuilder.forAnyOrigin()
                    : CorsConfigBuilder.forOrigins(corsConfiguration.getOrigins().toArray(new String[0]));
            CorsConfig corsConfig = corsConfigBuilder
                    .allowedRequestHeaders(HttpHeaderNames.CONTENT_TYPE)
                    .allowedRequestMethods(HttpMethod.POST)
                    .build();
            p.addLast(new CorsHandler(corsConfig));
        }
        p.addLast(new Web3HttpMethodFilterHandler());
        p.addLast(jsonRpcWeb3ServerHandler);
        p.addLast(new Web3ResultHttpResponseHandler());
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }
}
