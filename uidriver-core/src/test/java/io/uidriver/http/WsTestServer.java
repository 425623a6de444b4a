/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.uidriver.http;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Minimal websocket server for tests: every text message received is passed to a
 * responder, and whatever it returns is written back in order.
 */
public class WsTestServer implements AutoCloseable {

    public static final String PATH = "/ws";

    private final EventLoopGroup group;
    private final Channel serverChannel;
    private final List<Channel> clients = new CopyOnWriteArrayList<>();
    private final List<String> received = new CopyOnWriteArrayList<>();

    private WsTestServer(Function<String, List<String>> responder) throws InterruptedException {
        group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketServerProtocolHandler(PATH, null, false, 16 * 1024 * 1024));
                        p.addLast(new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                            @Override
                            public void handlerAdded(ChannelHandlerContext ctx) {
                                clients.add(ctx.channel());
                            }

                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
                                String text = frame.text();
                                received.add(text);
                                for (String reply : responder.apply(text)) {
                                    ctx.writeAndFlush(new TextWebSocketFrame(reply));
                                }
                            }
                        });
                    }
                });
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
    }

    public static WsTestServer start(Function<String, List<String>> responder) {
        try {
            return new WsTestServer(responder);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    public static WsTestServer echo() {
        return start(text -> List.of("echo:" + text));
    }

    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String getUrl() {
        return "ws://127.0.0.1:" + getPort() + PATH;
    }

    public List<String> getReceived() {
        return received;
    }

    /**
     * Close every client socket at the TCP level. The pipeline is bypassed, so the
     * websocket handler gets no chance to send a close frame first.
     */
    public void dropClients() {
        for (Channel client : clients) {
            client.eventLoop().execute(() -> client.unsafe().closeForcibly());
        }
    }

    /**
     * Close every client connection through the pipeline, which performs the
     * websocket close handshake.
     */
    public void closeClients() {
        for (Channel client : clients) {
            client.close();
        }
    }

    @Override
    public void close() {
        closeClients();
        serverChannel.close().syncUninterruptibly();
        group.shutdownGracefully();
    }

}
