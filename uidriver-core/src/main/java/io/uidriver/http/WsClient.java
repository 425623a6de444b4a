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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Websocket client built on Netty, one connection and one event loop thread per client.
 * <p>
 * The {@link Listener} is called on a dedicated dispatch thread: frames arrive in the order
 * they were received, and {@link Listener#onClose()} is the last call, made exactly once.
 * Fragmented messages are reassembled before delivery.
 */
public class WsClient {

    private static final Logger logger = LoggerFactory.getLogger(WsClient.class);

    private static final AtomicInteger CLIENT_IDS = new AtomicInteger();

    private static final int HANDSHAKE_RESPONSE_LIMIT = 64 * 1024;

    public interface Listener {

        void onFrame(WsFrame frame);

        default void onClose() {
        }

        default void onError(Throwable error) {
        }

    }

    private final WsClientOptions options;
    private final Listener listener;
    private final int id = CLIENT_IDS.incrementAndGet();
    private final ExecutorService dispatcher;
    private final AtomicBoolean closeNotified = new AtomicBoolean();

    private EventLoopGroup group;
    private volatile Channel channel;
    private volatile boolean open;

    private WsClient(WsClientOptions options, Listener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.options = options;
        this.listener = listener;
        this.dispatcher = Executors.newSingleThreadExecutor(daemonThreads("ws-dispatch-" + id));
    }

    /**
     * Connects and completes the websocket handshake before returning.
     *
     * @throws WsException of type {@link WsException.Type#CONNECT_FAILED} when the peer cannot be
     *                     reached or refuses the upgrade within the connect timeout
     */
    public static WsClient connect(WsClientOptions options, Listener listener) {
        WsClient client = new WsClient(options, listener);
        try {
            client.open();
        } catch (RuntimeException e) {
            client.release();
            throw e instanceof WsException ? e
                    : new WsException(WsException.Type.CONNECT_FAILED, "connection failed: " + e.getMessage(), e);
        }
        return client;
    }

    public static WsClient connect(String url, Listener listener) {
        return connect(WsClientOptions.of(url), listener);
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private void open() {
        URI uri = options.getUri();
        HttpHeaders headers = new DefaultHttpHeaders();
        options.getHeaders().forEach(headers::add);
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, options.getMaxPayloadSize());
        WsClientHandler handler = new WsClientHandler(this, handshaker);
        SslContext ssl = options.isSecure() ? clientSslContext() : null;

        group = new MultiThreadIoEventLoopGroup(1, daemonThreads("ws-io-" + id), NioIoHandler.newFactory());
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) options.getConnectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (ssl != null) {
                            ch.pipeline().addLast(ssl.newHandler(ch.alloc(), options.getHost(), options.getPort()));
                        }
                        ch.pipeline().addLast(
                                new HttpClientCodec(),
                                new HttpObjectAggregator(HANDSHAKE_RESPONSE_LIMIT),
                                new WebSocketFrameAggregator(options.getMaxPayloadSize()),
                                handler);
                    }
                });

        ChannelFuture connected = bootstrap.connect(options.getHost(), options.getPort()).awaitUninterruptibly();
        if (!connected.isSuccess()) {
            throw new WsException(WsException.Type.CONNECT_FAILED,
                    "cannot reach " + uri + ": " + describe(connected.cause()), connected.cause());
        }
        channel = connected.channel();
        ChannelFuture handshake = handler.getHandshakeFuture();
        if (!handshake.awaitUninterruptibly(options.getConnectTimeout().toMillis())) {
            throw new WsException(WsException.Type.CONNECT_FAILED, "websocket handshake timed out: " + uri);
        }
        if (!handshake.isSuccess()) {
            throw new WsException(WsException.Type.CONNECT_FAILED,
                    "websocket handshake failed: " + describe(handshake.cause()), handshake.cause());
        }
        open = true;
        logger.debug("websocket connected: {}", uri);
    }

    private SslContext clientSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new WsException(WsException.Type.CONNECT_FAILED, "cannot create SSL context", e);
        }
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown cause" : String.valueOf(cause.getMessage());
    }

    public boolean isOpen() {
        Channel ch = channel;
        return open && ch != null && ch.isActive();
    }

    public URI getUri() {
        return options.getUri();
    }

    /**
     * Queues a text message. Delivery failures are reported to {@link Listener#onError(Throwable)}.
     *
     * @throws WsException of type {@link WsException.Type#CONNECTION_CLOSED} if the connection is not open
     */
    public void send(String text) {
        if (!isOpen()) {
            throw new WsException(WsException.Type.CONNECTION_CLOSED, "websocket is not open: " + options.getUri());
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                failed(new WsException(WsException.Type.SEND_FAILED, "send failed: " + describe(future.cause()),
                        future.cause()));
            }
        });
    }

    /**
     * Starts the close handshake. {@link Listener#onClose()} follows once the connection is down.
     */
    public void close() {
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            disconnected();
        }
    }

    // called from the event loop

    void frameReceived(WsFrame frame) {
        dispatch(() -> listener.onFrame(frame));
    }

    void failed(Throwable cause) {
        dispatch(() -> listener.onError(cause));
    }

    void disconnected() {
        if (!closeNotified.compareAndSet(false, true)) {
            return;
        }
        open = false;
        logger.debug("websocket closed: {}", options.getUri());
        dispatch(listener::onClose);
        release();
    }

    private void dispatch(Runnable callback) {
        try {
            dispatcher.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    logger.warn("websocket listener failed: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("client released, dropping callback: {}", options.getUri());
        }
    }

    private void release() {
        open = false;
        if (group != null) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        dispatcher.shutdown();
    }

}
