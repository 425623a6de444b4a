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
package io.uidriver.driver;

import io.uidriver.http.HttpUtils;
import io.uidriver.http.WsClient;
import io.uidriver.http.WsClientOptions;
import io.uidriver.http.WsException;
import io.uidriver.http.WsFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * {@link DebugTransport} over the Netty websocket client.
 * Incoming text messages are queued in arrival order; a close puts a marker behind them.
 */
public class WsDebugTransport implements DebugTransport, WsClient.Listener {

    private static final Logger logger = LoggerFactory.getLogger(WsDebugTransport.class);

    // screenshots arrive as one large base64 message
    static final int MAX_PAYLOAD_SIZE = HttpUtils.MEGABYTE * 16;

    private static final WsFrame CLOSED = WsFrame.close(1006, "connection lost");

    private final BlockingQueue<WsFrame> inbox = new LinkedBlockingQueue<>();
    private volatile WsClient ws;
    private volatile boolean closed;

    private WsDebugTransport() {
    }

    /**
     * @throws DriverConnectionException if the url is not a websocket url or the endpoint cannot be reached
     */
    public static WsDebugTransport connect(String webSocketUrl) {
        WsClientOptions options;
        try {
            options = WsClientOptions.of(webSocketUrl).withMaxPayloadSize(MAX_PAYLOAD_SIZE);
        } catch (IllegalArgumentException e) {
            throw new DriverConnectionException("invalid websocket url: " + webSocketUrl, e);
        }
        WsDebugTransport transport = new WsDebugTransport();
        try {
            transport.ws = WsClient.connect(options, transport);
        } catch (WsException e) {
            throw new DriverConnectionException("cannot connect to " + webSocketUrl + ": " + e.getMessage(), e);
        }
        return transport;
    }

    @Override
    public void onFrame(WsFrame frame) {
        if (frame.isText()) {
            inbox.add(frame);
        }
    }

    @Override
    public void onClose() {
        inbox.add(CLOSED);
    }

    @Override
    public void onError(Throwable error) {
        logger.warn("debug connection error: {}", error.getMessage());
    }

    @Override
    public void send(String message) {
        if (closed) {
            throw new ProtocolException("debug connection is closed");
        }
        try {
            ws.send(message);
        } catch (WsException e) {
            throw new ProtocolException("send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String receive() {
        if (closed && inbox.isEmpty()) {
            throw new ProtocolException("debug connection is closed");
        }
        WsFrame frame;
        try {
            frame = inbox.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException("interrupted waiting for a message", e);
        }
        if (frame == CLOSED) {
            closed = true;
            // keep the marker so that later receives fail as well
            inbox.add(CLOSED);
            throw new ProtocolException("debug connection dropped: " + ws.getUri());
        }
        return frame.text();
    }

    @Override
    public boolean isOpen() {
        return !closed && ws.isOpen();
    }

    @Override
    public void close() {
        closed = true;
        ws.close();
    }

}
