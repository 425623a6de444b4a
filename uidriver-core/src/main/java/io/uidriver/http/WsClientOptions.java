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

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable connection settings for {@link WsClient}. Only {@code ws://} and {@code wss://}
 * urls are accepted, the {@code with*} methods return modified copies.
 */
public final class WsClientOptions {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final URI uri;
    private final boolean secure;
    private final int port;
    private final Map<String, String> headers;
    private final int maxPayloadSize;
    private final Duration connectTimeout;

    private WsClientOptions(URI uri, Map<String, String> headers, int maxPayloadSize, Duration connectTimeout) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        this.secure = "wss".equals(scheme);
        if (!secure && !"ws".equals(scheme)) {
            throw new IllegalArgumentException("not a websocket url: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("websocket url has no host: " + uri);
        }
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("max payload size must be positive: " + maxPayloadSize);
        }
        this.uri = uri;
        this.port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        this.headers = Map.copyOf(headers);
        this.maxPayloadSize = maxPayloadSize;
        this.connectTimeout = connectTimeout;
    }

    public static WsClientOptions of(String url) {
        return of(URI.create(url));
    }

    public static WsClientOptions of(URI uri) {
        if (uri == null) {
            throw new IllegalArgumentException("websocket url cannot be null");
        }
        return new WsClientOptions(uri, Map.of(), HttpUtils.MEGABYTE, DEFAULT_CONNECT_TIMEOUT);
    }

    public WsClientOptions withHeader(String name, String value) {
        Map<String, String> merged = new HashMap<>(headers);
        merged.put(name, value);
        return new WsClientOptions(uri, merged, maxPayloadSize, connectTimeout);
    }

    /**
     * Largest message accepted from the peer, after reassembly of fragmented frames.
     */
    public WsClientOptions withMaxPayloadSize(int bytes) {
        return new WsClientOptions(uri, headers, bytes, connectTimeout);
    }

    /**
     * Bounds both the TCP connect and the websocket handshake.
     */
    public WsClientOptions withConnectTimeout(Duration timeout) {
        return new WsClientOptions(uri, headers, maxPayloadSize, timeout);
    }

    public URI getUri() {
        return uri;
    }

    public String getHost() {
        return uri.getHost();
    }

    public int getPort() {
        return port;
    }

    public boolean isSecure() {
        return secure;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public String toString() {
        return "WsClientOptions[" + uri + ", maxPayload=" + maxPayloadSize + ", timeout=" + connectTimeout + "]";
    }

}
