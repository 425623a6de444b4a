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

import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WsClientTest {

    static class Recorder implements WsClient.Listener {

        final BlockingQueue<WsFrame> frames = new LinkedBlockingQueue<>();
        final CountDownLatch closed = new CountDownLatch(1);
        final AtomicInteger closeCalls = new AtomicInteger();
        final List<String> order = new ArrayList<>();

        @Override
        public void onFrame(WsFrame frame) {
            order.add(frame.isText() ? "text" : "close-frame");
            if (frame.isText()) {
                frames.add(frame);
            }
        }

        @Override
        public void onClose() {
            order.add("close");
            closeCalls.incrementAndGet();
            closed.countDown();
        }

    }

    @Test
    void testSendAndReceive() throws Exception {
        try (WsTestServer server = WsTestServer.echo()) {
            Recorder recorder = new Recorder();
            WsClient client = WsClient.connect(server.getUrl(), recorder);
            assertTrue(client.isOpen());

            client.send("hello");

            WsFrame frame = recorder.frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame);
            assertTrue(frame.isText());
            assertEquals("echo:hello", frame.text());
            client.close();
        }
    }

    @Test
    void testFramesDeliveredInOrder() throws Exception {
        List<String> burst = IntStream.range(0, 200).mapToObj(i -> "m" + i).collect(Collectors.toList());
        try (WsTestServer server = WsTestServer.start(text -> burst)) {
            Recorder recorder = new Recorder();
            WsClient client = WsClient.connect(server.getUrl(), recorder);

            client.send("go");

            List<String> received = new ArrayList<>();
            for (int i = 0; i < burst.size(); i++) {
                WsFrame frame = recorder.frames.poll(5, TimeUnit.SECONDS);
                assertNotNull(frame, "missing message " + i);
                received.add(frame.text());
            }
            assertEquals(burst, received);
            client.close();
        }
    }

    @Test
    void testLargeMessage() throws Exception {
        String big = "x".repeat(3 * HttpUtils.MEGABYTE);
        try (WsTestServer server = WsTestServer.start(text -> List.of(big))) {
            Recorder recorder = new Recorder();
            WsClientOptions options = WsClientOptions.of(server.getUrl()).withMaxPayloadSize(4 * HttpUtils.MEGABYTE);
            WsClient client = WsClient.connect(options, recorder);

            client.send("go");

            WsFrame frame = recorder.frames.poll(10, TimeUnit.SECONDS);
            assertNotNull(frame);
            assertEquals(big.length(), frame.text().length());
            client.close();
        }
    }

    @Test
    void testServerDropNotifiesCloseLast() throws Exception {
        try (WsTestServer server = WsTestServer.start(text -> List.of("a", "b"))) {
            Recorder recorder = new Recorder();
            WsClient client = WsClient.connect(server.getUrl(), recorder);
            client.send("go");
            assertNotNull(recorder.frames.poll(5, TimeUnit.SECONDS));
            assertNotNull(recorder.frames.poll(5, TimeUnit.SECONDS));

            server.dropClients();

            assertTrue(recorder.closed.await(5, TimeUnit.SECONDS));
            assertFalse(client.isOpen());
            assertEquals(List.of("text", "text", "close"), recorder.order);
            WsException e = assertThrows(WsException.class, () -> client.send("late"));
            assertEquals(WsException.Type.CONNECTION_CLOSED, e.getType());
        }
    }

    @Test
    void testServerCloseHandshakeForwardsCloseFrame() throws Exception {
        try (WsTestServer server = WsTestServer.echo()) {
            Recorder recorder = new Recorder();
            WsClient client = WsClient.connect(server.getUrl(), recorder);
            client.send("a");
            assertNotNull(recorder.frames.poll(5, TimeUnit.SECONDS));

            server.closeClients();

            assertTrue(recorder.closed.await(5, TimeUnit.SECONDS));
            assertFalse(client.isOpen());
            assertEquals("text", recorder.order.get(0));
            assertEquals("close", recorder.order.get(recorder.order.size() - 1));
            assertEquals(1, recorder.closeCalls.get());
        }
    }

    @Test
    void testClientCloseNotifiesOnce() throws Exception {
        try (WsTestServer server = WsTestServer.echo()) {
            Recorder recorder = new Recorder();
            WsClient client = WsClient.connect(server.getUrl(), recorder);

            client.close();
            assertTrue(recorder.closed.await(5, TimeUnit.SECONDS));
            client.close();

            assertFalse(client.isOpen());
            assertEquals(1, recorder.closeCalls.get());
        }
    }

    @Test
    void testConnectRefused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        WsException e = assertThrows(WsException.class,
                () -> WsClient.connect("ws://127.0.0.1:" + port + "/ws", new Recorder()));
        assertEquals(WsException.Type.CONNECT_FAILED, e.getType());
    }

    @Test
    void testHandshakeNotAnswered() {
        try (WsTestServer server = WsTestServer.echo()) {
            WsClientOptions options = WsClientOptions.of("ws://127.0.0.1:" + server.getPort() + "/not-websocket")
                    .withConnectTimeout(Duration.ofSeconds(1));
            WsException e = assertThrows(WsException.class, () -> WsClient.connect(options, new Recorder()));
            assertEquals(WsException.Type.CONNECT_FAILED, e.getType());
        }
    }

}
