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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DebugChannelTest {

    @Test
    void testCommandCarriesFixedId() {
        ScriptedTransport transport = new ScriptedTransport().reply("{\"id\":77,\"result\":{}}");
        DebugChannel channel = new DebugChannel(transport);

        DebugResponse response = channel.method("Page.navigate").param("url", "https://example.com").send();

        assertFalse(response.isError());
        assertEquals(77, response.getId());
        Map<String, Object> sent = transport.lastSent();
        assertEquals(77, ((Number) sent.get("id")).intValue());
        assertEquals("Page.navigate", sent.get("method"));
        assertEquals(Map.of("url", "https://example.com"), sent.get("params"));
    }

    @Test
    void testEventsAndStaleResponsesAreDiscarded() {
        ScriptedTransport transport = new ScriptedTransport().reply(
                "{\"method\":\"Page.loadEventFired\",\"params\":{}}",
                "{\"id\":12,\"result\":{\"stale\":true}}",
                "{\"id\":77,\"result\":{\"frameId\":\"F1\"}}",
                "{\"id\":77,\"result\":{\"frameId\":\"F2\"}}");
        DebugChannel channel = new DebugChannel(transport);

        DebugResponse response = channel.method("Page.navigate").send();

        assertEquals("F1", response.getResult("frameId"));
        // the following message stays queued for the next command
        assertEquals("F2", channel.method("Page.navigate").send().getResult("frameId"));
    }

    @Test
    void testErrorResponseIsReturned() {
        ScriptedTransport transport = new ScriptedTransport()
                .reply("{\"id\":77,\"error\":{\"code\":-32601,\"message\":\"method not found\"}}");
        DebugChannel channel = new DebugChannel(transport);

        DebugResponse response = channel.method("No.such").send();

        assertTrue(response.isError());
        assertEquals(-32601, response.getErrorCode());
        assertEquals("method not found", response.getErrorMessage());
    }

    @Test
    void testConnectionDropWhileWaiting() {
        ScriptedTransport transport = new ScriptedTransport().reply("{\"method\":\"Inspector.detached\"}");
        DebugChannel channel = new DebugChannel(transport);

        ProtocolException e = assertThrows(ProtocolException.class, () -> channel.method("Page.enable").send());
        assertTrue(e.isRecoverable());
        assertFalse(channel.isAlive());
    }

    @Test
    void testMalformedMessage() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport().reply("{\"id\":"));
        assertThrows(ProtocolException.class, () -> channel.method("Page.enable").send());
    }

    @Test
    void testNonObjectMessage() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport().reply("[1,2]"));
        ProtocolException e = assertThrows(ProtocolException.class, () -> channel.method("Page.enable").send());
        assertTrue(e.getMessage().contains("not a JSON object"));
    }

    @Test
    void testRunJsSendsExpression() {
        ScriptedTransport transport = new ScriptedTransport()
                .reply(ScriptedTransport.evaluateResult(Map.of("type", "number", "value", 2)));
        DebugChannel channel = new DebugChannel(transport);

        Map<String, Object> result = channel.runJs("1 + 1");

        assertEquals("number", result.get("type"));
        assertEquals("Runtime.evaluate", transport.lastSent().get("method"));
        assertEquals(Map.of("expression", "1 + 1"), transport.lastSent().get("params"));
    }

    @Test
    void testRunJsGetValuePlainValue() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply(ScriptedTransport.evaluateResult(Map.of("type", "string", "value", "hello"))));
        assertEquals("hello", channel.runJsGetValue("'hello'"));
    }

    @Test
    void testRunJsGetValueNullValue() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply("{\"id\":77,\"result\":{\"result\":{\"type\":\"object\",\"subtype\":\"null\",\"value\":null}}}"));
        assertNull(channel.runJsGetValue("null"));
    }

    @Test
    void testRunJsGetValueNode() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply(ScriptedTransport.evaluateResult(Map.of(
                        "type", "object", "subtype", "node", "objectId", "node-42", "className", "HTMLBodyElement"))));
        assertEquals("node-42", channel.runJsGetValue("document.body"));
    }

    @Test
    void testRunJsGetValueScriptError() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply(ScriptedTransport.evaluateResult(Map.of(
                        "type", "object", "subtype", "error",
                        "description", "TypeError: Cannot read properties of null"))));
        JsExecutionException e = assertThrows(JsExecutionException.class,
                () -> channel.runJsGetValue("document.querySelector('#missing').innerText"));
        assertEquals("TypeError: Cannot read properties of null", e.getDescription());
        assertFalse(e.isRecoverable());
    }

    @Test
    void testRunJsGetValueUnknownShape() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply(ScriptedTransport.evaluateResult(Map.of("type", "undefined"))));
        UnknownProtocolResultException e = assertThrows(UnknownProtocolResultException.class,
                () -> channel.runJsGetValue("undefined"));
        assertEquals("{\"type\":\"undefined\"}", e.getRawJson());
    }

    @Test
    void testToValueShapes() {
        assertEquals(42, DebugChannel.toValue(Map.of("value", 42)));
        assertEquals("123", DebugChannel.toValue(Map.of("subtype", "node", "objectId", "123")));
        JsExecutionException e = assertThrows(JsExecutionException.class,
                () -> DebugChannel.toValue(Map.of("subtype", "error", "description", "boom")));
        assertEquals("boom", e.getDescription());
        UnknownProtocolResultException u = assertThrows(UnknownProtocolResultException.class,
                () -> DebugChannel.toValue(Map.of("subtype", "other")));
        assertEquals("{\"subtype\":\"other\"}", u.getRawJson());
    }

    @Test
    void testRunJsMissingResult() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport().reply("{\"id\":77,\"result\":{}}"));
        assertThrows(UnknownProtocolResultException.class, () -> channel.runJs("1"));
    }

    @Test
    void testRunJsProtocolError() {
        DebugChannel channel = new DebugChannel(new ScriptedTransport()
                .reply("{\"id\":77,\"error\":{\"code\":-32000,\"message\":\"Execution context was destroyed.\"}}"));
        CommandException e = assertThrows(CommandException.class, () -> channel.runJs("1"));
        assertTrue(e.getMessage().contains("Execution context was destroyed."));
    }

    @Test
    void testResponderDrivenConversation() {
        ScriptedTransport transport = new ScriptedTransport(command -> List.of(
                "{\"method\":\"Runtime.consoleAPICalled\"}",
                ScriptedTransport.evaluateResult(Map.of("type", "string",
                        "value", ((Map<?, ?>) command.get("params")).get("expression")))));
        DebugChannel channel = new DebugChannel(transport);

        assertEquals("a", channel.runJsGetValue("a"));
        assertEquals("b", channel.runJsGetValue("b"));
        assertEquals(2, transport.getSent().size());
    }

    @Test
    void testCloseClosesTransport() {
        ScriptedTransport transport = new ScriptedTransport();
        DebugChannel channel = new DebugChannel(transport);
        assertTrue(channel.isAlive());
        channel.kill();
        assertFalse(channel.isAlive());
        assertThrows(ProtocolException.class, () -> channel.method("Page.enable").send());
    }

}
