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

import io.uidriver.common.StringUtils;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * One persistent connection to a debug target, speaking the remote-debugging protocol.
 * <p>
 * The channel is single-flight: every command is stamped with the same correlation id
 * ({@value #CORRELATION_ID}) and the caller blocks until the matching response arrives.
 * Anything else received meanwhile (protocol events, stale responses) is discarded,
 * so only one command may be outstanding at a time. There is no timeout here, callers
 * bound their waits with {@link io.uidriver.wait.RetryWaiter}.
 * <p>
 * Not thread-safe.
 */
public class DebugChannel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DebugChannel.class);

    public static final int CORRELATION_ID = 77;

    private final DebugTransport transport;

    public DebugChannel(DebugTransport transport) {
        this.transport = transport;
    }

    /**
     * Open a channel to the given websocket debugger url.
     *
     * @throws DriverConnectionException if the endpoint is unreachable
     */
    public static DebugChannel connect(String webSocketUrl) {
        logger.debug("opening debug channel: {}", webSocketUrl);
        return new DebugChannel(WsDebugTransport.connect(webSocketUrl));
    }

    public DebugCommand method(String method) {
        return new DebugCommand(this, method);
    }

    public DebugResponse runCommand(DebugCommand command) {
        String json = command.toJson(CORRELATION_ID);
        logger.trace(">>> {}", json);
        transport.send(json);
        while (true) {
            String text = transport.receive();
            Map<String, Object> message = parse(text);
            Object id = message.get("id");
            if (id instanceof Number && ((Number) id).intValue() == CORRELATION_ID) {
                DebugResponse response = new DebugResponse(message);
                if (response.isError()) {
                    logger.debug("{} returned error: {}", command.getMethod(), response.getErrorMessage());
                }
                return response;
            }
            if (id == null) {
                logger.trace("ignoring event: {}", message.get("method"));
            } else {
                logger.debug("discarding response with unexpected id: {}", id);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(String text) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(text);
        } catch (ParseException e) {
            throw new ProtocolException("invalid message: " + StringUtils.toDiagnostic(text), e);
        }
        if (!(parsed instanceof Map)) {
            throw new ProtocolException("message is not a JSON object: " + StringUtils.toDiagnostic(text));
        }
        return (Map<String, Object>) parsed;
    }

    /**
     * Evaluate an expression in the page and return the remote object describing the result.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> runJs(String script) {
        DebugResponse response = method("Runtime.evaluate")
                .param("expression", script)
                .send();
        if (response.isError()) {
            throw new CommandException("Runtime.evaluate failed: " + response.getErrorMessage());
        }
        Object result = response.getResult("result");
        if (!(result instanceof Map)) {
            throw new UnknownProtocolResultException(response.toJson());
        }
        return (Map<String, Object>) result;
    }

    /**
     * Evaluate an expression and interpret the result:
     * a plain value is returned as is, a DOM node yields its object id,
     * a script error throws {@link JsExecutionException} and any other shape
     * throws {@link UnknownProtocolResultException}.
     */
    public Object runJsGetValue(String script) {
        return toValue(runJs(script));
    }

    static Object toValue(Map<String, Object> result) {
        if (result.containsKey("value")) {
            return result.get("value");
        }
        Object subtype = result.get("subtype");
        if ("node".equals(subtype)) {
            return result.get("objectId");
        }
        if ("error".equals(subtype)) {
            Object description = result.get("description");
            throw new JsExecutionException(description == null ? null : description.toString());
        }
        throw new UnknownProtocolResultException(StringUtils.toJson(result));
    }

    public boolean isAlive() {
        return transport.isOpen();
    }

    public void kill() {
        close();
    }

    @Override
    public void close() {
        transport.close();
    }

}
