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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for remote-debugging protocol commands.
 * The correlation id is not part of the command, it is stamped by the channel on send.
 */
public class DebugCommand {

    private final DebugChannel channel;
    private final String method;
    private Map<String, Object> params;

    public DebugCommand(String method) {
        this(null, method);
    }

    DebugCommand(DebugChannel channel, String method) {
        if (method == null || method.isEmpty()) {
            throw new IllegalArgumentException("method cannot be empty");
        }
        this.channel = channel;
        this.method = method;
    }

    public DebugCommand param(String key, Object value) {
        if (params == null) {
            params = new LinkedHashMap<>();
        }
        params.put(key, value);
        return this;
    }

    public DebugCommand params(Map<String, Object> params) {
        if (params != null) {
            if (this.params == null) {
                this.params = new LinkedHashMap<>(params);
            } else {
                this.params.putAll(params);
            }
        }
        return this;
    }

    /**
     * Blocking send on the channel this command was created from.
     */
    public DebugResponse send() {
        if (channel == null) {
            throw new IllegalStateException("command is not bound to a channel: " + method);
        }
        return channel.runCommand(this);
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Map<String, Object> toMap(int id) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("method", method);
        if (params != null && !params.isEmpty()) {
            map.put("params", params);
        }
        return map;
    }

    public String toJson(int id) {
        return StringUtils.toJson(toMap(id));
    }

    @Override
    public String toString() {
        return "DebugCommand[" + method + "]";
    }

}
