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

import java.util.Map;

/**
 * A page (or other target) advertised by the discovery endpoint. Not owned, re-fetched on demand.
 */
public record DebugTarget(
        String id,
        String type,
        String title,
        String url,
        String webSocketDebuggerUrl
) {

    public static DebugTarget fromMap(Map<String, Object> map) {
        return new DebugTarget(
                asString(map.get("id")),
                asString(map.get("type")),
                asString(map.get("title")),
                asString(map.get("url")),
                asString(map.get("webSocketDebuggerUrl"))
        );
    }

    private static String asString(Object o) {
        return o == null ? null : o.toString();
    }

    public boolean isPage() {
        return "page".equals(type);
    }

}
