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

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import io.uidriver.common.StringUtils;

import java.util.Map;

/**
 * A reply to a {@link DebugCommand}: either a {@code result} object or an {@code error}
 * object carrying {@code code} and {@code message}.
 * <p>
 * Values are looked up with JSONPath, where a leading {@code $.} may be omitted.
 * A path that does not resolve yields null instead of an exception.
 */
public class DebugResponse {

    private static final Configuration LENIENT = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS, Option.DEFAULT_PATH_LEAF_TO_NULL);

    private final Map<String, Object> message;
    private final DocumentContext document;

    public DebugResponse(Map<String, Object> message) {
        this.message = message;
        this.document = JsonPath.using(LENIENT).parse(message);
    }

    public int getId() {
        Integer id = asInt(message.get("id"));
        return id == null ? -1 : id;
    }

    public boolean isError() {
        return getError() != null;
    }

    public Map<String, Object> getError() {
        return asMap(message.get("error"));
    }

    public String getErrorMessage() {
        Object text = isError() ? getError().get("message") : null;
        return text == null ? null : text.toString();
    }

    public Integer getErrorCode() {
        return isError() ? asInt(getError().get("code")) : null;
    }

    public Map<String, Object> getResult() {
        return asMap(message.get("result"));
    }

    /**
     * Look up a value inside the {@code result} object, e.g. {@code "data"} or {@code "nodes[0].nodeId"}.
     */
    public <T> T getResult(String path) {
        if (getResult() == null) {
            return null;
        }
        return get(path.startsWith("$") ? "$.result" + path.substring(1) : "result." + path);
    }

    public String getResultAsString(String path) {
        Object value = getResult(path);
        return value == null ? null : value.toString();
    }

    /**
     * Look up a value anywhere in the message.
     */
    public <T> T get(String path) {
        return document.read(path.startsWith("$") ? path : "$." + path);
    }

    public Map<String, Object> getRaw() {
        return message;
    }

    public String toJson() {
        return StringUtils.toJson(message);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private static Integer asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    @Override
    public String toString() {
        return isError()
                ? "DebugResponse[" + getId() + " ERROR: " + getErrorMessage() + "]"
                : "DebugResponse[" + getId() + "]";
    }

}
