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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DebugResponseTest {

    @Test
    void testSuccessResponse() {
        DebugResponse response = new DebugResponse(Map.of(
                "id", 77,
                "result", Map.of("data", "iVBORw0KGgo=")
        ));
        assertEquals(77, response.getId());
        assertFalse(response.isError());
        assertNull(response.getError());
        assertNull(response.getErrorMessage());
        assertNull(response.getErrorCode());
        assertEquals("iVBORw0KGgo=", response.getResultAsString("data"));
        assertEquals("DebugResponse[77]", response.toString());
    }

    @Test
    void testErrorResponse() {
        DebugResponse response = new DebugResponse(Map.of(
                "id", 77,
                "error", Map.of("code", -32000, "message", "Cannot find context")
        ));
        assertTrue(response.isError());
        assertEquals(-32000, response.getErrorCode());
        assertEquals("Cannot find context", response.getErrorMessage());
        assertNull(response.getResult());
        assertNull(response.getResult("data"));
        assertEquals("DebugResponse[77 ERROR: Cannot find context]", response.toString());
    }

    @Test
    void testMissingId() {
        DebugResponse response = new DebugResponse(Map.of("method", "Page.loadEventFired"));
        assertEquals(-1, response.getId());
    }

    @Test
    void testNestedDotPath() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("result", Map.of("type", "string", "value", "Hello"));
        DebugResponse response = new DebugResponse(Map.of("id", 77, "result", result));

        assertEquals("string", response.getResult("result.type"));
        assertEquals("Hello", response.getResult("result.value"));
        assertNull(response.getResult("result.missing.deeper"));
    }

    @Test
    void testJsonPathExpressions() {
        DebugResponse response = new DebugResponse(Map.of(
                "id", 77,
                "result", Map.of("nodes", List.of(Map.of("nodeId", 1), Map.of("nodeId", 2)))
        ));
        Integer second = response.getResult("nodes[1].nodeId");
        assertEquals(2, second);
        assertNull(response.getResult("$.absent[0]"));
        assertEquals(77, (Integer) response.get("id"));
    }

    @Test
    void testToJson() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", 77);
        raw.put("result", Map.of());
        assertEquals("{\"id\":77,\"result\":{}}", new DebugResponse(raw).toJson());
    }

}
