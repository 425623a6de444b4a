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

import io.uidriver.http.HttpException;
import io.uidriver.http.HttpUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists the debug targets a browser advertises.
 */
@FunctionalInterface
public interface TargetDiscovery {

    /**
     * Queries {@code GET http://host:port/json}.
     */
    TargetDiscovery HTTP = options -> {
        String url = options.getDiscoveryUrl();
        Object json;
        try {
            json = HttpUtils.getJson(url);
        } catch (HttpException e) {
            throw new DriverConnectionException("target discovery failed: " + e.getMessage(), e);
        }
        return parseTargets(json);
    };

    /**
     * @throws DriverConnectionException if the discovery endpoint cannot be reached
     */
    List<DebugTarget> listTargets(BrowserOptions options);

    @SuppressWarnings("unchecked")
    static List<DebugTarget> parseTargets(Object json) {
        if (!(json instanceof List)) {
            throw new UnknownProtocolResultException(String.valueOf(json));
        }
        List<DebugTarget> targets = new ArrayList<>();
        for (Object item : (List<Object>) json) {
            if (item instanceof Map) {
                targets.add(DebugTarget.fromMap((Map<String, Object>) item));
            }
        }
        return targets;
    }

}
