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
package io.uidriver.driver.ui;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Element bounds relative to the viewport, as reported by {@code getBoundingClientRect()}.
 */
public record ElementRect(double x, double y, double width, double height) {

    /**
     * Screenshot clip for this element in page coordinates.
     */
    public Map<String, Object> toClip(ScrollOffset scroll) {
        Map<String, Object> clip = new LinkedHashMap<>();
        clip.put("x", x + scroll.x());
        clip.put("y", y + scroll.y());
        clip.put("width", width);
        clip.put("height", height);
        clip.put("scale", 1.0);
        return clip;
    }

}
