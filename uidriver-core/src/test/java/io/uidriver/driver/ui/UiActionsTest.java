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

import io.uidriver.driver.DebugChannel;
import io.uidriver.driver.JsExecutionException;
import io.uidriver.driver.ScriptedTransport;
import io.uidriver.driver.UnknownProtocolResultException;
import io.uidriver.wait.OutOfRetriesException;
import io.uidriver.wait.RetryPolicy;
import io.uidriver.wait.RetryWaiter;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class UiActionsTest {

    private static final String RECT_JSON =
            "{\"x\":10,\"y\":20.5,\"width\":100,\"height\":50,\"top\":20.5,\"right\":110,\"bottom\":70.5,\"left\":10}";

    private final List<Map<String, Object>> commands = new ArrayList<>();

    private static String value(Object value) {
        return "{\"id\":77,\"result\":{\"result\":{\"type\":\"string\",\"value\":" + JSONValue.toJSONString(value) + "}}}";
    }

    private static String jsError(String description) {
        return ScriptedTransport.evaluateResult(Map.of("type", "object", "subtype", "error", "description", description));
    }

    @SuppressWarnings("unchecked")
    private UiActions actions(Function<String, String> evaluator) {
        ScriptedTransport transport = new ScriptedTransport(command -> {
            commands.add(command);
            if ("Page.captureScreenshot".equals(command.get("method"))) {
                return List.of("{\"id\":77,\"result\":{\"data\":\"" + pngBase64() + "\"}}");
            }
            Map<String, Object> params = (Map<String, Object>) command.get("params");
            return List.of(evaluator.apply((String) params.get("expression")));
        });
        return new UiActions(new DebugChannel(transport),
                new RetryWaiter(RetryPolicy.of(5, 0)), ImageDecoder.IMAGE_IO);
    }

    private static String pngBase64() {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xFF0000);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    @SuppressWarnings("unchecked")
    private List<String> expressions() {
        List<String> list = new ArrayList<>();
        for (Map<String, Object> command : commands) {
            if (command.get("params") instanceof Map) {
                Object expression = ((Map<String, Object>) command.get("params")).get("expression");
                if (expression != null) {
                    list.add(expression.toString());
                }
            }
        }
        return list;
    }

    @Test
    void testGoToUrlWaitsForTextChange() {
        AtomicInteger bodyReads = new AtomicInteger();
        UiActions actions = actions(js -> {
            if (js.equals(UiActions.BODY_TEXT_JS)) {
                int n = bodyReads.incrementAndGet();
                if (n == 3) {
                    return jsError("TypeError: Cannot read properties of null (reading 'innerText')");
                }
                return value(n < 4 ? "old page" : "new page");
            }
            return value("https://example.com/next");
        });

        actions.goToUrl("https://example.com/next");

        assertEquals(4, bodyReads.get());
        assertEquals("window.location=\"https://example.com/next\";", expressions().get(1));
    }

    @Test
    void testGoToUrlSamePageRunsOutOfRetries() {
        UiActions actions = actions(js -> value(js.equals(UiActions.BODY_TEXT_JS) ? "same" : "x"));
        OutOfRetriesException e = assertThrows(OutOfRetriesException.class, () -> actions.goToUrl("https://example.com"));
        assertEquals(5, e.getAttempts());
    }

    @Test
    void testUrlIsQuoted() {
        AtomicInteger bodyReads = new AtomicInteger();
        UiActions actions = actions(js -> js.equals(UiActions.BODY_TEXT_JS)
                ? value("page " + bodyReads.incrementAndGet())
                : value("ok"));

        actions.goToUrl("https://example.com/?q=\"x\"");

        assertEquals("window.location=\"https://example.com/?q=\\\"x\\\"\";", expressions().get(1));
    }

    @Test
    void testGetWindowScroll() {
        UiActions actions = actions(js -> value("{\"x\":0,\"y\":120.5}"));

        ScrollOffset scroll = actions.getWindowScroll();

        assertEquals(new ScrollOffset(0, 120.5), scroll);
        assertEquals(UiActions.WINDOW_SCROLL_JS, expressions().get(0));
    }

    @Test
    void testGetElementTextWaitsForElement() {
        AtomicInteger calls = new AtomicInteger();
        UiActions actions = actions(js -> calls.incrementAndGet() < 3
                ? jsError("TypeError: Cannot read properties of null (reading 'innerText')")
                : value("Welcome"));

        assertEquals("Welcome", actions.getElementText("#greeting"));
        assertEquals(3, calls.get());
        assertEquals("document.querySelector(\"#greeting\").innerText;", expressions().get(0));
    }

    @Test
    void testGetElementTextGivesUp() {
        UiActions actions = actions(js -> jsError("TypeError: null"));
        OutOfRetriesException e = assertThrows(OutOfRetriesException.class, () -> actions.getElementText(".missing"));
        assertTrue(e.getLastDiagnostic().contains("TypeError: null"));
    }

    @Test
    void testGetElementRect() {
        UiActions actions = actions(js -> value(RECT_JSON));

        ElementRect rect = actions.getElementRect("input[name=\"q\"]");

        assertEquals(new ElementRect(10, 20.5, 100, 50), rect);
        assertEquals("JSON.stringify(document.querySelector(\"input[name=\\\"q\\\"]\").getBoundingClientRect());",
                expressions().get(0));
    }

    @Test
    void testGetElementRectMissingElement() {
        UiActions actions = actions(js -> jsError("TypeError: Cannot read properties of null"));
        assertThrows(JsExecutionException.class, () -> actions.getElementRect("#nope"));
    }

    @Test
    void testGetElementRectUnexpectedValue() {
        UiActions actions = actions(js -> "{\"id\":77,\"result\":{\"result\":{\"type\":\"number\",\"value\":3}}}");
        assertThrows(UnknownProtocolResultException.class, () -> actions.getElementRect("#x"));
    }

    @Test
    void testViewportScreenshot() {
        UiActions actions = actions(js -> value("unused"));

        BufferedImage image = actions.takeScreenshot(null);

        assertEquals(3, image.getWidth());
        assertEquals(2, image.getHeight());
        assertEquals(1, commands.size());
        assertEquals(Map.of("format", "png"), commands.get(0).get("params"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testElementScreenshotClipIncludesScroll() {
        UiActions actions = actions(js -> js.equals(UiActions.WINDOW_SCROLL_JS)
                ? value("{\"x\":5,\"y\":300}")
                : value(RECT_JSON));

        BufferedImage image = actions.takeScreenshot("#logo");

        assertNotNull(image);
        Map<String, Object> params = (Map<String, Object>) commands.get(2).get("params");
        assertEquals("png", params.get("format"));
        Map<String, Object> clip = (Map<String, Object>) params.get("clip");
        assertEquals(15.0, ((Number) clip.get("x")).doubleValue());
        assertEquals(320.5, ((Number) clip.get("y")).doubleValue());
        assertEquals(100.0, ((Number) clip.get("width")).doubleValue());
        assertEquals(50.0, ((Number) clip.get("height")).doubleValue());
        assertEquals(1.0, ((Number) clip.get("scale")).doubleValue());
    }

    @Test
    void testScreenshotWithoutData() {
        ScriptedTransport transport = new ScriptedTransport(command -> List.of("{\"id\":77,\"result\":{}}"));
        UiActions actions = new UiActions(new DebugChannel(transport));
        assertThrows(UnknownProtocolResultException.class, () -> actions.takeScreenshot(null));
    }

    @Test
    void testElementRectClip() {
        Map<String, Object> clip = new ElementRect(1, 2, 3, 4).toClip(new ScrollOffset(10, 20));
        assertEquals(Map.of("x", 11.0, "y", 22.0, "width", 3.0, "height", 4.0, "scale", 1.0), clip);
    }

    @Test
    void testDecoderRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ImageDecoder.IMAGE_IO.decode(new byte[]{1, 2, 3}));
    }

}
