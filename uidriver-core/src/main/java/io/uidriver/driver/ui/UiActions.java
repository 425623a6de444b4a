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

import io.uidriver.common.StringUtils;
import io.uidriver.driver.CommandException;
import io.uidriver.driver.DebugChannel;
import io.uidriver.driver.DebugCommand;
import io.uidriver.driver.DebugResponse;
import io.uidriver.driver.JsExecutionException;
import io.uidriver.driver.UnknownProtocolResultException;
import io.uidriver.wait.Attempt;
import io.uidriver.wait.RetryPolicy;
import io.uidriver.wait.RetryWaiter;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Objects;

/**
 * Page-level actions on top of a {@link DebugChannel}: navigation, element text and
 * geometry, and screenshots. Actions that depend on the page settling poll with a
 * {@link RetryWaiter} tuned for UI latency.
 */
public class UiActions {

    private static final Logger logger = LoggerFactory.getLogger(UiActions.class);

    public static final RetryPolicy UI_POLICY = RetryPolicy.of(5, 4000);

    static final String BODY_TEXT_JS = "document.body.innerText;";
    static final String WINDOW_SCROLL_JS = "JSON.stringify({\"x\":window.scrollX,\"y\":window.scrollY});";

    private final DebugChannel channel;
    private final RetryWaiter waiter;
    private final ImageDecoder imageDecoder;

    public UiActions(DebugChannel channel) {
        this(channel, new RetryWaiter(UI_POLICY), ImageDecoder.IMAGE_IO);
    }

    public UiActions(DebugChannel channel, RetryWaiter waiter, ImageDecoder imageDecoder) {
        this.channel = channel;
        this.waiter = waiter;
        this.imageDecoder = imageDecoder;
    }

    /**
     * Navigate and wait until the body text differs from what it was before navigating.
     * Navigating to a page with identical text therefore runs out of retries.
     */
    public void goToUrl(String url) {
        Object before = channel.runJsGetValue(BODY_TEXT_JS);
        logger.debug("navigating to: {}", url);
        channel.runJsGetValue("window.location=" + StringUtils.toJsLiteral(url) + ";");
        waiter.<Object>until(run -> {
            try {
                Object text = run.get();
                if (Objects.equals(text, before)) {
                    return Attempt.retry("page text unchanged: " + StringUtils.toDiagnostic(text));
                }
                return Attempt.success(text);
            } catch (JsExecutionException e) {
                // document not yet available while the new page loads
                return Attempt.retry(e.getMessage());
            }
        }, () -> channel.runJsGetValue(BODY_TEXT_JS));
    }

    public ScrollOffset getWindowScroll() {
        Map<String, Object> json = evalJson(WINDOW_SCROLL_JS);
        return new ScrollOffset(toDouble(json, "x"), toDouble(json, "y"));
    }

    /**
     * Inner text of the first element matching the selector, waiting for it to appear.
     */
    public String getElementText(String cssSelector) {
        String script = querySelector(cssSelector) + ".innerText;";
        Object text = waiter.untilNoException(JsExecutionException.class, () -> channel.runJsGetValue(script));
        return text == null ? null : text.toString();
    }

    public ElementRect getElementRect(String cssSelector) {
        Map<String, Object> json = evalJson("JSON.stringify(" + querySelector(cssSelector) + ".getBoundingClientRect());");
        return new ElementRect(toDouble(json, "x"), toDouble(json, "y"),
                toDouble(json, "width"), toDouble(json, "height"));
    }

    /**
     * Capture the viewport, or only the element matching the selector when one is given.
     */
    public BufferedImage takeScreenshot(String cssSelector) {
        DebugCommand command = channel.method("Page.captureScreenshot").param("format", "png");
        if (cssSelector != null) {
            ElementRect rect = getElementRect(cssSelector);
            ScrollOffset scroll = getWindowScroll();
            command.param("clip", rect.toClip(scroll));
        }
        DebugResponse response = command.send();
        if (response.isError()) {
            throw new CommandException("Page.captureScreenshot failed: " + response.getErrorMessage());
        }
        String data = response.getResultAsString("data");
        if (data == null) {
            throw new UnknownProtocolResultException(response.toJson());
        }
        return imageDecoder.decodeBase64(data);
    }

    static String querySelector(String cssSelector) {
        return "document.querySelector(" + StringUtils.toJsLiteral(cssSelector) + ")";
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> evalJson(String script) {
        Object value = channel.runJsGetValue(script);
        if (!(value instanceof String)) {
            throw new UnknownProtocolResultException(StringUtils.toJson(value));
        }
        Object parsed;
        try {
            parsed = JSONValue.parseWithException((String) value);
        } catch (ParseException e) {
            throw new UnknownProtocolResultException((String) value);
        }
        if (!(parsed instanceof Map)) {
            throw new UnknownProtocolResultException((String) value);
        }
        return (Map<String, Object>) parsed;
    }

    private static double toDouble(Map<String, Object> json, String key) {
        Object value = json.get(key);
        if (!(value instanceof Number)) {
            throw new UnknownProtocolResultException(StringUtils.toJson(json));
        }
        return ((Number) value).doubleValue();
    }

}
