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

import java.util.List;

/**
 * A running browser that exposes debug targets.
 * This is what {@link DriverManager} supervises and what {@link DriverAction}s receive.
 */
public interface Driver {

    boolean isAlive();

    /**
     * @throws ProcessNotRunningException if the browser process has exited
     */
    default void checkAlive() {
        if (!isAlive()) {
            throw new ProcessNotRunningException("browser is not running");
        }
    }

    /**
     * Forceful termination. A no-op when the browser is already dead.
     */
    void kill();

    int getPort();

    List<DebugTarget> listTargets();

    DebugChannel openChannel(int targetIndex);

    default DebugChannel openChannel() {
        return openChannel(0);
    }

}
