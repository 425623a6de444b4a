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
package io.uidriver.process;

/**
 * One line read from a process, or the notice that it exited.
 *
 * @param line     the line without its terminator, null for an exit
 * @param exitCode meaningful only when {@link #isExit()}
 */
public record ProcessEvent(Source source, String line, int exitCode) {

    public enum Source {
        OUT,
        ERR,
        EXIT
    }

    static ProcessEvent line(Source source, String line) {
        return new ProcessEvent(source, line, 0);
    }

    static ProcessEvent exited(int exitCode) {
        return new ProcessEvent(Source.EXIT, null, exitCode);
    }

    public boolean isExit() {
        return source == Source.EXIT;
    }

}
