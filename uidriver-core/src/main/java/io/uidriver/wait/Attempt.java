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
package io.uidriver.wait;

import io.uidriver.common.StringUtils;

/**
 * Outcome of a single evaluation inside {@link RetryWaiter}.
 * <p>
 * A {@link Kind#RETRY} outcome only drives the loop and is never returned to callers.
 */
public final class Attempt<T> {

    public enum Kind {
        SUCCESS,
        RETRY,
        FATAL
    }

    private final Kind kind;
    private final T value;
    private final String diagnostic;
    private final RuntimeException error;

    private Attempt(Kind kind, T value, String diagnostic, RuntimeException error) {
        this.kind = kind;
        this.value = value;
        this.diagnostic = diagnostic;
        this.error = error;
    }

    public static <T> Attempt<T> success(T value) {
        return new Attempt<>(Kind.SUCCESS, value, null, null);
    }

    public static <T> Attempt<T> retry(String diagnostic) {
        return new Attempt<>(Kind.RETRY, null, StringUtils.toDiagnostic(diagnostic), null);
    }

    public static <T> Attempt<T> fatal(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("fatal attempt requires an error");
        }
        return new Attempt<>(Kind.FATAL, null, null, error);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetry() {
        return kind == Kind.RETRY;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    public T getValue() {
        return value;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public RuntimeException getError() {
        return error;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "Attempt[SUCCESS: " + StringUtils.toDiagnostic(value) + "]";
            case RETRY -> "Attempt[RETRY: " + diagnostic + "]";
            case FATAL -> "Attempt[FATAL: " + error + "]";
        };
    }

}
