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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry combinator that turns flaky, asynchronous state changes into blocking calls.
 * <p>
 * Example:
 * <pre>
 * RetryWaiter waiter = new RetryWaiter(RetryPolicy.of(5, 1000));
 * String text = waiter.untilNoException(JsExecutionException.class, () -&gt; channel.runJsGetValue(js));
 * </pre>
 * Attempts run sequentially on the calling thread. The total wait is bounded by
 * {@code maxAttempts * delay} plus the latency of the attempts.
 */
public class RetryWaiter {

    private static final Logger logger = LoggerFactory.getLogger(RetryWaiter.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryWaiter() {
        this(RetryPolicy.defaults());
    }

    public RetryWaiter(int maxAttempts, Duration delay) {
        this(new RetryPolicy(maxAttempts, delay));
    }

    public RetryWaiter(RetryPolicy policy) {
        this(policy, Sleeper.THREAD);
    }

    public RetryWaiter(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> T until(AttemptEvaluator<T> evaluator, Supplier<T> action) {
        int max = policy.maxAttempts();
        String lastDiagnostic = null;
        for (int attempt = 1; attempt <= max; attempt++) {
            Attempt<T> outcome = evaluator.evaluate(action);
            switch (outcome.getKind()) {
                case SUCCESS -> {
                    if (attempt > 1) {
                        logger.debug("succeeded after {} attempt(s)", attempt);
                    }
                    return outcome.getValue();
                }
                case FATAL -> throw outcome.getError();
                case RETRY -> {
                    lastDiagnostic = outcome.getDiagnostic();
                    logger.info("attempt {}/{} will be retried if allowed, current error: {}",
                            attempt, max, lastDiagnostic);
                    if (attempt < max) {
                        sleeper.sleep(policy.delay());
                    }
                }
            }
        }
        throw new OutOfRetriesException(max, lastDiagnostic);
    }

    /**
     * Waits until the value returned by the action passes the predicate, and returns it.
     * The retry diagnostic names the rejected value, cut to
     * {@link io.uidriver.common.StringUtils#DIAGNOSTIC_LENGTH} characters overall.
     */
    public <T> T untilValue(Predicate<? super T> predicate, Supplier<T> action) {
        return until(a -> {
            T result = a.get();
            if (predicate.test(result)) {
                return Attempt.success(result);
            }
            return Attempt.retry("unexpected return value: " + result);
        }, action);
    }

    /**
     * Waits until the action returns a truthy value, and returns it.
     */
    public <T> T untilTrue(Supplier<T> action) {
        return untilValue(RetryWaiter::isTruthy, action);
    }

    /**
     * Waits until the action stops throwing the given exception type.
     * Exceptions of any other type propagate on first occurrence.
     */
    public <T> T untilNoException(Class<? extends RuntimeException> type, Supplier<T> action) {
        return until(a -> {
            try {
                return Attempt.success(a.get());
            } catch (RuntimeException e) {
                if (type.isInstance(e)) {
                    return Attempt.retry(e.toString());
                }
                throw e;
            }
        }, action);
    }

    public static boolean isTruthy(Object o) {
        if (o == null) {
            return false;
        }
        if (o instanceof Boolean b) {
            return b;
        }
        if (o instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (o instanceof CharSequence cs) {
            return cs.length() > 0;
        }
        if (o instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (o instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (o instanceof Optional<?> opt) {
            return opt.isPresent();
        }
        return true;
    }

}
