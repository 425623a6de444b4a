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

import io.uidriver.wait.Attempt;
import io.uidriver.wait.RetryWaiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervises at most one browser on a fixed debugging port.
 * <p>
 * The browser is created lazily on the first {@link #execute(DriverAction)} and reused as
 * long as it reports alive. A dead browser is killed and replaced transparently, so callers
 * must start every action from a known state (e.g. by navigating first) instead of relying
 * on what an earlier action left behind.
 * <p>
 * Only one open manager may own a given port in this JVM. Calls on a manager are
 * serialized: concurrent callers wait for the lock in arrival order.
 * <pre>
 * try (DriverManager manager = new DriverManager(BrowserOptions.builder().headless(true).build())) {
 *     String title = manager.execute(driver -&gt; {
 *         try (DebugChannel channel = driver.openChannel()) {
 *             return (String) channel.runJsGetValue("document.title");
 *         }
 *     });
 * }
 * </pre>
 */
public class DriverManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DriverManager.class);

    private static final Map<Integer, DriverManager> OWNERS = new ConcurrentHashMap<>();

    private final BrowserOptions options;
    private final DriverFactory factory;
    private final ReentrantLock lock = new ReentrantLock(true);

    private volatile Driver driver;
    private volatile boolean closed;

    public DriverManager() {
        this(BrowserOptions.defaults());
    }

    public DriverManager(BrowserOptions options) {
        this(options, DriverFactory.BROWSER);
    }

    /**
     * @throws IllegalStateException if another open manager already owns the port
     */
    public DriverManager(BrowserOptions options, DriverFactory factory) {
        this.options = options;
        this.factory = factory;
        DriverManager existing = OWNERS.putIfAbsent(options.getPort(), this);
        if (existing != null) {
            throw new IllegalStateException("debugging port " + options.getPort()
                    + " is already owned by another driver manager");
        }
    }

    public <T> T execute(DriverAction<T> action) {
        return execute(action, false);
    }

    /**
     * Run the action against a live driver, creating or replacing the driver as needed.
     * Any exception escaping the action is rethrown unchanged, after the driver has been
     * discarded since it may be broken.
     */
    public <T> T execute(DriverAction<T> action, boolean closeUponCompletion) {
        lock.lock();
        try {
            ensureOpen();
            Driver current = getOrCreateDriver();
            T result;
            try {
                result = action.apply(current);
            } catch (RuntimeException | Error e) {
                logger.warn("driver action failed, discarding driver: {}", e.toString());
                discardQuietly();
                throw e;
            }
            if (closeUponCompletion) {
                quit();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #execute(DriverAction)}, but when the action fails in a way that points at
     * a broken browser ({@link DriverException#isRecoverable()}) it is repeated against a fresh
     * browser, within the recovery policy of the options. Other failures propagate at once.
     */
    public <T> T executeWithRecovery(DriverAction<T> action) {
        RetryWaiter waiter = new RetryWaiter(options.getRecoveryPolicy());
        return waiter.<T>until(run -> {
            try {
                return Attempt.success(run.get());
            } catch (DriverException e) {
                if (e.isRecoverable()) {
                    return Attempt.retry(e.toString());
                }
                return Attempt.fatal(e);
            }
        }, () -> execute(action));
    }

    /**
     * Kill the current driver, if any, and forget it. Safe to call repeatedly.
     */
    public void quit() {
        lock.lock();
        try {
            if (driver != null) {
                Driver old = driver;
                driver = null;
                old.kill();
                logger.debug("driver on port {} quit", options.getPort());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Quit and release the port so that another manager may claim it.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            quit();
            closed = true;
            OWNERS.remove(options.getPort(), this);
        } finally {
            lock.unlock();
        }
    }

    Driver getOrCreateDriver() {
        if (driver != null && driver.isAlive()) {
            return driver;
        }
        if (driver != null) {
            logger.info("driver on port {} is no longer alive, starting a new one", options.getPort());
        }
        quit();
        driver = factory.spawn(options);
        return driver;
    }

    private void discardQuietly() {
        try {
            quit();
        } catch (RuntimeException e) {
            logger.warn("cleanup after failed action also failed: {}", e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("driver manager for port " + options.getPort() + " is closed");
        }
    }

    public boolean hasDriver() {
        return driver != null;
    }

    public BrowserOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

}
