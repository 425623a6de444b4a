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

import io.uidriver.process.ProcessConfig;
import io.uidriver.process.ProcessHandle;
import io.uidriver.process.ProcessReaper;
import io.uidriver.wait.RetryWaiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * A browser process started with remote debugging enabled.
 * <p>
 * Owns its {@link ProcessHandle} exclusively. Debug targets are discovered over HTTP
 * every time they are needed, and each {@link #openChannel(int)} opens a new connection
 * that the caller must close.
 */
public class BrowserDriver implements Driver {

    private static final Logger logger = LoggerFactory.getLogger(BrowserDriver.class);

    static final String READY_CHECK_JS = "document.body.innerText;";

    private final ProcessHandle process;
    private final BrowserOptions options;
    private final TargetDiscovery discovery;
    private final Function<String, DebugChannel> channelOpener;

    BrowserDriver(ProcessHandle process, BrowserOptions options,
                  TargetDiscovery discovery, Function<String, DebugChannel> channelOpener) {
        this.process = process;
        this.options = options;
        this.discovery = discovery;
        this.channelOpener = channelOpener;
    }

    /**
     * Launch the browser and, unless disabled in the options, block until it is interactive.
     * If the browser never becomes ready it is killed and the failure is rethrown.
     */
    public static BrowserDriver spawn(BrowserOptions options) {
        if (options.isKillExisting()) {
            logger.debug("killing existing processes matching '{}'", options.getProcessPattern());
            ProcessReaper.forPattern(options.getProcessPattern()).reap();
        }
        List<String> args = options.toArgs();
        logger.debug("launching browser: {}", args);
        ProcessHandle process = ProcessHandle.start(ProcessConfig.command(args).build());
        BrowserDriver driver = new BrowserDriver(process, options, TargetDiscovery.HTTP, DebugChannel::connect);
        if (options.isWaitUntilReady()) {
            try {
                driver.waitUntilReady();
            } catch (RuntimeException e) {
                logger.warn("browser did not become ready, killing it: {}", e.getMessage());
                driver.kill();
                throw e;
            }
        }
        logger.info("browser started on port {}, pid: {}", options.getPort(), process.getPid());
        return driver;
    }

    /**
     * Polls discovery until it answers, then evaluates a trivial script on the first
     * target until it runs without a script error.
     */
    void waitUntilReady() {
        RetryWaiter waiter = new RetryWaiter(options.getReadyPolicy());
        waiter.untilNoException(DriverConnectionException.class, this::listTargets);
        try (DebugChannel channel = openChannel(0)) {
            waiter.untilNoException(JsExecutionException.class, () -> channel.runJsGetValue(READY_CHECK_JS));
        }
        logger.debug("browser on port {} is ready", options.getPort());
    }

    @Override
    public List<DebugTarget> listTargets() {
        checkAlive();
        return discovery.listTargets(options);
    }

    @Override
    public DebugChannel openChannel(int targetIndex) {
        List<DebugTarget> targets = listTargets();
        if (targetIndex < 0 || targetIndex >= targets.size()) {
            throw new TargetNotFoundException(targetIndex, targets.size());
        }
        DebugTarget target = targets.get(targetIndex);
        String url = target.webSocketDebuggerUrl();
        if (url == null) {
            throw new DriverConnectionException("target " + target.id() + " has no websocket url, "
                    + "another debugger may be attached", null);
        }
        return channelOpener.apply(url);
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void checkAlive() {
        if (!isAlive()) {
            throw new ProcessNotRunningException("browser process " + process.getPid() + " is not running");
        }
    }

    @Override
    public void kill() {
        process.kill();
    }

    @Override
    public int getPort() {
        return options.getPort();
    }

    public long getPid() {
        return process.getPid();
    }

    public BrowserOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "BrowserDriver[port=" + options.getPort() + ", pid=" + process.getPid() + "]";
    }

}
