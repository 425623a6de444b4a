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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one external OS process.
 * <p>
 * The process is started directly from its command and never wrapped in a shell,
 * so {@link #kill()} reaches the real process and does not leave an orphaned child behind.
 * Output is pumped on daemon threads, kept in memory and logged at debug level.
 */
public class ProcessHandle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessHandle.class);

    private static final long OUTPUT_DRAIN_MILLIS = 1000;

    private static final Executor DAEMONS = task -> {
        Thread thread = new Thread(task, "process-pump");
        thread.setDaemon(true);
        thread.start();
    };

    private final ProcessConfig config;
    private final Process process;
    private final Map<ProcessEvent.Source, StringBuffer> output = new EnumMap<>(ProcessEvent.Source.class);
    private final AtomicBoolean killed = new AtomicBoolean();
    private final CompletableFuture<Integer> exit;
    private volatile int exitCode = -1;

    private ProcessHandle(ProcessConfig config, Process process) {
        this.config = config;
        this.process = process;
        output.put(ProcessEvent.Source.OUT, new StringBuffer());
        output.put(ProcessEvent.Source.ERR, new StringBuffer());
        List<CompletableFuture<Void>> pumps = new ArrayList<>(2);
        pumps.add(pump(ProcessEvent.Source.OUT, process.getInputStream()));
        if (!config.mergeStderr()) {
            pumps.add(pump(ProcessEvent.Source.ERR, process.getErrorStream()));
        }
        exit = process.onExit().thenApplyAsync(p -> {
            drain(pumps);
            int code = p.exitValue();
            exitCode = code;
            logger.debug("process {} exited with code: {}", p.pid(), code);
            publish(ProcessEvent.exited(code));
            return code;
        }, DAEMONS);
    }

    /**
     * Spawn the process described by the config.
     *
     * @throws ProcessStartException if the executable cannot be started
     */
    public static ProcessHandle start(ProcessConfig config) {
        java.lang.ProcessBuilder pb = new java.lang.ProcessBuilder(config.command())
                .redirectErrorStream(config.mergeStderr());
        if (config.directory() != null) {
            pb.directory(config.directory().toFile());
        }
        pb.environment().putAll(config.environment());
        Process process;
        try {
            process = pb.start();
        } catch (IOException | SecurityException e) {
            throw new ProcessStartException("failed to start process " + config.executable() + ": " + e.getMessage(), e);
        }
        logger.debug("started pid {}: {}", process.pid(), config.command());
        return new ProcessHandle(config, process);
    }

    private CompletableFuture<Void> pump(ProcessEvent.Source source, InputStream in) {
        return CompletableFuture.runAsync(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, Charset.defaultCharset()))) {
                for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                    output.get(source).append(line).append('\n');
                    logger.debug("[{}] {}", process.pid(), line);
                    publish(ProcessEvent.line(source, line));
                }
            } catch (IOException e) {
                if (!killed.get()) {
                    logger.warn("cannot read {} of process {}: {}", source, process.pid(), e.getMessage());
                }
            }
        }, DAEMONS);
    }

    // grandchildren may keep the streams open after the process itself is gone
    private void drain(List<CompletableFuture<Void>> pumps) {
        try {
            CompletableFuture.allOf(pumps.toArray(new CompletableFuture[0]))
                    .get(OUTPUT_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.debug("process {} exited but its output is still open", process.pid());
        } catch (ExecutionException e) {
            logger.debug("output pump failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void publish(ProcessEvent event) {
        if (config.listener() == null) {
            return;
        }
        try {
            config.listener().accept(event);
        } catch (RuntimeException e) {
            logger.warn("process listener failed on {}: {}", event, e.getMessage());
        }
    }

    /**
     * Non-blocking liveness check.
     */
    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Forceful termination. Killing a handle that is already dead or killed is a no-op.
     */
    public void kill() {
        if (!killed.compareAndSet(false, true)) {
            return;
        }
        if (process.isAlive()) {
            process.destroyForcibly();
            logger.debug("process {} killed", process.pid());
        } else {
            logger.debug("process {} already exited, nothing to kill", process.pid());
        }
    }

    public boolean isKilled() {
        return killed.get();
    }

    /**
     * Block until the process has exited and its output has been read.
     *
     * @return the exit code
     * @throws IllegalStateException if the process is still running after the timeout
     */
    public int waitSync(long timeoutMillis) {
        try {
            return exit.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException("process " + process.pid() + " did not exit within " + timeoutMillis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for process " + process.pid(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("error waiting for process " + process.pid(), e.getCause());
        }
    }

    /**
     * Everything read from stdout so far, including stderr when the two are merged.
     */
    public String getOutput() {
        return output.get(ProcessEvent.Source.OUT).toString();
    }

    public String getErrorOutput() {
        return output.get(ProcessEvent.Source.ERR).toString();
    }

    /**
     * -1 until the process has exited.
     */
    public int getExitCode() {
        return exitCode;
    }

    public long getPid() {
        return process.pid();
    }

    @Override
    public String toString() {
        return "ProcessHandle[" + process.pid() + ": " + config.executable() + "]";
    }

}
