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

import io.uidriver.common.OsUtils;
import io.uidriver.wait.OutOfRetriesException;
import io.uidriver.wait.RetryPolicy;
import io.uidriver.wait.RetryWaiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Best-effort, name-based cleanup of stray processes.
 * <p>
 * This is racy by nature: anything whose executable name matches is killed, including
 * processes this library never started. Prefer {@link ProcessHandle#kill()} for processes
 * that were spawned here, and only use the reaper to clear a debugging port that an
 * unknown earlier instance may still hold. Failures are logged and never thrown.
 */
public class ProcessReaper {

    private static final Logger logger = LoggerFactory.getLogger(ProcessReaper.class);

    public static final RetryPolicy DEFAULT_POLICY = RetryPolicy.of(6, 500);

    private final Pattern namePattern;
    private final RetryPolicy policy;

    public ProcessReaper(Pattern namePattern) {
        this(namePattern, DEFAULT_POLICY);
    }

    public ProcessReaper(Pattern namePattern, RetryPolicy policy) {
        this.namePattern = namePattern;
        this.policy = policy;
    }

    /**
     * Reaper for executables whose name contains the given text, case-insensitive.
     */
    public static ProcessReaper forName(String name) {
        return new ProcessReaper(Pattern.compile(Pattern.quote(name), Pattern.CASE_INSENSITIVE));
    }

    /**
     * Reaper for executables whose name matches the given regex, case-insensitive.
     */
    public static ProcessReaper forPattern(String regex) {
        return new ProcessReaper(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public static boolean matches(String command, Pattern namePattern) {
        String name = OsUtils.executableName(command);
        return name != null && !name.isEmpty() && namePattern.matcher(name).find();
    }

    /**
     * Force-kill every matching process, re-checking until none is left or the policy is exhausted.
     *
     * @return true if no matching process remains
     */
    public boolean reap() {
        RetryWaiter waiter = new RetryWaiter(policy);
        try {
            waiter.untilValue(count -> count == 0, this::killMatching);
            return true;
        } catch (OutOfRetriesException e) {
            logger.warn("processes matching '{}' still running after {} attempts", namePattern, e.getAttempts());
            return false;
        } catch (RuntimeException e) {
            logger.warn("failed to reap processes matching '{}': {}", namePattern, e.getMessage());
            return false;
        }
    }

    /**
     * @return how many matching processes were found alive, zero means done
     */
    int killMatching() {
        long self = java.lang.ProcessHandle.current().pid();
        List<java.lang.ProcessHandle> found = java.lang.ProcessHandle.allProcesses()
                .filter(ph -> ph.pid() != self)
                .filter(ph -> ph.info().command().map(c -> matches(c, namePattern)).orElse(false))
                .collect(Collectors.toList());
        for (java.lang.ProcessHandle ph : found) {
            boolean requested = ph.destroyForcibly();
            logger.debug("kill requested for pid {} ({}): {}", ph.pid(),
                    ph.info().command().orElse("?"), requested);
        }
        return found.size();
    }

    public Pattern getNamePattern() {
        return namePattern;
    }

}
