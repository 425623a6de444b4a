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

import io.uidriver.common.OsUtils;
import io.uidriver.wait.RetryPolicy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Browser launch and supervision settings.
 * Supports both the Builder pattern and a Map (for config files and scripts).
 */
public class BrowserOptions {

    public static final int DEFAULT_PORT = 9222;
    public static final String DEFAULT_HOST = "localhost";

    public static final String DEFAULT_PATH_LINUX = "/usr/bin/chromium-browser";
    public static final String DEFAULT_PATH_MAC = "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome";
    public static final String DEFAULT_PATH_WIN64 = "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe";

    static final List<String> LINUX_CANDIDATES = List.of(
            DEFAULT_PATH_LINUX, "/usr/bin/chromium", "/usr/bin/google-chrome", "/usr/bin/google-chrome-stable");

    /**
     * File names of Chrome and Chromium binaries. Covers the real binary that launcher
     * scripts such as {@code /usr/bin/google-chrome} hand over to.
     */
    public static final String BROWSER_PROCESS_PATTERN = "^(google[ -])?chrom(e|ium)(-browser|-stable)?$";

    public static final RetryPolicy DEFAULT_READY_POLICY = RetryPolicy.of(10, 1000);
    public static final RetryPolicy DEFAULT_RECOVERY_POLICY = RetryPolicy.of(3, 500);

    private final String executable;
    private final String host;
    private final int port;
    private final boolean headless;
    private final boolean killExisting;
    private final String processPattern;
    private final boolean waitUntilReady;
    private final RetryPolicy readyPolicy;
    private final RetryPolicy recoveryPolicy;
    private final String userDataDir;
    private final List<String> addOptions;

    private BrowserOptions(Builder builder) {
        this.executable = builder.executable != null ? builder.executable : defaultExecutable();
        this.host = builder.host;
        this.port = builder.port;
        this.headless = builder.headless;
        this.killExisting = builder.killExisting;
        this.processPattern = builder.processPattern != null ? builder.processPattern : defaultProcessPattern(executable);
        this.waitUntilReady = builder.waitUntilReady;
        this.readyPolicy = builder.readyPolicy;
        this.recoveryPolicy = builder.recoveryPolicy;
        this.userDataDir = builder.userDataDir;
        this.addOptions = builder.addOptions != null ? List.copyOf(builder.addOptions) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BrowserOptions defaults() {
        return builder().build();
    }

    @SuppressWarnings("unchecked")
    public static BrowserOptions fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        if (map.containsKey("executable")) {
            builder.executable((String) map.get("executable"));
        }
        if (map.containsKey("host")) {
            builder.host((String) map.get("host"));
        }
        if (map.containsKey("port")) {
            builder.port(toInt(map.get("port")));
        }
        if (map.containsKey("headless")) {
            builder.headless(toBoolean(map.get("headless")));
        }
        if (map.containsKey("killExisting")) {
            builder.killExisting(toBoolean(map.get("killExisting")));
        }
        if (map.containsKey("processPattern")) {
            builder.processPattern((String) map.get("processPattern"));
        }
        if (map.containsKey("waitUntilReady")) {
            builder.waitUntilReady(toBoolean(map.get("waitUntilReady")));
        }
        if (map.containsKey("readyRetryCount") || map.containsKey("readyRetryInterval")) {
            builder.readyPolicy(RetryPolicy.of(
                    toInt(map.getOrDefault("readyRetryCount", DEFAULT_READY_POLICY.maxAttempts())),
                    toInt(map.getOrDefault("readyRetryInterval", DEFAULT_READY_POLICY.delay().toMillis()))));
        }
        if (map.containsKey("recoveryRetryCount") || map.containsKey("recoveryRetryInterval")) {
            builder.recoveryPolicy(RetryPolicy.of(
                    toInt(map.getOrDefault("recoveryRetryCount", DEFAULT_RECOVERY_POLICY.maxAttempts())),
                    toInt(map.getOrDefault("recoveryRetryInterval", DEFAULT_RECOVERY_POLICY.delay().toMillis()))));
        }
        if (map.containsKey("userDataDir")) {
            builder.userDataDir((String) map.get("userDataDir"));
        }
        if (map.containsKey("addOptions")) {
            builder.addOptions((List<String>) map.get("addOptions"));
        }
        return builder.build();
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * The browser family pattern when the executable is a Chrome or Chromium build,
     * otherwise an exact match on the executable's own file name.
     */
    static String defaultProcessPattern(String executable) {
        String name = OsUtils.executableName(executable);
        if (Pattern.compile(BROWSER_PROCESS_PATTERN, Pattern.CASE_INSENSITIVE).matcher(name).find()) {
            return BROWSER_PROCESS_PATTERN;
        }
        return "^" + Pattern.quote(name) + "$";
    }

    static String defaultExecutable() {
        if (OsUtils.isMac()) {
            return DEFAULT_PATH_MAC;
        }
        if (OsUtils.isWindows()) {
            return DEFAULT_PATH_WIN64;
        }
        for (String candidate : LINUX_CANDIDATES) {
            if (Files.isExecutable(Path.of(candidate))) {
                return candidate;
            }
        }
        return DEFAULT_PATH_LINUX;
    }

    /**
     * Full command line: executable first, then flags.
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>();
        args.add(executable);
        args.add("--remote-debugging-port=" + port);
        args.add("--remote-allow-origins=*");
        args.add("--no-first-run");
        args.add("--no-sandbox");
        if (headless) {
            args.add("--headless=new");
        }
        if (userDataDir != null) {
            args.add("--user-data-dir=" + userDataDir);
        }
        args.addAll(addOptions);
        return args;
    }

    public String getDiscoveryUrl() {
        return "http://" + host + ":" + port + "/json";
    }

    // Getters

    public String getExecutable() {
        return executable;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isHeadless() {
        return headless;
    }

    public boolean isKillExisting() {
        return killExisting;
    }

    /**
     * Case-insensitive regex matched against executable file names when
     * {@link #isKillExisting()} is set.
     */
    public String getProcessPattern() {
        return processPattern;
    }

    public boolean isWaitUntilReady() {
        return waitUntilReady;
    }

    public RetryPolicy getReadyPolicy() {
        return readyPolicy;
    }

    public RetryPolicy getRecoveryPolicy() {
        return recoveryPolicy;
    }

    public String getUserDataDir() {
        return userDataDir;
    }

    public List<String> getAddOptions() {
        return addOptions;
    }

    public static class Builder {

        private String executable;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean headless = false;
        private boolean killExisting = true;
        private String processPattern;
        private boolean waitUntilReady = true;
        private RetryPolicy readyPolicy = DEFAULT_READY_POLICY;
        private RetryPolicy recoveryPolicy = DEFAULT_RECOVERY_POLICY;
        private String userDataDir;
        private List<String> addOptions;

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("invalid port: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        /**
         * Force-kill processes matching the process pattern before spawning.
         * Best-effort, see {@link io.uidriver.process.ProcessReaper}.
         */
        public Builder killExisting(boolean killExisting) {
            this.killExisting = killExisting;
            return this;
        }

        /**
         * @throws java.util.regex.PatternSyntaxException if the regex is invalid
         */
        public Builder processPattern(String regex) {
            if (regex != null) {
                Pattern.compile(regex);
            }
            this.processPattern = regex;
            return this;
        }

        public Builder waitUntilReady(boolean waitUntilReady) {
            this.waitUntilReady = waitUntilReady;
            return this;
        }

        public Builder readyPolicy(RetryPolicy readyPolicy) {
            this.readyPolicy = readyPolicy;
            return this;
        }

        public Builder recoveryPolicy(RetryPolicy recoveryPolicy) {
            this.recoveryPolicy = recoveryPolicy;
            return this;
        }

        public Builder userDataDir(String userDataDir) {
            this.userDataDir = userDataDir;
            return this;
        }

        public Builder addOptions(List<String> addOptions) {
            this.addOptions = addOptions;
            return this;
        }

        public BrowserOptions build() {
            return new BrowserOptions(this);
        }

    }

}
