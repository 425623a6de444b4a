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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * What to launch and how. The first element of the command is the executable, which is
 * started directly and never through a shell, so arguments need no quoting.
 * <pre>
 * ProcessConfig config = ProcessConfig.command("chromium", "--headless=new")
 *         .environment("LANG", "C")
 *         .onEvent(event -&gt; logger.debug("{}", event.line()))
 *         .build();
 * </pre>
 *
 * @param mergeStderr when true, stderr is read as part of stdout
 * @param listener    receives every output line and the exit event, may be null
 */
public record ProcessConfig(
        List<String> command,
        Path directory,
        Map<String, String> environment,
        boolean mergeStderr,
        Consumer<ProcessEvent> listener
) {

    public ProcessConfig {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static Builder command(String... command) {
        return command(List.of(command));
    }

    public static Builder command(List<String> command) {
        return new Builder(command);
    }

    public String executable() {
        return command.get(0);
    }

    public static final class Builder {

        private final List<String> command;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Path directory;
        private boolean mergeStderr = true;
        private Consumer<ProcessEvent> listener;

        private Builder(List<String> command) {
            this.command = new ArrayList<>(command);
        }

        public Builder append(String arg) {
            command.add(arg);
            return this;
        }

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        /**
         * Added to, not replacing, the environment inherited from this JVM.
         */
        public Builder environment(String name, String value) {
            environment.put(name, value);
            return this;
        }

        public Builder separateStderr() {
            this.mergeStderr = false;
            return this;
        }

        public Builder onEvent(Consumer<ProcessEvent> listener) {
            this.listener = listener;
            return this;
        }

        public ProcessConfig build() {
            return new ProcessConfig(command, directory, environment, mergeStderr, listener);
        }

    }

}
