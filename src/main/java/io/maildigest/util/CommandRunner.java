package io.maildigest.util;

import java.util.List;

/**
 * Runs an external command with a hard timeout.
 */
@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, String stdin, long timeoutMs);

    record CommandResult(
            boolean success,
            int exitCode,
            String stdout,
            String error
    ) {
        public static CommandResult ok(String stdout) {
            return new CommandResult(true, 0, stdout, null);
        }

        public static CommandResult fail(int exitCode, String error) {
            return new CommandResult(false, exitCode, "", error);
        }
    }
}
