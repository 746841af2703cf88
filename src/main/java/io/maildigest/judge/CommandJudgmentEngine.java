package io.maildigest.judge;

import io.maildigest.util.CommandRunner;

import java.util.List;
import java.util.Optional;

/**
 * Runs a configured command with the prompt on stdin and takes its stdout as
 * the answer.
 */
public final class CommandJudgmentEngine implements JudgmentEngine {
    private final CommandRunner runner;
    private final List<String> command;

    public CommandJudgmentEngine(CommandRunner runner, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("classifier command cannot be empty");
        }
        this.runner = runner;
        this.command = List.copyOf(command);
    }

    @Override
    public Optional<String> judge(String prompt, long timeoutMs) throws JudgmentException {
        CommandRunner.CommandResult result = runner.run(command, prompt, timeoutMs);
        if (!result.success()) {
            throw new JudgmentException("classifier command failed (exit " + result.exitCode() + "): " + result.error());
        }
        String stdout = result.stdout();
        return stdout == null || stdout.isBlank() ? Optional.empty() : Optional.of(stdout);
    }
}
