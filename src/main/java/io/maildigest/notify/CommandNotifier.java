package io.maildigest.notify;

import io.maildigest.util.CommandRunner;

import java.util.List;

/**
 * Delivers a notification by running a command template. The placeholders
 * {@code {target}} and {@code {message}} are substituted per argument; when
 * the template has no {@code {message}} placeholder the message is passed on
 * stdin.
 */
public final class CommandNotifier implements Notifier {
    private final CommandRunner runner;
    private final List<String> template;

    public CommandNotifier(CommandRunner runner, List<String> template) {
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("notify command cannot be empty");
        }
        this.runner = runner;
        this.template = List.copyOf(template);
    }

    @Override
    public boolean notify(String target, String message, long timeoutMs) {
        boolean inlineMessage = template.stream().anyMatch(arg -> arg.contains("{message}"));
        List<String> command = template.stream()
                .map(arg -> arg.replace("{target}", target == null ? "" : target)
                        .replace("{message}", message == null ? "" : message))
                .toList();
        CommandRunner.CommandResult result = runner.run(command, inlineMessage ? null : message, timeoutMs);
        return result.success();
    }
}
