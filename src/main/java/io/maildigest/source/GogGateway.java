package io.maildigest.source;

import io.maildigest.util.CommandRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceGateway} backed by the {@code gog} command-line client.
 */
public final class GogGateway implements SourceGateway {
    private final CommandRunner runner;
    private final String executable;
    private final long timeoutMs;

    public GogGateway(CommandRunner runner, String executable, long timeoutMs) {
        this.runner = runner;
        this.executable = executable == null || executable.isBlank() ? "gog" : executable;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public MessageBatch changesSince(String account, String cursor) throws SourceException {
        String stdout = run(List.of("gmail", "history", "--since", cursor, "--account", account, "--json"));
        return GatewayParsers.parseMessages(stdout);
    }

    @Override
    public MessageBatch searchRecent(String account, int days) throws SourceException {
        String stdout = run(List.of(
                "gmail", "messages", "search", "newer_than:" + days + "d",
                "--account", account, "--json", "--include-body"
        ));
        return GatewayParsers.parseMessages(stdout);
    }

    @Override
    public Optional<RawThread> thread(String account, String threadId) throws SourceException {
        String stdout = run(List.of("gmail", "thread", "get", threadId, "--account", account, "--json"));
        return GatewayParsers.parseThread(stdout);
    }

    private String run(List<String> args) throws SourceException {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(executable);
        command.addAll(args);
        CommandRunner.CommandResult result = runner.run(command, null, timeoutMs);
        if (!result.success()) {
            throw new SourceException(executable + " " + String.join(" ", args.subList(0, Math.min(2, args.size())))
                    + " failed (exit " + result.exitCode() + "): " + result.error());
        }
        return result.stdout() == null ? "" : result.stdout();
    }
}
