package io.maildigest.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class ProcessCommandRunner implements CommandRunner {
    private static final int MAX_ERROR_CHARS = 512;

    @Override
    public CommandResult run(List<String> command, String stdin, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long effectiveTimeout = Math.max(1L, timeoutMs);
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CommandResult.fail(-1, "spawn failed: " + e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        // A child that exits without reading its input fails this future; the exit status decides the result.
        CompletableFuture.runAsync(() -> feed(process.getOutputStream(), stdin));
        try {
            boolean finished = process.waitFor(effectiveTimeout, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CommandResult.fail(-1, "timeout after " + Duration.ofMillis(effectiveTimeout));
            }
            String out = stdout.get(5, TimeUnit.SECONDS);
            if (process.exitValue() == 0) {
                return CommandResult.ok(out);
            }
            return CommandResult.fail(process.exitValue(), truncate(stderr.get(5, TimeUnit.SECONDS)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandResult.fail(-1, "interrupted");
        } catch (Exception e) {
            process.destroyForcibly();
            return CommandResult.fail(-1, "execution failed: " + e.getMessage());
        }
    }

    private static void feed(OutputStream stream, String stdin) {
        try (OutputStream in = stream) {
            if (stdin != null && !stdin.isEmpty()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
