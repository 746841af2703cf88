package io.maildigest;

import io.maildigest.cli.MailDigestCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MailDigestCommand()).execute(args);
        System.exit(code);
    }
}
