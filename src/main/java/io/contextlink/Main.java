package io.contextlink;

import io.contextlink.cli.ContextLinkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ContextLinkCommand()).execute(args);
        System.exit(code);
    }
}
