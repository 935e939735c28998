package io.contextlink.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class ConsoleCommandParser {
    record ConsoleCommand(String op, List<String> args) {
        String arg(int index) {
            return index < args.size() ? args.get(index) : null;
        }
    }

    record SnippetRequest(String file, Integer startLine, Integer endLine) {
    }

    private ConsoleCommandParser() {
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    static ConsoleCommand parse(String raw) {
        List<String> tokens = parseTokens(raw);
        if (tokens.isEmpty()) {
            return new ConsoleCommand("", List.of());
        }
        return new ConsoleCommand(tokens.get(0).toLowerCase(Locale.ROOT), List.copyOf(tokens.subList(1, tokens.size())));
    }

    static SnippetRequest snippet(ConsoleCommand command) {
        if (command.args().isEmpty()) {
            throw new IllegalArgumentException("usage: snippet <file> [start end]");
        }
        if (command.args().size() == 1) {
            return new SnippetRequest(command.arg(0), null, null);
        }
        if (command.args().size() != 3) {
            throw new IllegalArgumentException("usage: snippet <file> [start end]");
        }
        return new SnippetRequest(command.arg(0), lineNumber(command.arg(1)), lineNumber(command.arg(2)));
    }

    static boolean isQuit(String op) {
        return "quit".equals(op) || "exit".equals(op);
    }

    private static int lineNumber(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException("line numbers start at 1: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a line number: " + raw, e);
        }
    }
}
