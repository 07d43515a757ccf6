package com.example.waystone.net;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits a raw input line into a lowercased verb and its arguments.
 *
 * A leading {@code '} is shorthand for {@code say} and a leading {@code :}
 * for {@code emote}; in both cases the remainder of the line becomes a
 * single argument.
 */
public class CommandParser {

    private CommandParser() {
    }

    /**
     * @return the parsed line, or null for a blank line
     */
    public static ParsedCommand parse(String line) {
        if (line == null) return null;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return null;

        char first = trimmed.charAt(0);
        if (first == '\'' || first == ':') {
            String verb = first == '\'' ? "say" : "emote";
            String rest = trimmed.substring(1).trim();
            List<String> args = rest.isEmpty() ? Collections.emptyList() : List.of(rest);
            return new ParsedCommand(verb, args, trimmed);
        }

        String[] parts = trimmed.split("\\s+");
        String verb = parts[0].toLowerCase();
        List<String> args = new ArrayList<>(Arrays.asList(parts).subList(1, parts.length));
        return new ParsedCommand(verb, Collections.unmodifiableList(args), trimmed);
    }

    /**
     * A tokenized input line. Argument case is preserved.
     */
    public static class ParsedCommand {
        private final String verb;
        private final List<String> args;
        private final String rawInput;

        public ParsedCommand(String verb, List<String> args, String rawInput) {
            this.verb = verb;
            this.args = args;
            this.rawInput = rawInput;
        }

        public String getVerb() { return verb; }
        public List<String> getArgs() { return args; }
        public String getRawInput() { return rawInput; }

        /** Arguments joined by single spaces, or "" when there are none. */
        public String getArgString() {
            return String.join(" ", args);
        }
    }
}
