package com.team.remediation.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into argv, honouring single and double quotes and backslash escapes.
 * No shell expansion happens; the result is passed to {@link ProcessBuilder} as-is.
 */
public final class CommandLineTokenizer {

    private CommandLineTokenizer() {
    }

    /**
     * @throws IllegalArgumentException on an unterminated quote
     */
    public static List<String> tokenize(String commandLine) {
        List<String> tokens = new ArrayList<>();
        if (commandLine == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < commandLine.length()) {
                    current.append(commandLine.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\' && i + 1 < commandLine.length()) {
                current.append(commandLine.charAt(++i));
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command: " + commandLine);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
