package com.team.remediation.util;

import com.team.remediation.config.RemediationConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds raw diagnostic signals before they enter a bundle or a prompt.
 * Long log blocks keep their head, the error lines with context, and their tail.
 * Over the character limit, error lines are kept ahead of ordinary head and tail lines.
 */
@Component
@RequiredArgsConstructor
public class SignalTruncator {

    private static final List<String> ERROR_KEYWORDS = List.of(
            "error", "fail", "exception", "panic", "fatal", "killed",
            "caused by", "refused", "denied", "timeout", "timed out",
            "cannot", "unable", "not found", "no such", "in use"
    );

    private static final int HEAD_LINES = 20;
    private static final int TAIL_LINES = 20;
    private static final int CONTEXT_RADIUS = 2;
    private static final int MAX_ERROR_LINE_LENGTH = 400;
    private static final int CHAR_HEADER_RESERVE = 64;
    private static final String GAP_MARKER = "...\n";

    private final RemediationConfig config;

    /**
     * Keep at most {@code maxSignals} signals (the most recent ones) and bound each of them.
     */
    public List<String> truncateAll(List<String> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, signals.size() - config.getMaxSignals());
        List<String> bounded = new ArrayList<>(signals.size() - from);
        for (String signal : signals.subList(from, signals.size())) {
            if (signal != null && !signal.isBlank()) {
                bounded.add(truncate(signal));
            }
        }
        return bounded;
    }

    public String truncate(String signal) {
        if (signal == null || signal.isBlank()) {
            return "";
        }
        String result = truncateLines(signal);
        int maxLength = config.getMaxSignalLength();
        if (result.length() <= maxLength) {
            return result;
        }
        String kept = keepErrorLines(result, maxLength);
        return kept != null ? kept : cutMiddle(result, maxLength);
    }

    /**
     * Fits the text into {@code maxLength} by keeping every error line (each capped around its keyword)
     * and filling the rest of the budget with lines from the head and the tail.
     * Returns null when there are no error lines or they alone do not fit.
     */
    private String keepErrorLines(String text, int maxLength) {
        String[] lines = text.split("\n");
        boolean[] keep = new boolean[lines.length];
        int budget = maxLength - CHAR_HEADER_RESERVE;
        int used = 0;
        boolean anyError = false;
        for (int i = 0; i < lines.length; i++) {
            if (isErrorLine(lines[i])) {
                lines[i] = capAroundKeyword(lines[i]);
                keep[i] = true;
                used += cost(lines[i]);
                anyError = true;
            }
        }
        if (!anyError || used > budget) {
            return null;
        }

        int head = 0;
        int tail = lines.length - 1;
        boolean fromHead = true;
        while (head <= tail) {
            int i = fromHead ? head++ : tail--;
            fromHead = !fromHead;
            if (keep[i]) {
                continue;
            }
            if (used + cost(lines[i]) > budget) {
                break;
            }
            keep[i] = true;
            used += cost(lines[i]);
        }

        int dropped = 0;
        StringBuilder body = new StringBuilder();
        boolean gap = false;
        for (int i = 0; i < lines.length; i++) {
            if (keep[i]) {
                if (gap) {
                    body.append(GAP_MARKER);
                    gap = false;
                }
                body.append(lines[i]).append('\n');
            } else {
                dropped++;
                gap = true;
            }
        }
        if (gap) {
            body.append(GAP_MARKER);
        }
        return "=== " + dropped + " lines dropped to fit " + maxLength + " chars ===\n" + body;
    }

    private static int cost(String line) {
        return line.length() + 1 + GAP_MARKER.length();
    }

    private static String capAroundKeyword(String line) {
        if (line.length() <= MAX_ERROR_LINE_LENGTH) {
            return line;
        }
        String lower = line.toLowerCase();
        int at = ERROR_KEYWORDS.stream()
                .mapToInt(lower::indexOf)
                .filter(index -> index >= 0)
                .min()
                .orElse(0);
        int start = Math.max(0, Math.min(at - MAX_ERROR_LINE_LENGTH / 4, line.length() - MAX_ERROR_LINE_LENGTH));
        return (start > 0 ? "..." : "") + line.substring(start, start + MAX_ERROR_LINE_LENGTH)
                + (start + MAX_ERROR_LINE_LENGTH < line.length() ? "..." : "");
    }

    private static String cutMiddle(String text, int maxLength) {
        int half = maxLength / 2;
        return text.substring(0, half)
                + "\n... [" + (text.length() - maxLength) + " chars truncated] ...\n"
                + text.substring(text.length() - half);
    }

    private String truncateLines(String text) {
        String[] lines = text.split("\n");
        int maxLines = config.getMaxLogLines();
        if (lines.length <= maxLines) {
            return text;
        }

        StringBuilder result = new StringBuilder();
        result.append("=== LOG TRUNCATED (").append(lines.length).append(" lines -> ~")
                .append(maxLines).append(" lines) ===\n");

        for (int i = 0; i < Math.min(HEAD_LINES, lines.length); i++) {
            result.append(lines[i]).append('\n');
        }

        result.append("--- error sections ---\n");
        int budget = Math.max(0, maxLines - HEAD_LINES - TAIL_LINES);
        int added = 0;
        int tailStart = Math.max(HEAD_LINES, lines.length - TAIL_LINES);
        for (int i = HEAD_LINES; i < tailStart && added < budget; i++) {
            if (isErrorLine(lines[i])) {
                int start = Math.max(HEAD_LINES, i - CONTEXT_RADIUS);
                int end = Math.min(tailStart - 1, i + CONTEXT_RADIUS);
                for (int j = start; j <= end && added < budget; j++) {
                    result.append(lines[j]).append('\n');
                    added++;
                }
                result.append("...\n");
                i = end;
            }
        }

        result.append("--- end of log ---\n");
        for (int i = tailStart; i < lines.length; i++) {
            result.append(lines[i]).append('\n');
        }
        return result.toString();
    }

    private boolean isErrorLine(String line) {
        String lower = line.toLowerCase();
        return ERROR_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
