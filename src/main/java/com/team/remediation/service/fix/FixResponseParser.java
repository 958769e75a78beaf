package com.team.remediation.service.fix;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.remediation.exception.GenerationFailedException;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.util.CommandLineTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the backend's response into a {@link GeneratedCandidate}.
 * Anything that is not JSON or misses a required field is a {@link GenerationFailedException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FixResponseParser {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```json\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);
    private static final Pattern FIX_ID_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_\\-]{0,63}$");

    private final ObjectMapper objectMapper;

    public GeneratedCandidate parse(String response) {
        if (response == null || response.isBlank()) {
            throw new GenerationFailedException("Empty response");
        }

        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(extractJson(response), new TypeReference<>() {});
        } catch (GenerationFailedException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationFailedException("Response is not valid JSON: " + e.getMessage(), e);
        }

        String rootCause = requireText(parsed, "root_cause");
        List<String> command = requireCommand(parsed, "command");
        List<String> rollbackCommand = requireCommand(parsed, "rollback_command");
        String description = optionalText(parsed, "description", String.join(" ", command));
        String rollbackDescription = optionalText(parsed, "rollback_description", String.join(" ", rollbackCommand));

        String fixId = optionalText(parsed, "fix_id", null);
        if (fixId != null) {
            fixId = fixId.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
            if (!FIX_ID_PATTERN.matcher(fixId).matches()) {
                throw new GenerationFailedException("Invalid fix_id: " + fixId);
            }
        }

        return new GeneratedCandidate(rootCause, fixId, parseRisk(parsed.get("risk_level")),
                new ProposedAction(command, description),
                new ProposedAction(rollbackCommand, rollbackDescription),
                optionalText(parsed, "rationale", ""));
    }

    /**
     * Extract JSON content from a response that may wrap it in a markdown code block.
     */
    String extractJson(String text) {
        Matcher matcher = JSON_BLOCK_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new GenerationFailedException("No JSON found in response");
    }

    private static RiskLevel parseRisk(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return RiskLevel.fromValue(text);
        } catch (IllegalArgumentException e) {
            throw new GenerationFailedException("Invalid risk_level: " + text);
        }
    }

    private static String requireText(Map<String, Object> parsed, String key) {
        Object value = parsed.get(key);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new GenerationFailedException("Missing required field: " + key);
        }
        return text.trim();
    }

    private static String optionalText(Map<String, Object> parsed, String key, String defaultValue) {
        Object value = parsed.get(key);
        return value instanceof String text && !text.isBlank() ? text.trim() : defaultValue;
    }

    private static List<String> requireCommand(Map<String, Object> parsed, String key) {
        Object value = parsed.get(key);
        List<String> command = new ArrayList<>();
        if (value instanceof List<?> parts) {
            for (Object part : parts) {
                if (!(part instanceof String text)) {
                    throw new GenerationFailedException(key + " must be a list of strings");
                }
                command.add(text);
            }
        } else if (value instanceof String line) {
            try {
                command.addAll(CommandLineTokenizer.tokenize(line));
            } catch (IllegalArgumentException e) {
                throw new GenerationFailedException(key + " is not a valid command line: " + e.getMessage());
            }
        }
        if (command.isEmpty() || command.get(0).isBlank()) {
            throw new GenerationFailedException("Missing required field: " + key);
        }
        return command;
    }
}
