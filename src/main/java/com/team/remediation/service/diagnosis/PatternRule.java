package com.team.remediation.service.diagnosis;

import com.team.remediation.model.diagnosis.DiagnosticBundle;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One entry of the pattern table: a pattern id, its category and the predicate that detects it.
 */
public record PatternRule(String id, String category, String description, Predicate<DiagnosticBundle> predicate) {

    public PatternRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(predicate, "predicate");
        category = category == null || category.isBlank() ? "uncategorized" : category;
        description = description == null ? id : description;
    }

    /**
     * Matches when any keyword occurs (case-insensitive) in any signal.
     */
    public static PatternRule keywords(String id, String category, String description, List<String> keywords) {
        List<String> needles = keywords.stream().map(String::toLowerCase).toList();
        return new PatternRule(id, category, description, bundle -> {
            String text = bundle.normalizedText();
            return needles.stream().anyMatch(text::contains);
        });
    }

    /**
     * Matches when the regular expression finds a match in any signal.
     */
    public static PatternRule regex(String id, String category, String description, String regex) {
        Pattern compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return new PatternRule(id, category, description,
                bundle -> bundle.rawSignals().stream().anyMatch(s -> compiled.matcher(s).find()));
    }

    public boolean matches(DiagnosticBundle bundle) {
        return predicate.test(bundle);
    }
}
