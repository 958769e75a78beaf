package com.team.remediation.service.diagnosis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Builds the pattern detector from the built-in rules plus extra rules in {@code pattern-rules.yml}.
 */
@Configuration
@Slf4j
public class PatternRuleConfig {

    static final String RULES_RESOURCE = "pattern-rules.yml";

    @Bean
    public PatternDetector patternDetector() {
        PatternDetector detector = PatternDetector.withDefaults();
        for (PatternRule rule : loadExtraRules(RULES_RESOURCE)) {
            try {
                detector.register(rule);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping pattern rule {}: {}", rule.id(), e.getMessage());
            }
        }
        log.info("Pattern detector ready with {} rules", detector.rules().size());
        return detector;
    }

    /**
     * Load rule definitions from the classpath. A missing file yields no rules; an unreadable one is logged.
     */
    List<PatternRule> loadExtraRules(String resource) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                log.info("No {} on classpath, using built-in pattern rules only", resource);
                return List.of();
            }
            Map<String, Object> raw = new Yaml().load(inputStream);
            return parseRules(raw);
        } catch (Exception e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            return List.of();
        }
    }

    @SuppressWarnings("unchecked")
    List<PatternRule> parseRules(Map<String, Object> raw) {
        List<PatternRule> rules = new ArrayList<>();
        if (raw == null || !raw.containsKey("patterns")) {
            return rules;
        }

        List<Map<String, Object>> patterns = (List<Map<String, Object>>) raw.get("patterns");
        for (Map<String, Object> entry : patterns) {
            String id = (String) entry.get("id");
            if (id == null || id.isBlank()) {
                log.warn("Pattern rule without id ignored: {}", entry);
                continue;
            }
            String category = (String) entry.getOrDefault("category", "uncategorized");
            String description = (String) entry.getOrDefault("description", id);
            String regex = (String) entry.get("regex");
            List<String> keywords = (List<String>) entry.get("keywords");

            if (regex != null && !regex.isBlank()) {
                try {
                    rules.add(PatternRule.regex(id, category, description, regex));
                } catch (PatternSyntaxException e) {
                    log.warn("Pattern rule {} has an invalid regex, ignored: {}", id, e.getDescription());
                }
            } else if (keywords != null && !keywords.isEmpty()) {
                rules.add(PatternRule.keywords(id, category, description, keywords));
            } else {
                log.warn("Pattern rule {} has neither keywords nor regex, ignored", id);
            }
        }
        return rules;
    }
}
