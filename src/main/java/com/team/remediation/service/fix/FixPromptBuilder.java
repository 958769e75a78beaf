package com.team.remediation.service.fix;

import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.service.search.SearchHit;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Builds the fix-generation prompt from the template in {@code prompts/fix-generation.txt}.
 */
@Component
@Slf4j
public class FixPromptBuilder {

    static final String TEMPLATE_PATH = "prompts/fix-generation.txt";

    private String template;

    @PostConstruct
    public void loadTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource(TEMPLATE_PATH);
            template = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            log.info("Loaded fix generation prompt template ({} chars)", template.length());
        } catch (IOException e) {
            log.warn("Could not load prompt template '{}', using built-in default: {}", TEMPLATE_PATH, e.getMessage());
            template = defaultTemplate();
        }
    }

    public String build(FixContext context, List<String> allowedCommands) {
        String base = template != null ? template : defaultTemplate();
        return base
                .replace("{{ENTITY}}", describeEntity(context))
                .replace("{{PATTERN}}", context.patternId())
                .replace("{{SECONDARY_PATTERNS}}", context.secondaryPatterns().isEmpty()
                        ? "none" : String.join(", ", context.secondaryPatterns()))
                .replace("{{SIGNALS}}", context.bundle().rawSignals().isEmpty()
                        ? "No signals collected" : String.join("\n---\n", context.bundle().rawSignals()))
                .replace("{{PRIOR_FIXES}}", describePriorFixes(context.priorFixes()))
                .replace("{{SIMILAR}}", describeSnippets(context.similarSnippets()))
                .replace("{{FEEDBACK}}", context.bundle().reviewerFeedback() != null
                        ? context.bundle().reviewerFeedback() : "none")
                .replace("{{ALLOWED_COMMANDS}}", String.join(", ", allowedCommands));
    }

    private static String describeEntity(FixContext context) {
        AffectedEntity entity = context.entity();
        StringBuilder sb = new StringBuilder();
        sb.append("id: ").append(entity.getId());
        if (entity.getScope() != null) sb.append(", scope: ").append(entity.getScope());
        if (entity.getWorkload() != null) sb.append(", workload: ").append(entity.getWorkload());
        if (entity.getContainer() != null) sb.append(", container: ").append(entity.getContainer());
        if (entity.getReason() != null) sb.append(", reason: ").append(entity.getReason());
        sb.append(", restarts: ").append(entity.getRestartCount());
        if (entity.getAttributes() != null && !entity.getAttributes().isEmpty()) {
            sb.append(", attributes: ").append(entity.getAttributes());
        }
        return sb.toString();
    }

    private static String describePriorFixes(List<PriorFix> priorFixes) {
        if (priorFixes.isEmpty()) {
            return "No prior fixes recorded for this pattern";
        }
        StringBuilder sb = new StringBuilder();
        for (PriorFix fix : priorFixes) {
            sb.append(String.format(Locale.ROOT, "- %s (id %s): %d/%d successful (%.0f%%), last used %s%n",
                    fix.label(), fix.fixKey(), fix.successCount(), fix.attemptCount(),
                    fix.successRate() * 100, fix.lastUsed() != null ? fix.lastUsed() : "never"));
        }
        return sb.toString().trim();
    }

    private static String describeSnippets(List<SearchHit> snippets) {
        if (snippets.isEmpty()) {
            return "No similar past remediations found";
        }
        StringBuilder sb = new StringBuilder();
        for (SearchHit hit : snippets) {
            sb.append(String.format(Locale.ROOT, "- [score %.2f] %s%n", hit.score(), hit.content()));
        }
        return sb.toString().trim();
    }

    private static String defaultTemplate() {
        return """
                You are an SRE proposing one remediation for a failing workload.

                ## Entity
                {{ENTITY}}

                ## Detected pattern
                {{PATTERN}} (also matched: {{SECONDARY_PATTERNS}})

                ## Signals
                {{SIGNALS}}

                ## Prior fixes
                {{PRIOR_FIXES}}

                ## Similar past remediations
                {{SIMILAR}}

                ## Reviewer feedback
                {{FEEDBACK}}

                Commands may only use: {{ALLOWED_COMMANDS}}.
                Respond with JSON only:
                ```json
                {"root_cause": "...", "fix_id": "snake_case_name", "risk_level": "LOW|MEDIUM|HIGH",
                 "command": ["kubectl", "..."], "description": "...",
                 "rollback_command": ["kubectl", "..."], "rollback_description": "...", "rationale": "..."}
                ```
                """;
    }
}
