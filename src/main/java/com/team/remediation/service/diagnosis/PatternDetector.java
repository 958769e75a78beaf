package com.team.remediation.service.diagnosis;

import com.team.remediation.model.diagnosis.DiagnosticBundle;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Classifies a diagnostic bundle into zero or more causal patterns.
 *
 * Rules are evaluated independently in registration order; a bundle may match several.
 * New patterns are added by registering a rule, never by editing an existing predicate.
 */
@Slf4j
public class PatternDetector {

    private final List<PatternRule> rules = new CopyOnWriteArrayList<>();

    public PatternDetector() {
    }

    public PatternDetector(List<PatternRule> initialRules) {
        initialRules.forEach(this::register);
    }

    public static PatternDetector withDefaults() {
        return new PatternDetector(DefaultPatternRules.all());
    }

    public synchronized void register(PatternRule rule) {
        if (rule(rule.id()).isPresent()) {
            throw new IllegalArgumentException("Pattern already registered: " + rule.id());
        }
        rules.add(rule);
        log.debug("Registered pattern rule {} ({})", rule.id(), rule.category());
    }

    /**
     * @return matched pattern ids in registration order; empty when nothing matched
     */
    public Set<String> detect(DiagnosticBundle bundle) {
        Set<String> matched = new LinkedHashSet<>();
        for (PatternRule rule : rules) {
            try {
                if (rule.matches(bundle)) {
                    matched.add(rule.id());
                }
            } catch (RuntimeException e) {
                log.warn("Pattern rule {} failed on entity {}, treating as no match: {}",
                        rule.id(), bundle.entityId(), e.getMessage());
            }
        }
        return matched;
    }

    public List<PatternRule> rules() {
        return List.copyOf(rules);
    }

    public Optional<PatternRule> rule(String patternId) {
        return rules.stream().filter(r -> r.id().equals(patternId)).findFirst();
    }

    public String categoryOf(String patternId) {
        return rule(patternId).map(PatternRule::category).orElse("uncategorized");
    }
}
