package com.team.remediation.service.fix;

import org.springframework.stereotype.Component;

/**
 * Confidence of a generated proposal, derived from prior evidence only.
 *
 * With {@code a} prior attempts and {@code s} successes, {@code w = min(1, a / K)} and {@code r = s / a}:
 * <ul>
 *   <li>{@code a = 0}: {@code 0.40 + 0.10 * topSimilarity}, never above 0.5</li>
 *   <li>otherwise: {@code 0.40 * (1 - w) + 0.95 * w * r}, clamped to [0.05, 0.95]</li>
 * </ul>
 */
@Component
public class ConfidenceCalculator {

    public static final int EVIDENCE_SATURATION = 5;
    public static final double NO_EVIDENCE_BASE = 0.40;
    public static final double NO_EVIDENCE_CAP = 0.50;
    public static final double MAX_CONFIDENCE = 0.95;
    public static final double MIN_CONFIDENCE = 0.05;

    public double calculate(long attempts, long successes, double topSimilarity) {
        if (attempts <= 0) {
            double similarity = Math.max(0.0, Math.min(1.0, topSimilarity));
            return Math.min(NO_EVIDENCE_CAP, NO_EVIDENCE_BASE + 0.10 * similarity);
        }
        long boundedSuccesses = Math.max(0, Math.min(successes, attempts));
        double weight = Math.min(1.0, (double) attempts / EVIDENCE_SATURATION);
        double rate = (double) boundedSuccesses / attempts;
        double confidence = NO_EVIDENCE_BASE * (1 - weight) + MAX_CONFIDENCE * weight * rate;
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    /**
     * Evidence for a specific fix: its own history when it has any, else the pattern's overall history.
     */
    public double calculate(FixContext context, String fixId) {
        PriorFix match = context.priorFixes().stream()
                .filter(p -> p.fixKey().equals(fixId) && p.attemptCount() > 0)
                .findFirst()
                .orElse(null);
        if (match != null) {
            return calculate(match.attemptCount(), match.successCount(), context.topSimilarity());
        }
        return calculate(context.totalAttempts(), context.totalSuccesses(), context.topSimilarity());
    }
}
