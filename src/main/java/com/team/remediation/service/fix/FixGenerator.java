package com.team.remediation.service.fix;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.config.TargetSystemConfig;
import com.team.remediation.exception.GenerationFailedException;
import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.DiagnosticBundle;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposalSource;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.service.generation.GenerativeBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Produces one fix proposal for an entity's primary pattern.
 *
 * Uses the generative backend when it is available and falls back to the static rule table on
 * timeout, error, rate limiting or invalid output. Confidence of a generated proposal comes from
 * prior evidence through {@link ConfidenceCalculator}, never from the backend.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FixGenerator {

    private final FixContextBuilder contextBuilder;
    private final FixPromptBuilder promptBuilder;
    private final FixResponseParser responseParser;
    private final ConfidenceCalculator confidenceCalculator;
    private final FallbackRuleTable fallbackRuleTable;
    private final ProposalValidator validator;
    private final GenerativeBackend generativeBackend;
    private final RemediationConfig config;
    private final TargetSystemConfig targetConfig;
    private final Clock clock;

    /**
     * @param patterns matched patterns in rule order; the first is the primary one
     * @throws IllegalArgumentException when no pattern matched
     */
    public FixProposal generate(String workflowId, AffectedEntity entity, DiagnosticBundle bundle, Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("No pattern detected for entity " + entity.getId());
        }
        List<String> ordered = new ArrayList<>(patterns);
        String primary = ordered.get(0);
        FixContext context = contextBuilder.build(entity, bundle, primary, ordered.subList(1, ordered.size()));
        return generate(workflowId, context);
    }

    public FixProposal generate(String workflowId, FixContext context) {
        if (generativeBackend.isAvailable()) {
            try {
                FixProposal generated = generateWithBackend(workflowId, context);
                log.info("[{}] Generated proposal {} for {} ({}, confidence {})", workflowId, generated.getId(),
                        context.entity().getId(), generated.getRiskLevel(), format(generated.getConfidence()));
                return generated;
            } catch (GenerationFailedException | ProposalValidationException e) {
                log.warn("[{}] Generation failed for {}, using fallback rule: {}",
                        workflowId, context.entity().getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[{}] Generative backend error for {}, using fallback rule: {}",
                        workflowId, context.entity().getId(), e.toString());
            }
        } else {
            log.debug("[{}] Generative backend not configured, using fallback rule", workflowId);
        }
        return fallback(workflowId, context);
    }

    private FixProposal generateWithBackend(String workflowId, FixContext context) {
        String prompt = promptBuilder.build(context, targetConfig.getAllowedCommands());
        String response = generativeBackend.generate(prompt, config.getTemperature())
                .timeout(config.getGenerationTimeout())
                .block();

        GeneratedCandidate candidate = responseParser.parse(response);
        checkAllowed(candidate.action());
        checkAllowed(candidate.rollback());

        FallbackPlan reference = fallbackRuleTable.plan(context.patternId(), context.entity());
        String fixId = candidate.fixId() != null ? candidate.fixId() : reference.fixId();
        RiskLevel risk = candidate.riskLevel() != null ? candidate.riskLevel() : reference.riskLevel();
        double confidence = confidenceCalculator.calculate(context, fixId);

        FixProposal proposal = baseProposal(workflowId, context)
                .rootCause(candidate.rootCause())
                .proposedAction(candidate.action())
                .rollbackAction(candidate.rollback())
                .riskLevel(risk)
                .confidence(confidence)
                .fixId(fixId)
                .source(ProposalSource.GENERATED)
                .rationale(rationale(candidate.rationale(), context, fixId))
                .build();
        validator.validate(proposal);
        return proposal;
    }

    /**
     * Deterministic proposal from the static rule table.
     */
    public FixProposal fallback(String workflowId, FixContext context) {
        FallbackPlan plan = fallbackRuleTable.plan(context.patternId(), context.entity());
        FixProposal proposal = baseProposal(workflowId, context)
                .rootCause(plan.rootCause())
                .proposedAction(plan.action())
                .rollbackAction(plan.rollback())
                .riskLevel(plan.riskLevel())
                .confidence(plan.confidence())
                .fixId(plan.fixId())
                .source(ProposalSource.FALLBACK)
                .rationale(rationale("Static rule for " + context.patternId() + ": " + plan.fixLabel() + ".",
                        context, plan.fixId()))
                .build();
        validator.validate(proposal);
        log.info("[{}] Fallback proposal {} for {} ({}, confidence {})", workflowId, proposal.getId(),
                context.entity().getId(), proposal.getRiskLevel(), format(proposal.getConfidence()));
        return proposal;
    }

    private FixProposal.FixProposalBuilder baseProposal(String workflowId, FixContext context) {
        return FixProposal.builder()
                .id("fp-" + UUID.randomUUID().toString().substring(0, 8))
                .workflowId(workflowId)
                .entityId(context.entity().getId())
                .scope(context.entity().getScope())
                .patternId(context.patternId())
                .status(ApprovalStatus.PROPOSED)
                .createdAt(clock.instant());
    }

    private void checkAllowed(ProposedAction action) {
        String executable = action.command().get(0);
        if (!targetConfig.getAllowedCommands().contains(executable)) {
            throw new GenerationFailedException("Command not allowed: " + executable);
        }
    }

    private static String rationale(String base, FixContext context, String fixId) {
        StringBuilder sb = new StringBuilder(base == null ? "" : base.trim());
        PriorFix match = context.priorFixes().stream()
                .filter(p -> p.fixKey().equals(fixId))
                .findFirst()
                .orElse(null);
        if (sb.length() > 0) {
            sb.append(' ');
        }
        if (match != null && match.attemptCount() > 0) {
            sb.append(String.format(Locale.ROOT, "This fix was applied %d time(s) before with a %.0f%% success rate.",
                    match.attemptCount(), match.successRate() * 100));
        } else if (context.totalAttempts() > 0) {
            sb.append(String.format(Locale.ROOT, "%d similar past fix(es) for this pattern, %.0f%% successful.",
                    context.totalAttempts(), 100.0 * context.totalSuccesses() / context.totalAttempts()));
        } else {
            sb.append("No similar past fixes on record.");
        }
        if (!context.secondaryPatterns().isEmpty()) {
            sb.append(" Also matched: ").append(String.join(", ", context.secondaryPatterns())).append('.');
        }
        if (context.bundle().reviewerFeedback() != null) {
            sb.append(" Reviewer feedback considered: ").append(context.bundle().reviewerFeedback());
        }
        return sb.toString();
    }

    private static String format(double confidence) {
        return String.format(Locale.ROOT, "%.2f", confidence);
    }
}
