package com.team.remediation.service.notification;

import com.team.remediation.model.approval.ApprovalRecord;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.workflow.ProposalOutcome;
import com.team.remediation.model.workflow.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts Adaptive Card messages about remediation runs to a Microsoft Teams incoming webhook.
 * Delivery is best-effort: failures are logged and swallowed into an empty Mono.
 */
@Service
@Slf4j
public class TeamsNotificationService {

    private static final int MAX_LISTED = 10;

    private final WebClient webClient;
    private final String webhookUrl;

    public TeamsNotificationService(@Value("${teams.webhook-url:}") String webhookUrl) {
        this.webhookUrl = webhookUrl;
        this.webClient = WebClient.create();
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    /**
     * Announce proposals waiting for review.
     */
    public Mono<Void> notifyProposalsSubmitted(String workflowId, String scope, List<ApprovalRecord> records) {
        if (!isEnabled() || records.isEmpty()) {
            return Mono.empty();
        }

        List<Map<String, Object>> facts = new ArrayList<>();
        for (ApprovalRecord record : records.subList(0, Math.min(MAX_LISTED, records.size()))) {
            FixProposal proposal = record.proposal();
            facts.add(Map.of("title", proposal.getEntityId(),
                    "value", String.format(Locale.ROOT, "%s, %s risk, confidence %.2f: %s",
                            proposal.getPatternId(), proposal.getRiskLevel(), proposal.getConfidence(),
                            truncate(proposal.getProposedAction().description(), 120))));
        }

        Map<String, Object> card = adaptiveCard(List.of(
                textBlock("Remediation awaiting approval: " + workflowId, true),
                Map.of("type", "FactSet", "facts", List.of(
                        Map.of("title", "Scope", "value", scope != null ? scope : "N/A"),
                        Map.of("title", "Proposals", "value", String.valueOf(records.size()))
                )),
                Map.of("type", "FactSet", "facts", facts)
        ));
        return post(card, "proposals submitted for " + workflowId);
    }

    /**
     * Report the final state of a run.
     */
    public Mono<Void> notifyRunFinished(RunSummary run) {
        if (!isEnabled()) {
            return Mono.empty();
        }

        List<Map<String, Object>> body = new ArrayList<>();
        body.add(textBlock(statusIcon(run) + " Remediation " + run.id() + " finished: " + run.status().wireName(), true));
        body.add(Map.of("type", "FactSet", "facts", List.of(
                Map.of("title", "Scope", "value", run.scope() != null ? run.scope() : "N/A"),
                Map.of("title", "Proposals", "value", String.valueOf(run.proposalIds().size())),
                Map.of("title", "Manual investigation", "value", String.valueOf(run.manualInvestigation().size()))
        )));
        StringBuilder outcomes = new StringBuilder();
        for (ProposalOutcome outcome : run.outcomes().subList(0, Math.min(MAX_LISTED, run.outcomes().size()))) {
            outcomes.append("- ").append(outcome.entityId()).append(" (").append(outcome.patternId()).append("): ")
                    .append(outcome.finalStatus().wireName())
                    .append(outcome.rolledBack() ? ", rolled back" : "")
                    .append('\n');
        }
        if (outcomes.length() > 0) {
            body.add(textBlock(outcomes.toString().trim(), false));
        }
        return post(adaptiveCard(body), "run " + run.id() + " finished");
    }

    private Mono<Void> post(Map<String, Object> card, String what) {
        return webClient.post()
                .uri(URI.create(webhookUrl))
                .bodyValue(card)
                .retrieve()
                .bodyToMono(Void.class)
                .doOnSuccess(v -> log.info("Teams notification sent: {}", what))
                .doOnError(e -> log.warn("Failed to send Teams notification ({}): {}", what, e.getMessage()))
                .onErrorResume(e -> Mono.empty());
    }

    private static Map<String, Object> adaptiveCard(List<Map<String, Object>> body) {
        return Map.of(
                "type", "message",
                "attachments", List.of(Map.of(
                        "contentType", "application/vnd.microsoft.card.adaptive",
                        "content", Map.of(
                                "$schema", "http://adaptivecards.io/schemas/adaptive-card.json",
                                "type", "AdaptiveCard",
                                "version", "1.4",
                                "body", body
                        )
                ))
        );
    }

    private static Map<String, Object> textBlock(String text, boolean heading) {
        if (heading) {
            return Map.of("type", "TextBlock", "text", text, "weight", "bolder", "size", "medium", "wrap", true);
        }
        return Map.of("type", "TextBlock", "text", text, "wrap", true);
    }

    private static String statusIcon(RunSummary run) {
        return switch (run.status()) {
            case COMPLETED -> "✅";
            case PARTIAL_FAILURE, TIMEOUT, NO_ACTION -> "⚠️";
            default -> "🔴";
        };
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) return "N/A";
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
