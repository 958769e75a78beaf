package com.team.remediation.service.fix;

import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.PatternIds;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic remediations keyed by pattern id, used when generation is unavailable or invalid.
 * Confidence of every rule is fixed and never above {@link #MAX_CONFIDENCE}.
 */
@Component
public class FallbackRuleTable {

    public static final double MAX_CONFIDENCE = 0.75;

    static final String DEFAULT_MEMORY_LIMIT = "512Mi";

    private static final Pattern QUANTITY = Pattern.compile("^(\\d+(?:\\.\\d+)?)([A-Za-z]*)$");

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final Rule defaultRule;

    public FallbackRuleTable() {
        register(new Rule(PatternIds.RESOURCE_EXHAUSTION, "increase_memory_limit", "Increase memory limit",
                RiskLevel.LOW, 0.70,
                "Container was OOM-killed: its memory limit is too low for the current load",
                FallbackRuleTable::raiseMemoryLimit, FallbackRuleTable::restoreMemoryLimit));
        register(new Rule(PatternIds.DEPENDENCY_UNAVAILABLE, "restart_workload", "Restart workload",
                RiskLevel.LOW, 0.55,
                "A dependency refused connections; a restart re-resolves endpoints once it is reachable",
                FallbackRuleTable::restartWorkload, FallbackRuleTable::undoRollout));
        register(new Rule(PatternIds.PERMISSION_DENIED, "set_pod_fs_group", "Set pod fsGroup",
                RiskLevel.HIGH, 0.40,
                "The container user cannot access a mounted path or resource",
                FallbackRuleTable::setFsGroup, FallbackRuleTable::undoRollout));
        register(new Rule(PatternIds.MISSING_RESOURCE, "rollback_to_previous_revision", "Roll back to previous revision",
                RiskLevel.MEDIUM, 0.45,
                "A file, mount or config the workload expects is missing since the latest rollout",
                FallbackRuleTable::undoRollout, FallbackRuleTable::undoRollout));
        register(new Rule(PatternIds.FATAL_CRASH, "rollback_to_previous_revision", "Roll back to previous revision",
                RiskLevel.MEDIUM, 0.50,
                "The process crashes on start; the latest revision is the most likely culprit",
                FallbackRuleTable::undoRollout, FallbackRuleTable::undoRollout));
        register(new Rule(PatternIds.PORT_CONFLICT, "restart_workload", "Restart workload",
                RiskLevel.LOW, 0.50,
                "The listening port is held by a stale process or sidecar",
                FallbackRuleTable::restartWorkload, FallbackRuleTable::undoRollout));

        this.defaultRule = new Rule(PatternIds.UNKNOWN, "restart_workload", "Restart workload",
                RiskLevel.MEDIUM, 0.30,
                "Cause not covered by the rule table; restarting is the least invasive action",
                FallbackRuleTable::restartWorkload, FallbackRuleTable::undoRollout);
    }

    private void register(Rule rule) {
        if (rule.confidence() > MAX_CONFIDENCE) {
            throw new IllegalArgumentException("Fallback confidence above " + MAX_CONFIDENCE + ": " + rule.patternId());
        }
        rules.put(rule.patternId(), rule);
    }

    public FallbackPlan plan(String patternId, AffectedEntity entity) {
        Rule rule = rules.getOrDefault(patternId, defaultRule);
        return new FallbackPlan(patternId, rule.fixId(), rule.fixLabel(), rule.riskLevel(), rule.confidence(),
                rule.rootCause(), rule.action().apply(entity), rule.rollback().apply(entity));
    }

    public boolean covers(String patternId) {
        return rules.containsKey(patternId);
    }

    public Collection<Rule> rules() {
        return List.copyOf(rules.values());
    }

    /**
     * One row of the table.
     */
    public record Rule(String patternId,
                       String fixId,
                       String fixLabel,
                       RiskLevel riskLevel,
                       double confidence,
                       String rootCause,
                       Function<AffectedEntity, ProposedAction> action,
                       Function<AffectedEntity, ProposedAction> rollback) {
    }

    // ========== ACTION TEMPLATES ==========

    private static ProposedAction raiseMemoryLimit(AffectedEntity entity) {
        String prior = priorMemoryLimit(entity);
        String raised = doubleQuantity(prior);
        return new ProposedAction(setMemoryLimit(entity, raised),
                "Raise memory limit of " + workloadRef(entity) + " from " + prior + " to " + raised);
    }

    private static ProposedAction restoreMemoryLimit(AffectedEntity entity) {
        String prior = priorMemoryLimit(entity);
        return new ProposedAction(setMemoryLimit(entity, prior),
                "Restore memory limit of " + workloadRef(entity) + " to " + prior);
    }

    private static List<String> setMemoryLimit(AffectedEntity entity, String limit) {
        List<String> command = new ArrayList<>(List.of("kubectl", "set", "resources", workloadRef(entity)));
        command.addAll(namespaceArgs(entity));
        if (entity.getContainer() != null) {
            command.add("-c");
            command.add(entity.getContainer());
        }
        command.add("--limits=memory=" + limit);
        return command;
    }

    private static ProposedAction restartWorkload(AffectedEntity entity) {
        List<String> command = new ArrayList<>(List.of("kubectl", "rollout", "restart", workloadRef(entity)));
        command.addAll(namespaceArgs(entity));
        return new ProposedAction(command, "Restart " + workloadRef(entity));
    }

    private static ProposedAction undoRollout(AffectedEntity entity) {
        List<String> command = new ArrayList<>(List.of("kubectl", "rollout", "undo", workloadRef(entity)));
        command.addAll(namespaceArgs(entity));
        return new ProposedAction(command, "Roll " + workloadRef(entity) + " back to its previous revision");
    }

    private static ProposedAction setFsGroup(AffectedEntity entity) {
        List<String> command = new ArrayList<>(List.of("kubectl", "patch", workloadRef(entity)));
        command.addAll(namespaceArgs(entity));
        command.addAll(List.of("--type=merge", "-p",
                "{\"spec\":{\"template\":{\"spec\":{\"securityContext\":{\"fsGroup\":1000}}}}}"));
        return new ProposedAction(command, "Set fsGroup 1000 on the pod template of " + workloadRef(entity));
    }

    static String workloadRef(AffectedEntity entity) {
        String workload = entity.getWorkload() != null ? entity.getWorkload() : entity.getId();
        return "deployment/" + workload;
    }

    private static List<String> namespaceArgs(AffectedEntity entity) {
        return entity.getScope() != null ? List.of("-n", entity.getScope()) : List.of();
    }

    static String priorMemoryLimit(AffectedEntity entity) {
        String limit = entity.attribute(AffectedEntity.MEMORY_LIMIT);
        return limit != null && QUANTITY.matcher(limit.trim()).matches() ? limit.trim() : DEFAULT_MEMORY_LIMIT;
    }

    /**
     * Double a resource quantity keeping its unit, e.g. "512Mi" -> "1024Mi", "1.5Gi" -> "3Gi".
     */
    static String doubleQuantity(String quantity) {
        Matcher matcher = QUANTITY.matcher(quantity.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a resource quantity: " + quantity);
        }
        BigDecimal doubled = new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(2)).stripTrailingZeros();
        return doubled.toPlainString() + matcher.group(2);
    }
}
