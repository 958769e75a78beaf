package com.team.remediation.service.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.team.remediation.config.TargetSystemConfig;
import com.team.remediation.exception.TargetSystemException;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.proposal.ProposedAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kubernetes target driven through kubectl. A scope is a namespace and an entity is a pod.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KubectlTargetSystemClient implements TargetSystemClient {

    private final CommandRunner commandRunner;
    private final TargetSystemConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<AffectedEntity> identify(String scope) {
        List<String> command = new ArrayList<>(List.of(config.getKubectlPath(), "get", "pods"));
        command.addAll(namespaceArgs(scope));
        command.addAll(List.of("-o", "json"));

        CommandResult result = commandRunner.run(command);
        if (!result.isSuccess()) {
            throw new TargetSystemException("Listing pods in " + scope + " failed (exit " + result.exitCode()
                    + (result.timedOut() ? ", timed out" : "") + "): " + result.output());
        }
        try {
            List<AffectedEntity> affected = parsePods(result.output(), scope);
            log.info("Identified {} unhealthy pod(s) in {}", affected.size(), scope);
            return affected;
        } catch (IOException e) {
            throw new TargetSystemException("Could not parse pod list of " + scope + ": " + e.getMessage(), e);
        }
    }

    /**
     * Unhealthy pods from {@code kubectl get pods -o json} output.
     */
    List<AffectedEntity> parsePods(String json, String scope) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        List<AffectedEntity> affected = new ArrayList<>();
        for (JsonNode pod : root.path("items")) {
            String name = pod.path("metadata").path("name").asText(null);
            if (name == null) {
                continue;
            }
            String namespace = pod.path("metadata").path("namespace").asText(scope);
            for (JsonNode status : pod.path("status").path("containerStatuses")) {
                String reason = unhealthyReason(status);
                if (reason == null) {
                    continue;
                }
                String container = status.path("name").asText(null);
                Map<String, String> attributes = new HashMap<>();
                JsonNode limits = containerSpec(pod, container).path("resources").path("limits");
                if (limits.hasNonNull("memory")) {
                    attributes.put(AffectedEntity.MEMORY_LIMIT, limits.get("memory").asText());
                }
                if (limits.hasNonNull("cpu")) {
                    attributes.put(AffectedEntity.CPU_LIMIT, limits.get("cpu").asText());
                }
                String lastTerminated = status.path("lastState").path("terminated").path("reason").asText(null);
                if (lastTerminated != null) {
                    attributes.put("last_terminated_reason", lastTerminated);
                    attributes.put("last_exit_code", status.path("lastState").path("terminated").path("exitCode").asText());
                }

                affected.add(AffectedEntity.builder()
                        .id(name)
                        .scope(namespace)
                        .workload(owningDeployment(pod))
                        .container(container)
                        .image(status.path("image").asText(null))
                        .restartCount(status.path("restartCount").asInt())
                        .reason(reason)
                        .attributes(attributes)
                        .build());
                break;
            }
        }
        return affected;
    }

    @Override
    public List<String> collectSignals(AffectedEntity entity) {
        List<String> signals = new ArrayList<>();
        signals.add(statusLine(entity));

        addOutput(signals, "events", eventsCommand(entity));
        addOutput(signals, "previous logs", logsCommand(entity, true));
        addOutput(signals, "logs", logsCommand(entity, false));
        return signals;
    }

    @Override
    public ExecutionResult apply(ProposedAction action) {
        if (config.isDryRun()) {
            log.info("Dry run, not executing: {}", action.commandLine());
            return ExecutionResult.success("dry-run: " + action.commandLine(), clock.instant());
        }
        try {
            CommandResult result = commandRunner.run(action.command());
            return result.isSuccess()
                    ? ExecutionResult.success(result.output(), clock.instant())
                    : ExecutionResult.failure("exit " + result.exitCode() + ": " + result.output(), clock.instant());
        } catch (IllegalArgumentException e) {
            log.error("Refused to execute '{}': {}", action.commandLine(), e.getMessage());
            return ExecutionResult.failure(e.getMessage(), clock.instant());
        }
    }

    @Override
    public HealthCheckResult checkHealth(AffectedEntity entity) {
        if (config.isDryRun()) {
            return HealthCheckResult.healthy("dry-run");
        }
        if (entity.getWorkload() != null) {
            List<String> command = new ArrayList<>(List.of(config.getKubectlPath(), "rollout", "status",
                    "deployment/" + entity.getWorkload()));
            command.addAll(namespaceArgs(entity.getScope()));
            command.add("--timeout=" + config.getCommandTimeoutSeconds() + "s");
            CommandResult result = commandRunner.run(command);
            return result.isSuccess()
                    ? HealthCheckResult.healthy(result.output())
                    : HealthCheckResult.unhealthy(result.output());
        }

        List<String> command = new ArrayList<>(List.of(config.getKubectlPath(), "get", "pod", entity.getId()));
        command.addAll(namespaceArgs(entity.getScope()));
        command.addAll(List.of("-o", "jsonpath={.status.phase}"));
        CommandResult result = commandRunner.run(command);
        String phase = result.output() == null ? "" : result.output().trim();
        return result.isSuccess() && "Running".equals(phase)
                ? HealthCheckResult.healthy("pod phase Running")
                : HealthCheckResult.unhealthy("pod phase " + (phase.isEmpty() ? "unknown" : phase));
    }

    private void addOutput(List<String> signals, String label, List<String> command) {
        CommandResult result = commandRunner.run(command);
        if (result.isSuccess() && result.output() != null && !result.output().isBlank()) {
            signals.add("[" + label + "]\n" + result.output());
        } else if (!result.isSuccess()) {
            log.debug("Collecting {} for {} failed (exit {})", label, command, result.exitCode());
        }
    }

    private List<String> logsCommand(AffectedEntity entity, boolean previous) {
        List<String> command = new ArrayList<>(List.of(config.getKubectlPath(), "logs", entity.getId()));
        command.addAll(namespaceArgs(entity.getScope()));
        if (entity.getContainer() != null) {
            command.addAll(List.of("-c", entity.getContainer()));
        }
        command.add("--tail=" + config.getLogTailLines());
        if (previous) {
            command.add("--previous");
        }
        return command;
    }

    private List<String> eventsCommand(AffectedEntity entity) {
        List<String> command = new ArrayList<>(List.of(config.getKubectlPath(), "get", "events"));
        command.addAll(namespaceArgs(entity.getScope()));
        command.add("--field-selector=involvedObject.name=" + entity.getId());
        return command;
    }

    private String unhealthyReason(JsonNode containerStatus) {
        String waiting = containerStatus.path("state").path("waiting").path("reason").asText(null);
        if (waiting != null && config.getUnhealthyReasons().contains(waiting)) {
            return waiting;
        }
        String terminated = containerStatus.path("state").path("terminated").path("reason").asText(null);
        if (terminated != null && config.getUnhealthyReasons().contains(terminated)) {
            return terminated;
        }
        return null;
    }

    private static JsonNode containerSpec(JsonNode pod, String container) {
        for (JsonNode spec : pod.path("spec").path("containers")) {
            if (spec.path("name").asText("").equals(container)) {
                return spec;
            }
        }
        return MissingNode.getInstance();
    }

    /**
     * Deployment name from a ReplicaSet owner reference, e.g. "api-7d9f8b6c5" -> "api".
     */
    static String owningDeployment(JsonNode pod) {
        for (JsonNode owner : pod.path("metadata").path("ownerReferences")) {
            if ("ReplicaSet".equals(owner.path("kind").asText())) {
                String replicaSet = owner.path("name").asText("");
                int dash = replicaSet.lastIndexOf('-');
                return dash > 0 ? replicaSet.substring(0, dash) : replicaSet;
            }
        }
        return null;
    }

    private static String statusLine(AffectedEntity entity) {
        StringBuilder sb = new StringBuilder("[status] pod ").append(entity.getId());
        if (entity.getContainer() != null) {
            sb.append(" container ").append(entity.getContainer());
        }
        sb.append(": ").append(entity.getReason()).append(", restarts ").append(entity.getRestartCount());
        String lastReason = entity.attribute("last_terminated_reason");
        if (lastReason != null) {
            sb.append(", last terminated ").append(lastReason)
                    .append(" (exit code ").append(entity.attribute("last_exit_code")).append(')');
        }
        return sb.toString();
    }

    private static List<String> namespaceArgs(String scope) {
        return scope != null && !scope.isBlank() ? List.of("-n", scope) : List.of();
    }
}
