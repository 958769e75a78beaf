package com.team.remediation.model.proposal;

import java.util.List;

/**
 * A structured command against the target system plus a human description.
 *
 * @param command argv form, e.g. {@code ["kubectl", "rollout", "restart", "deployment/api", "-n", "payments"]}
 */
public record ProposedAction(List<String> command, String description) {

    public ProposedAction {
        command = command == null ? List.of() : List.copyOf(command);
    }

    public static ProposedAction of(String description, String... command) {
        return new ProposedAction(List.of(command), description);
    }

    public boolean isEmpty() {
        return command.isEmpty() || command.stream().allMatch(part -> part == null || part.isBlank());
    }

    public String commandLine() {
        return String.join(" ", command);
    }
}
