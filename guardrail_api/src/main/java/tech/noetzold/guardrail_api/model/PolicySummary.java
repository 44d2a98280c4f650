package tech.noetzold.guardrail_api.model;

import java.util.List;

public record PolicySummary(
        String policy_version,
        List<String> intents,
        List<String> roles
) {
    public static PolicySummary of(PolicyDocument doc) {
        return new PolicySummary(doc.version(), List.copyOf(doc.intents().keySet()), List.copyOf(doc.roles().keySet()));
    }
}
