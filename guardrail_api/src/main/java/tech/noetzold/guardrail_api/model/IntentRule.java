package tech.noetzold.guardrail_api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record IntentRule(
        Set<String> resources,              // may hold the "*" sentinel
        List<AttributeRequirement> requiresAttributes,
        boolean pii,                        // informational only
        boolean breakGlass
) {
    public IntentRule {
        resources = resources != null ? Collections.unmodifiableSet(new LinkedHashSet<>(resources)) : Set.of();
        requiresAttributes = requiresAttributes != null ? List.copyOf(requiresAttributes) : List.of();
    }

    public static IntentRule unrestricted() {
        return new IntentRule(Set.of(), List.of(), false, false);
    }
}
