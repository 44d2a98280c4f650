package tech.noetzold.guardrail_api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record RoleRule(
        Set<String> allow,
        Set<String> deny,
        List<String> breakGlassRequires
) {
    public RoleRule {
        allow = allow != null ? Collections.unmodifiableSet(new LinkedHashSet<>(allow)) : Set.of();
        deny = deny != null ? Collections.unmodifiableSet(new LinkedHashSet<>(deny)) : Set.of();
        breakGlassRequires = breakGlassRequires != null ? List.copyOf(breakGlassRequires) : List.of();
    }

    public boolean allows(String intent) {
        return allow.contains(PolicyDocument.WILDCARD) || allow.contains(intent);
    }

    public boolean denies(String intent) {
        return deny.contains(PolicyDocument.WILDCARD) || deny.contains(intent);
    }

    public boolean canBreakGlass() {
        return !breakGlassRequires.isEmpty();
    }
}
