package tech.noetzold.guardrail_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, read-only view of the role/intent policy file.
 * <p>
 * Instances are swapped as a whole on reload and never mutated, so a request keeps
 * evaluating against the reference it captured at entry.
 */
public record PolicyDocument(
        String version,
        Map<String, IntentRule> intents,
        Map<String, RoleRule> roles
) {
    public static final String WILDCARD = "*";
    public static final String UNVERSIONED = "unversioned";

    public PolicyDocument {
        version = (version == null || version.isBlank()) ? UNVERSIONED : version;
        intents = Collections.unmodifiableMap(new LinkedHashMap<>(intents));
        roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public RoleRule role(String name) {
        return name == null ? null : roles.get(name);
    }

    public IntentRule intent(String name) {
        return intents.getOrDefault(name, IntentRule.unrestricted());
    }
}
