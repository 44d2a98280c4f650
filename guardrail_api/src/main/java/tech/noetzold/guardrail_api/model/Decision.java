package tech.noetzold.guardrail_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record Decision(
        boolean allowed,
        String reason,
        String intent,
        Set<String> resolvedResources,
        boolean breakGlassUsed,
        @JsonIgnore ReasonCode reasonCode
) {
    public Decision {
        resolvedResources = resolvedResources != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(resolvedResources))
                : Set.of();
    }

    public static Decision deny(ReasonCode code, String intent) {
        return new Decision(false, code.code(), intent, Set.of(), false, code);
    }

    public static Decision missingAttribute(String key, String intent) {
        return new Decision(false, ReasonCode.MISSING_ATTR.render(key), intent, Set.of(), false, ReasonCode.MISSING_ATTR);
    }

    public static Decision allow(ReasonCode code, String intent, Set<String> resources) {
        return new Decision(true, code.code(), intent, resources, code == ReasonCode.BREAK_GLASS_ALLOW, code);
    }
}
