package tech.noetzold.guardrail_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RequestContext(
        String role,
        Map<String, String> attributes
) {
    public RequestContext {
        Map<String, String> clean = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (k != null && v != null && !v.isBlank()) clean.put(k, v);
            });
        }
        attributes = Collections.unmodifiableMap(clean);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }
}
