package tech.noetzold.guardrail_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.Map;
import java.util.Set;

/**
 * One audit line per guarded request. Field names follow the JSON-lines layout
 * consumed by the offline metrics tooling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AuditEvent {
    @JsonProperty("request_id")
    private String requestId;
    private String role;
    private Map<String, String> attrs;
    private String intent;
    private double confidence;
    private boolean allowed;
    private String reason;
    @JsonProperty("resolved_resources")
    private Set<String> resolvedResources;
    @JsonProperty("break_glass")
    private boolean breakGlass;
    @JsonProperty("t_intent_ms")
    private double classificationMs;
    @JsonProperty("t_policy_ms")
    private double evaluationMs;
    @JsonProperty("latency_ms")
    private double latencyMs;
    @JsonProperty("prompt_chars")
    private int promptChars;
    @JsonProperty("policy_version")
    private String policyVersion;
    private String ts;

    public static AuditEvent from(GuardResult result, int promptChars, String ts) {
        return AuditEvent.builder()
                .requestId(result.requestId())
                .role(result.context().role())
                .attrs(result.context().attributes())
                .intent(result.classification().intent())
                .confidence(result.classification().confidence())
                .allowed(result.decision().allowed())
                .reason(result.decision().reason())
                .resolvedResources(result.decision().resolvedResources())
                .breakGlass(result.decision().breakGlassUsed())
                .classificationMs(result.classificationMs())
                .evaluationMs(result.evaluationMs())
                .latencyMs(result.totalMs())
                .promptChars(promptChars)
                .policyVersion(result.policyVersion())
                .ts(ts)
                .build();
    }
}
