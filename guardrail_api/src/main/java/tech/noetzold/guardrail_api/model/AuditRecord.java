package tech.noetzold.guardrail_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "guardrail_audit", indexes = {
        @Index(name = "idx_guardrail_audit_request_id", columnList = "request_id")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", length = 120, nullable = false)
    private String requestId;

    @Column(name = "role", length = 80)
    private String role;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attributes_json", columnDefinition = "jsonb")
    private JsonNode attributesJson;

    @Column(name = "intent", length = 80, nullable = false)
    private String intent;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "allowed", nullable = false)
    private boolean allowed;

    @Column(name = "reason", length = 120, nullable = false)
    private String reason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "resources_json", columnDefinition = "jsonb")
    private JsonNode resourcesJson;

    @Column(name = "break_glass", nullable = false)
    private boolean breakGlass;

    @Column(name = "classification_ms")
    private double classificationMs;

    @Column(name = "evaluation_ms")
    private double evaluationMs;

    @Column(name = "latency_ms")
    private double latencyMs;

    @Column(name = "prompt_chars")
    private int promptChars;

    @Column(name = "policy_version", length = 80)
    private String policyVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
