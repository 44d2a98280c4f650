package tech.noetzold.guardrail_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.guardrail_api.model.AuditEvent;
import tech.noetzold.guardrail_api.model.AuditRecord;
import tech.noetzold.guardrail_api.repository.AuditRecordRepository;

import java.util.Map;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
public class JpaAuditSink implements AuditSink {

    private final AuditRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void append(AuditEvent event) {
        AuditRecord rec = AuditRecord.builder()
                .requestId(event.getRequestId())
                .role(event.getRole())
                .attributesJson(objectMapper.valueToTree(event.getAttrs() != null ? event.getAttrs() : Map.of()))
                .intent(event.getIntent())
                .confidence(event.getConfidence())
                .allowed(event.isAllowed())
                .reason(event.getReason())
                .resourcesJson(objectMapper.valueToTree(event.getResolvedResources() != null ? event.getResolvedResources() : Set.of()))
                .breakGlass(event.isBreakGlass())
                .classificationMs(event.getClassificationMs())
                .evaluationMs(event.getEvaluationMs())
                .latencyMs(event.getLatencyMs())
                .promptChars(event.getPromptChars())
                .policyVersion(event.getPolicyVersion())
                .build();
        repository.save(rec);
        log.debug("AuditRecord saved with requestId: {}", event.getRequestId());
    }
}
