package tech.noetzold.guardrail_api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.guardrail_api.repository.AuditRecordRepository;
import tech.noetzold.guardrail_api.service.AuditSink;
import tech.noetzold.guardrail_api.service.JpaAuditSink;
import tech.noetzold.guardrail_api.service.JsonlAuditSink;

import java.nio.file.Path;

@Configuration
public class AuditConfig {

    @Bean
    @ConditionalOnProperty(name = "guardrail.audit.sink", havingValue = "jpa", matchIfMissing = true)
    public AuditSink jpaAuditSink(AuditRecordRepository repository, ObjectMapper objectMapper) {
        return new JpaAuditSink(repository, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "guardrail.audit.sink", havingValue = "jsonl")
    public AuditSink jsonlAuditSink(@Value("${guardrail.audit.jsonl-path:logs/audit.jsonl}") String path,
                                    ObjectMapper objectMapper) {
        return new JsonlAuditSink(Path.of(path), objectMapper);
    }
}
