package tech.noetzold.guardrail_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.guardrail_api.model.AuditRecord;

import java.util.List;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {
    List<AuditRecord> findByRequestIdOrderByCreatedAtDesc(String requestId);
}
