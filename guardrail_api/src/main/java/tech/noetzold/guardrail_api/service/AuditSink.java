package tech.noetzold.guardrail_api.service;

import tech.noetzold.guardrail_api.model.AuditEvent;

/**
 * Append-only destination for per-request audit events.
 */
public interface AuditSink {

    void append(AuditEvent event);
}
