package tech.noetzold.guardrail_api.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.guardrail_api.model.AuditRecord;
import tech.noetzold.guardrail_api.repository.AuditRecordRepository;

@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditRecordRepository recordRepo;

    // request ids can repeat when the caller reuses x-request-id; newest wins
    @GetMapping("/record")
    public ResponseEntity<AuditRecord> getRecordByRequestId(@RequestParam("request_id") String requestId) {
        return recordRepo.findByRequestIdOrderByCreatedAtDesc(requestId)
                .stream()
                .findFirst()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
