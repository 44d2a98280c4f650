package tech.noetzold.guardrail_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.guardrail_api.client.UpstreamLlmClient;
import tech.noetzold.guardrail_api.model.ChatRequest;
import tech.noetzold.guardrail_api.model.ChatResponse;
import tech.noetzold.guardrail_api.model.GuardResult;
import tech.noetzold.guardrail_api.model.RequestContext;
import tech.noetzold.guardrail_api.service.GuardrailService;
import tech.noetzold.guardrail_api.service.IntentClassifier;
import tech.noetzold.guardrail_api.service.PolicyStore;
import tech.noetzold.guardrail_api.service.RequestContextResolver;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Chat")
public class ChatController {

    public static final String POLICY_VERSION_HEADER = "X-Policy-Version";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final GuardrailService guardrailService;
    private final RequestContextResolver contextResolver;
    private final UpstreamLlmClient upstreamLlmClient;
    private final PolicyStore policyStore;
    private final IntentClassifier intentClassifier;

    @PostMapping("/chat")
    public ResponseEntity<?> chat(@Valid @RequestBody ChatRequest req, HttpServletRequest httpReq) {
        String requestId = contextResolver.resolveRequestId(httpReq);
        RequestContext context = contextResolver.resolve(httpReq);

        String prompt = req.lastContent();
        if (prompt.isEmpty()) {
            return ResponseEntity.badRequest()
                    .headers(headers(policyStore.current().version(), requestId))
                    .body(Map.of("error", "empty content"));
        }

        GuardResult result = guardrailService.check(requestId, context, prompt);
        HttpHeaders headers = headers(result.policyVersion(), requestId);

        if (!result.allowed()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .headers(headers)
                    .body(ChatResponse.blocked(result.decision().intent(), result.decision().reason()));
        }

        String answer = upstreamLlmClient.complete(requestId, prompt);
        return ResponseEntity.ok()
                .headers(headers)
                .body(ChatResponse.answered(result.decision().intent(), answer));
    }

    @GetMapping("/whoami")
    public Map<String, Object> whoami(HttpServletRequest httpReq) {
        RequestContext context = contextResolver.resolve(httpReq);
        Map<String, Object> body = new HashMap<>();
        body.put("role", context.role());
        body.put("attrs", context.attributes());
        body.put("request_id", httpReq.getHeader(RequestContextResolver.REQUEST_ID_HEADER));
        return body;
    }

    @Tag(name = "Health")
    @GetMapping("/healthz")
    public Map<String, Object> healthz() {
        return Map.of("ok", true);
    }

    @Tag(name = "Health")
    @GetMapping("/readyz")
    public Map<String, Object> readyz() {
        try {
            intentClassifier.probe();
            return Map.of("ok", true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Map.of("ok", false, "error", "interrupted");
        } catch (Exception e) {
            return Map.of("ok", false, "error", String.valueOf(e.getMessage()));
        }
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of("status", "ok", "docs", "/swagger-ui.html");
    }

    private HttpHeaders headers(String policyVersion, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(POLICY_VERSION_HEADER, policyVersion);
        headers.set(REQUEST_ID_HEADER, requestId);
        return headers;
    }
}
