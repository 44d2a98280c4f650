package tech.noetzold.guardrail_api.controller;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.guardrail_api.service.PolicyConfigurationException;
import tech.noetzold.guardrail_api.service.UpstreamUnavailableException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex) {
        return body("INVALID_REQUEST", "Request body must contain at least one message with content");
    }

    @ExceptionHandler(PolicyConfigurationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handlePolicy(PolicyConfigurationException ex) {
        return body("POLICY_INVALID", ex.getMessage());
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamUnavailableException ex) {
        if (ex.isTimedOut()) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(body("UPSTREAM_TIMEOUT", "LLM backend timed out"));
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(body("UPSTREAM_UNAVAILABLE", ex.getMessage()));
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("trace_id", MDC.get("trace_id"));
        return body;
    }
}
