package tech.noetzold.guardrail_api.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.guardrail_api.service.UpstreamUnavailableException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Forwards allowed prompts to the generation backend. With no backend configured
 * the prompt is echoed back, which is enough for local runs and policy evaluation.
 */
@Slf4j
@Component
public class UpstreamLlmClient {

    private final WebClient webClient;
    private final String upstreamUrl;
    private final Duration timeout;

    public UpstreamLlmClient(@Qualifier("llmWebClient") WebClient llmWebClient,
                             @Value("${guardrail.upstream.url:}") String upstreamUrl,
                             @Value("${guardrail.upstream.timeout-ms:30000}") long timeoutMs) {
        this.webClient = llmWebClient;
        this.upstreamUrl = upstreamUrl;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    public String complete(String requestId, String prompt) {
        if (upstreamUrl == null || upstreamUrl.isBlank()) {
            return "Echo: " + prompt;
        }
        try {
            UpstreamReply reply = webClient.post()
                    .uri(upstreamUrl)
                    .header("X-Request-Id", requestId)
                    .bodyValue(Map.of("prompt", prompt))
                    .retrieve()
                    .bodyToMono(UpstreamReply.class)
                    .timeout(timeout)
                    .block();
            if (reply == null || reply.answer() == null) {
                throw new UpstreamUnavailableException("Upstream returned no answer", false, null);
            }
            return reply.answer();
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (Exception e) {
            boolean timedOut = hasCause(e, TimeoutException.class);
            log.warn("Upstream LLM call failed for {} (timeout={}): {}", requestId, timedOut, e.getMessage());
            throw new UpstreamUnavailableException("Upstream LLM call failed: " + e.getMessage(), timedOut, e);
        }
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
        }
        return false;
    }

    record UpstreamReply(String answer) {}
}
