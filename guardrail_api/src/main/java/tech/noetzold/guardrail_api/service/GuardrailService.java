package tech.noetzold.guardrail_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.guardrail_api.model.AuditEvent;
import tech.noetzold.guardrail_api.model.ClassificationResult;
import tech.noetzold.guardrail_api.model.Decision;
import tech.noetzold.guardrail_api.model.GuardResult;
import tech.noetzold.guardrail_api.model.PolicyDocument;
import tech.noetzold.guardrail_api.model.RequestContext;
import tech.noetzold.guardrail_api.model.RoleRule;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs classification and policy evaluation for one prompt, times both stages
 * separately and hands the outcome to the audit sink.
 */
@Slf4j
@Service
public class GuardrailService {

    private final IntentClassifier classifier;
    private final PolicyEvaluator evaluator;
    private final PolicyStore policyStore;
    private final AuditSink auditSink;
    private final boolean overrideHintEnabled;
    private final String overrideIntent;
    private final List<String> overrideKeywords;

    public GuardrailService(IntentClassifier classifier,
                            PolicyEvaluator evaluator,
                            PolicyStore policyStore,
                            AuditSink auditSink,
                            @Value("${guardrail.override-hint.enabled:true}") boolean overrideHintEnabled,
                            @Value("${guardrail.override-hint.intent:admin_override}") String overrideIntent,
                            @Value("${guardrail.override-hint.keywords:ignore,override,bypass}") List<String> overrideKeywords) {
        this.classifier = classifier;
        this.evaluator = evaluator;
        this.policyStore = policyStore;
        this.auditSink = auditSink;
        this.overrideHintEnabled = overrideHintEnabled;
        this.overrideIntent = overrideIntent;
        this.overrideKeywords = overrideKeywords.stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .toList();
    }

    public GuardResult check(String requestId, RequestContext context, String prompt) {
        long start = System.nanoTime();
        PolicyDocument policy = policyStore.current();

        long classifyStart = System.nanoTime();
        ClassificationResult classification = overrideHint(context, prompt, policy)
                .orElseGet(() -> classifier.classify(prompt));
        long classifyEnd = System.nanoTime();

        Decision decision = evaluator.evaluate(context, classification, policy);
        long evaluateEnd = System.nanoTime();

        GuardResult result = new GuardResult(
                requestId,
                context,
                classification,
                decision,
                millis(classifyEnd - classifyStart),
                millis(evaluateEnd - classifyEnd),
                millis(evaluateEnd - start),
                policy.version()
        );

        log.info("Guard decision {}: role={} intent={} ({}) allowed={} reason={}",
                requestId, context.role(), classification.intent(),
                String.format(Locale.ROOT, "%.3f", classification.confidence()),
                decision.allowed(), decision.reason());

        audit(result, prompt);
        return result;
    }

    /**
     * A role that may break glass and already carries every break-glass attribute skips the
     * classifier when the prompt asks for an override outright.
     */
    Optional<ClassificationResult> overrideHint(RequestContext context, String prompt, PolicyDocument policy) {
        if (!overrideHintEnabled || prompt == null) return Optional.empty();

        RoleRule role = policy.role(context.role());
        if (role == null || !role.canBreakGlass()) return Optional.empty();
        if (!policy.intents().containsKey(overrideIntent) || !policy.intent(overrideIntent).breakGlass()) {
            return Optional.empty();
        }
        if (!role.breakGlassRequires().stream().allMatch(context::hasAttribute)) return Optional.empty();

        String lower = prompt.toLowerCase(Locale.ROOT);
        if (overrideKeywords.stream().noneMatch(lower::contains)) return Optional.empty();

        log.debug("Override hint applied for role {}", context.role());
        return Optional.of(new ClassificationResult(overrideIntent, 1.0));
    }

    private void audit(GuardResult result, String prompt) {
        try {
            String ts = Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
            auditSink.append(AuditEvent.from(result, prompt != null ? prompt.length() : 0, ts));
        } catch (RuntimeException e) {
            log.warn("Error to persist audit event for requestId {}", result.requestId(), e);
        }
    }

    private static double millis(long nanos) {
        return Math.round(nanos / 10_000.0) / 100.0;
    }
}
