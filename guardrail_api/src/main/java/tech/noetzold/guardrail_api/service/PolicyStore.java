package tech.noetzold.guardrail_api.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tech.noetzold.guardrail_api.model.PolicyDocument;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active policy. Reload builds a complete new document first and only then
 * swaps the reference, so in-flight evaluations never see a half-applied policy.
 */
@Slf4j
@Service
public class PolicyStore {

    private final PolicyLoader loader;
    private final ResourceLoader resourceLoader;
    private final String policyLocation;
    private final AtomicReference<PolicyDocument> active = new AtomicReference<>();

    public PolicyStore(PolicyLoader loader,
                       ResourceLoader resourceLoader,
                       @Value("${guardrail.policy.path:classpath:policy/role_intent_policy.yml}") String policyLocation) {
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.policyLocation = policyLocation;
    }

    @PostConstruct
    public void init() {
        active.set(loader.load(resourceLoader.getResource(policyLocation)));
    }

    public PolicyDocument current() {
        PolicyDocument doc = active.get();
        if (doc == null) {
            throw new PolicyConfigurationException("No policy loaded");
        }
        return doc;
    }

    public PolicyDocument reload() {
        PolicyDocument previous = active.get();
        PolicyDocument next;
        try {
            next = loader.load(resourceLoader.getResource(policyLocation));
        } catch (PolicyConfigurationException e) {
            log.warn("Policy reload rejected, keeping version {}: {}",
                    previous != null ? previous.version() : "none", e.getMessage());
            throw e;
        }
        active.set(next);
        log.info("Policy reloaded: {} -> {}", previous != null ? previous.version() : "none", next.version());
        return next;
    }
}
