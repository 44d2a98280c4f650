package tech.noetzold.guardrail_api.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import tech.noetzold.guardrail_api.model.AttributeRequirement;
import tech.noetzold.guardrail_api.model.IntentRule;
import tech.noetzold.guardrail_api.model.PolicyDocument;
import tech.noetzold.guardrail_api.model.RoleRule;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the role/intent YAML policy and turns it into a validated {@link PolicyDocument}.
 * <p>
 * Anything that would leave the evaluator guessing (dangling intent references, malformed
 * {@code requires_attr} entries, missing sections) is rejected with a
 * {@link PolicyConfigurationException} naming the offending entry.
 */
@Slf4j
@Component
public class PolicyLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public PolicyDocument load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new PolicyConfigurationException("Policy document not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            PolicyDocument doc = load(in, resource.getDescription());
            log.info("Loaded policy version {} from {} ({} intents, {} roles)",
                    doc.version(), resource.getDescription(), doc.intents().size(), doc.roles().size());
            return doc;
        } catch (IOException e) {
            throw new PolicyConfigurationException("Cannot read policy document " + resource.getDescription(), e);
        }
    }

    PolicyDocument load(InputStream in, String origin) {
        RawPolicy raw;
        try {
            raw = yamlMapper.readValue(in, RawPolicy.class);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Malformed policy document " + origin + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new PolicyConfigurationException("Policy document " + origin + " is empty");
        }
        return toDocument(raw, origin);
    }

    private PolicyDocument toDocument(RawPolicy raw, String origin) {
        if (raw.getIntents() == null || raw.getIntents().isEmpty()) {
            throw new PolicyConfigurationException("Policy document " + origin + " declares no intents");
        }
        if (raw.getRoles() == null || raw.getRoles().isEmpty()) {
            throw new PolicyConfigurationException("Policy document " + origin + " declares no roles");
        }

        Map<String, IntentRule> intents = new LinkedHashMap<>();
        raw.getIntents().forEach((name, rawIntent) -> {
            requireName(name, "intent");
            intents.put(name, toIntent(name, Optional.ofNullable(rawIntent).orElseGet(RawIntent::new)));
        });

        Map<String, RoleRule> roles = new LinkedHashMap<>();
        raw.getRoles().forEach((name, rawRole) -> {
            requireName(name, "role");
            RoleRule role = toRole(name, Optional.ofNullable(rawRole).orElseGet(RawRole::new));
            checkReferences(name, "allow", role.allow(), intents);
            checkReferences(name, "deny", role.deny(), intents);
            roles.put(name, role);
        });

        return new PolicyDocument(raw.getPolicyVersion(), intents, roles);
    }

    private IntentRule toIntent(String name, RawIntent raw) {
        String owner = "Intent '" + name + "'";
        List<AttributeRequirement> requirements = new ArrayList<>();
        for (String entry : entries(raw.getRequiresAttr(), owner, "requires_attr")) {
            int sep = entry.indexOf(':');
            String key = sep < 0 ? "" : entry.substring(0, sep).trim();
            String value = sep < 0 ? "" : entry.substring(sep + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                throw new PolicyConfigurationException(
                        owner + " has malformed requires_attr entry '" + entry + "' (expected key:value)");
            }
            requirements.add(new AttributeRequirement(key, value));
        }
        return new IntentRule(
                new LinkedHashSet<>(entries(raw.getResources(), owner, "resources")),
                requirements,
                Boolean.TRUE.equals(raw.getPii()),
                Boolean.TRUE.equals(raw.getBreakGlass())
        );
    }

    private RoleRule toRole(String name, RawRole raw) {
        String owner = "Role '" + name + "'";
        List<String> breakGlass = raw.getSpecial() != null
                ? entries(raw.getSpecial().getBreakGlassRequires(), owner, "break_glass_requires")
                : List.of();
        return new RoleRule(
                new LinkedHashSet<>(entries(raw.getAllow(), owner, "allow")),
                new LinkedHashSet<>(entries(raw.getDeny(), owner, "deny")),
                breakGlass
        );
    }

    private void checkReferences(String role, String list, Iterable<String> names, Map<String, IntentRule> intents) {
        for (String intent : names) {
            if (!PolicyDocument.WILDCARD.equals(intent) && !intents.containsKey(intent)) {
                throw new PolicyConfigurationException(
                        "Role '" + role + "' references unknown intent '" + intent + "' in " + list);
            }
        }
    }

    private void requireName(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw new PolicyConfigurationException("Policy declares a " + kind + " with a blank name");
        }
    }

    /** An absent list is empty; a null or blank element is a policy error. */
    private static List<String> entries(List<String> list, String owner, String field) {
        if (list == null) {
            return List.of();
        }
        for (String entry : list) {
            if (entry == null || entry.isBlank()) {
                throw new PolicyConfigurationException(owner + " has a blank entry in " + field);
            }
        }
        return list;
    }

    @Data
    static class RawPolicy {
        @JsonProperty("policy_version")
        private String policyVersion;
        private Map<String, RawIntent> intents;
        private Map<String, RawRole> roles;
    }

    @Data
    static class RawIntent {
        private List<String> resources;
        @JsonProperty("requires_attr")
        private List<String> requiresAttr;
        private Boolean pii;
        @JsonProperty("break_glass")
        private Boolean breakGlass;
    }

    @Data
    static class RawRole {
        private List<String> allow;
        private List<String> deny;
        private RawSpecial special;
    }

    @Data
    static class RawSpecial {
        @JsonProperty("break_glass_requires")
        private List<String> breakGlassRequires;
    }
}
