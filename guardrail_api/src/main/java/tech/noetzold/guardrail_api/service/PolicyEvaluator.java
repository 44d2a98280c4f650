package tech.noetzold.guardrail_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.guardrail_api.model.AttributeRequirement;
import tech.noetzold.guardrail_api.model.ClassificationResult;
import tech.noetzold.guardrail_api.model.Decision;
import tech.noetzold.guardrail_api.model.IntentRule;
import tech.noetzold.guardrail_api.model.PolicyDocument;
import tech.noetzold.guardrail_api.model.ReasonCode;
import tech.noetzold.guardrail_api.model.RequestContext;
import tech.noetzold.guardrail_api.model.RoleRule;

/**
 * Role/attribute gate evaluated before any generation call.
 *
 * <p>Rule chain, first match wins:
 * <ol>
 *   <li>role not in policy: deny {@code unknown_role}</li>
 *   <li>intent {@code unknown}: deny {@code unknown_intent}</li>
 *   <li>role deny list holds the intent or {@code *}: deny {@code explicit_deny}</li>
 *   <li>first unmet {@code requires_attr}: deny {@code missing_attr:<key>}</li>
 *   <li>break-glass intent: deny {@code not_in_allow} if the role cannot break glass,
 *       deny {@code break_glass_missing} if a required attribute is absent,
 *       otherwise allow {@code break_glass_allow}</li>
 *   <li>role allow list holds the intent or {@code *}: allow {@code allow_match}</li>
 *   <li>otherwise deny {@code not_in_allow}</li>
 * </ol>
 * Audit and metrics aggregate on these codes, so the order must not change.
 */
@Component
public class PolicyEvaluator {

    public Decision evaluate(RequestContext context, ClassificationResult classification, PolicyDocument policy) {
        String intent = classification.intent();

        RoleRule role = policy.role(context.role());
        if (role == null) {
            return Decision.deny(ReasonCode.UNKNOWN_ROLE, intent);
        }
        if (classification.isUnknown()) {
            return Decision.deny(ReasonCode.UNKNOWN_INTENT, intent);
        }
        if (role.denies(intent)) {
            return Decision.deny(ReasonCode.EXPLICIT_DENY, intent);
        }

        IntentRule rule = policy.intent(intent);
        for (AttributeRequirement requirement : rule.requiresAttributes()) {
            if (!requirement.isSatisfiedBy(context.attributes())) {
                return Decision.missingAttribute(requirement.key(), intent);
            }
        }

        if (rule.breakGlass()) {
            if (!role.canBreakGlass()) {
                return Decision.deny(ReasonCode.NOT_IN_ALLOW, intent);
            }
            for (String key : role.breakGlassRequires()) {
                if (!context.hasAttribute(key)) {
                    return Decision.deny(ReasonCode.BREAK_GLASS_MISSING, intent);
                }
            }
            return Decision.allow(ReasonCode.BREAK_GLASS_ALLOW, intent, rule.resources());
        }

        if (role.allows(intent)) {
            return Decision.allow(ReasonCode.ALLOW_MATCH, intent, rule.resources());
        }
        return Decision.deny(ReasonCode.NOT_IN_ALLOW, intent);
    }
}
