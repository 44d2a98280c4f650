package tech.noetzold.guardrail_api.model;

/**
 * Stable reason codes emitted by the policy evaluator. Audit and metrics aggregate on
 * {@link #code()}, so the strings must not change.
 */
public enum ReasonCode {
    UNKNOWN_ROLE("unknown_role"),
    UNKNOWN_INTENT("unknown_intent"),
    EXPLICIT_DENY("explicit_deny"),
    MISSING_ATTR("missing_attr"),
    BREAK_GLASS_MISSING("break_glass_missing"),
    BREAK_GLASS_ALLOW("break_glass_allow"),
    ALLOW_MATCH("allow_match"),
    NOT_IN_ALLOW("not_in_allow");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Renders the code, appending {@code :detail} for parameterised families such as {@code missing_attr}. */
    public String render(String detail) {
        return detail == null ? code : code + ":" + detail;
    }
}
