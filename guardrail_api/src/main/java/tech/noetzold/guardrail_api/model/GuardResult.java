package tech.noetzold.guardrail_api.model;

public record GuardResult(
        String requestId,
        RequestContext context,
        ClassificationResult classification,
        Decision decision,
        double classificationMs,
        double evaluationMs,
        double totalMs,
        String policyVersion
) {
    public boolean allowed() {
        return decision.allowed();
    }
}
