package tech.noetzold.guardrail_api.model;

public record ClassificationResult(
        String intent,
        double confidence
) {
    public static final String UNKNOWN_INTENT = "unknown";

    public ClassificationResult {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static ClassificationResult unknown(double confidence) {
        return new ClassificationResult(UNKNOWN_INTENT, confidence);
    }

    public boolean isUnknown() {
        return UNKNOWN_INTENT.equals(intent);
    }
}
