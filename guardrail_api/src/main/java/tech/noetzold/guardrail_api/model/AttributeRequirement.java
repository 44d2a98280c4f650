package tech.noetzold.guardrail_api.model;

/**
 * A single {@code key:value} precondition an intent places on the request attributes.
 */
public record AttributeRequirement(
        String key,
        String value
) {

    public boolean isSatisfiedBy(java.util.Map<String, String> attributes) {
        String actual = attributes.get(key);
        return actual != null && actual.equals(value);
    }

    @Override
    public String toString() {
        return key + ":" + value;
    }
}
