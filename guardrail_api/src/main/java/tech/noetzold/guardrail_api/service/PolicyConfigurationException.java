package tech.noetzold.guardrail_api.service;

/**
 * Raised when a policy document cannot be read or fails validation. Fatal at startup;
 * on reload the previously active policy stays in place.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
