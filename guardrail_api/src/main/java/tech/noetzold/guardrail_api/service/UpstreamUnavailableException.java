package tech.noetzold.guardrail_api.service;

/**
 * The generation backend failed after the guard allowed the request.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final boolean timedOut;

    public UpstreamUnavailableException(String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
