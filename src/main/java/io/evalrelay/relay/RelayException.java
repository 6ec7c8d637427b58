package io.evalrelay.relay;

/**
 * Root of the relay failure taxonomy. Subclasses tell the gateway whether a failure is
 * local to one call or fatal for the rest of the run.
 */
public class RelayException extends RuntimeException {
    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
