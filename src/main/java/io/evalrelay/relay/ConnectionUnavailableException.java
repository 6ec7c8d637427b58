package io.evalrelay.relay;

public final class ConnectionUnavailableException extends RelayException {
    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
