package io.evalrelay.relay;

public final class TransportBrokenException extends RelayException {
    public TransportBrokenException(String message) {
        super(message);
    }

    public TransportBrokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
