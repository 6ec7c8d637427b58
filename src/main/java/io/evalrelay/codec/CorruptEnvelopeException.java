package io.evalrelay.codec;

import io.evalrelay.relay.RelayException;

public class CorruptEnvelopeException extends RelayException {
    public CorruptEnvelopeException(String message) {
        super(message);
    }

    public CorruptEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
