package io.evalrelay.relay;

import io.evalrelay.codec.ErrorPayload;

/**
 * The responder answered with an error envelope. The channel itself is healthy.
 */
public final class HandlerFailureException extends RelayException {
    private final ErrorPayload error;

    public HandlerFailureException(ErrorPayload error) {
        super(error.type() + ": " + error.message());
        this.error = error;
    }

    public ErrorPayload error() {
        return error;
    }
}
