package io.evalrelay.codec;

import io.evalrelay.relay.RelayException;

public final class UnknownEndpointException extends RelayException {
    private final String endpoint;

    public UnknownEndpointException(String endpoint) {
        super("Unknown endpoint: " + endpoint);
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }
}
