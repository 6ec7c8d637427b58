package io.evalrelay.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Wire unit of the relay: an endpoint name paired with an opaque payload.
 *
 * <p>The relay never looks inside {@code payload}; only the codec registered for
 * {@code endpoint} interprets it. {@code callId} pairs a response with its request.
 */
public record Envelope(
        String callId,
        String endpoint,
        EnvelopeKind kind,
        byte[] payload
) {
    public Envelope {
        payload = payload == null ? new byte[0] : payload;
    }

    public boolean isError() {
        return kind == EnvelopeKind.ERROR;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Envelope that)) {
            return false;
        }
        return Objects.equals(callId, that.callId)
                && Objects.equals(endpoint, that.endpoint)
                && kind == that.kind
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callId, endpoint, kind) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Envelope[callId=" + callId + ", endpoint=" + endpoint + ", kind=" + kind
                + ", payloadBytes=" + payload.length + "]";
    }
}
