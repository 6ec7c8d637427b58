package io.evalrelay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.evalrelay.model.Envelope;
import io.evalrelay.model.EnvelopeKind;
import io.evalrelay.util.Jsons;

import java.io.IOException;

/**
 * Symmetric envelope codec shared by gateway and responder.
 *
 * <p>The envelope itself has one fixed shape; what the payload bytes mean is decided by the
 * {@link EndpointSchema} registered under the envelope's endpoint name.
 */
public final class EnvelopeCodec {
    static final int WIRE_VERSION = 1;

    private final EndpointRegistry registry;

    public EnvelopeCodec(EndpointRegistry registry) {
        this.registry = registry;
    }

    public EndpointRegistry registry() {
        return registry;
    }

    public byte[] encode(Envelope envelope) {
        WireEnvelope wire = new WireEnvelope(
                WIRE_VERSION,
                envelope.callId(),
                envelope.endpoint(),
                envelope.kind().name(),
                envelope.payload()
        );
        try {
            return Jsons.compactMapper().writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope " + envelope.callId(), e);
        }
    }

    public Envelope decode(byte[] bytes) throws CorruptEnvelopeException {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptEnvelopeException("empty envelope");
        }
        WireEnvelope wire;
        try {
            wire = Jsons.compactMapper().readValue(bytes, WireEnvelope.class);
        } catch (IOException e) {
            throw new CorruptEnvelopeException("malformed envelope bytes", e);
        }
        if (wire == null) {
            throw new CorruptEnvelopeException("null envelope");
        }
        if (wire.v() != WIRE_VERSION) {
            throw new CorruptEnvelopeException("unsupported envelope version: " + wire.v());
        }
        if (wire.callId() == null || wire.callId().isBlank()) {
            throw new CorruptEnvelopeException("envelope without call id");
        }
        if (wire.endpoint() == null || wire.endpoint().isBlank()) {
            throw new CorruptEnvelopeException("envelope without endpoint: " + wire.callId());
        }
        EnvelopeKind kind;
        try {
            kind = EnvelopeKind.valueOf(wire.kind());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CorruptEnvelopeException("unknown envelope kind: " + wire.kind(), e);
        }
        return new Envelope(wire.callId(), wire.endpoint(), kind, wire.payload());
    }

    public <Q> Envelope request(String callId, EndpointSchema<Q, ?> schema, Q value) {
        return new Envelope(callId, schema.name(), EnvelopeKind.REQUEST, schema.requestCodec().encode(value));
    }

    public <R> Envelope response(String callId, EndpointSchema<?, R> schema, R value) {
        return new Envelope(callId, schema.name(), EnvelopeKind.RESPONSE, schema.responseCodec().encode(value));
    }

    public Envelope error(String callId, String endpoint, ErrorPayload error) {
        return new Envelope(callId, endpoint, EnvelopeKind.ERROR, ErrorPayload.CODEC.encode(error));
    }

    public Envelope cancel(String callId, String endpoint) {
        return new Envelope(callId, endpoint, EnvelopeKind.CANCEL, new byte[0]);
    }

    /**
     * Decodes a request payload using whatever schema is registered for its endpoint.
     */
    public Object readRequest(Envelope envelope) {
        return registry.require(envelope.endpoint()).requestCodec().decode(envelope.payload());
    }

    public <Q> Q readRequest(Envelope envelope, EndpointSchema<Q, ?> schema) {
        expectEndpoint(envelope, schema);
        return schema.requestCodec().decode(envelope.payload());
    }

    public <R> R readResponse(Envelope envelope, EndpointSchema<?, R> schema) {
        expectEndpoint(envelope, schema);
        if (envelope.kind() != EnvelopeKind.RESPONSE) {
            throw new CorruptEnvelopeException("expected RESPONSE, got " + envelope.kind() + " for " + envelope.callId());
        }
        return schema.responseCodec().decode(envelope.payload());
    }

    public ErrorPayload readError(Envelope envelope) {
        if (!envelope.isError()) {
            throw new CorruptEnvelopeException("expected ERROR, got " + envelope.kind() + " for " + envelope.callId());
        }
        return ErrorPayload.CODEC.decode(envelope.payload());
    }

    private void expectEndpoint(Envelope envelope, EndpointSchema<?, ?> schema) {
        if (!schema.name().equals(envelope.endpoint())) {
            throw new CorruptEnvelopeException(
                    "endpoint mismatch for " + envelope.callId() + ": expected " + schema.name() + ", got " + envelope.endpoint()
            );
        }
    }

    record WireEnvelope(
            int v,
            String callId,
            String endpoint,
            String kind,
            byte[] payload
    ) {
    }
}
