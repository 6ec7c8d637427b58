package io.evalrelay.relay;

import io.evalrelay.codec.ErrorPayload;
import io.evalrelay.model.Envelope;
import io.evalrelay.model.EnvelopeKind;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class IncomingCall {
    private final RelaySession session;
    private final Envelope envelope;
    private final AtomicBoolean answered = new AtomicBoolean(false);

    IncomingCall(RelaySession session, Envelope envelope) {
        this.session = session;
        this.envelope = envelope;
    }

    public Envelope envelope() {
        return envelope;
    }

    public String callId() {
        return envelope.callId();
    }

    public String endpoint() {
        return envelope.endpoint();
    }

    public void respond(byte[] payload) throws IOException {
        reply(new Envelope(envelope.callId(), envelope.endpoint(), EnvelopeKind.RESPONSE, payload));
    }

    public void respondError(ErrorPayload error) throws IOException {
        reply(session.codec().error(envelope.callId(), envelope.endpoint(), error));
    }

    /**
     * Sends a fully built reply. Each call is answered at most once.
     */
    public void reply(Envelope response) throws IOException {
        if (!envelope.callId().equals(response.callId())) {
            throw new IllegalArgumentException("reply call id " + response.callId() + " does not match " + envelope.callId());
        }
        if (!answered.compareAndSet(false, true)) {
            throw new IllegalStateException("call already answered: " + envelope.callId());
        }
        session.send(response);
    }
}
