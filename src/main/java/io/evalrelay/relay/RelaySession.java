package io.evalrelay.relay;

import io.evalrelay.codec.CorruptEnvelopeException;
import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.model.Envelope;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.Optional;

/**
 * One accepted gateway connection on the listener side.
 */
public final class RelaySession implements AutoCloseable {
    private final SocketChannel socket;
    private final EnvelopeCodec codec;
    private final int maxFrameBytes;
    private final Object writeLock = new Object();

    RelaySession(SocketChannel socket, EnvelopeCodec codec, int maxFrameBytes) {
        this.socket = socket;
        this.codec = codec;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Blocks for the next envelope from the gateway.
     *
     * @return the call, or empty once the gateway closed the connection
     * @throws CorruptEnvelopeException a well-framed but undecodable envelope; the session stays usable
     * @throws FrameException           the stream lost frame alignment; the session is finished
     */
    public Optional<IncomingCall> accept() throws IOException {
        byte[] frame = FrameIO.readFrame(socket, maxFrameBytes);
        if (frame == null) {
            return Optional.empty();
        }
        Envelope envelope = codec.decode(frame);
        return Optional.of(new IncomingCall(this, envelope));
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public boolean isOpen() {
        return socket.isOpen();
    }

    void send(Envelope envelope) throws IOException {
        byte[] frame = codec.encode(envelope);
        synchronized (writeLock) {
            FrameIO.writeFrame(socket, frame);
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
