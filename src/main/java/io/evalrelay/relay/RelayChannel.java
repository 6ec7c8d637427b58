package io.evalrelay.relay;

import io.evalrelay.codec.CorruptEnvelopeException;
import io.evalrelay.codec.EndpointSchema;
import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dialer side of the relay.
 *
 * <p>A daemon reader thread routes each incoming envelope to the caller waiting on its call id.
 * Envelopes nobody waits for any more (the caller already timed out) are dropped, and so are
 * well-framed envelopes that cannot be decoded. Deadlines belong to calls: a timed-out call
 * leaves the channel usable, a dead socket does not.
 */
public final class RelayChannel implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RelayChannel.class);

    private final RelayAddress address;
    private final SocketChannel socket;
    private final EnvelopeCodec codec;
    private final int maxFrameBytes;
    private final Map<String, CompletableFuture<Envelope>> pending = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final String callPrefix;
    private final AtomicLong callSequence = new AtomicLong(0L);
    private final AtomicLong discardedTotal = new AtomicLong(0L);
    private final Thread reader;
    private volatile RelayException brokenCause;
    private volatile boolean closed;

    RelayChannel(RelayAddress address, SocketChannel socket, EnvelopeCodec codec, int maxFrameBytes) {
        this.address = address;
        this.socket = socket;
        this.codec = codec;
        this.maxFrameBytes = maxFrameBytes;
        this.callPrefix = UUID.randomUUID().toString().substring(0, 8);
        this.reader = new Thread(this::readLoop, "evalrelay-channel-reader");
        this.reader.setDaemon(true);
        this.reader.start();
    }

    public static RelayChannel connect(RelayAddress address, BackoffPolicy backoff, EnvelopeCodec codec) {
        return connect(address, backoff, codec, FrameIO.DEFAULT_MAX_FRAME_BYTES);
    }

    /**
     * Dials {@code address}, retrying with backoff until the grace period runs out.
     *
     * @throws ConnectionUnavailableException when the peer never accepted within the grace period
     */
    public static RelayChannel connect(RelayAddress address, BackoffPolicy backoff, EnvelopeCodec codec, int maxFrameBytes) {
        long startedNanos = System.nanoTime();
        long graceNanos = backoff.gracePeriod().toNanos();
        int attempt = 0;
        IOException last = null;
        while (true) {
            attempt++;
            SocketChannel socket = null;
            try {
                socket = address.openChannel();
                socket.connect(address.socketAddress());
                LOG.info("Connected to responder at {} after {} attempt(s)", address, attempt);
                return new RelayChannel(address, socket, codec, maxFrameBytes);
            } catch (IOException e) {
                last = e;
                closeQuietly(socket);
            }
            long delayMs = backoff.delayMs(attempt);
            long elapsedNanos = System.nanoTime() - startedNanos;
            if (elapsedNanos + TimeUnit.MILLISECONDS.toNanos(delayMs) > graceNanos) {
                throw new ConnectionUnavailableException(
                        "responder at " + address + " unreachable after " + attempt + " attempt(s) within "
                                + backoff.gracePeriod(),
                        last
                );
            }
            LOG.debug("Responder at {} not ready (attempt {}): {}; retrying in {} ms", address, attempt, last.getMessage(), delayMs);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionUnavailableException("interrupted while connecting to " + address, e);
            }
        }
    }

    public RelayAddress address() {
        return address;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public boolean isOpen() {
        return !closed && brokenCause == null;
    }

    public long discardedTotal() {
        return discardedTotal.get();
    }

    public String nextCallId() {
        return callPrefix + "-" + callSequence.incrementAndGet();
    }

    /**
     * Typed call: encodes {@code request} with the endpoint's codec and decodes the answer.
     *
     * @throws HandlerFailureException  the responder replied with an error envelope
     * @throws CallTimeoutException     no reply within {@code timeout}
     * @throws CorruptEnvelopeException the reply could not be decoded
     * @throws TransportBrokenException the connection is gone
     */
    public <Q, R> R invoke(EndpointSchema<Q, R> schema, Q request, Duration timeout) {
        Envelope response = call(codec.request(nextCallId(), schema, request), timeout);
        if (response.isError()) {
            throw new HandlerFailureException(codec.readError(response));
        }
        return codec.readResponse(response, schema);
    }

    public Envelope call(Envelope request, Duration timeout) {
        ensureUsable();
        String callId = request.callId();
        CompletableFuture<Envelope> waiter = new CompletableFuture<>();
        if (pending.putIfAbsent(callId, waiter) != null) {
            throw new IllegalStateException("call id already in flight: " + callId);
        }
        long startedNanos = System.nanoTime();
        try {
            ensureUsable();
            send(request);
            long remainingNanos = timeout.toNanos() - (System.nanoTime() - startedNanos);
            return waiter.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.remove(callId, waiter);
            sendCancel(request);
            throw new CallTimeoutException(callId, request.endpoint(), timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RelayException relayFailure) {
                throw relayFailure;
            }
            throw new TransportBrokenException("call " + callId + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("interrupted while waiting for call " + callId, e);
        } finally {
            pending.remove(callId, waiter);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        markBroken(new TransportBrokenException("relay channel to " + address + " closed"));
    }

    private void ensureUsable() {
        RelayException broken = brokenCause;
        if (broken != null) {
            throw new TransportBrokenException("relay to " + address + " is not usable: " + broken.getMessage(), broken);
        }
    }

    private void send(Envelope envelope) {
        byte[] frame = codec.encode(envelope);
        if (frame.length > maxFrameBytes) {
            throw new CorruptEnvelopeException("envelope " + envelope.callId() + " exceeds " + maxFrameBytes + " bytes");
        }
        try {
            synchronized (writeLock) {
                FrameIO.writeFrame(socket, frame);
            }
        } catch (IOException e) {
            TransportBrokenException broken = new TransportBrokenException("write to " + address + " failed", e);
            markBroken(broken);
            throw broken;
        }
    }

    private void sendCancel(Envelope request) {
        if (!isOpen()) {
            return;
        }
        try {
            send(codec.cancel(request.callId(), request.endpoint()));
        } catch (TransportBrokenException e) {
            LOG.debug("Cancel for call {} not delivered: {}", request.callId(), e.getMessage());
        }
    }

    private void readLoop() {
        try {
            while (!closed) {
                byte[] frame = FrameIO.readFrame(socket, maxFrameBytes);
                if (frame == null) {
                    markBroken(new TransportBrokenException("responder at " + address + " closed the relay"));
                    return;
                }
                Envelope envelope;
                try {
                    envelope = codec.decode(frame);
                } catch (CorruptEnvelopeException e) {
                    // No call id to route by; the waiting caller's deadline settles it.
                    discardedTotal.incrementAndGet();
                    LOG.warn("Discarding undecodable envelope from {}: {}", address, e.getMessage());
                    continue;
                }
                CompletableFuture<Envelope> waiter = pending.remove(envelope.callId());
                if (waiter == null) {
                    discardedTotal.incrementAndGet();
                    LOG.debug("Discarding {} for call {} with no waiting caller", envelope.kind(), envelope.callId());
                    continue;
                }
                waiter.complete(envelope);
            }
        } catch (FrameException e) {
            failPending(new CorruptEnvelopeException(e.getMessage(), e));
            markBroken(new TransportBrokenException("relay stream from " + address + " is corrupt", e));
        } catch (IOException e) {
            if (!closed) {
                LOG.warn("Relay read from {} failed: {}", address, e.getMessage());
            }
            markBroken(new TransportBrokenException("relay read from " + address + " failed", e));
        }
    }

    private void failPending(RelayException failure) {
        List<CompletableFuture<Envelope>> waiters = new ArrayList<>(pending.values());
        pending.clear();
        for (CompletableFuture<Envelope> waiter : waiters) {
            waiter.completeExceptionally(failure);
        }
    }

    private void markBroken(RelayException cause) {
        synchronized (this) {
            if (brokenCause == null) {
                brokenCause = cause;
            }
        }
        failPending(brokenCause);
        closeQuietly(socket);
    }

    private static void closeQuietly(SocketChannel socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Ignoring close failure: {}", e.getMessage());
        }
    }
}
