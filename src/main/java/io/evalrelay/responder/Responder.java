package io.evalrelay.responder;

import io.evalrelay.codec.CorruptEnvelopeException;
import io.evalrelay.codec.EndpointSchema;
import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.codec.ErrorPayload;
import io.evalrelay.model.Envelope;
import io.evalrelay.relay.FrameException;
import io.evalrelay.relay.IncomingCall;
import io.evalrelay.relay.RelayListener;
import io.evalrelay.relay.RelaySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves named endpoints over a relay session.
 *
 * <p>The accept loop runs on the caller's thread; handlers run one at a time on a single
 * worker thread so a {@code CANCEL} envelope can still be read while a handler is busy.
 * Replies are written from a separate thread that is never interrupted, because interrupting
 * a thread blocked on a socket channel closes the channel.
 * Handler failures are answered as error envelopes and never end the loop.
 */
public final class Responder implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Responder.class);

    private final HandlerRegistry handlers;
    private final EnvelopeCodec codec;
    private final ExecutorService worker;
    private final ExecutorService replier;
    private final Map<String, FutureTask<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong servedTotal = new AtomicLong(0L);
    private final AtomicLong failedTotal = new AtomicLong(0L);
    private final AtomicLong cancelledTotal = new AtomicLong(0L);
    private volatile RelaySession currentSession;

    public Responder(HandlerRegistry handlers, Collection<String> requiredEndpoints) {
        List<String> missing = new ArrayList<>();
        for (String endpoint : requiredEndpoints) {
            if (handlers.findByEndpoint(endpoint).isEmpty()) {
                missing.add(endpoint);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Responder is missing handlers for required endpoints: " + missing);
        }
        this.handlers = handlers;
        this.codec = new EnvelopeCodec(handlers.schemas());
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "evalrelay-handler");
            thread.setDaemon(true);
            return thread;
        });
        this.replier = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "evalrelay-replier");
            thread.setDaemon(true);
            return thread;
        });
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    /**
     * Serves one gateway connection until the gateway disconnects or {@link #stop()} is called.
     */
    public ServeOutcome serve(RelayListener listener) throws IOException {
        running.set(true);
        try (RelaySession session = listener.acceptSession()) {
            currentSession = session;
            while (running.get()) {
                Optional<IncomingCall> next;
                try {
                    next = session.accept();
                } catch (CorruptEnvelopeException e) {
                    failedTotal.incrementAndGet();
                    LOG.warn("Dropping undecodable envelope: {}", e.getMessage());
                    continue;
                } catch (FrameException e) {
                    LOG.error("Relay stream lost frame alignment, ending session: {}", e.getMessage());
                    break;
                } catch (IOException e) {
                    if (running.get()) {
                        LOG.warn("Relay session ended: {}", e.getMessage());
                    }
                    break;
                }
                if (next.isEmpty()) {
                    LOG.info("Gateway closed the relay");
                    break;
                }
                IncomingCall call = next.get();
                switch (call.envelope().kind()) {
                    case REQUEST -> submit(call);
                    case CANCEL -> cancel(call.callId());
                    default -> LOG.warn("Ignoring unexpected {} envelope for call {}", call.envelope().kind(), call.callId());
                }
            }
        } finally {
            currentSession = null;
            running.set(false);
            for (FutureTask<Void> task : inFlight.values()) {
                task.cancel(true);
            }
            inFlight.clear();
        }
        return outcome();
    }

    /**
     * Turns one request envelope into its reply. Never throws for handler-side problems.
     */
    public Envelope dispatch(Envelope request) {
        Optional<HandlerRegistry.Binding<?, ?>> binding = handlers.findByEndpoint(request.endpoint());
        if (binding.isEmpty()) {
            failedTotal.incrementAndGet();
            return codec.error(request.callId(), request.endpoint(),
                    ErrorPayload.of(ErrorPayload.UNKNOWN_ENDPOINT, "Unknown endpoint: " + request.endpoint()));
        }
        try {
            Envelope response = binding.get().invoke(request, codec);
            servedTotal.incrementAndGet();
            return response;
        } catch (CorruptEnvelopeException e) {
            failedTotal.incrementAndGet();
            LOG.warn("Undecodable {} request {}: {}", request.endpoint(), request.callId(), e.getMessage());
            return codec.error(request.callId(), request.endpoint(),
                    ErrorPayload.of(ErrorPayload.CORRUPT_ENVELOPE, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelledTotal.incrementAndGet();
            return codec.error(request.callId(), request.endpoint(),
                    ErrorPayload.of(ErrorPayload.CANCELLED, "handler interrupted"));
        } catch (Exception e) {
            failedTotal.incrementAndGet();
            LOG.warn("Handler for {} failed on call {}", request.endpoint(), request.callId(), e);
            return codec.error(request.callId(), request.endpoint(), ErrorPayload.handlerFailure(e));
        }
    }

    /**
     * Runs a handler in-process, without any relay in between.
     */
    @SuppressWarnings("unchecked")
    public <Q, R> R invokeLocal(EndpointSchema<Q, R> schema, Q request) throws Exception {
        HandlerRegistry.Binding<Q, R> binding = (HandlerRegistry.Binding<Q, R>) handlers.findByEndpoint(schema.name())
                .orElseThrow(() -> new IllegalArgumentException("No handler bound to " + schema.name()));
        R result = binding.handler().handle(request);
        if (result == null) {
            throw new IllegalStateException("handler for " + schema.name() + " returned no value");
        }
        return result;
    }

    public void stop() {
        running.set(false);
        RelaySession session = currentSession;
        if (session != null) {
            try {
                session.close();
            } catch (IOException e) {
                LOG.debug("Closing relay session failed: {}", e.getMessage());
            }
        }
    }

    public ServeOutcome outcome() {
        return new ServeOutcome(servedTotal.get(), failedTotal.get(), cancelledTotal.get());
    }

    @Override
    public void close() {
        stop();
        worker.shutdownNow();
        replier.shutdown();
    }

    private void submit(IncomingCall call) {
        String callId = call.callId();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                Envelope response = dispatch(call.envelope());
                replier.execute(() -> deliver(call, response));
            } finally {
                inFlight.remove(callId);
            }
            return null;
        });
        inFlight.put(callId, task);
        worker.execute(task);
    }

    private void deliver(IncomingCall call, Envelope response) {
        try {
            call.reply(response);
        } catch (IOException e) {
            LOG.warn("Failed to deliver reply for call {}: {}", call.callId(), e.getMessage());
        }
    }

    private void cancel(String callId) {
        FutureTask<Void> task = inFlight.remove(callId);
        if (task == null) {
            LOG.debug("Cancel for call {} arrived after it finished", callId);
            return;
        }
        LOG.info("Gateway gave up on call {}; interrupting handler", callId);
        if (task.cancel(true)) {
            cancelledTotal.incrementAndGet();
        }
    }

    public record ServeOutcome(long served, long failed, long cancelled) {
    }
}
