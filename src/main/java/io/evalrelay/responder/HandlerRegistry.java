package io.evalrelay.responder;

import io.evalrelay.codec.EndpointRegistry;
import io.evalrelay.codec.EndpointSchema;
import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.model.Envelope;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, Binding<?, ?>> bindings = new ConcurrentHashMap<>();

    public <Q, R> HandlerRegistry register(EndpointSchema<Q, R> schema, EndpointHandler<Q, R> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null: " + schema.name());
        }
        if (bindings.putIfAbsent(schema.name(), new Binding<>(schema, handler)) != null) {
            throw new IllegalStateException("Endpoint already bound: " + schema.name());
        }
        return this;
    }

    public Optional<Binding<?, ?>> findByEndpoint(String endpoint) {
        if (endpoint == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(endpoint));
    }

    public Collection<String> listEndpoints() {
        return List.copyOf(bindings.keySet());
    }

    public EndpointRegistry schemas() {
        EndpointRegistry registry = new EndpointRegistry();
        for (Binding<?, ?> binding : bindings.values()) {
            registry.register(binding.schema());
        }
        return registry;
    }

    public record Binding<Q, R>(EndpointSchema<Q, R> schema, EndpointHandler<Q, R> handler) {
        Envelope invoke(Envelope request, EnvelopeCodec codec) throws Exception {
            Q value = codec.readRequest(request, schema);
            R result = handler.handle(value);
            if (result == null) {
                throw new IllegalStateException("handler for " + schema.name() + " returned no value");
            }
            return codec.response(request.callId(), schema, result);
        }
    }
}
