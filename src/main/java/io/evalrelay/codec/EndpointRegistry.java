package io.evalrelay.codec;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class EndpointRegistry {
    private final Map<String, EndpointSchema<?, ?>> schemas = new ConcurrentHashMap<>();

    public EndpointRegistry register(EndpointSchema<?, ?> schema) {
        EndpointSchema<?, ?> previous = schemas.putIfAbsent(schema.name(), schema);
        if (previous != null && previous != schema) {
            throw new IllegalStateException("Endpoint already registered: " + schema.name());
        }
        return this;
    }

    public Optional<EndpointSchema<?, ?>> find(String endpoint) {
        if (endpoint == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(endpoint));
    }

    public EndpointSchema<?, ?> require(String endpoint) {
        return find(endpoint).orElseThrow(() -> new UnknownEndpointException(endpoint));
    }

    public Collection<String> names() {
        return List.copyOf(schemas.keySet());
    }
}
