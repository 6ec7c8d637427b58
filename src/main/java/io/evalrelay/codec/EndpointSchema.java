package io.evalrelay.codec;

/**
 * Name plus request/response codecs of one endpoint.
 */
public record EndpointSchema<Q, R>(
        String name,
        PayloadCodec<Q> requestCodec,
        PayloadCodec<R> responseCodec
) {
    public EndpointSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("endpoint name cannot be empty");
        }
        if (requestCodec == null || responseCodec == null) {
            throw new IllegalArgumentException("endpoint codecs cannot be null: " + name);
        }
    }

    public static <Q, R> EndpointSchema<Q, R> json(String name, Class<Q> requestType, Class<R> responseType) {
        return new EndpointSchema<>(name, JsonPayloadCodec.of(requestType), JsonPayloadCodec.of(responseType));
    }
}
