package io.evalrelay.codec;

/**
 * Endpoint-specific (de)serialization of one payload shape.
 */
public interface PayloadCodec<T> {
    byte[] encode(T value);

    T decode(byte[] bytes) throws CorruptEnvelopeException;
}
