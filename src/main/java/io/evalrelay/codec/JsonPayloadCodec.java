package io.evalrelay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.evalrelay.util.Jsons;

import java.io.IOException;

public final class JsonPayloadCodec<T> implements PayloadCodec<T> {
    private final Class<T> type;

    public JsonPayloadCodec(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("payload type cannot be null");
        }
        this.type = type;
    }

    public static <T> JsonPayloadCodec<T> of(Class<T> type) {
        return new JsonPayloadCodec<>(type);
    }

    @Override
    public byte[] encode(T value) {
        try {
            return Jsons.compactMapper().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode payload as " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptEnvelopeException("empty payload for " + type.getSimpleName());
        }
        try {
            T value = Jsons.compactMapper().readValue(bytes, type);
            if (value == null) {
                throw new CorruptEnvelopeException("null payload for " + type.getSimpleName());
            }
            return value;
        } catch (IOException e) {
            throw new CorruptEnvelopeException("payload is not a valid " + type.getSimpleName(), e);
        }
    }
}
