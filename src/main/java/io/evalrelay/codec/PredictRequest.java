package io.evalrelay.codec;

public record PredictRequest(
        String id,
        String problem
) {
}
