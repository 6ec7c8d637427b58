package io.evalrelay.codec;

public record PredictResponse(
        long answer
) {
}
