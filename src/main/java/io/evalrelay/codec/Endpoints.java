package io.evalrelay.codec;

public final class Endpoints {
    public static final EndpointSchema<PredictRequest, PredictResponse> PREDICT =
            EndpointSchema.json("predict", PredictRequest.class, PredictResponse.class);

    private Endpoints() {
    }

    public static EndpointRegistry defaultRegistry() {
        return new EndpointRegistry().register(PREDICT);
    }
}
