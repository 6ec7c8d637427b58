package io.evalrelay.codec;

/**
 * Structured failure carried as data inside an error envelope.
 */
public record ErrorPayload(
        String type,
        String message,
        String detail
) {
    public static final String HANDLER_FAILURE = "HandlerFailure";
    public static final String UNKNOWN_ENDPOINT = "UnknownEndpoint";
    public static final String CORRUPT_ENVELOPE = "CorruptEnvelope";
    public static final String CANCELLED = "Cancelled";

    static final PayloadCodec<ErrorPayload> CODEC = JsonPayloadCodec.of(ErrorPayload.class);

    public static ErrorPayload handlerFailure(Throwable failure) {
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        return new ErrorPayload(HANDLER_FAILURE, message, failure.getClass().getName());
    }

    public static ErrorPayload of(String type, String message) {
        return new ErrorPayload(type, message == null ? "" : message, null);
    }
}
