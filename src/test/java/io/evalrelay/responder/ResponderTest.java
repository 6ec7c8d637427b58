package io.evalrelay.responder;

import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.codec.Endpoints;
import io.evalrelay.codec.ErrorPayload;
import io.evalrelay.codec.PredictRequest;
import io.evalrelay.codec.PredictResponse;
import io.evalrelay.model.Envelope;
import io.evalrelay.model.EnvelopeKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

final class ResponderTest {
    private final EnvelopeCodec codec = new EnvelopeCodec(Endpoints.defaultRegistry());

    @Test
    void dispatchAnswersThroughTheBoundHandler() {
        try (Responder responder = new Responder(predictReturning(12L), List.of("predict"))) {
            Envelope reply = responder.dispatch(codec.request("c1", Endpoints.PREDICT, new PredictRequest("p1", "x")));

            Assertions.assertEquals(EnvelopeKind.RESPONSE, reply.kind());
            Assertions.assertEquals("c1", reply.callId());
            Assertions.assertEquals(12L, codec.readResponse(reply, Endpoints.PREDICT).answer());
            Assertions.assertEquals(1L, responder.outcome().served());
        }
    }

    @Test
    void unknownEndpointBecomesAnErrorEnvelope() {
        try (Responder responder = new Responder(predictReturning(1L), List.of())) {
            Envelope reply = responder.dispatch(new Envelope("c2", "summarize", EnvelopeKind.REQUEST, utf8("{}")));

            Assertions.assertTrue(reply.isError());
            Assertions.assertEquals(ErrorPayload.UNKNOWN_ENDPOINT, codec.readError(reply).type());
            Assertions.assertEquals("summarize", reply.endpoint());
        }
    }

    @Test
    void undecodableRequestBecomesCorruptEnvelopeError() {
        try (Responder responder = new Responder(predictReturning(1L), List.of())) {
            Envelope reply = responder.dispatch(new Envelope("c3", "predict", EnvelopeKind.REQUEST, utf8("\"just a string\"")));

            Assertions.assertEquals(ErrorPayload.CORRUPT_ENVELOPE, codec.readError(reply).type());
            Assertions.assertEquals(1L, responder.outcome().failed());
        }
    }

    @Test
    void handlerExceptionsAndNullResultsAreReportedNotThrown() {
        HandlerRegistry throwing = new HandlerRegistry()
                .register(Endpoints.PREDICT, request -> {
                    throw new ArithmeticException("division by zero");
                });
        HandlerRegistry silent = new HandlerRegistry()
                .register(Endpoints.PREDICT, request -> null);
        try (Responder first = new Responder(throwing, List.of());
             Responder second = new Responder(silent, List.of())) {
            ErrorPayload error = codec.readError(first.dispatch(request("c4")));
            Assertions.assertEquals(ErrorPayload.HANDLER_FAILURE, error.type());
            Assertions.assertEquals("division by zero", error.message());
            Assertions.assertEquals(ArithmeticException.class.getName(), error.detail());

            Assertions.assertEquals(ErrorPayload.HANDLER_FAILURE, codec.readError(second.dispatch(request("c5"))).type());
        }
    }

    @Test
    void refusesToStartWithoutRequiredEndpoints() {
        IllegalStateException error = Assertions.assertThrows(IllegalStateException.class,
                () -> new Responder(new HandlerRegistry(), List.of("predict")));
        Assertions.assertTrue(error.getMessage().contains("predict"));
    }

    @Test
    void registryRejectsSecondHandlerForAnEndpoint() {
        HandlerRegistry handlers = predictReturning(3L);

        Assertions.assertThrows(IllegalStateException.class,
                () -> handlers.register(Endpoints.PREDICT, request -> new PredictResponse(4L)));
        Assertions.assertEquals(List.of("predict"), List.copyOf(handlers.listEndpoints()));
        Assertions.assertTrue(handlers.schemas().find("predict").isPresent());
    }

    @Test
    void invokeLocalSkipsTheRelay() throws Exception {
        try (Responder responder = new Responder(predictReturning(77L), List.of("predict"))) {
            Assertions.assertEquals(77L, responder.invokeLocal(Endpoints.PREDICT, new PredictRequest("p1", "x")).answer());
        }
    }

    private Envelope request(String callId) {
        return codec.request(callId, Endpoints.PREDICT, new PredictRequest("p1", "x"));
    }

    private static HandlerRegistry predictReturning(long answer) {
        return new HandlerRegistry().register(Endpoints.PREDICT, request -> new PredictResponse(answer));
    }

    private static byte[] utf8(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8);
    }
}
