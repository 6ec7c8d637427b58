package io.evalrelay.solver;

import io.evalrelay.codec.Endpoints;
import io.evalrelay.codec.PredictRequest;
import io.evalrelay.codec.PredictResponse;
import io.evalrelay.model.Problem;
import io.evalrelay.relay.RelayListener;
import io.evalrelay.responder.HandlerRegistry;
import io.evalrelay.responder.Responder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Responder preconfigured with the {@code predict} endpoint backed by a {@link Solver}.
 */
public final class InferenceServer<M> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(InferenceServer.class);

    private final Solver<M> solver;
    private final M model;
    private final Responder responder;

    private InferenceServer(Solver<M> solver, M model) {
        this.solver = solver;
        this.model = model;
        HandlerRegistry handlers = new HandlerRegistry()
                .register(Endpoints.PREDICT, this::handlePredict);
        this.responder = new Responder(handlers, List.of(Endpoints.PREDICT.name()));
    }

    /**
     * Initializes the solver once and wires it to the {@code predict} endpoint.
     */
    public static <M> InferenceServer<M> start(Solver<M> solver) throws Exception {
        long startedNanos = System.nanoTime();
        M model = solver.initialize();
        if (model == null) {
            throw new IllegalStateException("solver " + solver.name() + " initialized to null");
        }
        LOG.info("Solver {} initialized in {} ms", solver.name(), (System.nanoTime() - startedNanos) / 1_000_000L);
        return new InferenceServer<>(solver, model);
    }

    public M model() {
        return model;
    }

    public Responder responder() {
        return responder;
    }

    public Responder.ServeOutcome serve(RelayListener listener) throws IOException {
        return responder.serve(listener);
    }

    public long predictLocal(Problem problem) throws Exception {
        return responder.invokeLocal(Endpoints.PREDICT, new PredictRequest(problem.id(), problem.statement())).answer();
    }

    @Override
    public void close() {
        responder.close();
    }

    private PredictResponse handlePredict(PredictRequest request) throws Exception {
        if (request.problem() == null) {
            throw new IllegalArgumentException("predict request without problem text: " + request.id());
        }
        long answer = solver.predict(model, new Problem(request.id(), request.problem()));
        return new PredictResponse(answer);
    }
}
