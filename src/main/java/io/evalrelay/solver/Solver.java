package io.evalrelay.solver;

import io.evalrelay.model.Problem;

/**
 * User-supplied solving logic.
 *
 * <p>{@link #initialize()} runs once when the responder starts and returns an immutable handle
 * (loaded weights, lookup tables, a command line). Every {@link #predict} call receives that
 * same handle, so tests can hand in a fake one.
 *
 * @param <M> type of the shared, read-only handle
 */
public interface Solver<M> {
    M initialize() throws Exception;

    long predict(M model, Problem problem) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }
}
