package io.evalrelay.solver;

import io.evalrelay.model.Problem;

/**
 * Answers every problem with the same value. With the default of 0 this is the
 * placeholder submission.
 */
public final class ConstantSolver implements Solver<Long> {
    private final long answer;

    public ConstantSolver() {
        this(0L);
    }

    public ConstantSolver(long answer) {
        this.answer = answer;
    }

    @Override
    public Long initialize() {
        return answer;
    }

    @Override
    public long predict(Long model, Problem problem) {
        return model;
    }
}
