package io.evalrelay.dataset;

import io.evalrelay.model.Problem;

public record ReferenceProblem(
        String id,
        String problem,
        long answer
) {
    public Problem toProblem() {
        return new Problem(id, problem);
    }
}
