package io.evalrelay.solver;

import io.evalrelay.dataset.ProblemSetReader;
import io.evalrelay.dataset.ReferenceProblem;
import io.evalrelay.model.Problem;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Answers from a reference CSV keyed by problem text. Useful to dry-run the harness end to end.
 */
public final class ReferenceLookupSolver implements Solver<Map<String, Long>> {
    private final Path referenceFile;

    public ReferenceLookupSolver(Path referenceFile) {
        if (referenceFile == null) {
            throw new IllegalArgumentException("reference file is required for the reference solver");
        }
        this.referenceFile = referenceFile;
    }

    @Override
    public Map<String, Long> initialize() {
        Map<String, Long> answers = new HashMap<>();
        for (ReferenceProblem item : ProblemSetReader.readReference(referenceFile)) {
            answers.put(normalize(item.problem()), item.answer());
        }
        return Map.copyOf(answers);
    }

    @Override
    public long predict(Map<String, Long> model, Problem problem) {
        Long answer = model.get(normalize(problem.statement()));
        if (answer == null) {
            throw new IllegalArgumentException("no reference answer for problem " + problem.id());
        }
        return answer;
    }

    private static String normalize(String statement) {
        return statement == null ? "" : statement.strip().replace("\r\n", "\n");
    }
}
