package io.evalrelay.dataset;

import io.evalrelay.gateway.Answers;
import io.evalrelay.model.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Local debug evaluation: runs a predictor over reference problems in-process and scores it.
 */
public final class ReferenceScorer {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceScorer.class);

    private ReferenceScorer() {
    }

    public static ScoreReport score(List<ReferenceProblem> reference, Predictor predictor) {
        List<ScoredProblem> rows = new ArrayList<>();
        int correct = 0;
        for (ReferenceProblem item : reference) {
            long startedNanos = System.nanoTime();
            int predicted = Answers.DEFAULT_ANSWER;
            String error = null;
            try {
                predicted = Answers.clamp(predictor.predict(item.toProblem()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("local evaluation interrupted at " + item.id(), e);
            } catch (Exception e) {
                error = e.getClass().getSimpleName() + ": " + e.getMessage();
                LOG.warn("Predictor failed on reference problem {}: {}", item.id(), error);
            }
            long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000L;
            boolean ok = error == null && predicted == item.answer();
            if (ok) {
                correct++;
            }
            rows.add(new ScoredProblem(item.id(), predicted, item.answer(), ok, elapsedMs, error));
        }
        int total = reference.size();
        double percent = total == 0 ? 0.0d : (100.0d * correct) / total;
        return new ScoreReport(correct, total, percent, rows);
    }

    @FunctionalInterface
    public interface Predictor {
        long predict(Problem problem) throws Exception;
    }

    public record ScoredProblem(String id, int predicted, long expected, boolean correct, long elapsedMs, String error) {
    }

    public record ScoreReport(int correct, int total, double percent, List<ScoredProblem> problems) {
    }
}
