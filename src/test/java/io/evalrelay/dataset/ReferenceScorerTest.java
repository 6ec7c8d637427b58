package io.evalrelay.dataset;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ReferenceScorerTest {

    @Test
    void scoresClampedPredictionsAndKeepsGoingAfterFailures() {
        List<ReferenceProblem> reference = List.of(
                new ReferenceProblem("r1", "2+2", 4L),
                new ReferenceProblem("r2", "boom", 1L),
                new ReferenceProblem("r3", "huge", 99_999L),
                new ReferenceProblem("r4", "miss", 5L)
        );

        ReferenceScorer.ScoreReport report = ReferenceScorer.score(reference, problem -> {
            switch (problem.statement()) {
                case "2+2":
                    return 4L;
                case "boom":
                    throw new IllegalStateException("solver crashed");
                case "huge":
                    return 250_000L;
                default:
                    return 6L;
            }
        });

        Assertions.assertEquals(2, report.correct());
        Assertions.assertEquals(4, report.total());
        Assertions.assertEquals(50.0d, report.percent(), 1e-9);
        ReferenceScorer.ScoredProblem crashed = report.problems().get(1);
        Assertions.assertFalse(crashed.correct());
        Assertions.assertEquals(0, crashed.predicted());
        Assertions.assertTrue(crashed.error().contains("solver crashed"));
        Assertions.assertEquals(99_999, report.problems().get(2).predicted());
    }

    @Test
    void emptyReferenceScoresZero() {
        ReferenceScorer.ScoreReport report = ReferenceScorer.score(List.of(), problem -> 1L);

        Assertions.assertEquals(0, report.total());
        Assertions.assertEquals(0.0d, report.percent());
    }
}
