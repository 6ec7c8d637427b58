package io.evalrelay.dataset;

import io.evalrelay.model.Problem;
import io.evalrelay.support.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class SubmissionValidatorTest {
    private static final List<Problem> PROBLEMS = List.of(new Problem("p1", "a"), new Problem("p2", "b"));

    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("evalrelay-validate-");
    }

    @AfterEach
    void tearDown() throws Exception {
        TempDirs.deleteRecursively(root);
    }

    @Test
    void acceptsOneInRangeRowPerProblem() throws Exception {
        Path submission = root.resolve("submission.csv");
        Files.writeString(submission, "id,answer\np2,99999\np1,0\n");

        SubmissionValidator.ValidationReport report = SubmissionValidator.validate(PROBLEMS, submission);

        Assertions.assertTrue(report.valid(), report.errors().toString());
        Assertions.assertEquals(2, report.rows());
        Assertions.assertEquals(2, report.expectedRows());
    }

    @Test
    void reportsEveryKindOfMismatch() throws Exception {
        Path submission = root.resolve("submission.csv");
        Files.writeString(submission, "id,answer\np1,100000\np1,3\nzz,1\n");

        SubmissionValidator.ValidationReport report = SubmissionValidator.validate(PROBLEMS, submission);

        Assertions.assertFalse(report.valid());
        String errors = String.join("\n", report.errors());
        Assertions.assertTrue(errors.contains("outside"), errors);
        Assertions.assertTrue(errors.contains("duplicate id p1"), errors);
        Assertions.assertTrue(errors.contains("unknown id zz"), errors);
        Assertions.assertTrue(errors.contains("missing row for id p2"), errors);
    }

    @Test
    void missingFileOrHeaderIsInvalid() throws Exception {
        Assertions.assertFalse(SubmissionValidator.validate(PROBLEMS, root.resolve("absent.csv")).valid());

        Path wrongHeader = root.resolve("wrong.csv");
        Files.writeString(wrongHeader, "id,prediction\np1,1\np2,2\n");
        Assertions.assertFalse(SubmissionValidator.validate(PROBLEMS, wrongHeader).valid());
    }
}
