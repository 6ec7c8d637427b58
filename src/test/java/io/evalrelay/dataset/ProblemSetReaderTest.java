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

final class ProblemSetReaderTest {
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("evalrelay-problems-");
    }

    @AfterEach
    void tearDown() throws Exception {
        TempDirs.deleteRecursively(root);
    }

    @Test
    void readsQuotedMultilineStatements() throws Exception {
        Path file = root.resolve("test.csv");
        Files.writeString(file, "id,problem\n"
                + "a1,\"Compute 2+2, then stop.\"\n"
                + "b2,\"Line one\nLine two\"\n");

        List<Problem> problems = ProblemSetReader.read(file);

        Assertions.assertEquals(List.of(
                new Problem("a1", "Compute 2+2, then stop."),
                new Problem("b2", "Line one\nLine two")
        ), problems);
    }

    @Test
    void readsReferenceAnswers() throws Exception {
        Path file = root.resolve("reference.csv");
        Files.writeString(file, "id,problem,answer\nr1,one plus one,2\nr2,big,123456\n");

        List<ReferenceProblem> reference = ProblemSetReader.readReference(file);

        Assertions.assertEquals(2, reference.size());
        Assertions.assertEquals(2L, reference.get(0).answer());
        Assertions.assertEquals(new Problem("r2", "big"), reference.get(1).toProblem());
    }

    @Test
    void rejectsBrokenProblemSets() throws Exception {
        Path duplicate = root.resolve("duplicate.csv");
        Files.writeString(duplicate, "id,problem\nx,a\nx,b\n");
        Path missingColumn = root.resolve("missing.csv");
        Files.writeString(missingColumn, "id,question\nx,a\n");
        Path blankId = root.resolve("blank.csv");
        Files.writeString(blankId, "id,problem\n ,a\n");
        Path badAnswer = root.resolve("bad-answer.csv");
        Files.writeString(badAnswer, "id,problem,answer\nx,a,seven\n");

        Assertions.assertThrows(IllegalArgumentException.class, () -> ProblemSetReader.read(duplicate));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ProblemSetReader.read(missingColumn));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ProblemSetReader.read(blankId));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ProblemSetReader.readReference(badAnswer));
    }
}
