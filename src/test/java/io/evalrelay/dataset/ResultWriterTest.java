package io.evalrelay.dataset;

import io.evalrelay.model.ResultRow;
import io.evalrelay.support.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ResultWriterTest {
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("evalrelay-results-");
    }

    @AfterEach
    void tearDown() throws Exception {
        TempDirs.deleteRecursively(root);
    }

    @Test
    void writesHeaderAndRowsAndLeavesNoPartialFile() throws Exception {
        ResultWriter writer = new ResultWriter();
        Path target = root.resolve("out").resolve("submission.csv");

        Path written = writer.write(target, List.of(new ResultRow("p1", 4), new ResultRow("p2", 0)));

        Assertions.assertEquals(target.toAbsolutePath().normalize(), written);
        Assertions.assertEquals(List.of("id,answer", "p1,4", "p2,0"), Files.readAllLines(written));
        Assertions.assertFalse(Files.exists(ResultWriter.partialFile(written)));
    }

    @Test
    void rewriteReplacesThePreviousFile() throws Exception {
        ResultWriter writer = new ResultWriter();
        Path target = root.resolve("submission.csv");
        writer.write(target, List.of(new ResultRow("old", 1)));

        writer.write(target, List.of(new ResultRow("new", 2)));

        Assertions.assertEquals(List.of("id,answer", "new,2"), Files.readAllLines(target));
    }

    @Test
    void discardRemovesFinalAndPartialFiles() throws Exception {
        ResultWriter writer = new ResultWriter();
        Path target = root.resolve("submission.csv");
        Files.writeString(target, "id,answer\n");
        Files.writeString(ResultWriter.partialFile(target.toAbsolutePath()), "id,answer\np1,");

        Assertions.assertTrue(writer.discard(target));
        Assertions.assertFalse(Files.exists(target));
        Assertions.assertFalse(Files.exists(ResultWriter.partialFile(target.toAbsolutePath())));
        Assertions.assertFalse(writer.discard(target));
    }
}
