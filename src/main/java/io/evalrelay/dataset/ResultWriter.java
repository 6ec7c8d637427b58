package io.evalrelay.dataset;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.evalrelay.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the {@code id,answer} result file.
 *
 * <p>Rows go to a {@code .partial} sibling first and are moved into place only when complete,
 * so a reader never sees a half-written result file under the final name.
 */
public final class ResultWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);
    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("id")
            .addColumn("answer", CsvSchema.ColumnType.NUMBER)
            .build()
            .withHeader();

    public Path write(Path file, List<ResultRow> rows) {
        Path target = file.toAbsolutePath().normalize();
        Path partial = partialFile(target);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
                Csvs.mapper().writerFor(ResultRow.class).with(SCHEMA).writeValues(writer).writeAll(rows).close();
            }
            try {
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            deleteIfExists(partial);
            throw new RuntimeException("Failed to write results: " + target, e);
        }
    }

    /**
     * Removes a result file left by an earlier run so a failed run cannot be mistaken for a finished one.
     */
    public boolean discard(Path file) {
        Path target = file.toAbsolutePath().normalize();
        try {
            Files.deleteIfExists(partialFile(target));
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove stale results: " + target, e);
        }
    }

    static Path partialFile(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".partial");
    }

    private static void deleteIfExists(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not remove partial result file {}: {}", file, e.getMessage());
        }
    }
}
