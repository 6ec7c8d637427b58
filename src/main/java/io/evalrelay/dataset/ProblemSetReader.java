package io.evalrelay.dataset;

import io.evalrelay.model.Problem;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads problem sets ({@code id,problem}) and reference sets ({@code id,problem,answer}).
 */
public final class ProblemSetReader {
    private ProblemSetReader() {
    }

    public static List<Problem> read(Path file) {
        List<Problem> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int line = 1;
        for (Map<String, String> row : Csvs.readRows(file, List.of("id", "problem"))) {
            line++;
            String id = requireId(row, file, line, seen);
            problems.add(new Problem(id, nullToEmpty(row.get("problem"))));
        }
        return List.copyOf(problems);
    }

    public static List<ReferenceProblem> readReference(Path file) {
        List<ReferenceProblem> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int line = 1;
        for (Map<String, String> row : Csvs.readRows(file, List.of("id", "problem", "answer"))) {
            line++;
            String id = requireId(row, file, line, seen);
            String rawAnswer = nullToEmpty(row.get("answer")).trim();
            long answer;
            try {
                answer = Long.parseLong(rawAnswer);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Reference answer for " + id + " is not an integer: '" + rawAnswer + "' (" + file + ")", e
                );
            }
            problems.add(new ReferenceProblem(id, nullToEmpty(row.get("problem")), answer));
        }
        return List.copyOf(problems);
    }

    private static String requireId(Map<String, String> row, Path file, int line, Set<String> seen) {
        String id = nullToEmpty(row.get("id")).trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Empty problem id in " + file + " at row " + line);
        }
        if (!seen.add(id)) {
            throw new IllegalArgumentException("Duplicate problem id '" + id + "' in " + file);
        }
        return id;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
