package io.evalrelay.dataset;

import io.evalrelay.gateway.Answers;
import io.evalrelay.model.Problem;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a result file against the problem set it claims to answer.
 */
public final class SubmissionValidator {
    private static final int MAX_REPORTED_ERRORS = 50;

    private SubmissionValidator() {
    }

    public static ValidationReport validate(List<Problem> problems, Path submission) {
        List<String> errors = new ArrayList<>();
        if (!Files.isRegularFile(submission)) {
            errors.add("submission file not found: " + submission);
            return new ValidationReport(false, 0, problems.size(), errors);
        }
        List<Map<String, String>> rows;
        try {
            rows = Csvs.readRows(submission, List.of("id", "answer"));
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return new ValidationReport(false, 0, problems.size(), errors);
        }

        Set<String> expected = new LinkedHashSet<>();
        for (Problem problem : problems) {
            expected.add(problem.id());
        }
        Set<String> seen = new HashSet<>();
        int row = 1;
        for (Map<String, String> values : rows) {
            row++;
            String id = values.get("id") == null ? "" : values.get("id").trim();
            String rawAnswer = values.get("answer") == null ? "" : values.get("answer").trim();
            if (id.isEmpty()) {
                report(errors, "row " + row + ": missing id");
                continue;
            }
            if (!seen.add(id)) {
                report(errors, "row " + row + ": duplicate id " + id);
            }
            if (!expected.contains(id)) {
                report(errors, "row " + row + ": unknown id " + id);
            }
            if (rawAnswer.isEmpty()) {
                report(errors, "row " + row + ": missing answer for " + id);
                continue;
            }
            long answer;
            try {
                answer = Long.parseLong(rawAnswer);
            } catch (NumberFormatException e) {
                report(errors, "row " + row + ": answer for " + id + " is not an integer: " + rawAnswer);
                continue;
            }
            if (answer < Answers.MIN_ANSWER || answer > Answers.MAX_ANSWER) {
                report(errors, "row " + row + ": answer for " + id + " outside ["
                        + Answers.MIN_ANSWER + ", " + Answers.MAX_ANSWER + "]: " + answer);
            }
        }
        for (String id : expected) {
            if (!seen.contains(id)) {
                report(errors, "missing row for id " + id);
            }
        }
        return new ValidationReport(errors.isEmpty(), rows.size(), problems.size(), errors);
    }

    private static void report(List<String> errors, String message) {
        if (errors.size() < MAX_REPORTED_ERRORS) {
            errors.add(message);
        }
    }

    public record ValidationReport(boolean valid, int rows, int expectedRows, List<String> errors) {
    }
}
