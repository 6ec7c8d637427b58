package io.evalrelay.solver;

import io.evalrelay.model.Problem;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs an external command per problem: the statement goes to stdin, the last integer printed
 * on stdout is the answer.
 */
public final class ScriptSolver implements Solver<List<String>> {
    private static final int MAX_ERROR_CHARS = 512;
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final List<String> command;
    private final long timeoutMs;

    public ScriptSolver(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("script solver command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public List<String> initialize() {
        return command;
    }

    @Override
    public String name() {
        return "script:" + command.get(0);
    }

    @Override
    public long predict(List<String> model, Problem problem) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(model));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IllegalStateException("script spawn failed: " + e.getMessage(), e);
        }

        try {
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(problem.statement().getBytes(StandardCharsets.UTF_8));
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = output.get(5, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return parseAnswer(combined);
        } catch (InterruptedException | IOException e) {
            process.destroyForcibly();
            throw e;
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new IllegalStateException("script output unreadable: " + e.getCause().getMessage(), e.getCause());
        }
    }

    static long parseAnswer(String output) {
        Matcher matcher = INTEGER.matcher(output == null ? "" : output);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        if (last == null) {
            throw new IllegalStateException("script printed no integer answer: " + truncate(output));
        }
        try {
            return Long.parseLong(last);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("script answer does not fit a long: " + last, e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("failed reading script output", e);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
