package io.evalrelay.solver;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public final class Solvers {
    public static final String CONSTANT = "constant";
    public static final String SCRIPT = "script";
    public static final String REFERENCE = "reference";

    private Solvers() {
    }

    public static Solver<?> create(String kind, long constantAnswer, List<String> command, long scriptTimeoutMs, Path referenceFile) {
        String normalized = kind == null || kind.isBlank() ? CONSTANT : kind.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case CONSTANT -> new ConstantSolver(constantAnswer);
            case SCRIPT -> new ScriptSolver(command, scriptTimeoutMs);
            case REFERENCE -> new ReferenceLookupSolver(referenceFile);
            default -> throw new IllegalArgumentException("Unknown solver: " + kind + " (expected constant|script|reference)");
        };
    }
}
