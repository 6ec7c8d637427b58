package io.evalrelay.cli;

import io.evalrelay.solver.Solver;
import io.evalrelay.solver.Solvers;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

final class SolverOptions {
    @Option(names = {"--solver"}, defaultValue = "constant", description = "Solver: constant|script|reference")
    String solver;

    @Option(names = {"--constant-answer"}, defaultValue = "0", description = "Answer returned by the constant solver")
    long constantAnswer;

    @Option(names = {"--command"}, split = ",", description = "Script solver command, comma separated (e.g. python3,solve.py)")
    List<String> command;

    @Option(names = {"--script-timeout-ms"}, defaultValue = "300000", description = "Per-problem timeout of the script solver")
    long scriptTimeoutMs;

    @Option(names = {"--answers"}, description = "Reference CSV (id,problem,answer) backing the reference solver")
    Path answers;

    Solver<?> create() {
        return Solvers.create(solver, constantAnswer, command, scriptTimeoutMs, answers);
    }
}
