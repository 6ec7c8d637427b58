package io.evalrelay;

import io.evalrelay.cli.EvalRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EvalRelayCommand()).execute(args);
        System.exit(code);
    }
}
