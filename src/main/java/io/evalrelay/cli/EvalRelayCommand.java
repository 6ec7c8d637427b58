package io.evalrelay.cli;

import io.evalrelay.codec.EnvelopeCodec;
import io.evalrelay.codec.Endpoints;
import io.evalrelay.config.EvalRelayConfig;
import io.evalrelay.config.RelaySettings;
import io.evalrelay.dataset.ProblemSetReader;
import io.evalrelay.dataset.ReferenceScorer;
import io.evalrelay.dataset.ResultWriter;
import io.evalrelay.dataset.SubmissionValidator;
import io.evalrelay.gateway.Gateway;
import io.evalrelay.gateway.GatewayOutcome;
import io.evalrelay.gateway.OrderingPolicy;
import io.evalrelay.model.CallStatus;
import io.evalrelay.model.OrderingMode;
import io.evalrelay.model.Problem;
import io.evalrelay.relay.RelayAddress;
import io.evalrelay.relay.RelayChannel;
import io.evalrelay.relay.RelayListener;
import io.evalrelay.responder.Responder;
import io.evalrelay.solver.InferenceServer;
import io.evalrelay.storage.CallRecordStore;
import io.evalrelay.storage.Database;
import io.evalrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

@Command(
        name = "evalrelay",
        mixinStandardHelpOptions = true,
        description = "Evaluation relay between a problem gateway and a solver responder",
        subcommands = {
                EvalRelayCommand.ServeCommand.class,
                EvalRelayCommand.GatewayCommand.class,
                EvalRelayCommand.LocalEvalCommand.class,
                EvalRelayCommand.ValidateCommand.class,
                EvalRelayCommand.RunsCommand.class,
                EvalRelayCommand.RecordsCommand.class
        }
)
public final class EvalRelayCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(EvalRelayCommand.class);

    @Option(names = {"--root"}, description = "Data root (run ledger, settings)", defaultValue = "data")
    String root;

    @Option(names = {"--address"}, description = "Relay address: unix:<path> or host:port (default: $"
            + EvalRelayConfig.ENV_ADDRESS + " or " + EvalRelayConfig.DEFAULT_ADDRESS + ")")
    String address;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | gateway | local-eval | validate | runs | records");
    }

    EvalRelayConfig config() {
        return EvalRelayConfig.fromRoot(root, address);
    }

    CallRecordStore ledger() {
        Database database = new Database(config());
        database.init();
        return new CallRecordStore(database);
    }

    static ReferenceScorer.ScoreReport evaluateLocally(InferenceServer<?> server, Path reference) {
        return ReferenceScorer.score(ProblemSetReader.readReference(reference), server::predictLocal);
    }

    @Command(name = "serve", description = "Start the solver responder; off a scored run, evaluate against a reference set instead")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        EvalRelayCommand parent;

        @Mixin
        SolverOptions solverOptions;

        @Option(names = {"--reference"}, description = "Reference CSV (id,problem,answer) for the local debug run")
        Path reference;

        @Option(names = {"--force-serve"}, defaultValue = "false",
                description = "Serve even when $" + EvalRelayConfig.ENV_SCORED_RUN + " is not set")
        boolean forceServe;

        @Option(names = {"--sessions"}, defaultValue = "1",
                description = "Gateway sessions to serve before exiting; 0 serves until killed")
        int sessions;

        @Override
        public Integer call() throws Exception {
            EvalRelayConfig config = parent.config();
            try (InferenceServer<?> server = InferenceServer.start(solverOptions.create())) {
                if (!config.scoredRun() && !forceServe) {
                    if (reference == null) {
                        System.err.println("Not a scored run ($" + EvalRelayConfig.ENV_SCORED_RUN
                                + " unset): pass --reference for a local evaluation or --force-serve to start the responder");
                        return 2;
                    }
                    LOG.info("Local debug run against {}", reference);
                    System.out.println(Jsons.toJson(evaluateLocally(server, reference)));
                    return 0;
                }
                RelaySettings settings = config.loadSettings();
                try (RelayListener listener = RelayListener.bind(
                        config.relayAddress(), server.responder().codec(), settings.maxFrameBytes())) {
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        server.responder().stop();
                        try {
                            listener.close();
                        } catch (IOException e) {
                            LOG.debug("Listener close on shutdown failed: {}", e.getMessage());
                        }
                    }, "evalrelay-shutdown-hook"));
                    int served = 0;
                    while (sessions <= 0 || served < sessions) {
                        Responder.ServeOutcome outcome;
                        try {
                            outcome = server.serve(listener);
                        } catch (ClosedChannelException e) {
                            LOG.info("Relay listener closed, stopping");
                            break;
                        }
                        served++;
                        System.out.println(Jsons.toJson(outcome));
                    }
                }
                return 0;
            }
        }
    }

    @Command(name = "gateway", description = "Feed a problem set to the responder and write the result file")
    static final class GatewayCommand implements Callable<Integer> {
        @ParentCommand
        EvalRelayCommand parent;

        @Option(names = {"--problems"}, required = true, description = "Problem CSV (id,problem)")
        Path problems;

        @Option(names = {"--out"}, defaultValue = "submission.csv", description = "Result CSV (id,answer)")
        Path out;

        @Option(names = {"--ordering"}, description = "Evaluation order: random|fixed (default from settings)")
        String ordering;

        @Option(names = {"--seed"}, description = "Committed seed for fixed ordering")
        Long seed;

        @Option(names = {"--deadline-ms"}, description = "Per-problem deadline in ms")
        Long deadlineMs;

        @Option(names = {"--grace-ms"}, description = "How long to keep retrying the initial connection")
        Long graceMs;

        @Option(names = {"--run-id"}, description = "Run id (default: random)")
        String runId;

        @Override
        public Integer call() {
            EvalRelayConfig config = parent.config();
            RelaySettings settings = config.loadSettings();
            if (deadlineMs != null) {
                settings = settings.withCallDeadlineMs(deadlineMs);
            }
            if (graceMs != null) {
                settings = settings.withStartupGraceMs(graceMs);
            }
            if (ordering != null || seed != null) {
                OrderingMode mode = ordering == null ? settings.orderingMode() : OrderingMode.fromString(ordering);
                settings = settings.withOrdering(mode, seed == null ? settings.orderSeed() : seed);
            }
            List<Problem> problemSet = ProblemSetReader.read(problems);
            RelayAddress relayAddress = config.relayAddress();
            EnvelopeCodec codec = new EnvelopeCodec(Endpoints.defaultRegistry());
            RelaySettings effective = settings;
            Gateway gateway = new Gateway(
                    () -> RelayChannel.connect(relayAddress, effective.backoffPolicy(), codec, effective.maxFrameBytes()),
                    effective.callDeadline(),
                    OrderingPolicy.of(effective.orderingMode(), effective.orderSeed()),
                    new ResultWriter(),
                    parent.ledger(),
                    relayAddress.toString()
            );
            String id = runId == null || runId.isBlank() ? "run-" + UUID.randomUUID() : runId.trim();
            GatewayOutcome outcome = gateway.run(id, problemSet, out);
            System.out.println(Jsons.toJson(new GatewaySummary(
                    outcome.runId(),
                    outcome.state().name(),
                    outcome.orderingMode().label(),
                    problemSet.size(),
                    outcome.statusCounts(),
                    outcome.resultFile(),
                    outcome.error(),
                    Instant.now().toString()
            )));
            return outcome.exitCode();
        }
    }

    @Command(name = "local-eval", description = "Run a solver in-process over a reference set and score it")
    static final class LocalEvalCommand implements Callable<Integer> {
        @Mixin
        SolverOptions solverOptions;

        @Option(names = {"--reference"}, required = true, description = "Reference CSV (id,problem,answer)")
        Path reference;

        @Override
        public Integer call() throws Exception {
            try (InferenceServer<?> server = InferenceServer.start(solverOptions.create())) {
                System.out.println(Jsons.toJson(evaluateLocally(server, reference)));
            }
            return 0;
        }
    }

    @Command(name = "validate", description = "Check a result file against its problem set")
    static final class ValidateCommand implements Callable<Integer> {
        @Option(names = {"--problems"}, required = true, description = "Problem CSV (id,problem)")
        Path problems;

        @Option(names = {"--submission"}, required = true, description = "Result CSV (id,answer)")
        Path submission;

        @Override
        public Integer call() {
            SubmissionValidator.ValidationReport report =
                    SubmissionValidator.validate(ProblemSetReader.read(problems), submission);
            System.out.println(Jsons.toJson(report));
            return report.valid() ? 0 : 1;
        }
    }

    @Command(name = "runs", description = "List recent gateway runs")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        EvalRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max runs")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.ledger().listRuns(limit)));
            return 0;
        }
    }

    @Command(name = "records", description = "Show the call records of one run")
    static final class RecordsCommand implements Callable<Integer> {
        @ParentCommand
        EvalRelayCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            CallRecordStore ledger = parent.ledger();
            Optional<CallRecordStore.RunSummary> run = ledger.findRun(runId);
            if (run.isEmpty()) {
                System.out.println("{\"error\":\"run not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(Map.of("run", run.get(), "records", ledger.listRecords(runId))));
            return 0;
        }
    }

    record GatewaySummary(
            String runId,
            String state,
            String ordering,
            int problems,
            Map<CallStatus, Long> statusCounts,
            String resultFile,
            String error,
            String finishedAt
    ) {
    }
}
