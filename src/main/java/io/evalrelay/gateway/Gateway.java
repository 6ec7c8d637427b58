package io.evalrelay.gateway;

import io.evalrelay.codec.CorruptEnvelopeException;
import io.evalrelay.codec.Endpoints;
import io.evalrelay.codec.PredictRequest;
import io.evalrelay.codec.PredictResponse;
import io.evalrelay.dataset.ResultWriter;
import io.evalrelay.model.CallRecord;
import io.evalrelay.model.CallStatus;
import io.evalrelay.model.GatewayState;
import io.evalrelay.model.Problem;
import io.evalrelay.model.ResultRow;
import io.evalrelay.relay.CallTimeoutException;
import io.evalrelay.relay.ConnectionUnavailableException;
import io.evalrelay.relay.HandlerFailureException;
import io.evalrelay.relay.RelayChannel;
import io.evalrelay.relay.RelayException;
import io.evalrelay.relay.TransportBrokenException;
import io.evalrelay.storage.CallRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives one evaluation run: order the problems, feed them to the responder one at a time,
 * record every outcome, then write exactly one answer per problem in input order.
 *
 * <p>Per-problem failures (handler error, timeout, corrupt reply) are recorded with the default
 * answer and the run moves on. A broken connection stops serving; the problems not yet served
 * are recorded as transport errors and still get a row.
 */
public final class Gateway {
    private static final Logger LOG = LoggerFactory.getLogger(Gateway.class);

    private final RelayConnector connector;
    private final Duration callDeadline;
    private final OrderingPolicy ordering;
    private final ResultWriter writer;
    private final CallRecordStore ledger;
    private final String addressLabel;
    private volatile GatewayState state = GatewayState.INIT;

    public Gateway(
            RelayConnector connector,
            Duration callDeadline,
            OrderingPolicy ordering,
            ResultWriter writer,
            CallRecordStore ledger,
            String addressLabel
    ) {
        if (callDeadline == null || callDeadline.isZero() || callDeadline.isNegative()) {
            throw new IllegalArgumentException("call deadline must be positive");
        }
        this.connector = connector;
        this.callDeadline = callDeadline;
        this.ordering = ordering;
        this.writer = writer;
        this.ledger = ledger;
        this.addressLabel = addressLabel == null ? "" : addressLabel;
    }

    public GatewayState state() {
        return state;
    }

    public GatewayOutcome run(String runId, List<Problem> problems, Path resultFile) {
        transition(runId, GatewayState.INIT);
        requireUniqueIds(problems);
        List<Problem> evaluationOrder = ordering.permute(problems);
        writer.discard(resultFile);
        recordToLedger("start run", () -> ledger.startRun(
                runId, ordering.mode().label(), problems.size(), addressLabel, Instant.now().toEpochMilli()));
        LOG.info("Run {}: {} problem(s), ordering={}, deadline={}", runId, problems.size(), ordering.mode().label(), callDeadline);

        transition(runId, GatewayState.CONNECTING);
        RelayChannel channel;
        try {
            channel = connector.open();
        } catch (ConnectionUnavailableException e) {
            LOG.error("Run {}: responder never became reachable: {}", runId, e.getMessage());
            return fail(runId, List.of(), List.of(), null, e.getMessage());
        }

        Map<String, CallRecord> records = new LinkedHashMap<>();
        try (channel) {
            transition(runId, GatewayState.SERVING);
            TransportBrokenException broken = null;
            int seq = 0;
            for (Problem problem : evaluationOrder) {
                CallRecord record = broken == null
                        ? serve(channel, problem)
                        : notAttempted(problem, broken);
                if (broken == null && record.status() == CallStatus.TRANSPORT_ERROR && !channel.isOpen()) {
                    broken = new TransportBrokenException(record.rawError());
                    LOG.error("Run {}: relay broke at problem {}; remaining problems get the default answer", runId, problem.id());
                }
                records.put(problem.id(), record);
                int position = seq++;
                recordToLedger("append call record", () -> ledger.append(runId, position, record));
            }

            transition(runId, GatewayState.FINALIZING);
        }

        List<CallRecord> recordList = List.copyOf(records.values());
        List<ResultRow> results = new ArrayList<>(problems.size());
        for (Problem problem : problems) {
            CallRecord record = records.get(problem.id());
            int answer = record == null || record.answer() == null ? Answers.DEFAULT_ANSWER : record.answer();
            results.add(new ResultRow(problem.id(), answer));
        }
        Path written;
        try {
            written = writer.write(resultFile, results);
        } catch (RuntimeException e) {
            LOG.error("Run {}: failed to persist results: {}", runId, e.getMessage());
            return fail(runId, recordList, results, null, e.getMessage());
        }

        transition(runId, GatewayState.DONE);
        recordToLedger("finish run", () -> ledger.finishRun(
                runId, GatewayState.DONE, written.toString(), null, Instant.now().toEpochMilli()));
        LOG.info("Run {} done: {} row(s) written to {}", runId, results.size(), written);
        return new GatewayOutcome(runId, GatewayState.DONE, ordering.mode(), recordList, List.copyOf(results), written.toString(), null);
    }

    private CallRecord serve(RelayChannel channel, Problem problem) {
        Instant startedAt = Instant.now();
        Instant deadline = startedAt.plus(callDeadline);
        long startedNanos = System.nanoTime();
        try {
            PredictResponse response = channel.invoke(
                    Endpoints.PREDICT,
                    new PredictRequest(problem.id(), problem.statement()),
                    callDeadline
            );
            int answer = Answers.clamp(response.answer());
            if (answer != response.answer()) {
                LOG.info("Problem {}: answer {} clamped to {}", problem.id(), response.answer(), answer);
            }
            return CallRecord.ok(problem.id(), startedAt, deadline, answer, elapsedMs(startedNanos));
        } catch (HandlerFailureException e) {
            LOG.warn("Problem {}: handler failed: {}", problem.id(), e.getMessage());
            return CallRecord.failed(problem.id(), startedAt, deadline, CallStatus.HANDLER_ERROR, e.getMessage(), elapsedMs(startedNanos));
        } catch (CallTimeoutException e) {
            LOG.warn("Problem {}: no answer within {}", problem.id(), callDeadline);
            return CallRecord.failed(problem.id(), startedAt, deadline, CallStatus.TIMEOUT, e.getMessage(), elapsedMs(startedNanos));
        } catch (CorruptEnvelopeException e) {
            LOG.warn("Problem {}: corrupt reply: {}", problem.id(), e.getMessage());
            return CallRecord.failed(problem.id(), startedAt, deadline, CallStatus.TRANSPORT_ERROR, e.getMessage(), elapsedMs(startedNanos));
        } catch (RelayException e) {
            LOG.warn("Problem {}: relay failure: {}", problem.id(), e.getMessage());
            return CallRecord.failed(problem.id(), startedAt, deadline, CallStatus.TRANSPORT_ERROR, e.getMessage(), elapsedMs(startedNanos));
        }
    }

    private CallRecord notAttempted(Problem problem, TransportBrokenException broken) {
        Instant now = Instant.now();
        return CallRecord.failed(problem.id(), now, now, CallStatus.TRANSPORT_ERROR,
                "not attempted, relay already broken: " + broken.getMessage(), 0L);
    }

    private GatewayOutcome fail(String runId, List<CallRecord> records, List<ResultRow> results, String resultFile, String error) {
        transition(runId, GatewayState.FAILED);
        recordToLedger("finish run", () -> ledger.finishRun(
                runId, GatewayState.FAILED, resultFile, error, Instant.now().toEpochMilli()));
        return new GatewayOutcome(runId, GatewayState.FAILED, ordering.mode(), records, results, resultFile, error);
    }

    private void transition(String runId, GatewayState next) {
        LOG.debug("Run {}: {} -> {}", runId, state, next);
        state = next;
        if (next != GatewayState.INIT && next != GatewayState.DONE && next != GatewayState.FAILED) {
            recordToLedger("mark state", () -> ledger.markState(runId, next));
        }
    }

    private void recordToLedger(String action, Runnable write) {
        if (ledger == null) {
            return;
        }
        try {
            write.run();
        } catch (RuntimeException e) {
            // The ledger is diagnostics only; answers and the result file do not depend on it.
            LOG.warn("Run ledger: {} failed: {}", action, e.getMessage());
        }
    }

    private static void requireUniqueIds(List<Problem> problems) {
        Set<String> seen = new HashSet<>();
        for (Problem problem : problems) {
            if (!seen.add(problem.id())) {
                throw new IllegalArgumentException("Duplicate problem id: " + problem.id());
            }
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
