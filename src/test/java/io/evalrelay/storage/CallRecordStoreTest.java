package io.evalrelay.storage;

import io.evalrelay.config.EvalRelayConfig;
import io.evalrelay.model.CallRecord;
import io.evalrelay.model.CallStatus;
import io.evalrelay.model.GatewayState;
import io.evalrelay.support.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

final class CallRecordStoreTest {

    @Test
    void keepsRunsAndRecordsInEvaluationOrder() throws Exception {
        Path root = Files.createTempDirectory("evalrelay-ledger-");
        try {
            CallRecordStore store = newStore(root);
            Instant started = Instant.ofEpochMilli(1_700_000_000_000L);
            store.startRun("run-a", "fixed", 3, "127.0.0.1:50051", 1_000L);
            store.markState("run-a", GatewayState.SERVING);
            store.append("run-a", 0, CallRecord.ok("p3", started, started.plusSeconds(360), 12, 40L));
            store.append("run-a", 1, CallRecord.failed("p1", started, started.plusSeconds(360), CallStatus.TIMEOUT, "deadline", 360_000L));
            store.append("run-a", 2, CallRecord.failed("p2", started, started, CallStatus.TRANSPORT_ERROR, "not attempted", 0L));

            CallRecordStore.RunSummary serving = store.findRun("run-a").orElseThrow();
            Assertions.assertEquals("SERVING", serving.state());
            Assertions.assertNull(serving.finishedAtMs());

            store.finishRun("run-a", GatewayState.DONE, "/tmp/submission.csv", null, 2_000L);

            List<CallRecord> records = store.listRecords("run-a");
            Assertions.assertEquals(List.of("p3", "p1", "p2"), records.stream().map(CallRecord::problemId).toList());
            Assertions.assertEquals(12, records.get(0).answer());
            Assertions.assertNull(records.get(1).answer());
            Assertions.assertEquals(CallStatus.TIMEOUT, records.get(1).status());
            Assertions.assertEquals(started, records.get(1).startedAt());
            Assertions.assertEquals(started.plusSeconds(360), records.get(1).deadline());

            CallRecordStore.RunSummary done = store.findRun("run-a").orElseThrow();
            Assertions.assertEquals("DONE", done.state());
            Assertions.assertEquals(2_000L, done.finishedAtMs());
            Assertions.assertEquals("/tmp/submission.csv", done.resultFile());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void rejectsASecondRecordForTheSameProblem() throws Exception {
        Path root = Files.createTempDirectory("evalrelay-ledger-dup-");
        try {
            CallRecordStore store = newStore(root);
            Instant now = Instant.now();
            store.startRun("run-b", "random", 1, "unix:/tmp/relay.sock", 1L);
            store.append("run-b", 0, CallRecord.ok("p1", now, now, 1, 1L));

            Assertions.assertThrows(RuntimeException.class,
                    () -> store.append("run-b", 1, CallRecord.ok("p1", now, now, 2, 1L)));
            Assertions.assertEquals(1, store.listRecords("run-b").size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void listsNewestRunsFirst() throws Exception {
        Path root = Files.createTempDirectory("evalrelay-ledger-list-");
        try {
            CallRecordStore store = newStore(root);
            store.startRun("old", "random", 1, "a", 10L);
            store.startRun("new", "random", 1, "a", 20L);

            Assertions.assertEquals(List.of("new", "old"),
                    store.listRuns(10).stream().map(CallRecordStore.RunSummary::runId).toList());
            Assertions.assertEquals(1, store.listRuns(1).size());
            Assertions.assertTrue(store.findRun("missing").isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    private static CallRecordStore newStore(Path root) {
        Database database = new Database(EvalRelayConfig.fromRoot(root.toString()));
        database.init();
        return new CallRecordStore(database);
    }
}
