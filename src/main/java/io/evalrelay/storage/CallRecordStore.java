package io.evalrelay.storage;

import io.evalrelay.model.CallRecord;
import io.evalrelay.model.CallStatus;
import io.evalrelay.model.GatewayState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Run ledger: one row per gateway run, one append-only row per finished call.
 */
public final class CallRecordStore {
    private final Database database;

    public CallRecordStore(Database database) {
        this.database = database;
    }

    public void startRun(String runId, String orderingMode, int problemCount, String address, long nowMs) {
        exec("INSERT INTO runs(run_id,state,ordering_mode,problem_count,address,started_at_ms) VALUES(?,?,?,?,?,?)", ps -> {
            ps.setString(1, runId);
            ps.setString(2, GatewayState.INIT.name());
            ps.setString(3, orderingMode);
            ps.setInt(4, problemCount);
            ps.setString(5, address);
            ps.setLong(6, nowMs);
        });
    }

    public void markState(String runId, GatewayState state) {
        exec("UPDATE runs SET state=? WHERE run_id=?", ps -> {
            ps.setString(1, state.name());
            ps.setString(2, runId);
        });
    }

    public void finishRun(String runId, GatewayState state, String resultFile, String error, long nowMs) {
        exec("UPDATE runs SET state=?, result_file=?, last_error=?, finished_at_ms=? WHERE run_id=?", ps -> {
            ps.setString(1, state.name());
            ps.setString(2, resultFile);
            ps.setString(3, error);
            ps.setLong(4, nowMs);
            ps.setString(5, runId);
        });
    }

    /**
     * Appends a finished call. A second record for the same problem in the same run is rejected.
     */
    public void append(String runId, int seq, CallRecord record) {
        exec("""
                INSERT INTO call_records(run_id,seq,problem_id,status,answer,raw_error,started_at_ms,deadline_at_ms,elapsed_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """, ps -> {
            ps.setString(1, runId);
            ps.setInt(2, seq);
            ps.setString(3, record.problemId());
            ps.setString(4, record.status().name());
            if (record.answer() == null) {
                ps.setNull(5, Types.INTEGER);
            } else {
                ps.setInt(5, record.answer());
            }
            ps.setString(6, record.rawError());
            ps.setLong(7, record.startedAt().toEpochMilli());
            ps.setLong(8, record.deadline().toEpochMilli());
            ps.setLong(9, record.elapsedMs());
        });
    }

    public List<CallRecord> listRecords(String runId) {
        String sql = """
                SELECT problem_id,status,answer,raw_error,started_at_ms,deadline_at_ms,elapsed_ms
                FROM call_records WHERE run_id=? ORDER BY seq ASC
                """;
        List<CallRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int answer = rs.getInt("answer");
                    Integer boxed = rs.wasNull() ? null : answer;
                    out.add(new CallRecord(
                            rs.getString("problem_id"),
                            Instant.ofEpochMilli(rs.getLong("started_at_ms")),
                            Instant.ofEpochMilli(rs.getLong("deadline_at_ms")),
                            CallStatus.valueOf(rs.getString("status")),
                            boxed,
                            rs.getString("raw_error"),
                            rs.getLong("elapsed_ms")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
        return out;
    }

    public Optional<RunSummary> findRun(String runId) {
        List<RunSummary> rows = queryRuns("SELECT * FROM runs WHERE run_id=?", ps -> ps.setString(1, runId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<RunSummary> listRuns(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1_000));
        return queryRuns("SELECT * FROM runs ORDER BY started_at_ms DESC LIMIT ?", ps -> ps.setInt(1, safeLimit));
    }

    private List<RunSummary> queryRuns(String sql, Binder binder) {
        List<RunSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long finished = rs.getLong("finished_at_ms");
                    Long finishedAt = rs.wasNull() ? null : finished;
                    out.add(new RunSummary(
                            rs.getString("run_id"),
                            rs.getString("state"),
                            rs.getString("ordering_mode"),
                            rs.getInt("problem_count"),
                            rs.getString("address"),
                            rs.getString("result_file"),
                            rs.getString("last_error"),
                            rs.getLong("started_at_ms"),
                            finishedAt
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
        return out;
    }

    private void exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }

    public record RunSummary(
            String runId,
            String state,
            String orderingMode,
            int problemCount,
            String address,
            String resultFile,
            String lastError,
            long startedAtMs,
            Long finishedAtMs
    ) {
    }
}
