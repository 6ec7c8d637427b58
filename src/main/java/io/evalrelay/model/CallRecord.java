package io.evalrelay.model;

import java.time.Instant;

public record CallRecord(
        String problemId,
        Instant startedAt,
        Instant deadline,
        CallStatus status,
        Integer answer,
        String rawError,
        long elapsedMs
) {
    public static CallRecord ok(String problemId, Instant startedAt, Instant deadline, int answer, long elapsedMs) {
        return new CallRecord(problemId, startedAt, deadline, CallStatus.OK, answer, null, elapsedMs);
    }

    public static CallRecord failed(
            String problemId,
            Instant startedAt,
            Instant deadline,
            CallStatus status,
            String rawError,
            long elapsedMs
    ) {
        return new CallRecord(problemId, startedAt, deadline, status, null, rawError, elapsedMs);
    }
}
