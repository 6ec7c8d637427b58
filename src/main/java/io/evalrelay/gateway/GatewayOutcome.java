package io.evalrelay.gateway;

import io.evalrelay.model.CallRecord;
import io.evalrelay.model.CallStatus;
import io.evalrelay.model.GatewayState;
import io.evalrelay.model.OrderingMode;
import io.evalrelay.model.ResultRow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record GatewayOutcome(
        String runId,
        GatewayState state,
        OrderingMode orderingMode,
        List<CallRecord> records,
        List<ResultRow> results,
        String resultFile,
        String error
) {
    public boolean done() {
        return state == GatewayState.DONE;
    }

    public int exitCode() {
        return done() ? 0 : 1;
    }

    public Map<CallStatus, Long> statusCounts() {
        Map<CallStatus, Long> counts = new EnumMap<>(CallStatus.class);
        for (CallStatus status : CallStatus.values()) {
            counts.put(status, 0L);
        }
        for (CallRecord record : records) {
            counts.merge(record.status(), 1L, Long::sum);
        }
        return counts;
    }
}
