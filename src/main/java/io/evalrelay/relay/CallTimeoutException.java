package io.evalrelay.relay;

import java.time.Duration;

public final class CallTimeoutException extends RelayException {
    private final String callId;
    private final Duration deadline;

    public CallTimeoutException(String callId, String endpoint, Duration deadline) {
        super("call " + callId + " to " + endpoint + " exceeded deadline " + deadline);
        this.callId = callId;
        this.deadline = deadline;
    }

    public String callId() {
        return callId;
    }

    public Duration deadline() {
        return deadline;
    }
}
