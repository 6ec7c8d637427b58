package io.evalrelay.model;

public enum GatewayState {
    INIT,
    CONNECTING,
    SERVING,
    FINALIZING,
    DONE,
    FAILED
}
