package io.evalrelay.model;

public enum CallStatus {
    OK,
    TIMEOUT,
    HANDLER_ERROR,
    TRANSPORT_ERROR
}
