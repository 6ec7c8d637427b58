package io.evalrelay.model;

public enum EnvelopeKind {
    REQUEST,
    RESPONSE,
    ERROR,
    CANCEL
}
