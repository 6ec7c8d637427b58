package io.evalrelay.model;

public record Problem(
        String id,
        String statement
) {
}
