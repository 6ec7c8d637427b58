package io.evalrelay.model;

public record ResultRow(
        String id,
        int answer
) {
}
