package io.evalrelay.gateway;

public final class Answers {
    public static final int MIN_ANSWER = 0;
    public static final int MAX_ANSWER = 99_999;
    public static final int DEFAULT_ANSWER = 0;

    private Answers() {
    }

    public static int clamp(long raw) {
        if (raw < MIN_ANSWER) {
            return MIN_ANSWER;
        }
        if (raw > MAX_ANSWER) {
            return MAX_ANSWER;
        }
        return (int) raw;
    }
}
