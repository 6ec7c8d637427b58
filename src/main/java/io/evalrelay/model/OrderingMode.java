package io.evalrelay.model;

public enum OrderingMode {
    RANDOM("random"),
    FIXED_SEEDED("fixed");

    private final String label;

    OrderingMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OrderingMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RANDOM;
        }
        for (OrderingMode value : values()) {
            if (value.name().equalsIgnoreCase(raw)
                    || value.label.equalsIgnoreCase(raw)
                    || value.name().replace('_', '-').equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ordering mode: " + raw);
    }
}
