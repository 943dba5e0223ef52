package io.fleetprov.retry;

public enum DelayMode {
    FIXED("fixed"),
    LINEAR("linear");

    private final String label;

    DelayMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DelayMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIXED;
        }
        for (DelayMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown retry delay mode: " + raw);
    }
}
