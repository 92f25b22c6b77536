package marouter.placement.model;

import java.util.Locale;

/**
 * Placement request priority.
 */
public enum Priority {
    NORMAL,
    HIGH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Priority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        for (Priority p : values()) {
            if (p.name().equalsIgnoreCase(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("priority must be 'normal' or 'high', got: " + value);
    }
}
