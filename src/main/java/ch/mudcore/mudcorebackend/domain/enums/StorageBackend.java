package ch.mudcore.mudcorebackend.domain.enums;

import java.util.Locale;

/**
 * Which persistence backend(s) the player store uses. Resolved once at startup.
 */
public enum StorageBackend {
    /** JSON file only. */
    FILE,
    /** Relational database only, no fallback. */
    DATABASE,
    /** Database first with the JSON file as fallback and synchronous backup. */
    AUTO;

    /**
     * Parses a configuration value. Accepts the enum names in any case plus the legacy
     * aliases {@code json} and {@code sqlite}.
     *
     * @param value configured value, may be blank
     * @return parsed backend, {@link #AUTO} when blank
     * @throws IllegalArgumentException for unknown values
     */
    public static StorageBackend fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "file", "json" -> FILE;
            case "database", "sqlite", "db" -> DATABASE;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException("Unknown storage backend: " + value);
        };
    }
}
