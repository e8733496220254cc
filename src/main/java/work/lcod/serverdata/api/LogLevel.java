package work.lcod.serverdata.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the CLI and {@code server-data.toml}.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("error"),
    OFF("off");

    private final String simpleLoggerLevel;

    LogLevel(String simpleLoggerLevel) {
        this.simpleLoggerLevel = simpleLoggerLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Level name understood by {@code org.slf4j.simpleLogger.defaultLogLevel}. */
    public String simpleLoggerLevel() {
        return simpleLoggerLevel;
    }
}
