package work.lcod.serverdata.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a {@link ServerDataService#check} run.
 */
public record LoadResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public LoadResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LoadResult success(Map<String, Object> metadata, Instant startedAt) {
        return new LoadResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static LoadResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new LoadResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
