package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks and registers one record of a content category.
 */
@FunctionalInterface
public interface RecordLoader {
    void load(JsonNode record, String path, LoadContext context);
}
