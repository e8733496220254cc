package work.lcod.serverdata.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Reads content files into records. A content file holds one document whose {@code objects}
 * array lists the records; {@code .json} files are read as JSON, everything else as YAML. A file
 * holding no document at all (blank or comments only) has no records.
 */
public final class RecordParser {
    public static final String OBJECTS_FIELD = "objects";

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordParser.class);

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public RecordParser(boolean strict) {
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()), strict);
        this.jsonMapper = configure(new ObjectMapper(), strict);
    }

    private static ObjectMapper configure(ObjectMapper mapper, boolean strict) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, strict);
    }

    /**
     * Record nodes of a content file.
     *
     * @throws ServerDataException with {@link ErrorKind#MALFORMED_RECORD} when the file cannot be
     *     parsed or has no {@code objects} array
     */
    public List<JsonNode> parseObjects(String path, byte[] content) {
        JsonNode root;
        try {
            root = mapperFor(path).readTree(content);
        } catch (IOException ex) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Failed to parse file: " + path, ex);
        }
        if (root == null || root.isMissingNode()) {
            LOGGER.warn("File does not exist or is empty: {}", path);
            return List.of();
        }
        if (!root.has(OBJECTS_FIELD)) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "No objects list found in file: " + path);
        }
        var objects = root.get(OBJECTS_FIELD);
        if (objects.isNull()) {
            return List.of();
        }
        if (!objects.isArray()) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Objects entry is not a list in file: " + path);
        }
        var records = new ArrayList<JsonNode>(objects.size());
        objects.forEach(records::add);
        return records;
    }

    public <T> T bind(JsonNode node, Class<T> type, String path) {
        try {
            var value = yamlMapper.treeToValue(node, type);
            if (value == null) {
                throw new ServerDataException(ErrorKind.MALFORMED_RECORD,
                    "Empty " + type.getSimpleName() + " record in file: " + path);
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD,
                "Invalid " + type.getSimpleName() + " record in file: " + path + ": " + rootMessage(ex), ex);
        }
    }

    private ObjectMapper mapperFor(String path) {
        return path.endsWith(".json") ? jsonMapper : yamlMapper;
    }

    private static String rootMessage(Throwable error) {
        var current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        if (current instanceof JsonProcessingException json) {
            return json.getOriginalMessage();
        }
        return current.getMessage();
    }
}
