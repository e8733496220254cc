package work.lcod.serverdata.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * {@link DefinitionCatalog} over a fixed table of zones and species, read from a YAML document:
 *
 * <pre>
 * zones:
 *   1: 1      # zone id: basic type
 *   100: 2
 * species: [101, 102]
 * </pre>
 *
 * Derived definitions are kept per category; a second record with an id already registered in
 * the same category is rejected.
 */
public final class StaticDefinitionCatalog implements DefinitionCatalog {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<Integer, Integer> zoneTypes;
    private final Set<Integer> species;
    private final Map<String, List<JsonNode>> derived = new LinkedHashMap<>();
    private final Map<String, Set<Integer>> derivedIds = new LinkedHashMap<>();

    public StaticDefinitionCatalog(Map<Integer, Integer> zoneTypes, Set<Integer> species) {
        this.zoneTypes = zoneTypes == null ? Map.of() : Map.copyOf(zoneTypes);
        this.species = species == null ? Set.of() : Set.copyOf(species);
    }

    public static StaticDefinitionCatalog load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read definition catalog: " + path, ex);
        }
    }

    static StaticDefinitionCatalog parse(InputStream in) throws IOException {
        var document = YAML_MAPPER.readValue(in, CatalogDocument.class);
        if (document == null) {
            return new StaticDefinitionCatalog(Map.of(), Set.of());
        }
        return new StaticDefinitionCatalog(document.zones(), document.species());
    }

    @Override
    public OptionalInt zoneBasicType(int zoneId) {
        Integer type = zoneTypes.get(zoneId);
        return type == null ? OptionalInt.empty() : OptionalInt.of(type);
    }

    @Override
    public boolean speciesExists(int speciesId) {
        return species.contains(speciesId);
    }

    @Override
    public synchronized boolean registerDerivedDefinition(String category, JsonNode record) {
        if (record == null || !record.isObject()) {
            return false;
        }
        if (record.hasNonNull("id")) {
            var ids = derivedIds.computeIfAbsent(category, ignored -> new HashSet<>());
            if (!ids.add(record.get("id").asInt())) {
                return false;
            }
        }
        derived.computeIfAbsent(category, ignored -> new ArrayList<>()).add(record.deepCopy());
        return true;
    }

    public synchronized List<JsonNode> derivedDefinitions(String category) {
        var records = derived.get(category);
        return records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
    }

    record CatalogDocument(Map<Integer, Integer> zones, Set<Integer> species) {}
}
