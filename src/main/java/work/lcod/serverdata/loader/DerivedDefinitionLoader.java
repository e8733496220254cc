package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Hands records extending a catalog category over to the catalog unchanged.
 */
final class DerivedDefinitionLoader implements RecordLoader {
    private final String category;

    DerivedDefinitionLoader(String category) {
        this.category = category;
    }

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        if (!context.hasCatalog() || !context.catalog().registerDerivedDefinition(category, record)) {
            throw new ServerDataException(ErrorKind.EXTERNAL_REJECTED,
                "Catalog rejected " + category + " definition in file: " + path);
        }
    }
}
