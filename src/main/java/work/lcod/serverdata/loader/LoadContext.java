package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.serverdata.catalog.DefinitionCatalog;
import work.lcod.serverdata.runtime.DefinitionRegistry;
import work.lcod.serverdata.validation.ActionValidator;

/**
 * State shared by the record loaders during one {@link ServerDataLoader#loadAll} call.
 *
 * @param catalog may be {@code null}, in which case catalog checks are skipped
 */
public record LoadContext(
    DefinitionRegistry.Builder definitions,
    DefinitionCatalog catalog,
    ActionValidator validator,
    RecordParser parser
) {
    public boolean hasCatalog() {
        return catalog != null;
    }

    public <T> T bind(JsonNode record, Class<T> type, String path) {
        return parser.bind(record, type, path);
    }
}
