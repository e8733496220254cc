package work.lcod.serverdata.loader;

import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.catalog.DefinitionCatalog;
import work.lcod.serverdata.runtime.DefinitionRegistry;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;
import work.lcod.serverdata.runtime.ServerDataSnapshot;
import work.lcod.serverdata.script.GraalScriptEngine;
import work.lcod.serverdata.script.ScriptEngine;
import work.lcod.serverdata.script.ScriptRegistry;
import work.lcod.serverdata.store.DataStore;
import work.lcod.serverdata.validation.ActionValidator;

/**
 * Loads a content pack in {@link ContentCategory} order followed by the scripts. The first error
 * aborts the load and nothing is returned.
 */
public final class ServerDataLoader {
    public static final String SCRIPTS_PATH = "/scripts";
    public static final List<String> CONTENT_SUFFIXES = List.of(".yaml", ".yml", ".json");

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerDataLoader.class);

    private final RecordParser parser;
    private final ActionValidator validator;
    private final Supplier<ScriptEngine> engineFactory;
    private final String scriptSuffix;

    public ServerDataLoader() {
        this(new RecordParser(false), GraalScriptEngine::new, ScriptRegistry.DEFAULT_SUFFIX);
    }

    public ServerDataLoader(RecordParser parser, Supplier<ScriptEngine> engineFactory, String scriptSuffix) {
        this.parser = parser;
        this.validator = new ActionValidator();
        this.engineFactory = engineFactory;
        this.scriptSuffix = scriptSuffix;
    }

    /**
     * @param catalog may be {@code null}; catalog checks and catalog only categories are then skipped
     * @throws ServerDataException on the first invalid file or record
     */
    public ServerDataSnapshot loadAll(DataStore store, DefinitionCatalog catalog) {
        var definitions = DefinitionRegistry.builder();
        var context = new LoadContext(definitions, catalog, validator, parser);
        for (var category : ContentCategory.values()) {
            if (category.requiresCatalog() && catalog == null) {
                continue;
            }
            LOGGER.debug("Loading {} definitions from {}", category, category.path());
            loadCategory(store, category, context);
        }

        LOGGER.debug("Loading server scripts...");
        var scripts = new ScriptRegistry(engineFactory);
        scripts.loadScripts(store, SCRIPTS_PATH, scriptSuffix, true);
        return ServerDataSnapshot.of(definitions.build(), scripts);
    }

    private void loadCategory(DataStore store, ContentCategory category, LoadContext context) {
        List<String> files;
        try {
            files = store.listFiles(category.path(), category.recursive());
        } catch (IOException ex) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Failed to list " + category.path(), ex);
        }

        boolean loaded = false;
        for (String file : files) {
            if (isContentFile(file)) {
                loadFile(file, read(store, file), category, context);
                loaded = true;
            }
        }
        if (loaded || !category.fileOrPath()) {
            return;
        }

        for (String suffix : CONTENT_SUFFIXES) {
            String file = category.path() + suffix;
            byte[] content = read(store, file);
            if (content.length > 0) {
                loadFile(file, content, category, context);
                return;
            }
        }
        LOGGER.warn("File does not exist or is empty: {}{}", category.path(), CONTENT_SUFFIXES.get(0));
    }

    private void loadFile(String file, byte[] content, ContentCategory category, LoadContext context) {
        if (content.length == 0) {
            LOGGER.warn("File does not exist or is empty: {}", file);
            return;
        }
        try {
            var records = parser.parseObjects(file, content);
            for (var record : records) {
                category.loader().load(record, file, context);
            }
            LOGGER.debug("Loaded {} {} record(s) from {}", records.size(), category, file);
        } catch (ServerDataException ex) {
            LOGGER.error("Failed to load file: {}", file);
            throw ex;
        }
    }

    private static byte[] read(DataStore store, String file) {
        try {
            return store.readFile(file);
        } catch (IOException ex) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Failed to read file: " + file, ex);
        }
    }

    static boolean isContentFile(String file) {
        for (String suffix : CONTENT_SUFFIXES) {
            if (file.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
