package work.lcod.serverdata.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.catalog.DefinitionCatalog;
import work.lcod.serverdata.catalog.StaticDefinitionCatalog;
import work.lcod.serverdata.loader.RecordParser;
import work.lcod.serverdata.loader.ServerDataLoader;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ServerDataException;
import work.lcod.serverdata.runtime.ServerDataHolder;
import work.lcod.serverdata.runtime.ServerDataSnapshot;
import work.lcod.serverdata.script.GraalScriptEngine;
import work.lcod.serverdata.store.FileSystemDataStore;

/**
 * Public entry point for loading a content pack from disk.
 */
public final class ServerDataService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerDataService.class);

    /**
     * @throws ServerDataException when the pack is invalid
     */
    public ServerDataSnapshot load(LoaderConfiguration configuration) {
        var loader = new ServerDataLoader(new RecordParser(configuration.strict()), GraalScriptEngine::new,
            configuration.scriptSuffix());
        var store = new FileSystemDataStore(configuration.contentRoot());
        DefinitionCatalog catalog = configuration.catalogFile().map(StaticDefinitionCatalog::load).orElse(null);
        if (catalog == null) {
            LOGGER.warn("No definition catalog configured, catalog checks are skipped");
        }
        return loader.loadAll(store, catalog);
    }

    /**
     * Loads the pack into a holder that can later be reloaded with the same configuration.
     */
    public ServerDataHolder open(LoaderConfiguration configuration) {
        return new ServerDataHolder(load(configuration));
    }

    public LoadResult check(LoaderConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("contentRoot", configuration.contentRoot().toString());
        configuration.catalogFile().ifPresent(file -> metadata.put("catalog", file.toString()));
        try {
            var snapshot = load(configuration);
            var definitions = snapshot.definitions();
            metadata.put("zones", definitions.size(Category.ZONE));
            metadata.put("zonePartials", definitions.size(Category.ZONE_PARTIAL));
            metadata.put("events", definitions.size(Category.EVENT));
            metadata.put("zoneInstances", definitions.size(Category.ZONE_INSTANCE));
            metadata.put("zoneInstanceVariants", definitions.size(Category.ZONE_INSTANCE_VARIANT));
            metadata.put("shops", definitions.size(Category.SHOP));
            metadata.put("aiLogicGroups", definitions.size(Category.AI_LOGIC_GROUP));
            metadata.put("demonPresents", definitions.size(Category.DEMON_PRESENT));
            metadata.put("demonQuestRewards", definitions.size(Category.DEMON_QUEST_REWARD));
            metadata.put("dropSets", definitions.size(Category.DROP_SET));
            metadata.put("scripts", snapshot.scripts().scripts().size());
            metadata.put("aiScripts", snapshot.scripts().aiScripts().size());
            return LoadResult.success(metadata, started);
        } catch (ServerDataException ex) {
            metadata.put("errorKind", ex.kind().name());
            if (Boolean.getBoolean("serverdata.debug")) {
                LOGGER.error("Content load failed", ex);
            }
            return LoadResult.failure(ex.getMessage(), metadata, started);
        }
    }

    public Optional<ServerZone> composeZone(LoaderConfiguration configuration, int zoneId, int dynamicMapId,
        Set<Integer> partialIds) {
        return load(configuration).composer().getComposed(zoneId, dynamicMapId, partialIds);
    }
}
