package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.model.ServerZonePartial;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Registers zone partials. The global partial keeps only its skill, drop set, spawn and trigger
 * data and is never indexed for auto-apply.
 */
final class ZonePartialLoader implements RecordLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ZonePartialLoader.class);

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var partial = context.bind(record, ServerZonePartial.class, path);
        int id = partial.id();
        var definitions = context.definitions();
        if (definitions.contains(Category.ZONE_PARTIAL, id)) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate zone partial encountered: " + id);
        }

        if (partial.isGlobal()) {
            if (!partial.dynamicMapIds().isEmpty() || !partial.npcs().isEmpty()
                || !partial.objects().isEmpty() || !partial.spots().isEmpty()) {
                LOGGER.warn("Direct global partial zone definitions specified but will be ignored");
                partial = partial.withoutPlacements();
            }
        } else {
            ZoneContentChecks.checkSpawns(partial.spawns(), "zone partial " + id, context);
        }

        String label = "Partial " + id;
        var validator = context.validator();
        ZoneContentChecks.validateSpawnGroups(partial.spawnGroups(), label, validator);
        ZoneContentChecks.validatePlacements(partial.npcs(), partial.objects(), partial.spots(), label, validator);
        ZoneContentChecks.validateTriggers(partial.triggers(), label, validator);

        definitions.register(Category.ZONE_PARTIAL, id, partial);
        if (!partial.isGlobal() && partial.autoApply()) {
            for (int dynamicMapId : partial.dynamicMapIds()) {
                definitions.indexAutoApplyPartial(dynamicMapId, id);
            }
        }
    }
}
