package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.catalog.DefinitionCatalog;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

final class ZoneLoader implements RecordLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ZoneLoader.class);

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var zone = context.bind(record, ServerZone.class, path);
        var key = zone.key();

        boolean field = false;
        if (context.hasCatalog()) {
            var type = context.catalog().zoneBasicType(zone.id());
            if (type.isEmpty()) {
                LOGGER.warn("Skipping unknown zone: {}", key);
                return;
            }
            field = type.getAsInt() == DefinitionCatalog.FIELD_ZONE_TYPE;
        }

        var definitions = context.definitions();
        if (definitions.contains(Category.ZONE, key)) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate zone encountered: " + key);
        }

        String owner = "zone " + key;
        ZoneContentChecks.checkSpawns(zone.spawns(), owner, context);
        ZoneContentChecks.checkReferences(zone.spawns(), zone.spawnGroups(), zone.spawnLocationGroups(), owner);

        String label = "Zone " + key;
        var validator = context.validator();
        ZoneContentChecks.validateSpawnGroups(zone.spawnGroups(), label, validator);
        ZoneContentChecks.validatePlacements(zone.npcs(), zone.objects(), zone.spots(), label, validator);
        zone.plasmaSpawns().forEach((plasmaId, plasma) -> {
            validator.validate(plasma.successActions(), label + ", Plasma " + plasmaId, false);
            validator.validate(plasma.failActions(), label + ", Plasma " + plasmaId, false);
        });
        ZoneContentChecks.validateTriggers(zone.triggers(), label, validator);

        definitions.register(Category.ZONE, key, zone);
        if (field) {
            definitions.markFieldZone(key);
        }
    }
}
