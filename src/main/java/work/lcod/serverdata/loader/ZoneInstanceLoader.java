package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.model.ServerZoneInstance;
import work.lcod.serverdata.model.ZoneKey;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

final class ZoneInstanceLoader implements RecordLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ZoneInstanceLoader.class);

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var instance = context.bind(record, ServerZoneInstance.class, path);
        if (context.hasCatalog() && context.catalog().zoneBasicType(instance.lobbyId()).isEmpty()) {
            LOGGER.warn("Skipping zone instance with unknown lobby: {}", instance.lobbyId());
            return;
        }

        var zoneIds = instance.zoneIds();
        var dynamicMapIds = instance.dynamicMapIds();
        if (zoneIds.size() != dynamicMapIds.size()) {
            throw new ServerDataException(ErrorKind.INVALID_RECORD,
                "Zone instance encountered with zone and dynamic map counts that do not match: " + instance.id());
        }

        var definitions = context.definitions();
        for (int i = 0; i < zoneIds.size(); i++) {
            var key = new ZoneKey(zoneIds.get(i), dynamicMapIds.get(i));
            if (!definitions.contains(Category.ZONE, key)) {
                throw new ServerDataException(ErrorKind.DANGLING_REFERENCE,
                    "Invalid zone encountered for instance " + instance.id() + ": " + key.zoneId()
                        + " (" + key.dynamicMapId() + ")");
            }
        }

        if (definitions.contains(Category.ZONE_INSTANCE, instance.id())) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate zone instance encountered: " + instance.id());
        }
        definitions.register(Category.ZONE_INSTANCE, instance.id(), instance);
    }
}
