package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.serverdata.model.ServerZoneInstanceVariant;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Registers instance variants after checking the time points each mode needs. PvP variants
 * naming a default instance are checked against the catalog zone types.
 */
final class ZoneInstanceVariantLoader implements RecordLoader {
    private static final int PENTALPHA_SUB_ID_LIMIT = 5;

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var variant = context.bind(record, ServerZoneInstanceVariant.class, path);
        int id = variant.id();
        var definitions = context.definitions();
        if (definitions.contains(Category.ZONE_INSTANCE_VARIANT, id)) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate zone instance variant encountered: " + id);
        }

        checkTimePoints(variant);

        var pvp = variant.pvp();
        if (pvp != null) {
            int instanceId = pvp.defaultInstanceId();
            if (context.hasCatalog() && instanceId != 0) {
                var instance = definitions.lookup(Category.ZONE_INSTANCE, instanceId).orElseThrow(() ->
                    new ServerDataException(ErrorKind.DANGLING_REFERENCE, "Failed to verify PvP instance: " + instanceId));
                if (!context.catalog().isPvpInstance(instance)) {
                    throw new ServerDataException(ErrorKind.INVALID_RECORD,
                        "Instance contains non-PvP zones and cannot be used for PvP: " + instanceId);
                }
            }
            if (pvp.isStandard()) {
                definitions.indexStandardPvpVariant(pvp.matchType(), id);
            }
        }

        definitions.register(Category.ZONE_INSTANCE_VARIANT, id, variant);
    }

    private static void checkTimePoints(ServerZoneInstanceVariant variant) {
        int count = variant.timePoints().size();
        String problem = switch (variant.instanceType()) {
            case TIME_TRIAL -> count != 4
                ? "Time trial zone instance variant encountered without 4 time points specified" : null;
            case PVP -> count != 2 && count != 3
                ? "PVP zone instance variant encountered without 2 or 3 time points specified" : null;
            case DEMON_ONLY -> count != 3 && count != 4
                ? "Demon only zone instance variant encountered without 3 or 4 time points specified" : null;
            case DIASPORA -> count != 2
                ? "Diaspora zone instance variant encountered without 2 time points specified" : null;
            case MISSION -> count != 1
                ? "Mission zone instance variant encountered without time point specified" : null;
            case PENTALPHA -> variant.subId() >= PENTALPHA_SUB_ID_LIMIT
                ? "Pentalpha zone instance variant encountered with invalid sub ID" : null;
            default -> null;
        };
        if (problem != null) {
            throw new ServerDataException(ErrorKind.INVALID_RECORD, problem + ": " + variant.id());
        }
    }
}
