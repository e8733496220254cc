package work.lcod.serverdata.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.OptionalInt;
import work.lcod.serverdata.model.ServerZoneInstance;

/**
 * Client side definitions the server content is checked against.
 */
public interface DefinitionCatalog {
    /** Basic zone type of field zones. */
    int FIELD_ZONE_TYPE = 2;
    /** Basic zone type of PvP zones. */
    int PVP_ZONE_TYPE = 7;

    /**
     * Basic type of a zone known to the client, empty when the zone id is unknown.
     */
    OptionalInt zoneBasicType(int zoneId);

    boolean speciesExists(int speciesId);

    /**
     * Hands over a server side definition extending a client catalog category
     * (enchant sets, s-items, tokusei, ...).
     *
     * @return {@code false} when the catalog rejects the record
     */
    boolean registerDerivedDefinition(String category, JsonNode record);

    /**
     * Whether every zone of the instance is a PvP zone.
     */
    default boolean isPvpInstance(ServerZoneInstance instance) {
        if (instance.zoneIds().isEmpty()) {
            return false;
        }
        for (int zoneId : instance.zoneIds()) {
            var type = zoneBasicType(zoneId);
            if (type.isEmpty() || type.getAsInt() != PVP_ZONE_TYPE) {
                return false;
            }
        }
        return true;
    }
}
