package work.lcod.serverdata.model;

import java.util.List;

/**
 * Set of zones joined together as one instance, entered through the lobby zone.
 * {@code zoneIds} and {@code dynamicMapIds} are parallel lists.
 */
public record ServerZoneInstance(int id, int lobbyId, List<Integer> zoneIds, List<Integer> dynamicMapIds) {
    public ServerZoneInstance {
        zoneIds = ModelCollections.list(zoneIds);
        dynamicMapIds = ModelCollections.list(dynamicMapIds);
    }

    public boolean contains(int zoneId, int dynamicMapId) {
        for (int i = 0; i < zoneIds.size() && i < dynamicMapIds.size(); i++) {
            if (zoneIds.get(i) == zoneId && (dynamicMapId == 0 || dynamicMapIds.get(i) == dynamicMapId)) {
                return true;
            }
        }
        return false;
    }
}
