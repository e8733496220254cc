package work.lcod.serverdata.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Patch layered onto a zone when it is composed.
 *
 * <p>Auto-apply partials are applied to every zone whose dynamic map id is listed in
 * {@code dynamicMapIds}; the others are only applied on request. Partial 0 is the global
 * partial: only its skill and drop set data is kept.
 */
public record ServerZonePartial(
    int id,
    boolean autoApply,
    Set<Integer> dynamicMapIds,
    Map<Integer, Spawn> spawns,
    Map<Integer, SpawnGroup> spawnGroups,
    Map<Integer, SpawnLocationGroup> spawnLocationGroups,
    Map<Integer, ZoneSpot> spots,
    List<ServerNpc> npcs,
    List<ServerObject> objects,
    List<ZoneTrigger> triggers,
    Set<Integer> skillWhitelist,
    Set<Integer> skillBlacklist,
    Set<Integer> dropSetIds
) {
    public static final int GLOBAL_ID = 0;

    public ServerZonePartial {
        dynamicMapIds = ModelCollections.set(dynamicMapIds);
        spawns = ModelCollections.map(spawns);
        spawnGroups = ModelCollections.map(spawnGroups);
        spawnLocationGroups = ModelCollections.map(spawnLocationGroups);
        spots = ModelCollections.map(spots);
        npcs = ModelCollections.list(npcs);
        objects = ModelCollections.list(objects);
        triggers = ModelCollections.list(triggers);
        skillWhitelist = ModelCollections.set(skillWhitelist);
        skillBlacklist = ModelCollections.set(skillBlacklist);
        dropSetIds = ModelCollections.set(dropSetIds);
    }

    public boolean isGlobal() {
        return id == GLOBAL_ID;
    }

    public boolean appliesTo(int dynamicMapId) {
        return dynamicMapIds.isEmpty() || dynamicMapIds.contains(dynamicMapId);
    }

    /**
     * Copy of this partial without the placement data a global partial cannot carry.
     */
    public ServerZonePartial withoutPlacements() {
        return new ServerZonePartial(id, autoApply, null, spawns, spawnGroups, spawnLocationGroups, null,
            null, null, triggers, skillWhitelist, skillBlacklist, dropSetIds);
    }
}
