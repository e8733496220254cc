package work.lcod.serverdata.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Server side zone definition.
 *
 * <p>Spawn groups reference spawns by id and spawn location groups reference spawn groups by id;
 * both references are checked when the zone is loaded and repaired when partials are composed.
 */
public record ServerZone(
    int id,
    int dynamicMapId,
    Map<Integer, Spawn> spawns,
    Map<Integer, SpawnGroup> spawnGroups,
    Map<Integer, SpawnLocationGroup> spawnLocationGroups,
    Map<Integer, ZoneSpot> spots,
    Map<Integer, PlasmaSpawn> plasmaSpawns,
    List<ServerNpc> npcs,
    List<ServerObject> objects,
    List<ZoneTrigger> triggers,
    Set<Integer> skillWhitelist,
    Set<Integer> skillBlacklist,
    Set<Integer> dropSetIds
) {
    public ServerZone {
        spawns = ModelCollections.map(spawns);
        spawnGroups = ModelCollections.map(spawnGroups);
        spawnLocationGroups = ModelCollections.map(spawnLocationGroups);
        spots = ModelCollections.map(spots);
        plasmaSpawns = ModelCollections.map(plasmaSpawns);
        npcs = ModelCollections.list(npcs);
        objects = ModelCollections.list(objects);
        triggers = ModelCollections.list(triggers);
        skillWhitelist = ModelCollections.set(skillWhitelist);
        skillBlacklist = ModelCollections.set(skillBlacklist);
        dropSetIds = ModelCollections.set(dropSetIds);
    }

    public ZoneKey key() {
        return new ZoneKey(id, dynamicMapId);
    }
}
