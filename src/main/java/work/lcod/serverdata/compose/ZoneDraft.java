package work.lcod.serverdata.compose;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.serverdata.model.PlasmaSpawn;
import work.lcod.serverdata.model.ServerNpc;
import work.lcod.serverdata.model.ServerObject;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.model.Spawn;
import work.lcod.serverdata.model.SpawnGroup;
import work.lcod.serverdata.model.SpawnLocationGroup;
import work.lcod.serverdata.model.ZoneKey;
import work.lcod.serverdata.model.ZoneSpot;
import work.lcod.serverdata.model.ZoneTrigger;

/**
 * Mutable working copy of a zone while partials are merged into it. Nothing in a draft is shared
 * with the zone it was copied from except the immutable entries themselves.
 */
public final class ZoneDraft {
    private final int id;
    private final int dynamicMapId;
    private final Map<Integer, Spawn> spawns;
    private final Map<Integer, SpawnGroup> spawnGroups;
    private final Map<Integer, SpawnLocationGroup> spawnLocationGroups;
    private final Map<Integer, ZoneSpot> spots;
    private final Map<Integer, PlasmaSpawn> plasmaSpawns;
    private final List<ServerNpc> npcs;
    private final List<ServerObject> objects;
    private final List<ZoneTrigger> triggers;
    private final Set<Integer> skillWhitelist;
    private final Set<Integer> skillBlacklist;
    private final Set<Integer> dropSetIds;

    private ZoneDraft(ServerZone zone) {
        this.id = zone.id();
        this.dynamicMapId = zone.dynamicMapId();
        this.spawns = new LinkedHashMap<>(zone.spawns());
        this.spawnGroups = new LinkedHashMap<>(zone.spawnGroups());
        this.spawnLocationGroups = new LinkedHashMap<>(zone.spawnLocationGroups());
        this.spots = new LinkedHashMap<>(zone.spots());
        this.plasmaSpawns = new LinkedHashMap<>(zone.plasmaSpawns());
        this.npcs = new ArrayList<>(zone.npcs());
        this.objects = new ArrayList<>(zone.objects());
        this.triggers = new ArrayList<>(zone.triggers());
        this.skillWhitelist = new LinkedHashSet<>(zone.skillWhitelist());
        this.skillBlacklist = new LinkedHashSet<>(zone.skillBlacklist());
        this.dropSetIds = new LinkedHashSet<>(zone.dropSetIds());
    }

    public static ZoneDraft of(ServerZone zone) {
        return new ZoneDraft(zone);
    }

    public ServerZone toZone() {
        return new ServerZone(id, dynamicMapId, spawns, spawnGroups, spawnLocationGroups, spots, plasmaSpawns,
            npcs, objects, triggers, skillWhitelist, skillBlacklist, dropSetIds);
    }

    public ZoneKey key() {
        return new ZoneKey(id, dynamicMapId);
    }

    public Map<Integer, Spawn> spawns() {
        return spawns;
    }

    public Map<Integer, SpawnGroup> spawnGroups() {
        return spawnGroups;
    }

    public Map<Integer, SpawnLocationGroup> spawnLocationGroups() {
        return spawnLocationGroups;
    }

    public Map<Integer, ZoneSpot> spots() {
        return spots;
    }

    public List<ServerNpc> npcs() {
        return npcs;
    }

    public List<ServerObject> objects() {
        return objects;
    }

    public List<ZoneTrigger> triggers() {
        return triggers;
    }

    public Set<Integer> skillWhitelist() {
        return skillWhitelist;
    }

    public Set<Integer> skillBlacklist() {
        return skillBlacklist;
    }

    public Set<Integer> dropSetIds() {
        return dropSetIds;
    }
}
