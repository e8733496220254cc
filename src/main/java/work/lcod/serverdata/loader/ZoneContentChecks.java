package work.lcod.serverdata.loader;

import java.util.List;
import java.util.Map;
import work.lcod.serverdata.model.ServerNpc;
import work.lcod.serverdata.model.ServerObject;
import work.lcod.serverdata.model.Spawn;
import work.lcod.serverdata.model.SpawnCategory;
import work.lcod.serverdata.model.SpawnGroup;
import work.lcod.serverdata.model.SpawnLocationGroup;
import work.lcod.serverdata.model.ZoneSpot;
import work.lcod.serverdata.model.ZoneTrigger;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;
import work.lcod.serverdata.validation.ActionValidator;

/**
 * Checks shared by zones and zone partials.
 */
final class ZoneContentChecks {
    private ZoneContentChecks() {}

    static void checkSpawns(Map<Integer, Spawn> spawns, String owner, LoadContext context) {
        if (!context.hasCatalog()) {
            return;
        }
        spawns.forEach((spawnId, spawn) -> {
            if (!context.catalog().speciesExists(spawn.enemyType())) {
                throw new ServerDataException(ErrorKind.DANGLING_REFERENCE,
                    "Invalid spawn enemy type encountered in " + owner + ": " + spawn.enemyType());
            }
            if (spawn.bossGroup() != 0 && spawn.category() != SpawnCategory.BOSS) {
                throw new ServerDataException(ErrorKind.INVALID_RECORD,
                    "Invalid spawn boss group encountered in " + owner + ": " + spawnId);
            }
        });
    }

    static void checkReferences(Map<Integer, Spawn> spawns, Map<Integer, SpawnGroup> spawnGroups,
        Map<Integer, SpawnLocationGroup> locationGroups, String owner) {
        spawnGroups.values().forEach(group -> group.spawns().keySet().forEach(spawnId -> {
            if (!spawns.containsKey(spawnId)) {
                throw new ServerDataException(ErrorKind.DANGLING_REFERENCE,
                    "Invalid spawn group spawn ID encountered in " + owner + ": " + spawnId);
            }
        }));
        locationGroups.values().forEach(location -> location.groupIds().forEach(groupId -> {
            if (!spawnGroups.containsKey(groupId)) {
                throw new ServerDataException(ErrorKind.DANGLING_REFERENCE,
                    "Invalid spawn location group spawn group ID encountered in " + owner + ": " + groupId);
            }
        }));
    }

    static void validateSpawnGroups(Map<Integer, SpawnGroup> spawnGroups, String label, ActionValidator validator) {
        spawnGroups.forEach((groupId, group) -> {
            validator.validate(group.defeatActions(), label + ", SG " + groupId + " Defeat", false);
            validator.validate(group.spawnActions(), label + ", SG " + groupId + " Spawn", false);
        });
    }

    static void validatePlacements(List<ServerNpc> npcs, List<ServerObject> objects, Map<Integer, ZoneSpot> spots,
        String label, ActionValidator validator) {
        for (var npc : npcs) {
            validator.validate(npc.actions(), label + ", NPC " + npc.id(), false);
        }
        for (var object : objects) {
            validator.validate(object.actions(), label + ", Object " + object.id(), false);
        }
        spots.forEach((spotId, spot) -> {
            validator.validate(spot.actions(), label + ", Spot " + spotId, false);
            validator.validate(spot.leaveActions(), label + ", Spot " + spotId, false);
        });
    }

    static void validateTriggers(List<ZoneTrigger> triggers, String label, ActionValidator validator) {
        for (var trigger : triggers) {
            validator.validate(trigger.actions(), label + " trigger", ActionValidator.triggerIsAutoContext(trigger));
        }
    }
}
