package work.lcod.serverdata.model;

import java.util.List;
import java.util.Map;

/**
 * Group of spawns placed together; {@code spawns} maps spawn id to count.
 */
public record SpawnGroup(Map<Integer, Integer> spawns, List<Action> spawnActions, List<Action> defeatActions) {
    public SpawnGroup {
        spawns = ModelCollections.map(spawns);
        spawnActions = ModelCollections.list(spawnActions);
        defeatActions = ModelCollections.list(defeatActions);
    }

    public SpawnGroup withSpawns(Map<Integer, Integer> replacement) {
        return new SpawnGroup(replacement, spawnActions, defeatActions);
    }
}
