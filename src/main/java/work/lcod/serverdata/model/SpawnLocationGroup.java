package work.lcod.serverdata.model;

import java.util.Set;

/**
 * Spawn groups sharing a set of spawn locations.
 */
public record SpawnLocationGroup(Set<Integer> groupIds, Set<Integer> spotIds, float respawnTime) {
    public SpawnLocationGroup {
        groupIds = ModelCollections.set(groupIds);
        spotIds = ModelCollections.set(spotIds);
    }

    public SpawnLocationGroup withGroupIds(Set<Integer> replacement) {
        return new SpawnLocationGroup(replacement, spotIds, respawnTime);
    }
}
