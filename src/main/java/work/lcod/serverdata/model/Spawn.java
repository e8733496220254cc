package work.lcod.serverdata.model;

/**
 * Enemy spawn definition; keyed by spawn id on its zone.
 *
 * @param enemyType species id resolved against the definition catalog
 * @param bossGroup non-zero only for {@link SpawnCategory#BOSS} spawns
 */
public record Spawn(int enemyType, SpawnCategory category, int bossGroup, int level) {
    public Spawn {
        category = category == null ? SpawnCategory.NORMAL : category;
    }
}
