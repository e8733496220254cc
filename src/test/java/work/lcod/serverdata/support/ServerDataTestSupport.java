package work.lcod.serverdata.support;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.serverdata.catalog.DefinitionCatalog;
import work.lcod.serverdata.catalog.StaticDefinitionCatalog;
import work.lcod.serverdata.loader.RecordParser;
import work.lcod.serverdata.loader.ServerDataLoader;
import work.lcod.serverdata.script.GraalScriptEngine;
import work.lcod.serverdata.script.ScriptRegistry;

/**
 * Shared helpers for the content loading suites.
 */
public final class ServerDataTestSupport {
    public static final int LOBBY_ZONE = 1;
    public static final int FIELD_ZONE = 100;
    public static final int PVP_ZONE_A = 200;
    public static final int PVP_ZONE_B = 201;
    public static final int DUNGEON_ZONE = 300;
    public static final int UNKNOWN_ZONE = 999;

    public static final int SLIME = 101;
    public static final int PIXIE = 102;
    public static final int DRAGON = 103;

    private ServerDataTestSupport() {}

    /**
     * Catalog knowing a lobby (type 1), a field zone, two PvP zones, a dungeon and three species.
     */
    public static StaticDefinitionCatalog catalog() {
        return new StaticDefinitionCatalog(
            Map.of(
                LOBBY_ZONE, 1,
                FIELD_ZONE, DefinitionCatalog.FIELD_ZONE_TYPE,
                PVP_ZONE_A, DefinitionCatalog.PVP_ZONE_TYPE,
                PVP_ZONE_B, DefinitionCatalog.PVP_ZONE_TYPE,
                DUNGEON_ZONE, 3
            ),
            Set.of(SLIME, PIXIE, DRAGON)
        );
    }

    public static ServerDataLoader loader() {
        return new ServerDataLoader(new RecordParser(false), GraalScriptEngine::new, ScriptRegistry.DEFAULT_SUFFIX);
    }

    /**
     * YAML content file holding the given records, each already written as a YAML block.
     */
    public static String objects(String... records) {
        var builder = new StringBuilder("objects:\n");
        for (String record : records) {
            List<String> lines = record.strip().lines().collect(Collectors.toList());
            for (int i = 0; i < lines.size(); i++) {
                builder.append(i == 0 ? "  - " : "    ").append(lines.get(i)).append('\n');
            }
        }
        return builder.toString();
    }

    /**
     * Minimal zone record with one spawn, one spawn group and one spawn location group.
     */
    public static String zoneRecord(int id, int dynamicMapId) {
        return String.format("""
            id: %d
            dynamicMapId: %d
            spawns:
              1: { enemyType: 101 }
            spawnGroups:
              10: { spawns: { 1: 2 } }
            spawnLocationGroups:
              20: { groupIds: [10], spotIds: [5], respawnTime: 30 }
            """, id, dynamicMapId);
    }
}
