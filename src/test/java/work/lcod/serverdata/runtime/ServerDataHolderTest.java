package work.lcod.serverdata.runtime;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.serverdata.script.GraalScriptEngine;
import work.lcod.serverdata.script.ScriptRegistry;
import work.lcod.serverdata.support.ZoneFixture;

final class ServerDataHolderTest {
    private static ServerDataSnapshot snapshot(int zoneId) {
        var zone = ZoneFixture.create().zone(zoneId, zoneId);
        var definitions = DefinitionRegistry.builder().register(Category.ZONE, zone.key(), zone).build();
        return ServerDataSnapshot.of(definitions, new ScriptRegistry(GraalScriptEngine::new));
    }

    @Test
    void reloadSwapsWholeSnapshot() {
        var initial = snapshot(1);
        var holder = new ServerDataHolder(initial);
        var replacement = snapshot(2);

        var previous = holder.reload(() -> replacement);

        assertSame(initial, previous);
        assertSame(replacement, holder.current());
    }

    @Test
    void failedReloadKeepsCurrentSnapshot() {
        var initial = snapshot(1);
        var holder = new ServerDataHolder(initial);

        assertThrows(ServerDataException.class, () -> holder.reload(() -> {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate zone encountered: 1");
        }));

        assertSame(initial, holder.current());
    }
}
