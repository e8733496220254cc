package work.lcod.serverdata.runtime;

import work.lcod.serverdata.compose.ZonePartialComposer;
import work.lcod.serverdata.script.ScriptRegistry;

/**
 * Everything one successful load produced.
 */
public record ServerDataSnapshot(DefinitionRegistry definitions, ScriptRegistry scripts, ZonePartialComposer composer) {
    public static ServerDataSnapshot of(DefinitionRegistry definitions, ScriptRegistry scripts) {
        return new ServerDataSnapshot(definitions, scripts, new ZonePartialComposer(definitions));
    }
}
