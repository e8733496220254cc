package work.lcod.serverdata.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.model.ServerScript;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;
import work.lcod.serverdata.store.DataStore;

/**
 * Script sources by declared name, split into AI scripts and everything else.
 *
 * <p>Registering a script evaluates it in a fresh engine only to call its {@code define}
 * function, which fills in the script's {@code name} and {@code type}, and to check that the
 * entry points its type requires exist. Game logic is never run here.
 */
public final class ScriptRegistry {
    public static final String DEFINE_FUNCTION = "define";
    public static final String DEFAULT_SUFFIX = ".js";

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptRegistry.class);

    private final Supplier<ScriptEngine> engineFactory;
    private volatile Map<String, ServerScript> scripts;
    private volatile Map<String, ServerScript> aiScripts;

    public ScriptRegistry(Supplier<ScriptEngine> engineFactory) {
        this(engineFactory, Map.of(), Map.of());
    }

    private ScriptRegistry(Supplier<ScriptEngine> engineFactory, Map<String, ServerScript> scripts,
        Map<String, ServerScript> aiScripts) {
        this.engineFactory = engineFactory;
        this.scripts = scripts;
        this.aiScripts = aiScripts;
    }

    /**
     * Classifies and stores a script.
     *
     * @throws ServerDataException when the script cannot be evaluated, is not defined properly,
     *     is a duplicate or misses an entry point of its type
     */
    public ServerScript registerScript(String path, String source) {
        try (ScriptEngine engine = engineFactory.get()) {
            try {
                engine.evaluate(source);
            } catch (IllegalArgumentException ex) {
                throw new ServerDataException(ErrorKind.MALFORMED_RECORD,
                    "Improperly formatted script encountered: " + path, ex);
            }
            if (!engine.hasFunction(DEFINE_FUNCTION)) {
                throw new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Invalid script encountered: " + path);
            }

            var fields = new ScriptFields("name", "type");
            Object result;
            try {
                result = engine.callFunction(DEFINE_FUNCTION, fields);
            } catch (IllegalArgumentException ex) {
                throw new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Script is not properly defined: " + path, ex);
            }
            String name = fields.getString("name");
            String type = fields.getString("type");
            if (!(result instanceof Number number) || number.intValue() != 0
                || name == null || name.isEmpty() || type == null || type.isEmpty()) {
                throw new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Script is not properly defined: " + path);
            }

            var script = new ServerScript(name, type, path, source);
            if (script.isAi()) {
                if (aiScripts.containsKey(name)) {
                    throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate AI script encountered: " + name);
                }
            } else if (scripts.containsKey(name)) {
                throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate script encountered: " + name);
            }

            var contract = ScriptContract.forType(type).orElseThrow(() ->
                new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Invalid script type encountered: " + type));
            if (!engine.hasFunction(contract.requiredFunction())) {
                throw new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Script of type " + contract.type()
                    + " encountered with no '" + contract.requiredFunction() + "' function: " + name);
            }
            if (contract.reservedFunction() != null && engine.hasFunction(contract.reservedFunction())) {
                throw new ServerDataException(ErrorKind.SCRIPT_CONTRACT, "Script of type " + contract.type()
                    + " encountered with reserved function name '" + contract.reservedFunction() + "': " + name);
            }

            if (script.isAi()) {
                aiScripts = with(aiScripts, script);
            } else {
                scripts = with(scripts, script);
            }
            return script;
        }
    }

    /**
     * Registers every script file under {@code path}.
     *
     * @param keep when {@code false} the scripts are checked against this registry but not kept
     * @return the scripts loaded by this call
     */
    public List<ServerScript> loadScripts(DataStore store, String path, String suffix, boolean keep) {
        var target = keep ? this : new ScriptRegistry(engineFactory, scripts, aiScripts);
        var loaded = new ArrayList<ServerScript>();
        List<String> files;
        try {
            files = store.listFiles(path, true);
        } catch (IOException ex) {
            throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Failed to list scripts under " + path, ex);
        }
        for (String file : files) {
            if (!file.endsWith(suffix)) {
                continue;
            }
            try {
                String source = new String(store.readFile(file), StandardCharsets.UTF_8);
                loaded.add(target.registerScript(file, source));
            } catch (IOException ex) {
                throw new ServerDataException(ErrorKind.MALFORMED_RECORD, "Failed to read script file: " + file, ex);
            } catch (ServerDataException ex) {
                LOGGER.error("Failed to load script file: {}", file);
                throw ex;
            }
            LOGGER.debug("Loaded script file: {}", file);
        }
        return loaded;
    }

    public Optional<ServerScript> script(String name) {
        return Optional.ofNullable(scripts.get(name));
    }

    public Optional<ServerScript> aiScript(String name) {
        return Optional.ofNullable(aiScripts.get(name));
    }

    public Map<String, ServerScript> scripts() {
        return scripts;
    }

    public Map<String, ServerScript> aiScripts() {
        return aiScripts;
    }

    private static Map<String, ServerScript> with(Map<String, ServerScript> current, ServerScript script) {
        var copy = new LinkedHashMap<>(current);
        copy.put(script.name(), script);
        return Collections.unmodifiableMap(copy);
    }
}
