package work.lcod.serverdata.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named fields of a host value exposed to script code.
 */
public final class ScriptFields {
    private final Map<String, Object> values = new LinkedHashMap<>();

    public ScriptFields(String... names) {
        for (String name : names) {
            values.put(name, null);
        }
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : String.valueOf(value);
    }

    public ScriptFields set(String name, Object value) {
        values.put(name, value);
        return this;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
