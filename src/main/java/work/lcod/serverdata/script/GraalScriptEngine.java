package work.lcod.serverdata.script;

import java.util.HashMap;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * {@link ScriptEngine} running JavaScript through GraalVM polyglot.
 */
public final class GraalScriptEngine implements ScriptEngine {
    private static final String LANGUAGE = "js";

    private final Context context;

    public GraalScriptEngine() {
        this.context = Context
            .newBuilder(LANGUAGE)
            .allowHostAccess(HostAccess.NONE)
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2023")
            .build();
    }

    @Override
    public void evaluate(String source) {
        try {
            context.eval(LANGUAGE, source);
        } catch (PolyglotException ex) {
            throw new IllegalArgumentException("Script evaluation failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean hasFunction(String name) {
        Value member = context.getBindings(LANGUAGE).getMember(name);
        return member != null && member.canExecute();
    }

    @Override
    public Object callFunction(String name, Object... args) {
        Value function = context.getBindings(LANGUAGE).getMember(name);
        if (function == null || !function.canExecute()) {
            throw new IllegalArgumentException("Script function not defined: " + name);
        }
        Object[] arguments = new Object[args.length];
        Map<Integer, Map<String, Object>> exposed = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof ScriptFields fields) {
                Map<String, Object> backing = new HashMap<>(fields.asMap());
                exposed.put(i, backing);
                arguments[i] = ProxyObject.fromMap(backing);
            } else {
                arguments[i] = args[i];
            }
        }
        try {
            Value result = function.execute(arguments);
            return valueToJava(result);
        } catch (PolyglotException ex) {
            throw new IllegalArgumentException("Script function " + name + " failed: " + ex.getMessage(), ex);
        } finally {
            exposed.forEach((index, backing) -> {
                var fields = (ScriptFields) args[index];
                backing.forEach((key, value) -> fields.set(key, value instanceof Value v ? valueToJava(v) : value));
            });
        }
    }

    @Override
    public void close() {
        context.close();
    }

    private static Object valueToJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) {
                return value.asInt();
            }
            if (value.fitsInLong()) {
                return value.asLong();
            }
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        return value.toString();
    }
}
