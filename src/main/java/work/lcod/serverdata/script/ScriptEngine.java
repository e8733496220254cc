package work.lcod.serverdata.script;

/**
 * Embedded script interpreter. One engine holds the global state of the sources evaluated in it.
 */
public interface ScriptEngine extends AutoCloseable {
    /**
     * Evaluates {@code source} in the global scope.
     *
     * @throws IllegalArgumentException when the source cannot be parsed or its top level fails
     */
    void evaluate(String source);

    boolean hasFunction(String name);

    /**
     * Calls a global function. {@link ScriptFields} arguments are exposed to the script as objects
     * with those named fields; assignments made by the script are visible on the argument once the
     * call returns.
     *
     * @return the result converted to a Java value ({@code Integer}, {@code Long}, {@code Double},
     *     {@code Boolean}, {@code String}) or {@code null}
     */
    Object callFunction(String name, Object... args);

    @Override
    void close();
}
