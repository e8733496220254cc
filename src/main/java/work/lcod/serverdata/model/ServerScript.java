package work.lcod.serverdata.model;

import java.util.Locale;

/**
 * Script source registered under the name it declares.
 */
public record ServerScript(String name, String type, String path, String source) {
    public static final String AI_TYPE = "ai";

    public boolean isAi() {
        return AI_TYPE.equals(type.toLowerCase(Locale.ROOT));
    }
}
