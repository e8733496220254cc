package work.lcod.serverdata.script;

import java.util.Locale;
import java.util.Optional;

/**
 * Entry points a script must (and must not) define for its declared type.
 */
public enum ScriptContract {
    AI("ai", "prepare", null),
    EVENT_CONDITION("eventcondition", "check", null),
    EVENT_BRANCH_LOGIC("eventbranchlogic", "check", null),
    ACTION_TRANSFORM("actiontransform", "transform", "prepare"),
    EVENT_TRANSFORM("eventtransform", "transform", "prepare"),
    ACTION_CUSTOM("actioncustom", "run", null),
    WEB_GAME("webgame", "start", null);

    private final String type;
    private final String requiredFunction;
    private final String reservedFunction;

    ScriptContract(String type, String requiredFunction, String reservedFunction) {
        this.type = type;
        this.requiredFunction = requiredFunction;
        this.reservedFunction = reservedFunction;
    }

    public static Optional<ScriptContract> forType(String declaredType) {
        if (declaredType == null) {
            return Optional.empty();
        }
        String normalized = declaredType.toLowerCase(Locale.ROOT);
        for (ScriptContract contract : values()) {
            if (contract.type.equals(normalized)) {
                return Optional.of(contract);
            }
        }
        return Optional.empty();
    }

    public String type() {
        return type;
    }

    public String requiredFunction() {
        return requiredFunction;
    }

    /** Function name the script may not define, or {@code null}. */
    public String reservedFunction() {
        return reservedFunction;
    }
}
