package work.lcod.serverdata.validation;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.model.Action;
import work.lcod.serverdata.model.SourceContext;
import work.lcod.serverdata.model.ZoneInstanceMode;
import work.lcod.serverdata.model.ZoneTrigger;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Walks action lists (and the lists nested in them) before they are registered.
 *
 * <p>Zone changing actions before the end of a list outside of an event are only reported.
 * Actions that need a player target are rejected when the list can run without one.
 */
public final class ActionValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ActionValidator.class);

    /**
     * Validates {@code actions} and returns the ordering advisories found, already logged.
     *
     * @param source label naming where the list is defined, used in messages
     * @param autoContext whether the list may run without a player (enemy or system fired)
     * @param inEvent whether the list is the body of an event, which disables ordering advisories
     * @throws ServerDataException with {@link ErrorKind#CONTEXT_VIOLATION} on a player-only action
     *     reachable from a non-player context
     */
    public List<String> validate(List<Action> actions, String source, boolean autoContext, boolean inEvent) {
        var advisories = new ArrayList<String>();
        walk(actions, source, autoContext, inEvent, advisories);
        return advisories;
    }

    public List<String> validate(List<Action> actions, String source, boolean autoContext) {
        return validate(actions, source, autoContext, false);
    }

    /**
     * Trigger kinds fired by a player action start in a player context; every other trigger
     * is fired by the zone itself.
     */
    public static boolean triggerIsAutoContext(ZoneTrigger trigger) {
        return switch (trigger.trigger()) {
            case ON_DEATH, ON_DIASPORA_BASE_CAPTURE, ON_FLAG_SET, ON_PVP_BASE_CAPTURE, ON_PVP_COMPLETE, ON_REVIVAL,
                ON_ZONE_IN, ON_ZONE_OUT -> false;
            default -> true;
        };
    }

    private void walk(List<Action> actions, String source, boolean autoContext, boolean inEvent, List<String> advisories) {
        int count = actions.size();
        for (int index = 0; index < count; index++) {
            var action = actions.get(index);
            if (!inEvent && index + 1 < count && changesZone(action)) {
                var message = "Zone change action encountered mid-action set in a context outside of an event."
                    + " This can cause unexpected behavior for multi-channel setups."
                    + " Move to the end of the set to avoid errors: " + source;
                LOGGER.warn(message);
                advisories.add(message);
            }

            boolean autoCtx = autoContext && (action.sourceContext() == SourceContext.ENEMIES
                || action.sourceContext() == SourceContext.SOURCE);
            switch (action.actionType().requirement()) {
                case NESTED -> walkNested(action, source, autoCtx, advisories);
                case PLAYER -> {
                    if (autoCtx) {
                        throw new ServerDataException(ErrorKind.CONTEXT_VIOLATION,
                            "Non-player context with player required action type " + action.actionType()
                                + " encountered: " + source);
                    }
                }
                default -> {
                    // no player requirement
                }
            }
        }
    }

    private void walkNested(Action action, String source, boolean autoContext, List<String> advisories) {
        switch (action.actionType()) {
            case DELAY -> walk(action.actions(), source + " => Delay Actions", autoContext, false, advisories);
            case SPAWN -> walk(action.defeatActions(), source + " => Defeat Actions", autoContext, false, advisories);
            default -> throw new IllegalStateException("No nested action list for " + action.actionType());
        }
    }

    private static boolean changesZone(Action action) {
        return switch (action.actionType()) {
            case ZONE_CHANGE -> action.zoneId() != 0;
            case ZONE_INSTANCE -> action.mode() != null && joinsInstance(action.mode());
            default -> false;
        };
    }

    private static boolean joinsInstance(ZoneInstanceMode mode) {
        return switch (mode) {
            case JOIN, CLAN_JOIN, TEAM_JOIN, TEAM_PVP -> true;
            default -> false;
        };
    }
}
