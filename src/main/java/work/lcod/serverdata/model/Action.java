package work.lcod.serverdata.model;

import java.util.List;

/**
 * Single step of an action list.
 *
 * <p>Only the fields needed to validate the graph are modelled: the zone id of a
 * {@link ActionType#ZONE_CHANGE}, the mode of a {@link ActionType#ZONE_INSTANCE}, the nested list of
 * a {@link ActionType#DELAY} and the defeat list of a {@link ActionType#SPAWN}. Other fields in
 * content files are carried by the game server itself.
 */
public record Action(
    ActionType actionType,
    SourceContext sourceContext,
    int zoneId,
    ZoneInstanceMode mode,
    List<Action> actions,
    List<Action> defeatActions
) {
    public Action {
        if (actionType == null) {
            throw new IllegalArgumentException("actionType is required");
        }
        sourceContext = sourceContext == null ? SourceContext.SOURCE : sourceContext;
        actions = ModelCollections.list(actions);
        defeatActions = ModelCollections.list(defeatActions);
    }

    public static Action of(ActionType type) {
        return new Action(type, SourceContext.SOURCE, 0, null, null, null);
    }

    public static Action of(ActionType type, SourceContext sourceContext) {
        return new Action(type, sourceContext, 0, null, null, null);
    }

    public static Action zoneChange(int zoneId, SourceContext sourceContext) {
        return new Action(ActionType.ZONE_CHANGE, sourceContext, zoneId, null, null, null);
    }

    public static Action zoneInstance(ZoneInstanceMode mode, SourceContext sourceContext) {
        return new Action(ActionType.ZONE_INSTANCE, sourceContext, 0, mode, null, null);
    }

    public static Action delay(SourceContext sourceContext, List<Action> actions) {
        return new Action(ActionType.DELAY, sourceContext, 0, null, actions, null);
    }

    public static Action spawn(SourceContext sourceContext, List<Action> defeatActions) {
        return new Action(ActionType.SPAWN, sourceContext, 0, null, null, defeatActions);
    }
}
