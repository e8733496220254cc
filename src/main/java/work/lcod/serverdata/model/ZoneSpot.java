package work.lcod.serverdata.model;

import java.util.List;

/**
 * Server side behaviour attached to a client spot: actions run on enter and on leave.
 */
public record ZoneSpot(List<Action> actions, List<Action> leaveActions) {
    public ZoneSpot {
        actions = ModelCollections.list(actions);
        leaveActions = ModelCollections.list(leaveActions);
    }
}
