package work.lcod.serverdata.model;

import java.util.List;

public record ZoneTrigger(TriggerKind trigger, int value, List<Action> actions) {
    public ZoneTrigger {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger is required");
        }
        actions = ModelCollections.list(actions);
    }
}
