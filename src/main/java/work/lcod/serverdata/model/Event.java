package work.lcod.serverdata.model;

import java.util.List;

/**
 * Event definition. Only {@link EventType#PERFORM_ACTIONS} events carry {@code actions}.
 */
public record Event(String id, EventType eventType, String next, List<Action> actions) {
    public Event {
        eventType = eventType == null ? EventType.FORK : eventType;
        actions = ModelCollections.list(actions);
    }
}
