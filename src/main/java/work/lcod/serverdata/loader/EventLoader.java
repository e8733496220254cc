package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.serverdata.model.Event;
import work.lcod.serverdata.model.EventType;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

final class EventLoader implements RecordLoader {
    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var event = context.bind(record, Event.class, path);
        if (event.id() == null || event.id().isEmpty()) {
            throw new ServerDataException(ErrorKind.INVALID_RECORD, "Event with no ID encountered: " + path);
        }
        var definitions = context.definitions();
        if (definitions.contains(Category.EVENT, event.id())) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate event encountered: " + event.id());
        }
        if (event.eventType() == EventType.PERFORM_ACTIONS) {
            context.validator().validate(event.actions(), event.id(), false, true);
        }
        definitions.register(Category.EVENT, event.id(), event);
    }
}
