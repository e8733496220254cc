package work.lcod.serverdata.model;

import java.util.List;

public record ServerObject(int id, int spotId, float x, float y, float rotation, int state, List<Action> actions)
    implements PositionedEntity {
    public ServerObject {
        actions = ModelCollections.list(actions);
    }
}
