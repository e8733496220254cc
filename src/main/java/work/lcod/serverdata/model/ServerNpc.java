package work.lcod.serverdata.model;

import java.util.List;

public record ServerNpc(int id, int spotId, float x, float y, float rotation, List<Action> actions)
    implements PositionedEntity {
    public ServerNpc {
        actions = ModelCollections.list(actions);
    }
}
