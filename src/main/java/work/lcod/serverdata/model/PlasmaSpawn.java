package work.lcod.serverdata.model;

import java.util.List;

public record PlasmaSpawn(int spotId, int count, List<Action> successActions, List<Action> failActions) {
    public PlasmaSpawn {
        successActions = ModelCollections.list(successActions);
        failActions = ModelCollections.list(failActions);
    }
}
