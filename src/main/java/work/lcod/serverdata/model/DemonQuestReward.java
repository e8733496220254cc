package work.lcod.serverdata.model;

import java.util.List;

public record DemonQuestReward(int id, int levelMin, int levelMax, List<Integer> dropSetIds) {
    public DemonQuestReward {
        dropSetIds = ModelCollections.list(dropSetIds);
    }
}
