package work.lcod.serverdata.model;

import java.util.List;

public record DemonPresent(int id, List<Integer> commonItems, List<Integer> uncommonItems, List<Integer> rareItems) {
    public DemonPresent {
        commonItems = ModelCollections.list(commonItems);
        uncommonItems = ModelCollections.list(uncommonItems);
        rareItems = ModelCollections.list(rareItems);
    }
}
