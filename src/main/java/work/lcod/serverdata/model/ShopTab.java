package work.lcod.serverdata.model;

import java.util.List;

public record ShopTab(String name, List<Integer> productIds) {
    public ShopTab {
        productIds = ModelCollections.list(productIds);
    }
}
