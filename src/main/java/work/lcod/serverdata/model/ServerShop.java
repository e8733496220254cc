package work.lcod.serverdata.model;

import java.util.List;

public record ServerShop(int shopId, ShopType type, List<ShopTab> tabs) {
    public static final int MAX_TABS = 100;

    public ServerShop {
        type = type == null ? ShopType.NORMAL : type;
        tabs = ModelCollections.list(tabs);
    }
}
