package work.lcod.serverdata.model;

public enum ShopType {
    NORMAL,
    COMP_SHOP,
    REPAIR
}
