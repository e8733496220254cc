package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.serverdata.model.ServerShop;
import work.lcod.serverdata.model.ShopType;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.ErrorKind;
import work.lcod.serverdata.runtime.ServerDataException;

final class ShopLoader implements RecordLoader {
    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var shop = context.bind(record, ServerShop.class, path);
        int id = shop.shopId();
        var definitions = context.definitions();
        if (definitions.contains(Category.SHOP, id)) {
            throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate shop encountered: " + id);
        }
        if (shop.tabs().size() > ServerShop.MAX_TABS) {
            throw new ServerDataException(ErrorKind.INVALID_RECORD,
                "Shop with more than " + ServerShop.MAX_TABS + " tabs encountered: " + id);
        }
        definitions.register(Category.SHOP, id, shop);
        if (shop.type() == ShopType.COMP_SHOP) {
            definitions.indexCompShop(id);
        }
    }
}
