package work.lcod.serverdata.loader;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.ToIntFunction;
import work.lcod.serverdata.model.DropSet;
import work.lcod.serverdata.runtime.Category;

/**
 * Loader for the categories that only need a unique integer id.
 */
class KeyedRecordLoader<V> implements RecordLoader {
    private final Category<Integer, V> category;
    private final ToIntFunction<V> idOf;

    KeyedRecordLoader(Category<Integer, V> category, ToIntFunction<V> idOf) {
        this.category = category;
        this.idOf = idOf;
    }

    @Override
    public void load(JsonNode record, String path, LoadContext context) {
        var definition = context.bind(record, category.valueType(), path);
        int id = idOf.applyAsInt(definition);
        context.definitions().register(category, id, definition);
        registered(id, definition, context);
    }

    protected void registered(int id, V definition, LoadContext context) {}

    static final class DropSets extends KeyedRecordLoader<DropSet> {
        DropSets() {
            super(Category.DROP_SET, DropSet::id);
        }

        @Override
        protected void registered(int id, DropSet dropSet, LoadContext context) {
            if (dropSet.giftBoxId() != 0) {
                context.definitions().indexGiftBox(dropSet.giftBoxId(), id);
            }
        }
    }
}
