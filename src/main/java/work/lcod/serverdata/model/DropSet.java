package work.lcod.serverdata.model;

import java.util.List;

/**
 * Drop table; a non-zero {@code giftBoxId} also makes it reachable as a gift box.
 */
public record DropSet(int id, int giftBoxId, List<ItemDrop> drops) {
    public DropSet {
        drops = ModelCollections.list(drops);
    }
}
