package work.lcod.serverdata.loader;

import work.lcod.serverdata.model.AILogicGroup;
import work.lcod.serverdata.model.DemonPresent;
import work.lcod.serverdata.model.DemonQuestReward;
import work.lcod.serverdata.runtime.Category;

/**
 * Content categories in load order, with the pack location each one is read from.
 */
public enum ContentCategory {
    AI_LOGIC_GROUP("/data/ailogicgroup", false, true, true,
        new KeyedRecordLoader<>(Category.AI_LOGIC_GROUP, AILogicGroup::id)),
    DEMON_PRESENT("/data/demonpresent", false, true, true,
        new KeyedRecordLoader<>(Category.DEMON_PRESENT, DemonPresent::id)),
    DEMON_QUEST_REWARD("/data/demonquestreward", false, true, true,
        new KeyedRecordLoader<>(Category.DEMON_QUEST_REWARD, DemonQuestReward::id)),
    DROP_SET("/data/dropset", false, true, true, new KeyedRecordLoader.DropSets()),
    ENCHANT_SET("/data/enchantset", false, true, true, new DerivedDefinitionLoader("enchantset")),
    ENCHANT_SPECIAL("/data/enchantspecial", false, true, true, new DerivedDefinitionLoader("enchantspecial")),
    S_ITEM_EXTENDED("/data/sitemextended", false, true, true, new DerivedDefinitionLoader("sitemextended")),
    S_STATUS("/data/sstatus", false, true, true, new DerivedDefinitionLoader("sstatus")),
    TOKUSEI("/data/tokusei", false, true, true, new DerivedDefinitionLoader("tokusei")),
    ZONE("/zones", false, false, false, new ZoneLoader()),
    ZONE_PARTIAL("/zones/partial", true, false, false, new ZonePartialLoader()),
    EVENT("/events", true, false, false, new EventLoader()),
    ZONE_INSTANCE("/data/zoneinstance", false, true, false, new ZoneInstanceLoader()),
    ZONE_INSTANCE_VARIANT("/data/zoneinstancevariant", false, true, false, new ZoneInstanceVariantLoader()),
    SHOP("/shops", true, false, false, new ShopLoader());

    private final String path;
    private final boolean recursive;
    private final boolean fileOrPath;
    private final boolean requiresCatalog;
    private final RecordLoader loader;

    ContentCategory(String path, boolean recursive, boolean fileOrPath, boolean requiresCatalog, RecordLoader loader) {
        this.path = path;
        this.recursive = recursive;
        this.fileOrPath = fileOrPath;
        this.requiresCatalog = requiresCatalog;
        this.loader = loader;
    }

    public String path() {
        return path;
    }

    public boolean recursive() {
        return recursive;
    }

    /** Whether a single {@code <path>.yaml} file is read when the directory has no content files. */
    public boolean fileOrPath() {
        return fileOrPath;
    }

    /** Categories only loaded when a definition catalog is available. */
    public boolean requiresCatalog() {
        return requiresCatalog;
    }

    RecordLoader loader() {
        return loader;
    }
}
