package work.lcod.serverdata.runtime;

import work.lcod.serverdata.model.AILogicGroup;
import work.lcod.serverdata.model.DemonPresent;
import work.lcod.serverdata.model.DemonQuestReward;
import work.lcod.serverdata.model.DropSet;
import work.lcod.serverdata.model.Event;
import work.lcod.serverdata.model.ServerShop;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.model.ServerZoneInstance;
import work.lcod.serverdata.model.ServerZoneInstanceVariant;
import work.lcod.serverdata.model.ServerZonePartial;
import work.lcod.serverdata.model.ZoneKey;

/**
 * Typed key of one definition map in the {@link DefinitionRegistry}.
 *
 * @param <K> id type
 * @param <V> definition type
 */
public final class Category<K, V> {
    public static final Category<ZoneKey, ServerZone> ZONE = new Category<>("zone", ServerZone.class);
    public static final Category<Integer, ServerZonePartial> ZONE_PARTIAL =
        new Category<>("zone partial", ServerZonePartial.class);
    public static final Category<String, Event> EVENT = new Category<>("event", Event.class);
    public static final Category<Integer, ServerZoneInstance> ZONE_INSTANCE =
        new Category<>("zone instance", ServerZoneInstance.class);
    public static final Category<Integer, ServerZoneInstanceVariant> ZONE_INSTANCE_VARIANT =
        new Category<>("zone instance variant", ServerZoneInstanceVariant.class);
    public static final Category<Integer, ServerShop> SHOP = new Category<>("shop", ServerShop.class);
    public static final Category<Integer, AILogicGroup> AI_LOGIC_GROUP =
        new Category<>("AI logic group", AILogicGroup.class);
    public static final Category<Integer, DemonPresent> DEMON_PRESENT =
        new Category<>("demon present", DemonPresent.class);
    public static final Category<Integer, DemonQuestReward> DEMON_QUEST_REWARD =
        new Category<>("demon quest reward", DemonQuestReward.class);
    public static final Category<Integer, DropSet> DROP_SET = new Category<>("drop set", DropSet.class);

    private final String name;
    private final Class<V> valueType;

    private Category(String name, Class<V> valueType) {
        this.name = name;
        this.valueType = valueType;
    }

    public String name() {
        return name;
    }

    public Class<V> valueType() {
        return valueType;
    }

    @Override
    public String toString() {
        return name;
    }
}
