package work.lcod.serverdata.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.serverdata.model.AILogicGroup;
import work.lcod.serverdata.model.DemonPresent;
import work.lcod.serverdata.model.DemonQuestReward;
import work.lcod.serverdata.model.DropSet;
import work.lcod.serverdata.model.Event;
import work.lcod.serverdata.model.PvpMatchType;
import work.lcod.serverdata.model.ServerShop;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.model.ServerZoneInstance;
import work.lcod.serverdata.model.ServerZoneInstanceVariant;
import work.lcod.serverdata.model.ServerZonePartial;
import work.lcod.serverdata.model.ZoneKey;

/**
 * Canonical definitions by category and id, plus the secondary indexes built while loading.
 *
 * <p>Instances are only created through {@link Builder#build()} and never change afterwards, so
 * they can be read from any number of threads without locking.
 */
public final class DefinitionRegistry {
    private final Map<Category<?, ?>, Map<Object, Object>> definitions;
    private final Map<Integer, List<Integer>> dynamicMapIdsByZone;
    private final List<ZoneKey> fieldZones;
    private final Map<Integer, Set<Integer>> autoApplyPartials;
    private final Map<PvpMatchType, Set<Integer>> standardPvpVariants;
    private final List<Integer> compShopIds;
    private final Map<Integer, Integer> giftBoxDropSets;

    private DefinitionRegistry(Builder builder) {
        var frozen = new HashMap<Category<?, ?>, Map<Object, Object>>();
        builder.definitions.forEach((category, entries) ->
            frozen.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(entries))));
        this.definitions = Collections.unmodifiableMap(frozen);

        var dynamicIds = new HashMap<Integer, List<Integer>>();
        builder.dynamicMapIdsByZone.forEach((zoneId, ids) -> dynamicIds.put(zoneId, List.copyOf(ids)));
        this.dynamicMapIdsByZone = Collections.unmodifiableMap(dynamicIds);

        this.fieldZones = List.copyOf(builder.fieldZones);

        var partials = new HashMap<Integer, Set<Integer>>();
        builder.autoApplyPartials.forEach((dynamicMapId, ids) ->
            partials.put(dynamicMapId, Collections.unmodifiableSet(new TreeSet<>(ids))));
        this.autoApplyPartials = Collections.unmodifiableMap(partials);

        var pvp = new EnumMap<PvpMatchType, Set<Integer>>(PvpMatchType.class);
        builder.standardPvpVariants.forEach((type, ids) -> pvp.put(type, Collections.unmodifiableSet(new TreeSet<>(ids))));
        this.standardPvpVariants = Collections.unmodifiableMap(pvp);

        this.compShopIds = List.copyOf(builder.compShopIds);
        this.giftBoxDropSets = Map.copyOf(builder.giftBoxDropSets);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DefinitionRegistry empty() {
        return builder().build();
    }

    public <K, V> Optional<V> lookup(Category<K, V> category, K id) {
        var entries = definitions.get(category);
        if (entries == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(category.valueType().cast(entries.get(id)));
    }

    @SuppressWarnings("unchecked")
    public <K, V> Map<K, V> entries(Category<K, V> category) {
        var entries = definitions.get(category);
        return entries == null ? Map.of() : (Map<K, V>) entries;
    }

    /**
     * Canonical zone definition. A {@code dynamicMapId} of 0 selects the first definition
     * registered for the zone id.
     */
    public Optional<ServerZone> zone(int zoneId, int dynamicMapId) {
        if (dynamicMapId != 0) {
            return lookup(Category.ZONE, new ZoneKey(zoneId, dynamicMapId));
        }
        var ids = dynamicMapIdsByZone.get(zoneId);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        return lookup(Category.ZONE, new ZoneKey(zoneId, ids.get(0)));
    }

    public boolean isCanonical(ServerZone zone) {
        return zone != null && lookup(Category.ZONE, zone.key()).orElse(null) == zone;
    }

    public Map<Integer, Set<Integer>> allZoneIds() {
        var result = new LinkedHashMap<Integer, Set<Integer>>();
        dynamicMapIdsByZone.forEach((zoneId, ids) -> result.put(zoneId, Collections.unmodifiableSet(new TreeSet<>(ids))));
        return Collections.unmodifiableMap(result);
    }

    public List<ZoneKey> fieldZoneIds() {
        return fieldZones;
    }

    public Optional<ServerZonePartial> zonePartial(int id) {
        return lookup(Category.ZONE_PARTIAL, id);
    }

    /**
     * Ids of the auto-apply partials targeting a dynamic map, ascending.
     */
    public Set<Integer> autoApplyPartialIds(int dynamicMapId) {
        return autoApplyPartials.getOrDefault(dynamicMapId, Set.of());
    }

    public Optional<ServerZoneInstance> zoneInstance(int id) {
        return lookup(Category.ZONE_INSTANCE, id);
    }

    public Set<Integer> allZoneInstanceIds() {
        return Collections.unmodifiableSet(new TreeSet<>(entries(Category.ZONE_INSTANCE).keySet()));
    }

    public boolean existsInInstance(int instanceId, int zoneId, int dynamicMapId) {
        return zoneInstance(instanceId).map(inst -> inst.contains(zoneId, dynamicMapId)).orElse(false);
    }

    public Optional<ServerZoneInstanceVariant> zoneInstanceVariant(int id) {
        return lookup(Category.ZONE_INSTANCE_VARIANT, id);
    }

    public Set<Integer> standardPvpVariantIds(PvpMatchType type) {
        return standardPvpVariants.getOrDefault(type, Set.of());
    }

    public Optional<Event> event(String id) {
        return lookup(Category.EVENT, id);
    }

    public Optional<ServerShop> shop(int id) {
        return lookup(Category.SHOP, id);
    }

    public List<Integer> compShopIds() {
        return compShopIds;
    }

    public Optional<AILogicGroup> aiLogicGroup(int id) {
        return lookup(Category.AI_LOGIC_GROUP, id);
    }

    public Optional<DemonPresent> demonPresent(int id) {
        return lookup(Category.DEMON_PRESENT, id);
    }

    public Map<Integer, DemonQuestReward> demonQuestRewards() {
        return entries(Category.DEMON_QUEST_REWARD);
    }

    public Optional<DropSet> dropSet(int id) {
        return lookup(Category.DROP_SET, id);
    }

    public Optional<DropSet> giftDropSet(int giftBoxId) {
        var dropSetId = giftBoxDropSets.get(giftBoxId);
        return dropSetId == null ? Optional.empty() : dropSet(dropSetId);
    }

    public int size(Category<?, ?> category) {
        var entries = definitions.get(category);
        return entries == null ? 0 : entries.size();
    }

    /**
     * Mutable side of the registry used by the loaders. Later categories read earlier ones
     * through {@link #lookup}.
     */
    public static final class Builder {
        private final Map<Category<?, ?>, Map<Object, Object>> definitions = new HashMap<>();
        private final Map<Integer, List<Integer>> dynamicMapIdsByZone = new HashMap<>();
        private final List<ZoneKey> fieldZones = new ArrayList<>();
        private final Map<Integer, Set<Integer>> autoApplyPartials = new HashMap<>();
        private final Map<PvpMatchType, Set<Integer>> standardPvpVariants = new EnumMap<>(PvpMatchType.class);
        private final List<Integer> compShopIds = new ArrayList<>();
        private final Map<Integer, Integer> giftBoxDropSets = new HashMap<>();

        private Builder() {}

        public <K, V> Builder register(Category<K, V> category, K id, V definition) {
            var entries = definitions.computeIfAbsent(category, ignored -> new LinkedHashMap<>());
            if (entries.containsKey(id)) {
                throw new ServerDataException(ErrorKind.DUPLICATE_ID, "Duplicate " + category + " encountered: " + id);
            }
            entries.put(id, definition);
            if (category == Category.ZONE) {
                var key = (ZoneKey) id;
                dynamicMapIdsByZone.computeIfAbsent(key.zoneId(), ignored -> new ArrayList<>()).add(key.dynamicMapId());
            }
            return this;
        }

        public <K, V> Optional<V> lookup(Category<K, V> category, K id) {
            var entries = definitions.get(category);
            if (entries == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(category.valueType().cast(entries.get(id)));
        }

        public <K> boolean contains(Category<K, ?> category, K id) {
            var entries = definitions.get(category);
            return entries != null && entries.containsKey(id);
        }

        public Builder markFieldZone(ZoneKey key) {
            fieldZones.add(key);
            return this;
        }

        public Builder indexAutoApplyPartial(int dynamicMapId, int partialId) {
            autoApplyPartials.computeIfAbsent(dynamicMapId, ignored -> new LinkedHashSet<>()).add(partialId);
            return this;
        }

        public Builder indexStandardPvpVariant(PvpMatchType type, int variantId) {
            standardPvpVariants.computeIfAbsent(type, ignored -> new LinkedHashSet<>()).add(variantId);
            return this;
        }

        public Builder indexCompShop(int shopId) {
            compShopIds.add(shopId);
            return this;
        }

        public Builder indexGiftBox(int giftBoxId, int dropSetId) {
            if (giftBoxDropSets.containsKey(giftBoxId)) {
                throw new ServerDataException(ErrorKind.DUPLICATE_ID,
                    "Duplicate drop set gift box ID encountered: " + giftBoxId);
            }
            giftBoxDropSets.put(giftBoxId, dropSetId);
            return this;
        }

        public DefinitionRegistry build() {
            return new DefinitionRegistry(this);
        }
    }
}
