package work.lcod.serverdata.compose;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.serverdata.model.PositionedEntity;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.model.ServerZonePartial;
import work.lcod.serverdata.model.SpawnLocationGroup;
import work.lcod.serverdata.runtime.DefinitionRegistry;

/**
 * Builds zone snapshots with partials layered over the canonical definition.
 *
 * <p>Partials are applied in ascending id order, so the highest id wins on keyed entries. The
 * registry is never modified: a composed zone is a new {@link ServerZone} built from a
 * {@link ZoneDraft}, or the canonical zone itself when no partial applies.
 */
public final class ZonePartialComposer {
    /** Distance under which two spot-less placements count as the same position, per axis. */
    public static final float POSITION_TOLERANCE = 10f;

    private static final Logger LOGGER = LoggerFactory.getLogger(ZonePartialComposer.class);

    private final DefinitionRegistry registry;

    public ZonePartialComposer(DefinitionRegistry registry) {
        this.registry = registry;
    }

    public Optional<ServerZone> getComposed(int zoneId, int dynamicMapId) {
        return getComposed(zoneId, dynamicMapId, Set.of());
    }

    /**
     * Zone with its auto-apply partials and the requested extra partials applied.
     *
     * @param dynamicMapId 0 selects the first definition registered for the zone
     * @return empty when the zone is unknown or an extra partial cannot be applied to it
     */
    public Optional<ServerZone> getComposed(int zoneId, int dynamicMapId, Set<Integer> extraPartialIds) {
        var canonical = registry.zone(zoneId, dynamicMapId);
        if (canonical.isEmpty()) {
            return Optional.empty();
        }
        var zone = canonical.get();

        var partialIds = new TreeSet<>(registry.autoApplyPartialIds(zone.dynamicMapId()));
        for (int partialId : extraPartialIds) {
            var partial = registry.zonePartial(partialId);
            if (partialId == ServerZonePartial.GLOBAL_ID || partial.isEmpty() || partial.get().autoApply()
                || !partial.get().appliesTo(zone.dynamicMapId())) {
                LOGGER.error("Invalid zone partial {} requested for zone {}", partialId, zone.key());
                return Optional.empty();
            }
            partialIds.add(partialId);
        }

        if (partialIds.isEmpty()) {
            return canonical;
        }

        var draft = ZoneDraft.of(zone);
        for (int partialId : partialIds) {
            registry.zonePartial(partialId).ifPresent(partial -> applyPartial(draft, partial, true));
        }
        repair(draft);
        return Optional.of(draft.toZone());
    }

    /**
     * Applies one more partial to an already composed zone.
     *
     * @return empty when {@code zone} is the registry's own definition or the partial does not exist
     */
    public Optional<ServerZone> applyPartial(ServerZone zone, int partialId) {
        if (zone == null || partialId == ServerZonePartial.GLOBAL_ID) {
            return Optional.empty();
        }
        if (registry.isCanonical(zone)) {
            LOGGER.error("Attempted to apply partial definition to original zone definition: {}", zone.key());
            return Optional.empty();
        }
        var partial = registry.zonePartial(partialId);
        if (partial.isEmpty()) {
            LOGGER.error("Invalid zone partial ID encountered: {}", partialId);
            return Optional.empty();
        }
        var draft = ZoneDraft.of(zone);
        applyPartial(draft, partial.get(), true);
        repair(draft);
        return Optional.of(draft.toZone());
    }

    /**
     * Merges {@code partial} into {@code draft}. Placements with id 0 only remove what they
     * replace.
     *
     * @param positionReplace whether incoming NPCs and objects replace the ones at their position
     */
    public static void applyPartial(ZoneDraft draft, ServerZonePartial partial, boolean positionReplace) {
        draft.dropSetIds().addAll(partial.dropSetIds());
        draft.skillWhitelist().addAll(partial.skillWhitelist());
        draft.skillBlacklist().addAll(partial.skillBlacklist());

        place(draft.npcs(), partial.npcs(), positionReplace);
        place(draft.objects(), partial.objects(), positionReplace);

        draft.spawns().putAll(partial.spawns());
        draft.spawnGroups().putAll(partial.spawnGroups());
        draft.spawnLocationGroups().putAll(partial.spawnLocationGroups());
        draft.spots().putAll(partial.spots());

        draft.triggers().addAll(partial.triggers());
    }

    /**
     * Prunes spawn groups and spawn location groups whose references no longer resolve. A group
     * losing every reference is removed.
     */
    static void repair(ZoneDraft draft) {
        var spawnGroups = draft.spawnGroups();
        var groupIterator = spawnGroups.entrySet().iterator();
        while (groupIterator.hasNext()) {
            var entry = groupIterator.next();
            var group = entry.getValue();
            var kept = new LinkedHashMap<Integer, Integer>();
            group.spawns().forEach((spawnId, count) -> {
                if (draft.spawns().containsKey(spawnId)) {
                    kept.put(spawnId, count);
                }
            });
            if (kept.size() == group.spawns().size()) {
                continue;
            }
            if (kept.isEmpty()) {
                LOGGER.debug("Removing empty spawn group {} when generating zone: {}", entry.getKey(), draft.key());
                groupIterator.remove();
            } else {
                entry.setValue(group.withSpawns(kept));
            }
        }

        var locationIterator = draft.spawnLocationGroups().entrySet().iterator();
        while (locationIterator.hasNext()) {
            var entry = locationIterator.next();
            SpawnLocationGroup location = entry.getValue();
            var kept = new LinkedHashSet<Integer>();
            for (int groupId : location.groupIds()) {
                if (spawnGroups.containsKey(groupId)) {
                    kept.add(groupId);
                }
            }
            if (kept.size() == location.groupIds().size()) {
                continue;
            }
            if (kept.isEmpty()) {
                LOGGER.debug("Removing empty spawn location group {} when generating zone: {}",
                    entry.getKey(), draft.key());
                locationIterator.remove();
            } else {
                entry.setValue(location.withGroupIds(kept));
            }
        }
    }

    private static <T extends PositionedEntity> void place(List<T> current, List<T> incoming, boolean positionReplace) {
        for (T placement : incoming) {
            if (positionReplace) {
                Iterator<T> iterator = current.iterator();
                while (iterator.hasNext()) {
                    if (samePosition(iterator.next(), placement)) {
                        iterator.remove();
                    }
                }
            }
            if (placement.id() != 0) {
                current.add(placement);
            }
        }
    }

    private static boolean samePosition(PositionedEntity existing, PositionedEntity incoming) {
        if (incoming.spotId() != 0) {
            return existing.spotId() == incoming.spotId();
        }
        return existing.spotId() == 0
            && Math.abs(existing.x() - incoming.x()) < POSITION_TOLERANCE
            && Math.abs(existing.y() - incoming.y()) < POSITION_TOLERANCE;
    }
}
