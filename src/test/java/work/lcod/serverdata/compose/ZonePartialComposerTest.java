package work.lcod.serverdata.compose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.serverdata.model.ServerNpc;
import work.lcod.serverdata.model.ServerObject;
import work.lcod.serverdata.model.ServerZone;
import work.lcod.serverdata.model.ServerZonePartial;
import work.lcod.serverdata.model.Spawn;
import work.lcod.serverdata.model.TriggerKind;
import work.lcod.serverdata.runtime.Category;
import work.lcod.serverdata.runtime.DefinitionRegistry;
import work.lcod.serverdata.support.ZoneFixture;

final class ZonePartialComposerTest {
    private static ServerZone baseZone() {
        return ZoneFixture.create()
            .spawn(1, 101)
            .spawn(2, 102)
            .spawnGroup(10, 1)
            .spawnGroup(11, 2)
            .locationGroup(20, 10, 11)
            .locationGroup(21, 11)
            .npc(1000, 7, 0f, 0f)
            .object(2000, 0, 105f, 108f)
            .object(2001, 0, 115f, 100f)
            .object(2002, 5, 100f, 100f)
            .whitelist(1)
            .dropSets(50)
            .trigger(TriggerKind.ON_SETUP)
            .zone(1, 1);
    }

    private static DefinitionRegistry registry(ServerZone zone, ServerZonePartial... partials) {
        var builder = DefinitionRegistry.builder().register(Category.ZONE, zone.key(), zone);
        for (var partial : partials) {
            builder.register(Category.ZONE_PARTIAL, partial.id(), partial);
            if (partial.autoApply()) {
                partial.dynamicMapIds().forEach(dynamicMapId -> builder.indexAutoApplyPartial(dynamicMapId, partial.id()));
            }
        }
        return builder.build();
    }

    @Test
    void returnsCanonicalZoneWhenNoPartialApplies() {
        var zone = baseZone();
        var composer = new ZonePartialComposer(registry(zone, ZoneFixture.create().autoApply(2).partial(5)));

        var composed = composer.getComposed(1, 1).orElseThrow();

        assertSame(zone, composed);
    }

    @Test
    void unknownZoneYieldsNothing() {
        var composer = new ZonePartialComposer(registry(baseZone()));

        assertTrue(composer.getComposed(2, 2).isEmpty());
        assertTrue(composer.getComposed(1, 9).isEmpty());
    }

    @Test
    void dynamicMapZeroSelectsFirstRegisteredZone() {
        var first = ZoneFixture.create().zone(1, 1);
        var second = ZoneFixture.create().zone(1, 2);
        var registry = DefinitionRegistry.builder()
            .register(Category.ZONE, first.key(), first)
            .register(Category.ZONE, second.key(), second)
            .build();

        assertSame(first, new ZonePartialComposer(registry).getComposed(1, 0).orElseThrow());
    }

    @Test
    void autoApplyPartialIsMergedIntoCopy() {
        var zone = baseZone();
        var partial = ZoneFixture.create()
            .autoApply(1)
            .spawn(3, 103)
            .whitelist(2)
            .blacklist(9)
            .dropSets(50, 51)
            .trigger(TriggerKind.ON_SETUP)
            .partial(5);

        var composed = new ZonePartialComposer(registry(zone, partial)).getComposed(1, 1).orElseThrow();

        assertNotSame(zone, composed);
        assertEquals(Set.of(1, 2, 3), composed.spawns().keySet());
        assertEquals(Set.of(1, 2), composed.skillWhitelist());
        assertEquals(Set.of(9), composed.skillBlacklist());
        assertEquals(Set.of(50, 51), composed.dropSetIds());
        assertEquals(2, composed.triggers().size(), "triggers are appended without deduplication");
        assertEquals(Set.of(1, 2), zone.spawns().keySet(), "canonical zone untouched");
    }

    @Test
    void spawnGroupsLosingEveryReferenceAreRemovedAndLocationGroupsRepaired() {
        var zone = baseZone();
        var partial = ZoneFixture.create()
            .autoApply(1)
            .spawnGroup(11, 99)
            .partial(5);

        var composed = new ZonePartialComposer(registry(zone, partial)).getComposed(1, 1).orElseThrow();

        assertFalse(composed.spawnGroups().containsKey(11));
        assertEquals(Set.of(10), composed.spawnLocationGroups().get(20).groupIds());
        assertFalse(composed.spawnLocationGroups().containsKey(21));
        composed.spawnLocationGroups().values()
            .forEach(location -> assertTrue(composed.spawnGroups().keySet().containsAll(location.groupIds())));
        assertEquals(Set.of(10, 11), zone.spawnLocationGroups().get(20).groupIds(), "canonical zone untouched");
    }

    @Test
    void spawnGroupsLosingSomeReferencesArePruned() {
        var partial = ZoneFixture.create()
            .autoApply(1)
            .spawnGroup(10, 1, 98)
            .partial(5);

        var composed = new ZonePartialComposer(registry(baseZone(), partial)).getComposed(1, 1).orElseThrow();

        assertEquals(Map.of(1, 1), composed.spawnGroups().get(10).spawns());
    }

    @Test
    void npcWithSpotReplacesNpcAtSameSpot() {
        var partial = ZoneFixture.create().autoApply(1).npc(1001, 7, 500f, 500f).partial(5);

        var composed = new ZonePartialComposer(registry(baseZone(), partial)).getComposed(1, 1).orElseThrow();

        List<ServerNpc> atSpot = composed.npcs().stream().filter(npc -> npc.spotId() == 7).collect(Collectors.toList());
        assertEquals(1, atSpot.size());
        assertEquals(1001, atSpot.get(0).id());
    }

    @Test
    void objectWithoutSpotReplacesObjectsWithinTolerance() {
        var partial = ZoneFixture.create().autoApply(1).object(2100, 0, 100f, 100f).partial(5);

        var composed = new ZonePartialComposer(registry(baseZone(), partial)).getComposed(1, 1).orElseThrow();

        var ids = composed.objects().stream().map(ServerObject::id).collect(Collectors.toSet());
        assertEquals(Set.of(2001, 2002, 2100), ids);
    }

    @Test
    void placementWithIdZeroOnlyDeletes() {
        var partial = ZoneFixture.create()
            .autoApply(1)
            .npc(0, 7, 0f, 0f)
            .object(0, 0, 110f, 105f)
            .partial(5);

        var composed = new ZonePartialComposer(registry(baseZone(), partial)).getComposed(1, 1).orElseThrow();

        assertTrue(composed.npcs().isEmpty());
        var ids = composed.objects().stream().map(ServerObject::id).collect(Collectors.toSet());
        assertEquals(Set.of(2002), ids);
    }

    @Test
    void partialsApplyInAscendingIdOrder() {
        var low = ZoneFixture.create().autoApply(1).spawn(1, 102).partial(3);
        var high = ZoneFixture.create().autoApply(1).spawn(1, 103).partial(8);

        var composed = new ZonePartialComposer(registry(baseZone(), high, low)).getComposed(1, 1).orElseThrow();

        assertEquals(103, composed.spawns().get(1).enemyType());
    }

    @Test
    void extraPartialIsApplied() {
        var extra = ZoneFixture.create().restrictTo(1, 2).spawn(4, 101).partial(6);
        var unrestricted = ZoneFixture.create().spot(3).partial(7);

        var composed = new ZonePartialComposer(registry(baseZone(), extra, unrestricted))
            .getComposed(1, 1, Set.of(6, 7))
            .orElseThrow();

        assertTrue(composed.spawns().containsKey(4));
        assertTrue(composed.spots().containsKey(3));
    }

    @Test
    void invalidExtraPartialFailsTheWholeCall() {
        var auto = ZoneFixture.create().autoApply(1).spawn(3, 101).partial(5);
        var otherMap = ZoneFixture.create().restrictTo(2).partial(6);
        var global = ZoneFixture.create().whitelist(4).partial(ServerZonePartial.GLOBAL_ID);
        var composer = new ZonePartialComposer(registry(baseZone(), auto, otherMap, global));

        assertTrue(composer.getComposed(1, 1, Set.of(404)).isEmpty(), "unknown partial");
        assertTrue(composer.getComposed(1, 1, Set.of(5)).isEmpty(), "auto-apply partial");
        assertTrue(composer.getComposed(1, 1, Set.of(6)).isEmpty(), "other dynamic map");
        assertTrue(composer.getComposed(1, 1, Set.of(0)).isEmpty(), "global partial");
    }

    @Test
    void composedSnapshotsAreIndependent() {
        var partial = ZoneFixture.create().autoApply(1).spawn(3, 103).partial(5);
        var zone = baseZone();
        var composer = new ZonePartialComposer(registry(zone, partial));

        var first = composer.getComposed(1, 1).orElseThrow();
        var second = composer.getComposed(1, 1).orElseThrow();

        assertNotSame(first, second);
        assertNotSame(first.spawns(), second.spawns());
        assertEquals(first, second);
        assertThrows(UnsupportedOperationException.class, () -> first.spawns().put(9, new Spawn(101, null, 0, 1)));
        assertFalse(zone.spawns().containsKey(3));
    }

    @Test
    void applyPartialRefusesCanonicalZone() {
        var zone = baseZone();
        var partial = ZoneFixture.create().spawn(3, 103).partial(6);
        var composer = new ZonePartialComposer(registry(zone, partial));

        assertTrue(composer.applyPartial(zone, 6).isEmpty());
    }

    @Test
    void applyPartialOnCopyReturnsNewZone() {
        var zone = baseZone();
        var partial = ZoneFixture.create().spawn(3, 103).partial(6);
        var composer = new ZonePartialComposer(registry(zone, partial));
        var copy = ZoneDraft.of(zone).toZone();

        var applied = composer.applyPartial(copy, 6).orElseThrow();

        assertTrue(applied.spawns().containsKey(3));
        assertFalse(copy.spawns().containsKey(3));
        assertTrue(composer.applyPartial(copy, 0).isEmpty());
        assertTrue(composer.applyPartial(copy, 404).isEmpty());
    }

    @Test
    void mergeWithoutPositionReplaceKeepsExistingPlacements() {
        var draft = ZoneDraft.of(baseZone());

        ZonePartialComposer.applyPartial(draft, ZoneFixture.create().npc(1001, 7, 0f, 0f).partial(5), false);

        assertEquals(2, draft.npcs().size());
    }
}
