package work.lcod.serverdata.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.serverdata.model.DropSet;
import work.lcod.serverdata.model.ServerZoneInstance;
import work.lcod.serverdata.model.ZoneKey;
import work.lcod.serverdata.support.ServerDataTestSupport;
import work.lcod.serverdata.support.ZoneFixture;

final class DefinitionRegistryTest {
    @Test
    void registerRejectsDuplicates() {
        var zone = ZoneFixture.create().zone(1, 2);
        var builder = DefinitionRegistry.builder().register(Category.ZONE, zone.key(), zone);

        var error = assertThrows(ServerDataException.class, () -> builder.register(Category.ZONE, zone.key(), zone));

        assertEquals(ErrorKind.DUPLICATE_ID, error.kind());
        assertEquals("Duplicate zone encountered: 1 (2)", error.getMessage());
    }

    @Test
    void lookupOfMissingEntryIsEmpty() {
        var registry = DefinitionRegistry.empty();

        assertTrue(registry.lookup(Category.SHOP, 1).isEmpty());
        assertTrue(registry.zone(1, 0).isEmpty());
        assertTrue(registry.entries(Category.EVENT).isEmpty());
        assertEquals(0, registry.size(Category.DROP_SET));
    }

    @Test
    void builtRegistryIsDetachedFromBuilder() {
        var zone = ZoneFixture.create().zone(1, 1);
        var builder = DefinitionRegistry.builder().register(Category.ZONE, zone.key(), zone);
        var registry = builder.build();
        var later = ZoneFixture.create().zone(2, 2);

        builder.register(Category.ZONE, later.key(), later);

        assertEquals(1, registry.size(Category.ZONE));
        assertThrows(UnsupportedOperationException.class,
            () -> registry.entries(Category.ZONE).put(new ZoneKey(3, 3), later));
    }

    @Test
    void canonicalCheckIsByIdentity() {
        var zone = ZoneFixture.create().spawn(1, 101).zone(1, 1);
        var registry = DefinitionRegistry.builder().register(Category.ZONE, zone.key(), zone).build();

        assertTrue(registry.isCanonical(zone));
        assertFalse(registry.isCanonical(ZoneFixture.create().spawn(1, 101).zone(1, 1)));
        assertFalse(registry.isCanonical(null));
    }

    @Test
    void secondaryIndexesAreExposedSorted() {
        var registry = DefinitionRegistry.builder()
            .indexAutoApplyPartial(4, 9)
            .indexAutoApplyPartial(4, 2)
            .register(Category.DROP_SET, 3, new DropSet(3, 77, List.of()))
            .indexGiftBox(77, 3)
            .build();

        assertEquals(List.of(2, 9), List.copyOf(registry.autoApplyPartialIds(4)));
        assertEquals(3, registry.giftDropSet(77).orElseThrow().id());
        assertTrue(registry.giftDropSet(78).isEmpty());
    }

    @Test
    void zoneInstancesAreListedById() {
        var pvp = new ServerZoneInstance(1, 1, List.of(200, 201), List.of(200, 201));
        var mixed = new ServerZoneInstance(2, 1, List.of(200, 300), List.of(200, 300));
        var registry = DefinitionRegistry.builder()
            .register(Category.ZONE_INSTANCE, 1, pvp)
            .register(Category.ZONE_INSTANCE, 2, mixed)
            .build();
        var catalog = ServerDataTestSupport.catalog();

        assertTrue(catalog.isPvpInstance(registry.zoneInstance(1).orElseThrow()));
        assertFalse(catalog.isPvpInstance(registry.zoneInstance(2).orElseThrow()));
        assertTrue(registry.zoneInstance(3).isEmpty());
        assertTrue(registry.existsInInstance(2, 300, 300));
        assertEquals(Set.of(1, 2), registry.allZoneInstanceIds());
        assertSame(pvp, registry.zoneInstance(1).orElseThrow());
    }
}
