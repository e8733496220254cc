package work.lcod.serverdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copy helpers used by the definition records so every loaded definition owns unmodifiable,
 * order-preserving collections (Jackson leaves absent collections as {@code null}).
 *
 * <p>Null entries are rejected with an {@link IllegalArgumentException}, which record binding
 * reports as a malformed record.
 */
public final class ModelCollections {
    private ModelCollections() {}

    public static <T> List<T> list(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        for (T element : source) {
            requireEntry(element);
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    public static <T> Set<T> set(Set<T> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        for (T element : source) {
            requireEntry(element);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    public static <K, V> Map<K, V> map(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        source.forEach((key, value) -> {
            requireEntry(key);
            requireEntry(value);
        });
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static void requireEntry(Object entry) {
        if (entry == null) {
            throw new IllegalArgumentException("null entry");
        }
    }
}
