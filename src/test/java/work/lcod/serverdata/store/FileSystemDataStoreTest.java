package work.lcod.serverdata.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FileSystemDataStoreTest {
    @Test
    void listsFilesAsPackPaths() throws Exception {
        var root = Files.createTempDirectory("server-data-store");
        Files.createDirectories(root.resolve("zones/partial/deep"));
        Files.writeString(root.resolve("zones/b.yaml"), "objects: []");
        Files.writeString(root.resolve("zones/a.yaml"), "objects: []");
        Files.writeString(root.resolve("zones/.hidden.yaml"), "objects: []");
        Files.writeString(root.resolve("zones/partial/deep/p.yaml"), "objects: []");
        var store = new FileSystemDataStore(root);

        assertEquals(List.of("/zones/a.yaml", "/zones/b.yaml"), store.listFiles("/zones", false));
        assertEquals(List.of("/zones/a.yaml", "/zones/b.yaml", "/zones/partial/deep/p.yaml"),
            store.listFiles("/zones", true));
        assertTrue(store.listFiles("/shops", true).isEmpty());
    }

    @Test
    void readsFilesAndTreatsMissingAsEmpty() throws Exception {
        var root = Files.createTempDirectory("server-data-store");
        Files.writeString(root.resolve("shops.yaml"), "objects: []");
        var store = new FileSystemDataStore(root);

        assertArrayEquals("objects: []".getBytes(StandardCharsets.UTF_8), store.readFile("/shops.yaml"));
        assertEquals(0, store.readFile("/missing.yaml").length);
    }

    @Test
    void rejectsPathsOutsideRoot() throws Exception {
        var store = new FileSystemDataStore(Files.createTempDirectory("server-data-store"));

        assertThrows(IllegalArgumentException.class, () -> store.readFile("/../secret"));
    }
}
