package work.lcod.serverdata.store;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of a content pack. Paths are absolute within the pack ({@code /zones/partial}).
 */
public interface DataStore {
    /**
     * Files under {@code path}, as pack paths, sorted. A missing directory yields an empty list.
     */
    List<String> listFiles(String path, boolean recursive) throws IOException;

    /**
     * Content of a file, or an empty array when it does not exist.
     */
    byte[] readFile(String path) throws IOException;
}
