package work.lcod.serverdata.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link DataStore} backed by a directory on disk.
 */
public final class FileSystemDataStore implements DataStore {
    private final Path root;

    public FileSystemDataStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> listFiles(String path, boolean recursive) throws IOException {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
            List<String> files = new ArrayList<>();
            for (Path entry : stream.filter(Files::isRegularFile).collect(Collectors.toList())) {
                if (entry.getFileName().toString().startsWith(".")) {
                    continue;
                }
                files.add(toPackPath(entry));
            }
            files.sort(String::compareTo);
            return files;
        }
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            return new byte[0];
        }
        return Files.readAllBytes(file);
    }

    private Path resolve(String path) {
        String relative = path == null ? "" : path.replaceFirst("^/+", "");
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the content root: " + path);
        }
        return resolved;
    }

    private String toPackPath(Path file) {
        String relative = root.relativize(file).toString().replace('\\', '/');
        return "/" + relative;
    }
}
