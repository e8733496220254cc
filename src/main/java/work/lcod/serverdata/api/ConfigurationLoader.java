package work.lcod.serverdata.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Reads the optional {@code server-data.toml} at the root of a content pack:
 *
 * <pre>
 * [loader]
 * catalog = "catalog.yaml"   # relative to the content root
 * strict = false
 * script_suffix = ".js"
 *
 * [logging]
 * level = "info"
 * </pre>
 */
public final class ConfigurationLoader {
    public static final String FILE_NAME = "server-data.toml";

    private ConfigurationLoader() {}

    /**
     * Builder seeded with the pack settings, ready for command line overrides.
     */
    public static LoaderConfiguration.Builder load(Path contentRoot) {
        var builder = LoaderConfiguration.builder().contentRoot(contentRoot);
        Path file = contentRoot.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return builder;
        }

        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + file, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid " + FILE_NAME + ": " + errors);
        }

        String catalog = result.getString("loader.catalog");
        if (catalog != null && !catalog.isBlank()) {
            builder.catalogFile(Optional.of(contentRoot.resolve(catalog).normalize()));
        }
        Boolean strict = result.getBoolean("loader.strict");
        if (strict != null) {
            builder.strict(strict);
        }
        String suffix = result.getString("loader.script_suffix");
        if (suffix != null && !suffix.isBlank()) {
            builder.scriptSuffix(suffix);
        }
        String level = result.getString("logging.level");
        if (level != null) {
            builder.logLevel(LogLevel.from(level));
        }
        return builder;
    }
}
