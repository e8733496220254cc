package work.lcod.serverdata.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.serverdata.script.ScriptRegistry;

/**
 * Immutable settings of one content load.
 *
 * @param catalogFile definition catalog; without one the catalog checks are skipped
 * @param strict whether unknown record properties are rejected
 */
public record LoaderConfiguration(
    Path contentRoot,
    Optional<Path> catalogFile,
    boolean strict,
    String scriptSuffix,
    LogLevel logLevel
) {
    public LoaderConfiguration {
        Objects.requireNonNull(contentRoot, "contentRoot");
        Objects.requireNonNull(catalogFile, "catalogFile");
        Objects.requireNonNull(scriptSuffix, "scriptSuffix");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path contentRoot;
        private Optional<Path> catalogFile = Optional.empty();
        private boolean strict;
        private String scriptSuffix = ScriptRegistry.DEFAULT_SUFFIX;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder contentRoot(Path contentRoot) {
            this.contentRoot = contentRoot;
            return this;
        }

        public Builder catalogFile(Optional<Path> catalogFile) {
            this.catalogFile = catalogFile;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder scriptSuffix(String scriptSuffix) {
            this.scriptSuffix = scriptSuffix;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public LoaderConfiguration build() {
            return new LoaderConfiguration(contentRoot, catalogFile, strict, scriptSuffix, logLevel);
        }
    }
}
