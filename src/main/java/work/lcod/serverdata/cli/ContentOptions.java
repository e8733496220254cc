package work.lcod.serverdata.cli;

import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine;
import work.lcod.serverdata.api.ConfigurationLoader;
import work.lcod.serverdata.api.LoaderConfiguration;
import work.lcod.serverdata.api.LogLevel;

/**
 * Options shared by the subcommands; they override {@code server-data.toml}.
 */
final class ContentOptions {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Parameters(index = "0", paramLabel = "CONTENT_ROOT", description = "Content pack directory.")
    Path contentRoot;

    @CommandLine.Option(
        names = "--catalog",
        description = "Definition catalog YAML file (overrides server-data.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path catalog;

    @CommandLine.Option(names = "--strict", description = "Reject unknown record properties.")
    boolean strict;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    LoaderConfiguration toConfiguration() {
        var root = contentRoot.toAbsolutePath().normalize();
        var builder = ConfigurationLoader.load(root);
        if (catalog != null) {
            builder.catalogFile(Optional.of(catalog.toAbsolutePath().normalize()));
        }
        if (strict) {
            builder.strict(true);
        }
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("SERVER_DATA_LOG_LEVEL");
        }
        if (candidate != null && !candidate.isBlank()) {
            builder.logLevel(LogLevel.from(candidate));
        }
        var configuration = builder.build();
        applyLogLevel(configuration.logLevel());
        return configuration;
    }

    /** Only effective before the first logger is created. */
    static void applyLogLevel(LogLevel level) {
        if (System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
            System.setProperty(SIMPLE_LOGGER_LEVEL, level.simpleLoggerLevel());
        }
    }
}
