package work.lcod.serverdata.cli;

import picocli.CommandLine;
import work.lcod.serverdata.api.ConfigurationLoader;
import work.lcod.serverdata.loader.ServerDataLoader;

/**
 * Reports the build version and the content pack layout it reads.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_VERSION = "development";

    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "server-data " + (version != null ? version : DEVELOPMENT_VERSION),
            "content files: " + String.join(", ", ServerDataLoader.CONTENT_SUFFIXES)
                + "; settings: " + ConfigurationLoader.FILE_NAME
        };
    }
}
