package work.lcod.serverdata.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "server-data",
    description = "Check and inspect game server content packs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { CheckCommand.class, ZoneCommand.class }
)
final class ServerDataCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (check|zone).");
    }
}
