package work.lcod.serverdata.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.serverdata.api.ServerDataService;

@CommandLine.Command(
    name = "check",
    description = "Load a content pack and report what it defines.",
    mixinStandardHelpOptions = true
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private ContentOptions options = new ContentOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var configuration = options.toConfiguration();
        var result = new ServerDataService().check(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }
}
