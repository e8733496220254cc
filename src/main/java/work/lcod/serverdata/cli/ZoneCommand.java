package work.lcod.serverdata.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.serverdata.api.ServerDataService;

@CommandLine.Command(
    name = "zone",
    description = "Print a zone with its partials applied.",
    mixinStandardHelpOptions = true
)
final class ZoneCommand implements Callable<Integer> {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    @CommandLine.Mixin
    private ContentOptions options = new ContentOptions();

    @CommandLine.Option(names = {"-z", "--zone"}, required = true, description = "Zone id.")
    private int zoneId;

    @CommandLine.Option(
        names = {"-d", "--dynamic-map"},
        defaultValue = "0",
        description = "Dynamic map id; 0 selects the first one defined."
    )
    private int dynamicMapId;

    @CommandLine.Option(names = {"-p", "--partial"}, description = "Extra partial id to apply (repeatable).")
    private List<Integer> partialIds = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var configuration = options.toConfiguration();
        var zone = new ServerDataService().composeZone(configuration, zoneId, dynamicMapId,
            new LinkedHashSet<>(partialIds));
        if (zone.isEmpty()) {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme()
                .errorText("No zone " + zoneId + " could be composed with partials " + partialIds));
            return 1;
        }
        spec.commandLine().getOut().print(YAML_MAPPER.writeValueAsString(zone.get()));
        return 0;
    }
}
