package work.lcod.serverdata.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

final class MainTest {
    private static final String BASIC = Path.of("src", "test", "resources", "packs", "basic").toString();

    @Test
    void checkPrintsJsonSummary() {
        var out = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exit = commandLine.execute("check", BASIC);

        assertEquals(0, exit);
        assertTrue(out.toString().contains("\"zones\" : 2"));
    }

    @Test
    void zonePrintsComposedYaml() {
        var out = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exit = commandLine.execute("zone", BASIC, "-z", "1", "-p", "5");

        assertEquals(0, exit);
        assertTrue(out.toString().contains("id: 8"));
    }

    @Test
    void unknownZoneExitsWithError() {
        var err = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setErr(new PrintWriter(err));

        int exit = commandLine.execute("zone", BASIC, "-z", "42");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("No zone 42"));
    }

    @Test
    void missingSubcommandIsUsageError() {
        var commandLine = Main.commandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertEquals(2, commandLine.execute());
    }

    @Test
    void contentErrorsArePrintedWithTheirKind() {
        var err = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setErr(new PrintWriter(err));
        var broken = Path.of("src", "test", "resources", "packs", "broken").toString();

        int exit = commandLine.execute("zone", broken, "-z", "1");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("[DUPLICATE_ID] Duplicate zone encountered: 1"));
    }

    @Test
    void versionNamesContentLayout() {
        var out = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));

        assertEquals(0, commandLine.execute("--version"));
        assertTrue(out.toString().startsWith("server-data "));
        assertTrue(out.toString().contains("settings: server-data.toml"));
    }
}
