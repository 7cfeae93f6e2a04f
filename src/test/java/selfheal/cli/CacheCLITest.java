package selfheal.cli;

import selfheal.cache.HealingCacheEntry;
import selfheal.cache.JsonFileCachePersistence;
import selfheal.model.Locator;
import selfheal.model.StrategyName;
import picocli.CommandLine;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the cache sub-commands in-process with captured output.
 */
public class CacheCLITest {

    private Path dir;
    private Path file;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeMethod
    public void setUp() throws IOException {
        dir  = Files.createTempDirectory("cache-cli");
        file = dir.resolve("healing_cache.json");
        out  = new StringWriter();
        err  = new StringWriter();
        cli  = new CommandLine(new CacheCLI());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private static HealingCacheEntry entry(String original, String healed, long hits) {
        return new HealingCacheEntry(Locator.id(original), "ctx", Locator.id(healed),
                StrategyName.TEXT_CONTENT, 0.95, Instant.parse("2026-03-01T10:00:00Z"), hits, null, 0);
    }

    @Test
    public void show_listsEntriesMostUsedFirst() throws IOException {
        new JsonFileCachePersistence(file).save(List.of(
                entry("old-cancel", "cancel", 1),
                entry("old-button-id", "submit", 5)));

        int exit = cli.execute("show", "--file", file.toString());

        assertThat(exit).isZero();
        String text = out.toString();
        assertThat(text).contains("Entries    : 2");
        assertThat(text).contains("text-content");
        assertThat(text.indexOf("id=old-button-id")).isLessThan(text.indexOf("id=old-cancel"));
    }

    @Test
    public void show_missingFile_reportsNoEntries() {
        int exit = cli.execute("show", "-f", file.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Entries    : 0");
    }

    @Test
    public void show_corruptFile_exitsWithTwo() throws IOException {
        Files.writeString(file, "{ not json");

        int exit = cli.execute("show", "--file", file.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("Cache file is corrupt");
    }

    @Test
    public void clear_emptiesFile() throws IOException {
        new JsonFileCachePersistence(file).save(List.of(entry("old-button-id", "submit", 3)));

        int exit = cli.execute("clear", "--file", file.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Cleared");
        assertThat(new JsonFileCachePersistence(file).load()).isEmpty();
    }

    @Test
    public void noSubcommand_printsUsage() {
        int exit = cli.execute();

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("show").contains("clear");
    }
}
