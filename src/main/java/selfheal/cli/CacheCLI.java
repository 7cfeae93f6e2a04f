package selfheal.cli;

import selfheal.cache.CacheCorruptionException;
import selfheal.cache.HealingCacheEntry;
import selfheal.cache.JsonFileCachePersistence;
import selfheal.engine.HealingConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Administers the persisted healing cache file.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code cache show}: list healed locators stored in the file</li>
 *   <li>{@code cache clear}: empty the file</li>
 * </ul>
 *
 * <p>The file defaults to {@code healing.cache.file} from {@code healing.properties}.
 */
@Command(
        name        = "cache",
        description = "Inspect or reset the persisted self-healing locator cache",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                CacheCLI.ShowCommand.class,
                CacheCLI.ClearCommand.class
        }
)
public class CacheCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new CacheCLI()).execute(args);
        System.exit(exit);
    }

    static Path resolveFile(Path explicit) {
        return explicit != null ? explicit : new HealingConfig().getCacheFile();
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /** Prints every entry of the cache file, most used first. */
    @Command(
            name        = "show",
            description = "List healed locators in the cache file",
            mixinStandardHelpOptions = true
    )
    static class ShowCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-f", "--file"}, description = "Cache file (default: healing.cache.file)")
        Path file;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            Path target = resolveFile(file);
            List<HealingCacheEntry> entries;
            try {
                entries = new JsonFileCachePersistence(target).load();
            } catch (CacheCorruptionException e) {
                err.println("Cache file is corrupt: " + e.getMessage());
                return 2;
            }

            out.printf("Cache file : %s%n", target.toAbsolutePath());
            out.printf("Entries    : %d%n", entries.size());
            entries.stream()
                    .sorted(Comparator.comparingLong(HealingCacheEntry::getHitCount).reversed())
                    .forEach(e -> out.printf("  %-40s -> %-40s %-22s conf=%.2f hits=%d failures=%d%n",
                            e.getOriginal(), e.getHealedLocator(),
                            e.getStrategy() == null ? "-" : e.getStrategy().label(),
                            e.getConfidence(), e.getHitCount(), e.getConsecutiveFailures()));
            out.flush();
            return 0;
        }
    }

    /** Replaces the cache file with an empty one. */
    @Command(
            name        = "clear",
            description = "Remove every healed locator from the cache file",
            mixinStandardHelpOptions = true
    )
    static class ClearCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-f", "--file"}, description = "Cache file (default: healing.cache.file)")
        Path file;

        @Override
        public Integer call() {
            Path target = resolveFile(file);
            try {
                new JsonFileCachePersistence(target).save(List.of());
            } catch (IOException e) {
                spec.commandLine().getErr().println("Cannot clear " + target + ": " + e.getMessage());
                return 1;
            }
            spec.commandLine().getOut().println("Cleared " + target.toAbsolutePath());
            return 0;
        }
    }
}
