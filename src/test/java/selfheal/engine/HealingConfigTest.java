package selfheal.engine;

import selfheal.cache.JsonFileCachePersistence;
import selfheal.model.StrategyName;
import selfheal.strategy.StrategyChain;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HealingConfig}.
 *
 * <p>Most tests use the package-private {@code HealingConfig(Properties)}
 * constructor to avoid classpath file I/O.
 */
public class HealingConfigTest {

    // ── Default value tests ───────────────────────────────────────────────

    @Test(description = "All accessor methods return documented defaults when properties are empty")
    public void testAllDefaults() {
        HealingConfig cfg = new HealingConfig(new Properties());

        assertThat(cfg.getTimeout()).as("timeout default").isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getRecentCapacity()).as("recent capacity default").isEqualTo(50);
        assertThat(cfg.getTextExactConfidence()).isEqualTo(0.95);
        assertThat(cfg.getTextPartialConfidence()).isEqualTo(0.75);
        assertThat(cfg.isTextDeriveHints()).isTrue();
        assertThat(cfg.getAttributeThreshold()).isEqualTo(0.6);
        assertThat(cfg.getNearbyRadius()).isEqualTo(3);
        assertThat(cfg.getNearbyConfidence()).isEqualTo(0.6);
        assertThat(cfg.getPositionMaxDistancePx()).isEqualTo(150.0);
        assertThat(cfg.getVisualThreshold()).isEqualTo(0.8);
        assertThat(cfg.isCachePersistenceEnabled()).isFalse();
        assertThat(cfg.getCacheFile()).isEqualTo(Paths.get("reports/healing_cache.json"));
    }

    @Test(description = "The classpath healing.properties loads and matches the defaults")
    public void testClasspathConfigLoads() {
        HealingConfig cfg = new HealingConfig();

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(10_000));
        assertThat(cfg.getAttributeThreshold()).isEqualTo(0.6);
    }

    // ── Override tests ────────────────────────────────────────────────────

    @Test(description = "Values are read from properties and trimmed")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("healing.timeout.ms", " 2500 ");
        p.setProperty("healing.recent.capacity", "5");
        p.setProperty("healing.attribute.threshold", "0.7");
        p.setProperty("healing.text.derive.hints", "false");
        p.setProperty("healing.cache.persistence.enabled", "true");
        p.setProperty("healing.cache.file", "target/cache.json");

        HealingConfig cfg = new HealingConfig(p);

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getRecentCapacity()).isEqualTo(5);
        assertThat(cfg.getAttributeThreshold()).isEqualTo(0.7);
        assertThat(cfg.isTextDeriveHints()).isFalse();
        assertThat(cfg.isCachePersistenceEnabled()).isTrue();
        assertThat(cfg.getCacheFile()).isEqualTo(Paths.get("target/cache.json"));
    }

    // ── Invalid value tests ───────────────────────────────────────────────

    @Test(description = "Unparseable numbers fall back to defaults")
    public void testInvalidNumbersFallBack() {
        Properties p = new Properties();
        p.setProperty("healing.timeout.ms", "soon");
        p.setProperty("healing.nearby.radius", "three");
        p.setProperty("healing.position.max.distance.px", "far");

        HealingConfig cfg = new HealingConfig(p);

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getNearbyRadius()).isEqualTo(3);
        assertThat(cfg.getPositionMaxDistancePx()).isEqualTo(150.0);
    }

    @Test(description = "Out-of-range values fall back to defaults")
    public void testOutOfRangeFallsBack() {
        Properties p = new Properties();
        p.setProperty("healing.timeout.ms", "-1");
        p.setProperty("healing.recent.capacity", "0");
        p.setProperty("healing.text.exact.confidence", "1.5");
        p.setProperty("healing.visual.threshold", "-0.1");

        HealingConfig cfg = new HealingConfig(p);

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getRecentCapacity()).isEqualTo(50);
        assertThat(cfg.getTextExactConfidence()).isEqualTo(0.95);
        assertThat(cfg.getVisualThreshold()).isEqualTo(0.8);
    }

    // ── Factory tests ─────────────────────────────────────────────────────

    @Test(description = "The strategy chain keeps the fixed priority order")
    public void testStrategyChainOrder() {
        StrategyChain chain = new HealingConfig(new Properties()).buildStrategyChain();

        assertThat(chain.recovery()).extracting(s -> s.name()).containsExactly(
                StrategyName.TEXT_CONTENT, StrategyName.ATTRIBUTE_SIMILARITY, StrategyName.NEARBY_ELEMENT,
                StrategyName.POSITION, StrategyName.VISUAL_SIMILARITY);
    }

    @Test(description = "File persistence is used only when enabled")
    public void testPersistenceSelection() {
        Properties p = new Properties();
        assertThat(new HealingConfig(p).buildPersistence()).isNotInstanceOf(JsonFileCachePersistence.class);

        p.setProperty("healing.cache.persistence.enabled", "true");
        assertThat(new HealingConfig(p).buildPersistence()).isInstanceOf(JsonFileCachePersistence.class);
    }

    @Test(description = "The built orchestrator carries the configured timeout")
    public void testBuildOrchestrator() {
        Properties p = new Properties();
        p.setProperty("healing.timeout.ms", "3000");

        HealingOrchestrator orchestrator = new HealingConfig(p).buildOrchestrator();

        assertThat(orchestrator.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(orchestrator.getHealingStatistics().totalAttempts()).isZero();
    }
}
