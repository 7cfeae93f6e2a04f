package selfheal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * One successful healing event: which locator failed, what replaced it, and
 * how the replacement was found.
 *
 * @param originalLocator        the locator that no longer resolved
 * @param healedLocator          the replacement that resolved
 * @param strategyUsed           strategy that produced the replacement
 * @param confidence             strategy confidence in [0, 1]
 * @param timestamp              when the healing happened
 * @param pageContextFingerprint page the healing is scoped to
 * @param healingTime            from the start of the resolution to the healed result;
 *                               {@code null} is read as zero
 */
public record HealingRecord(
        @JsonProperty("original_locator") Locator originalLocator,
        @JsonProperty("healed_locator") Locator healedLocator,
        @JsonProperty("strategy") StrategyName strategyUsed,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("page_context") String pageContextFingerprint,
        @JsonProperty("healing_time") Duration healingTime) {

    public HealingRecord {
        if (healingTime == null) {
            healingTime = Duration.ZERO;
        } else if (healingTime.isNegative()) {
            throw new IllegalArgumentException("healing time must not be negative: " + healingTime);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
    }
}
