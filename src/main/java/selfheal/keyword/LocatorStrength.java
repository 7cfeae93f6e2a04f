package selfheal.keyword;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Robustness verdict for a locator string.
 *
 * @param score           0 (fragile) to 100 (robust)
 * @param strength        bucket derived from {@code score}
 * @param issues          fragile patterns found
 * @param recommendations one fix per issue, same order
 */
public record LocatorStrength(
        @JsonProperty("score") int score,
        @JsonProperty("strength") Strength strength,
        @JsonProperty("issues") List<String> issues,
        @JsonProperty("recommendations") List<String> recommendations) {

    public enum Strength {
        STRONG("Strong"), MEDIUM("Medium"), WEAK("Weak");

        private final String label;

        Strength(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        static Strength of(int score) {
            if (score >= 75) return STRONG;
            if (score >= 50) return MEDIUM;
            return WEAK;
        }
    }

    public LocatorStrength {
        issues          = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }
}
