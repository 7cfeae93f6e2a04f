package selfheal.strategy;

import java.awt.image.BufferedImage;

/**
 * Perceptual comparison of two image regions, injected into
 * {@link VisualSimilarityStrategy} so the engine does not depend on any
 * particular image library.
 */
@FunctionalInterface
public interface ImageSimilarity {

    /** @return similarity in [0, 1]; 1 means visually identical */
    double similarity(BufferedImage reference, BufferedImage candidate);
}
