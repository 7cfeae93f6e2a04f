package selfheal.strategy;

import java.awt.image.BufferedImage;

/**
 * Default {@link ImageSimilarity}: normalised cross-correlation of the two
 * regions in grayscale. The candidate is resampled (nearest neighbour) to
 * the reference size, capped at {@value #MAX_SIDE} pixels a side. Negative
 * correlation is reported as 0.
 */
public class NormalizedCrossCorrelation implements ImageSimilarity {

    static final int MAX_SIDE = 64;

    @Override
    public double similarity(BufferedImage reference, BufferedImage candidate) {
        if (reference == null || candidate == null) return 0.0;
        int width  = Math.max(1, Math.min(MAX_SIDE, reference.getWidth()));
        int height = Math.max(1, Math.min(MAX_SIDE, reference.getHeight()));
        double[] a = grayscale(reference, width, height);
        double[] b = grayscale(candidate, width, height);

        double meanA = mean(a);
        double meanB = mean(b);
        double cross = 0.0;
        double varA = 0.0;
        double varB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            cross += da * db;
            varA  += da * da;
            varB  += db * db;
        }
        if (varA == 0.0 && varB == 0.0) {
            // two flat regions: equal only if they are the same shade
            return Math.abs(meanA - meanB) < 1.0 ? 1.0 : 0.0;
        }
        if (varA == 0.0 || varB == 0.0) return 0.0;
        double ncc = cross / Math.sqrt(varA * varB);
        return Math.max(0.0, Math.min(1.0, ncc));
    }

    private static double[] grayscale(BufferedImage image, int width, int height) {
        double[] out = new double[width * height];
        for (int y = 0; y < height; y++) {
            int sy = Math.min(image.getHeight() - 1, y * image.getHeight() / height);
            for (int x = 0; x < width; x++) {
                int sx = Math.min(image.getWidth() - 1, x * image.getWidth() / width);
                int rgb = image.getRGB(sx, sy);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >>  8) & 0xFF;
                int bl = rgb        & 0xFF;
                out[y * width + x] = 0.299 * r + 0.587 * g + 0.114 * bl;
            }
        }
        return out;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }
}
