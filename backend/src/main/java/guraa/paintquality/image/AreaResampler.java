package guraa.paintquality.image;

/**
 * Area-averaging resampler.
 * Each target pixel is the mean of the source area it covers, with partially covered source
 * pixels weighted by their covered fraction. Works separably (rows, then columns), never crops,
 * and is fully deterministic.
 */
public final class AreaResampler {

    private AreaResampler() {
    }

    /**
     * Resample an image to the given dimensions.
     *
     * @param source The source raster
     * @param width The target width
     * @param height The target height
     * @return A new raster of the target size, or the source itself when sizes already match
     */
    public static RasterImage resample(RasterImage source, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target dimensions must be positive: " + width + "x" + height);
        }
        int srcW = source.getWidth();
        int srcH = source.getHeight();
        if (srcW == width && srcH == height) {
            return source;
        }

        Span[] columns = spans(srcW, width);
        Span[] rows = spans(srcH, height);

        // Horizontal pass: srcH rows of `width` samples per channel
        double[][] horizontal = new double[3][srcH * width];
        for (int y = 0; y < srcH; y++) {
            for (int x = 0; x < width; x++) {
                Span span = columns[x];
                double r = 0, g = 0, b = 0;
                for (int k = 0; k < span.weights.length; k++) {
                    int rgb = source.rgb(span.start + k, y);
                    double w = span.weights[k];
                    r += w * ((rgb >> 16) & 0xFF);
                    g += w * ((rgb >> 8) & 0xFF);
                    b += w * (rgb & 0xFF);
                }
                int i = y * width + x;
                horizontal[0][i] = r;
                horizontal[1][i] = g;
                horizontal[2][i] = b;
            }
        }

        // Vertical pass
        int[] out = new int[width * height];
        for (int y = 0; y < height; y++) {
            Span span = rows[y];
            for (int x = 0; x < width; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = 0; k < span.weights.length; k++) {
                    int i = (span.start + k) * width + x;
                    double w = span.weights[k];
                    r += w * horizontal[0][i];
                    g += w * horizontal[1][i];
                    b += w * horizontal[2][i];
                }
                out[y * width + x] = (toByte(r) << 16) | (toByte(g) << 8) | toByte(b);
            }
        }

        return RasterImage.of(width, height, source.getChannels(), out);
    }

    private static int toByte(double value) {
        long rounded = Math.round(value);
        return (int) Math.max(0, Math.min(255, rounded));
    }

    /**
     * Compute, for each target index, the covered source indices and their normalized weights.
     */
    private static Span[] spans(int sourceLength, int targetLength) {
        double scale = (double) sourceLength / targetLength;
        Span[] spans = new Span[targetLength];
        for (int t = 0; t < targetLength; t++) {
            double from = t * scale;
            double to = Math.min(sourceLength, (t + 1) * scale);
            int first = (int) Math.floor(from);
            int last = Math.min(sourceLength - 1, (int) Math.ceil(to) - 1);
            if (last < first) {
                last = first;
            }

            double[] weights = new double[last - first + 1];
            double total = 0;
            for (int s = first; s <= last; s++) {
                double covered = Math.min(s + 1, to) - Math.max(s, from);
                weights[s - first] = Math.max(0, covered);
                total += weights[s - first];
            }
            if (total <= 0) {
                weights[0] = 1.0;
                total = 1.0;
            }
            for (int k = 0; k < weights.length; k++) {
                weights[k] /= total;
            }
            spans[t] = new Span(first, weights);
        }
        return spans;
    }

    private static final class Span {
        private final int start;
        private final double[] weights;

        private Span(int start, double[] weights) {
            this.start = start;
            this.weights = weights;
        }
    }
}
