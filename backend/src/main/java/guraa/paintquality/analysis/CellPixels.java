package guraa.paintquality.analysis;

import guraa.paintquality.grid.Cell;
import guraa.paintquality.image.RasterImage;

/**
 * Pixel helpers that operate on the area of a single cell.
 * Neighborhoods are clamped to the cell, so no computation reads across a cell boundary.
 */
final class CellPixels {

    private CellPixels() {
    }

    /**
     * Extract the luminance of a cell into a row-major array.
     */
    static double[] luminance(RasterImage image, Cell cell) {
        int w = cell.getWidth();
        int h = cell.getHeight();
        double[] patch = new double[w * h];
        for (int j = 0; j < h; j++) {
            for (int i = 0; i < w; i++) {
                patch[j * w + i] = image.luminance(cell.getX() + i, cell.getY() + j);
            }
        }
        return patch;
    }

    /**
     * Sobel gradient magnitudes of a patch, replicating the border pixels.
     */
    static double[] sobelMagnitudes(double[] patch, int w, int h) {
        double[] magnitudes = new double[patch.length];
        for (int y = 0; y < h; y++) {
            int ym = Math.max(0, y - 1);
            int yp = Math.min(h - 1, y + 1);
            for (int x = 0; x < w; x++) {
                int xm = Math.max(0, x - 1);
                int xp = Math.min(w - 1, x + 1);

                double gx = patch[ym * w + xp] + 2 * patch[y * w + xp] + patch[yp * w + xp]
                        - patch[ym * w + xm] - 2 * patch[y * w + xm] - patch[yp * w + xm];
                double gy = patch[yp * w + xm] + 2 * patch[yp * w + x] + patch[yp * w + xp]
                        - patch[ym * w + xm] - 2 * patch[ym * w + x] - patch[ym * w + xp];
                magnitudes[y * w + x] = Math.sqrt(gx * gx + gy * gy);
            }
        }
        return magnitudes;
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation.
     */
    static double std(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / values.length);
    }

    static int countAbove(double[] values, double threshold) {
        int count = 0;
        for (double v : values) {
            if (v > threshold) {
                count++;
            }
        }
        return count;
    }
}
