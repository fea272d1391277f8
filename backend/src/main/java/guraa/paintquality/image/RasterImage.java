package guraa.paintquality.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * An immutable 8-bit RGB raster.
 * Samples are packed as 0xRRGGBB per pixel in row-major order; alpha, when the source had it,
 * is recorded in the channel count but not used for analysis.
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final int channels;
    private final int[] pixels;

    private RasterImage(int width, int height, int channels, int[] pixels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    /**
     * Create a raster from packed RGB samples. The array is copied.
     *
     * @param width The width
     * @param height The height
     * @param channels 3 or 4
     * @param rgb Packed 0xRRGGBB samples, row-major
     * @return The raster
     */
    public static RasterImage of(int width, int height, int channels, int[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if (channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (rgb.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + rgb.length);
        }
        int[] copy = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            copy[i] = rgb[i] & 0xFFFFFF;
        }
        return new RasterImage(width, height, channels, copy);
    }

    /**
     * Create a raster from a decoded AWT image.
     *
     * @param image The decoded image
     * @return The raster
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        int channels = image.getColorModel().hasAlpha() ? 4 : 3;
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] &= 0xFFFFFF;
        }
        return new RasterImage(width, height, channels, rgb);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * Get the packed RGB value of a pixel.
     *
     * @param x The column
     * @param y The row
     * @return 0xRRGGBB
     */
    public int rgb(int x, int y) {
        return pixels[y * width + x];
    }

    public int red(int x, int y) {
        return (pixels[y * width + x] >> 16) & 0xFF;
    }

    public int green(int x, int y) {
        return (pixels[y * width + x] >> 8) & 0xFF;
    }

    public int blue(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /**
     * Get the luma of a pixel (0.299R + 0.587G + 0.114B), in 0-255 units.
     *
     * @param x The column
     * @param y The row
     * @return The luminance
     */
    public double luminance(int x, int y) {
        int rgb = pixels[y * width + x];
        return 0.299 * ((rgb >> 16) & 0xFF) + 0.587 * ((rgb >> 8) & 0xFF) + 0.114 * (rgb & 0xFF);
    }

    /**
     * Check whether this raster has the same dimensions as another.
     *
     * @param other The other raster
     * @return true if width and height match
     */
    public boolean sameSizeAs(RasterImage other) {
        return width == other.width && height == other.height;
    }

    /**
     * Copy this raster into a new RGB image for drawing.
     *
     * @return A fresh TYPE_INT_RGB image
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterImage)) return false;
        RasterImage that = (RasterImage) o;
        return width == that.width && height == that.height && channels == that.channels
                && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + ", " + channels + " channels]";
    }
}
