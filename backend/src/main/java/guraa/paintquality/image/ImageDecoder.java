package guraa.paintquality.image;

import guraa.paintquality.exception.DecodeException;

/**
 * Turns raw image bytes into a raster. The pipeline depends only on this contract, not on a codec.
 */
public interface ImageDecoder {

    /**
     * Decode an image.
     *
     * @param input The raw image
     * @return The decoded raster
     * @throws DecodeException If the bytes are corrupt or the format is unsupported
     */
    RasterImage decode(ImageInput input) throws DecodeException;
}
