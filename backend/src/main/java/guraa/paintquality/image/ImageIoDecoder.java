package guraa.paintquality.image;

import guraa.paintquality.exception.DecodeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Decoder backed by the javax.imageio plugins available on the class path.
 */
@Slf4j
@Component
public class ImageIoDecoder implements ImageDecoder {

    /**
     * Non-standard MIME types that browsers and phones send, mapped to the registered ones.
     */
    private static final Map<String, String> MIME_ALIASES = Map.of(
            "image/jpg", "image/jpeg",
            "image/pjpeg", "image/jpeg",
            "image/x-png", "image/png",
            "image/x-ms-bmp", "image/bmp",
            "image/x-tiff", "image/tiff");

    @Override
    public RasterImage decode(ImageInput input) throws DecodeException {
        String format = input.getDeclaredFormat();
        if (format != null && !format.isBlank() && !isSupported(format)) {
            throw new DecodeException("Unsupported format '" + format + "' for " + input.getLabel() + " image");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(input.getBytes()));
        } catch (IOException | RuntimeException e) {
            log.debug("ImageIO failed on {} image: {}", input.getLabel(), e.getMessage());
            throw new DecodeException("Could not decode " + input.getLabel() + " image: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new DecodeException("Could not decode " + input.getLabel() + " image: unrecognized or corrupt data");
        }

        log.debug("Decoded {} image: {}x{}", input.getLabel(), image.getWidth(), image.getHeight());
        return RasterImage.fromBufferedImage(image);
    }

    /**
     * Check whether a MIME type or format name has an ImageIO reader.
     * MIME parameters are ignored and common aliases such as {@code image/jpg} are accepted.
     *
     * @param format MIME type or format name
     * @return true if a reader exists
     */
    boolean isSupported(String format) {
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        int parameters = normalized.indexOf(';');
        if (parameters >= 0) {
            normalized = normalized.substring(0, parameters).trim();
        }
        if (normalized.contains("/")) {
            String mimeType = MIME_ALIASES.getOrDefault(normalized, normalized);
            return ImageIO.getImageReadersByMIMEType(mimeType).hasNext();
        }
        return ImageIO.getImageReadersByFormatName(normalized).hasNext();
    }
}
