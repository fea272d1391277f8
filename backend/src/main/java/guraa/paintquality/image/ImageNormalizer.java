package guraa.paintquality.image;

import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.exception.DimensionMismatchException;
import guraa.paintquality.exception.ValidationException;
import guraa.paintquality.model.AnalysisConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates, decodes and brings a before/after pair to a common frame.
 * The after image is resampled to the before image's dimensions when they differ.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageNormalizer {

    private final ImageDecoder decoder;

    /**
     * Normalize an image pair.
     *
     * @param before The before image
     * @param after The after image
     * @param config The analysis configuration
     * @return Two rasters of identical dimensions
     * @throws AnalysisException If validation, decoding or reconciliation fails
     */
    public ImagePair normalize(ImageInput before, ImageInput after, AnalysisConfig config)
            throws AnalysisException {
        // Byte limits are checked for both images before anything is decoded
        checkPresentAndSize(before, "before", config);
        checkPresentAndSize(after, "after", config);

        RasterImage beforeImage = decoder.decode(before);
        checkDimensions(beforeImage, before.getLabel(), config);
        RasterImage afterImage = decoder.decode(after);
        checkDimensions(afterImage, after.getLabel(), config);

        if (beforeImage.sameSizeAs(afterImage)) {
            return new ImagePair(beforeImage, afterImage);
        }

        double beforeAspect = (double) beforeImage.getWidth() / beforeImage.getHeight();
        double afterAspect = (double) afterImage.getWidth() / afterImage.getHeight();
        double aspectDifference = Math.abs(afterAspect / beforeAspect - 1.0);
        if (aspectDifference > config.getAspectTolerance()) {
            throw new DimensionMismatchException(String.format(
                    "Aspect ratios differ by %.1f%% (before %dx%d, after %dx%d), tolerance is %.1f%%",
                    aspectDifference * 100, beforeImage.getWidth(), beforeImage.getHeight(),
                    afterImage.getWidth(), afterImage.getHeight(), config.getAspectTolerance() * 100));
        }

        log.debug("Resampling after image from {}x{} to {}x{}", afterImage.getWidth(), afterImage.getHeight(),
                beforeImage.getWidth(), beforeImage.getHeight());
        RasterImage resampled = AreaResampler.resample(afterImage, beforeImage.getWidth(), beforeImage.getHeight());
        return new ImagePair(beforeImage, resampled);
    }

    private void checkPresentAndSize(ImageInput input, String expectedLabel, AnalysisConfig config)
            throws ValidationException {
        if (input == null || input.getBytes() == null || input.getBytes().length == 0) {
            throw new ValidationException("The " + expectedLabel + " image is missing");
        }
        if (input.size() > config.getMaxUploadBytes()) {
            throw new ValidationException(String.format("The %s image is %d bytes, exceeding the maximum of %d bytes",
                    input.getLabel(), input.size(), config.getMaxUploadBytes()));
        }
    }

    private void checkDimensions(RasterImage image, String label, AnalysisConfig config) throws ValidationException {
        if (image.getWidth() < config.getMinWidth()) {
            throw new ValidationException(String.format("The %s image is %d pixels wide, below the minimum width of %d",
                    label, image.getWidth(), config.getMinWidth()));
        }
        if (image.getHeight() < config.getMinHeight()) {
            throw new ValidationException(String.format("The %s image is %d pixels high, below the minimum height of %d",
                    label, image.getHeight(), config.getMinHeight()));
        }
    }
}
