package guraa.paintquality.image;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw bytes of one uploaded image with its declared format.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ImageInput {

    /**
     * Which image this is ("before" or "after"), used in error messages.
     */
    private final String label;

    private final byte[] bytes;

    /**
     * MIME type ("image/png") or format name ("png"); may be null when unknown.
     */
    private final String declaredFormat;

    public static ImageInput before(byte[] bytes, String declaredFormat) {
        return new ImageInput("before", bytes, declaredFormat);
    }

    public static ImageInput after(byte[] bytes, String declaredFormat) {
        return new ImageInput("after", bytes, declaredFormat);
    }

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }
}
