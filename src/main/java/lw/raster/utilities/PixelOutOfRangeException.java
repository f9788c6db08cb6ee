package lw.raster.utilities;

/**
 * Exception thrown when a pixel lookup falls outside the scaled image.
 * A scan generator or trimmer handed out a bad coordinate; the run cannot recover.
 *
 * @since 1.0.0
 */
public class PixelOutOfRangeException extends IndexOutOfBoundsException {

    /**
     * Constructs a new out-of-range exception with the specified detail message.
     *
     * @param message the detail message
     */
    public PixelOutOfRangeException(String message) {
        super(message);
    }
}
