package lw.raster.service;

/**
 * Exception raised to the caller when a rasterization run aborts on the engine side.
 * The original failure is available as the cause.
 *
 * @since 1.0.0
 */
public class RasterEngineException extends RuntimeException {

    /**
     * Constructs a new engine exception with the specified detail message.
     *
     * @param message the detail message
     */
    public RasterEngineException(String message) {
        super(message);
    }

    /**
     * Constructs a new engine exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public RasterEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
