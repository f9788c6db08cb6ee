package lw.raster.model;

/**
 * Exception thrown when raster settings are missing or invalid.
 * Raised before any output is produced, so a run never starts with bad settings.
 *
 * @since 1.0.0
 */
public class RasterConfigurationException extends IllegalArgumentException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     *
     * @param message the detail message
     */
    public RasterConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public RasterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
