package lw.raster.utilities;

import lw.raster.model.PixelCoordinate;

/**
 * Supplies the raw power sample of a pixel: inverted grayscale in {@code [0, 255]},
 * 0 for white (no burn) and 255 for black.
 */
@FunctionalInterface
public interface PowerSource {

    /**
     * @param x pixel column
     * @param y pixel row, 0 being the bottom row
     * @return raw power sample
     * @throws PixelOutOfRangeException if the pixel is outside the image
     */
    double getPower(int x, int y);

    default double getPower(PixelCoordinate pixel) {
        return getPower(pixel.x(), pixel.y());
    }
}
