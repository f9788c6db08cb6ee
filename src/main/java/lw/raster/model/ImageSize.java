package lw.raster.model;

/**
 * Pixel dimensions of the image after scaling to beam-sized pixels.
 *
 * @param width  width in pixels, never negative
 * @param height height in pixels, never negative
 */
public record ImageSize(int width, int height) {

    public ImageSize {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image size must not be negative: " + width + "x" + height);
        }
    }

    /**
     * @return total number of pixels
     */
    public long pixelCount() {
        return (long) width * height;
    }

    /**
     * @return true when the image holds no pixel at all
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
