package lw.raster.model;

/**
 * A pixel position in scan space. {@code y = 0} is the bottom row of the engraving;
 * pixel lookups invert it to reach the top-left origin of the image buffers.
 *
 * @param x column
 * @param y row
 */
public record PixelCoordinate(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
