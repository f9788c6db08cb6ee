package lw.raster.model;

/**
 * Scale and tiling values computed once per run by the controller and handed
 * to the engine alongside the settings.
 *
 * @param ppm        resolution factor derived from the settings' ppi
 * @param scaleRatio source pixel to output pixel ratio
 * @param imageSize  scaled image size in output pixels
 * @param gridSize   number of tiles per axis
 * @param bufferSize maximum tile edge length in pixels
 */
public record RasterGeometry(double ppm, double scaleRatio, ImageSize imageSize,
                             GridSize gridSize, int bufferSize) {

    public RasterGeometry {
        if (imageSize == null || gridSize == null) {
            throw new IllegalArgumentException("Image size and grid size are required");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
    }
}
