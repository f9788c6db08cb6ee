package lw.raster.utilities;

import lw.raster.model.GridSize;
import lw.raster.model.ImageSize;
import lw.raster.model.RasterGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine-side store of the tile grid, answering raw power queries per pixel.
 *
 * <p>Tiles arrive one at a time and in any order. Each lookup inverts Y (the image
 * buffers have a top-left origin, the machine a bottom-left one), finds the owning tile
 * by integer division by the buffer size and reads the RGBA bytes at the local offset.
 * Alpha is ignored since tiles are rendered over a white background.</p>
 *
 * @since 1.0.0
 */
public class PixelTileStore implements PowerSource {
    private static final Logger logger = LoggerFactory.getLogger(PixelTileStore.class);

    private final RasterGeometry geometry;
    private final byte[][][] cells;
    private final int[] columnWidths;
    private int cellCount;

    public PixelTileStore(RasterGeometry geometry) {
        this.geometry = geometry;
        GridSize grid = geometry.gridSize();
        this.cells = new byte[grid.y()][grid.x()][];
        this.columnWidths = new int[grid.x()];
        for (int gx = 0; gx < grid.x(); gx++) {
            columnWidths[gx] = TilingUtilities.tileWidth(geometry, gx);
        }
    }

    /**
     * Stores the buffer of one tile. The buffer is kept as-is, not copied.
     *
     * @param gx     tile column
     * @param gy     tile row
     * @param buffer RGBA bytes of the tile
     * @throws IllegalArgumentException if the position is outside the grid, the tile was
     *                                  already added, or the buffer has the wrong length
     */
    public void addCell(int gx, int gy, byte[] buffer) {
        GridSize grid = geometry.gridSize();
        if (gx < 0 || gx >= grid.x() || gy < 0 || gy >= grid.y()) {
            throw new IllegalArgumentException(String.format(
                    "Tile (%d, %d) outside grid of %d x %d", gx, gy, grid.x(), grid.y()));
        }
        if (cells[gy][gx] != null) {
            throw new IllegalArgumentException(String.format("Tile (%d, %d) already added", gx, gy));
        }
        int expected = columnWidths[gx] * TilingUtilities.tileHeight(geometry, gy) * 4;
        if (buffer == null || buffer.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Tile (%d, %d) buffer must hold %d bytes, got %s",
                    gx, gy, expected, buffer == null ? "null" : String.valueOf(buffer.length)));
        }
        cells[gy][gx] = buffer;
        cellCount++;
        logger.debug("Added tile ({}, {}), {} of {}", gx, gy, cellCount, grid.cellCount());
    }

    /**
     * @return true once every tile of the grid has been added
     */
    public boolean isComplete() {
        return cellCount == geometry.gridSize().cellCount();
    }

    public int getCellCount() {
        return cellCount;
    }

    public ImageSize getImageSize() {
        return geometry.imageSize();
    }

    /**
     * Raw power of a pixel: {@code 255 - (R + G + B) / 3}.
     *
     * @param x pixel column
     * @param y pixel row, 0 being the bottom row
     * @return raw power sample in {@code [0, 255]}
     * @throws PixelOutOfRangeException if {@code x} or {@code y} is outside the image
     */
    @Override
    public double getPower(int x, int y) {
        ImageSize size = geometry.imageSize();
        if (x < 0 || x >= size.width()) {
            throw new PixelOutOfRangeException("Out of range: x = " + x);
        }
        if (y < 0 || y >= size.height()) {
            throw new PixelOutOfRangeException("Out of range: y = " + y);
        }

        int bufferSize = geometry.bufferSize();
        int imageY = size.height() - y - 1;

        int gx = x / bufferSize;
        int gy = imageY / bufferSize;
        byte[] data = cells[gy][gx];
        if (data == null) {
            throw new IllegalStateException(String.format("Tile (%d, %d) has not been added", gx, gy));
        }

        int localX = x - gx * bufferSize;
        int localY = imageY - gy * bufferSize;
        int i = (localY * columnWidths[gx] + localX) * 4;

        int sum = (data[i] & 0xFF) + (data[i + 1] & 0xFF) + (data[i + 2] & 0xFF);
        return 255 - sum / 3.0;
    }
}
