package lw.raster.model;

/**
 * Number of tiles along each axis of the tile grid.
 *
 * @param x number of tile columns
 * @param y number of tile rows
 */
public record GridSize(int x, int y) {

    /**
     * @return total number of tiles
     */
    public int cellCount() {
        return x * y;
    }
}
