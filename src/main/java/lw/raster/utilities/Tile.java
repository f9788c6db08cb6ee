package lw.raster.utilities;

/**
 * A rectangular RGBA chunk of the scaled image, addressed by its grid position.
 * <p>
 * The buffer is handed over without copying; once a tile has been posted to the
 * engine the producer no longer reads or writes it.
 *
 * @param gridX  tile column
 * @param gridY  tile row
 * @param width  tile width in pixels
 * @param height tile height in pixels
 * @param buffer RGBA bytes, row-major from the top-left corner
 */
public record Tile(int gridX, int gridY, int width, int height, byte[] buffer) {

    public Tile {
        if (buffer == null || buffer.length != width * height * 4) {
            throw new IllegalArgumentException(String.format(
                    "Tile (%d, %d) buffer must hold %d bytes for %d x %d pixels, got %s",
                    gridX, gridY, width * height * 4, width, height,
                    buffer == null ? "null" : String.valueOf(buffer.length)));
        }
    }
}
