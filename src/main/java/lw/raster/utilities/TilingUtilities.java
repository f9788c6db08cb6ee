package lw.raster.utilities;

import lw.raster.model.GridSize;
import lw.raster.model.ImageSize;
import lw.raster.model.RasterConfigurationException;
import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Utilities for splitting a scaled image into a grid of bounded-size RGBA tiles.
 * <p>
 * A single pixel buffer for a large engraving can exceed practical size limits, so the
 * scaled image is held as a grid of tiles no larger than {@code bufferSize} on each edge.
 * This class handles:
 * <ul>
 *   <li>Scale and output size calculation from the run settings</li>
 *   <li>Grid calculation, including the remainder tiles on the last column and row</li>
 *   <li>Rendering each tile over a white background so alpha never reaches the power lookup</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class TilingUtilities {
    private static final Logger logger = LoggerFactory.getLogger(TilingUtilities.class);

    /** Maximum tile edge length in pixels */
    public static final int DEFAULT_BUFFER_SIZE = 2048;

    private TilingUtilities() {
    }

    /**
     * Computes the scale factors, scaled image size and tile grid for a source image.
     *
     * @param sourceWidth  width of the decoded source image in pixels
     * @param sourceHeight height of the decoded source image in pixels
     * @param settings     the run settings providing ppi and beam size
     * @param bufferSize   maximum tile edge length
     * @return the geometry shared by the controller and the engine
     * @throws RasterConfigurationException if the scaled image does not fit in an int per axis
     */
    public static RasterGeometry computeGeometry(int sourceWidth, int sourceHeight,
                                                 RasterSettings settings, int bufferSize) {
        if (sourceWidth < 0 || sourceHeight < 0) {
            throw new IllegalArgumentException("Source size must not be negative: "
                    + sourceWidth + "x" + sourceHeight);
        }
        double ppm = settings.getPpm();
        double scaleRatio = settings.getScaleRatio();
        ImageSize imageSize = new ImageSize(
                scaledExtent(sourceWidth, sourceWidth, sourceHeight, settings),
                scaledExtent(sourceHeight, sourceWidth, sourceHeight, settings));
        GridSize gridSize = gridSize(imageSize, bufferSize);

        logger.info("Raster geometry:");
        logger.info("  Source: {} x {} px", sourceWidth, sourceHeight);
        logger.info("  PPM: {}, scale ratio: {}", ppm, scaleRatio);
        logger.info("  Scaled image: {} x {} px", imageSize.width(), imageSize.height());
        logger.info("  Grid: {} columns x {} rows (buffer size {})", gridSize.x(), gridSize.y(), bufferSize);

        return new RasterGeometry(ppm, scaleRatio, imageSize, gridSize, bufferSize);
    }

    private static int scaledExtent(int extent, int sourceWidth, int sourceHeight, RasterSettings settings) {
        long scaled = Math.round(extent * settings.getScaleRatio());
        if (scaled > Integer.MAX_VALUE) {
            throw new RasterConfigurationException(String.format(
                    "Scaled image too large: %d x %d px source at ppi %d and beamSize %s gives %d px",
                    sourceWidth, sourceHeight, settings.getPpi(), settings.getBeamSize(), scaled));
        }
        return (int) scaled;
    }

    /**
     * Number of tiles needed along each axis.
     *
     * @param imageSize  scaled image size
     * @param bufferSize maximum tile edge length, must be positive
     * @return {@code ceil(imageSize / bufferSize)} per axis
     */
    public static GridSize gridSize(ImageSize imageSize, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        int x = (int) Math.ceil((double) imageSize.width() / bufferSize);
        int y = (int) Math.ceil((double) imageSize.height() / bufferSize);
        return new GridSize(x, y);
    }

    /**
     * Edge length of the tile at {@code index} along one axis.
     * <p>
     * Every tile but the last is {@code bufferSize} long. The last one holds the remainder,
     * or a full buffer when {@code total} is an exact multiple of {@code bufferSize}.
     *
     * @param index      tile index along the axis
     * @param count      number of tiles along the axis
     * @param total      image extent along the axis
     * @param bufferSize maximum tile edge length
     * @return the tile extent in pixels
     */
    public static int tileExtent(int index, int count, int total, int bufferSize) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Tile index " + index + " outside grid of " + count);
        }
        if (index < count - 1) {
            return bufferSize;
        }
        int remainder = total % bufferSize;
        return remainder == 0 ? Math.min(total, bufferSize) : remainder;
    }

    /**
     * @param geometry the run geometry
     * @param gx       tile column
     * @return width in pixels of every tile in column {@code gx}
     */
    public static int tileWidth(RasterGeometry geometry, int gx) {
        return tileExtent(gx, geometry.gridSize().x(), geometry.imageSize().width(), geometry.bufferSize());
    }

    /**
     * @param geometry the run geometry
     * @param gy       tile row
     * @return height in pixels of every tile in row {@code gy}
     */
    public static int tileHeight(RasterGeometry geometry, int gy) {
        return tileExtent(gy, geometry.gridSize().y(), geometry.imageSize().height(), geometry.bufferSize());
    }

    /**
     * Renders the whole tile grid for a source image.
     *
     * @param source    decoded source image
     * @param geometry  geometry computed by {@link #computeGeometry}
     * @param smoothing true for bilinear interpolation while scaling
     * @return tiles indexed as {@code [gridY][gridX]}
     */
    public static Tile[][] buildTiles(BufferedImage source, RasterGeometry geometry, boolean smoothing) {
        GridSize grid = geometry.gridSize();
        Tile[][] tiles = new Tile[grid.y()][grid.x()];

        for (int gy = 0; gy < grid.y(); gy++) {
            for (int gx = 0; gx < grid.x(); gx++) {
                tiles[gy][gx] = renderTile(source, geometry, gx, gy, smoothing);
            }
        }

        logger.info("Built {} tiles", grid.cellCount());
        return tiles;
    }

    /**
     * Renders one tile: white background first, then the matching scaled region of the source.
     *
     * @param source    decoded source image
     * @param geometry  run geometry
     * @param gx        tile column
     * @param gy        tile row
     * @param smoothing true for bilinear interpolation while scaling
     * @return the tile with its own RGBA buffer
     */
    public static Tile renderTile(BufferedImage source, RasterGeometry geometry,
                                  int gx, int gy, boolean smoothing) {
        int width = tileWidth(geometry, gx);
        int height = tileHeight(geometry, gy);
        int bufferSize = geometry.bufferSize();

        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, smoothing
                    ? RenderingHints.VALUE_INTERPOLATION_BILINEAR
                    : RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);

            // Opaque background, transparent source pixels end up white
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);

            AffineTransform transform = new AffineTransform();
            transform.translate(-(double) gx * bufferSize, -(double) gy * bufferSize);
            transform.scale(geometry.scaleRatio(), geometry.scaleRatio());
            g.drawImage(source, transform, null);
        } finally {
            g.dispose();
        }

        logger.debug("Rendered tile ({}, {}): {} x {} px", gx, gy, width, height);
        return new Tile(gx, gy, width, height, toRgba(canvas));
    }

    /**
     * Extracts the pixels of an image as RGBA bytes, row by row from the top-left corner.
     *
     * @param image the image to read
     * @return a new buffer of {@code width * height * 4} bytes
     */
    public static byte[] toRgba(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] rgba = new byte[argb.length * 4];

        for (int i = 0; i < argb.length; i++) {
            int pixel = argb[i];
            int offset = i * 4;
            rgba[offset] = (byte) ((pixel >> 16) & 0xFF);
            rgba[offset + 1] = (byte) ((pixel >> 8) & 0xFF);
            rgba[offset + 2] = (byte) (pixel & 0xFF);
            rgba[offset + 3] = (byte) ((pixel >>> 24) & 0xFF);
        }
        return rgba;
    }
}
