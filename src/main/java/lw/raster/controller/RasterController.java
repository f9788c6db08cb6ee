package lw.raster.controller;

import lw.raster.model.GridSize;
import lw.raster.model.RasterConfigurationException;
import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import lw.raster.service.EngineMessage;
import lw.raster.service.RasterEngine;
import lw.raster.service.RasterEngineException;
import lw.raster.utilities.Tile;
import lw.raster.utilities.TilingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Producer side of a rasterization run.
 *
 * <p>For each run the controller:
 * <ol>
 *   <li>Computes the scaled image size and tile grid from the settings</li>
 *   <li>Renders the tile grid from the decoded source image</li>
 *   <li>Starts a {@link RasterEngine} on its own thread</li>
 *   <li>Posts {@code INIT}, one {@code ADD_CELL} per tile and {@code PARSE}, in that order</li>
 * </ol>
 * The returned {@link RasterJob} streams the engine's output back to the caller.
 * Tiles are handed to the engine without copying and are not touched again here.</p>
 *
 * <p>Decoding image files is left to the caller (for example with {@code ImageIO.read}).</p>
 *
 * @since 1.0.0
 */
public class RasterController {
    private static final Logger logger = LoggerFactory.getLogger(RasterController.class);

    /** Version written in the G-code header */
    public static final String VERSION = "1.0.0";

    private static final AtomicInteger threadCounter = new AtomicInteger();

    private final int bufferSize;

    public RasterController() {
        this(TilingUtilities.DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize maximum tile edge length in pixels
     */
    public RasterController(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Starts rasterizing a decoded image.
     *
     * @param image    the decoded source image
     * @param settings the run settings
     * @return handle streaming the run output
     * @throws RasterConfigurationException if settings are missing
     * @throws IllegalArgumentException     if the image is missing
     */
    public RasterJob rasterize(BufferedImage image, RasterSettings settings) {
        if (settings == null) {
            throw new RasterConfigurationException("No raster settings provided");
        }
        if (image == null) {
            throw new IllegalArgumentException("No image loaded");
        }

        logger.info("Starting rasterization of {} x {} image with {}", image.getWidth(), image.getHeight(), settings);

        RasterGeometry geometry = TilingUtilities.computeGeometry(
                image.getWidth(), image.getHeight(), settings, bufferSize);
        Tile[][] tiles = TilingUtilities.buildTiles(image, geometry, settings.isSmoothing());

        RasterJob job = new RasterJob();
        BlockingQueue<EngineMessage> inbox = new LinkedBlockingQueue<>();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "RasterEngine-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            executor.execute(new RasterEngine(inbox, job));
            executor.shutdown();

            inbox.put(EngineMessage.init(settings, geometry, VERSION));

            GridSize grid = geometry.gridSize();
            for (int gy = 0; gy < grid.y(); gy++) {
                for (int gx = 0; gx < grid.x(); gx++) {
                    inbox.put(EngineMessage.addCell(tiles[gy][gx]));
                    tiles[gy][gx] = null;
                }
            }

            inbox.put(EngineMessage.parse());
            logger.debug("Posted {} tiles and parse request", grid.cellCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new RasterEngineException("Interrupted while posting tiles to the engine", e);
        }

        return job;
    }

    /**
     * Rasterizes an image and waits for the complete program.
     *
     * @param image    the decoded source image
     * @param settings the run settings
     * @return the header followed by every command line
     * @throws RasterEngineException if the run fails
     */
    public String rasterizeToString(BufferedImage image, RasterSettings settings) {
        return rasterize(image, settings).collectGCode();
    }
}
