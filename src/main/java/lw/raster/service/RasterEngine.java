package lw.raster.service;

import lw.raster.model.OutputEvent;
import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.PixelTileStore;
import lw.raster.utilities.ScanLine;
import lw.raster.utilities.ScanOrderGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;

/**
 * Consumer side of a rasterization run.
 *
 * <p>The engine takes {@link EngineMessage}s from its inbox strictly in order and streams
 * {@link OutputEvent}s to an {@link EngineOutput} as they are produced. It runs on its own
 * thread and owns all per-run state (tile store, command state, direction toggle); nothing
 * of it is shared with the producer.</p>
 *
 * <p>State machine: {@code IDLE -> INITIALIZED -> STREAMING -> DONE}. A message arriving
 * in the wrong state aborts the run, as does any failure while scanning. An aborted run
 * never emits {@link OutputEvent.Type#DONE}.</p>
 *
 * @since 1.0.0
 */
public class RasterEngine implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(RasterEngine.class);

    /**
     * Lifecycle of an engine.
     */
    public enum State {
        IDLE,
        INITIALIZED,
        STREAMING,
        DONE,
        FAILED
    }

    private final BlockingQueue<EngineMessage> inbox;
    private final EngineOutput output;

    private State state = State.IDLE;
    private RasterSettings settings;
    private RasterGeometry geometry;
    private String version;
    private PixelTileStore tileStore;
    private CommandState commandState;

    public RasterEngine(BlockingQueue<EngineMessage> inbox, EngineOutput output) {
        this.inbox = inbox;
        this.output = output;
    }

    /**
     * Processes messages until the run is done or has failed.
     */
    @Override
    public void run() {
        try {
            while (state != State.DONE) {
                handle(inbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(new CancellationException("Rasterization interrupted in state " + state));
        } catch (CancellationException e) {
            abort(e);
        } catch (RuntimeException | Error e) {
            logger.error("Rasterization failed in state {}: {}", state, e.getMessage(), e);
            abort(e);
        }
    }

    /**
     * Handles a single message.
     *
     * @param message the message
     * @throws IllegalStateException if the message is not valid in the current state
     */
    public void handle(EngineMessage message) {
        logger.debug("Handling {} in state {}", message, state);
        switch (message.getType()) {
            case INIT:
                init(message);
                break;
            case ADD_CELL:
                addCell(message);
                break;
            case PARSE:
                parse();
                break;
            default:
                throw new IllegalStateException("Unknown message type: " + message.getType());
        }
    }

    public State getState() {
        return state;
    }

    private void init(EngineMessage message) {
        requireState(message, State.IDLE);
        if (message.getSettings() == null || message.getGeometry() == null) {
            throw new IllegalStateException("Init message requires settings and geometry");
        }
        settings = message.getSettings();
        geometry = message.getGeometry();
        version = message.getVersion();
        tileStore = new PixelTileStore(geometry);
        commandState = new CommandState();
        state = State.INITIALIZED;

        RasterSettings.PowerRange range = settings.getEffectiveBeamRange();
        logger.info("Engine initialized: {} x {} px, {} tiles, beam offset {}, beam range {} to {}",
                geometry.imageSize().width(), geometry.imageSize().height(),
                geometry.gridSize().cellCount(), settings.getBeamOffset(), range.min(), range.max());
    }

    private void addCell(EngineMessage message) {
        if (state != State.INITIALIZED && state != State.STREAMING) {
            throw new IllegalStateException("Cannot add a tile in state " + state);
        }
        tileStore.addCell(message.getTile().gridX(), message.getTile().gridY(), message.getTile().buffer());
    }

    private void parse() {
        if (state != State.INITIALIZED) {
            throw new IllegalStateException("Cannot parse in state " + state);
        }
        if (!tileStore.isComplete()) {
            throw new IllegalStateException(String.format("Cannot parse with %d of %d tiles",
                    tileStore.getCellCount(), geometry.gridSize().cellCount()));
        }
        state = State.STREAMING;

        output.publish(OutputEvent.header(GCodeHeader.render(settings, geometry, version)));

        ScanOrderGenerator generator = ScanOrderGenerator.create(geometry.imageSize(), settings.isDiagonal());
        LineProcessor processor = new LineProcessor(settings, tileStore, commandState);
        logger.info("Starting {} scan", generator.getName());

        int lines = 0;
        while (generator.hasNext()) {
            if (output.isCancelled()) {
                throw new CancellationException("Rasterization cancelled after " + lines + " lines");
            }
            ScanLine line = generator.next();
            String gcode = processor.process(line.pixels());
            if (gcode != null) {
                output.publish(OutputEvent.gcode(gcode, line.percent()));
                lines++;
            }
        }

        state = State.DONE;
        output.publish(OutputEvent.done());
        output.complete(lines, commandState.getCommandCount());
        logger.info("Scan finished: {} lines, {} commands", lines, commandState.getCommandCount());
    }

    private void requireState(EngineMessage message, State expected) {
        if (state != expected) {
            throw new IllegalStateException("Cannot handle " + message.getType() + " in state " + state);
        }
    }

    private void abort(Throwable cause) {
        state = State.FAILED;
        if (cause instanceof CancellationException) {
            logger.info("Rasterization stopped: {}", cause.getMessage());
        }
        output.fail(cause);
    }
}
