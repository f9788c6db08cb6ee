package lw.raster.controller;

import lw.raster.model.OutputEvent;
import lw.raster.model.RasterSummary;
import lw.raster.service.EngineOutput;
import lw.raster.service.RasterEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running rasterization.
 *
 * <p>The engine pushes events into an unbounded FIFO queue as it produces them. The caller
 * consumes them with a blocking iteration, which ends after {@link OutputEvent.Type#DONE}.
 * If the run fails, iteration throws {@link RasterEngineException}; if it was cancelled,
 * iteration throws {@link CancellationException}. The events can be consumed only once.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * RasterJob job = new RasterController().rasterize(image, settings);
 * for (OutputEvent event : job) {
 *     if (event.getType() != OutputEvent.Type.DONE) {
 *         writer.write(event.getText());
 *         progress.update(event.getPercent());
 *     }
 * }
 * RasterSummary summary = job.completion().join();
 * }</pre>
 *
 * @since 1.0.0
 */
public class RasterJob implements Iterable<OutputEvent>, EngineOutput {
    private static final Logger logger = LoggerFactory.getLogger(RasterJob.class);

    /** Queue entry carrying an engine failure */
    private record Failure(Throwable cause) {}

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<RasterSummary> completion = new CompletableFuture<>();
    private final long startNanos = System.nanoTime();
    private final EventIterator iterator = new EventIterator();

    // Engine side

    @Override
    public void publish(OutputEvent event) {
        queue.add(event);
    }

    @Override
    public void complete(int lines, long commands) {
        long elapsed = (System.nanoTime() - startNanos) / 1_000_000;
        RasterSummary summary = new RasterSummary(lines, commands, elapsed);
        logger.info("Rasterization done in {} ms: {} lines, {} commands", elapsed, lines, commands);
        completion.complete(summary);
    }

    @Override
    public void fail(Throwable cause) {
        queue.add(new Failure(cause));
        if (cause instanceof CancellationException) {
            completion.completeExceptionally(cause);
        } else {
            completion.completeExceptionally(new RasterEngineException(
                    "Rasterization failed: " + cause.getMessage(), cause));
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    // Caller side

    /**
     * Asks the engine to stop before its next line. Events already queued remain readable.
     *
     * Cancellation is best-effort: the flag is only checked between lines, so a run that
     * reaches its last line first still ends with {@link OutputEvent.Type#DONE}.
     *
     * @return false if the run had already completed; true only means the request was recorded
     */
    public boolean cancel() {
        if (completion.isDone()) {
            return false;
        }
        logger.info("Cancelling rasterization");
        cancelled.set(true);
        return true;
    }

    /**
     * @return a future completed with the run statistics, or exceptionally on failure or cancellation
     */
    public CompletableFuture<RasterSummary> completion() {
        return completion;
    }

    /**
     * @return the blocking event iterator of this job
     */
    @Override
    public Iterator<OutputEvent> iterator() {
        return iterator;
    }

    /**
     * Consumes every event and concatenates the header and command chunks, one chunk per line.
     *
     * @return the complete G-code program
     */
    public String collectGCode() {
        StringBuilder sb = new StringBuilder();
        for (OutputEvent event : this) {
            if (event.isDone()) {
                break;
            }
            if (event.getType() == OutputEvent.Type.GCODE && sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
                sb.append('\n');
            }
            sb.append(event.getText());
        }
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        return sb.toString();
    }

    private class EventIterator implements Iterator<OutputEvent> {
        private OutputEvent next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            next = take();
            if (next.isDone()) {
                finished = true;
            }
            return true;
        }

        @Override
        public OutputEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Rasterization output fully consumed");
            }
            OutputEvent event = next;
            next = null;
            return event;
        }

        private OutputEvent take() {
            Object item;
            try {
                item = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RasterEngineException("Interrupted while waiting for rasterization output", e);
            }
            if (item instanceof Failure) {
                finished = true;
                Throwable cause = ((Failure) item).cause();
                if (cause instanceof CancellationException) {
                    throw (CancellationException) cause;
                }
                throw new RasterEngineException("Rasterization failed: " + cause.getMessage(), cause);
            }
            return (OutputEvent) item;
        }
    }
}
