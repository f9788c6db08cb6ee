package lw.raster.service;

import lw.raster.model.OutputEvent;

/**
 * Receiving end of the engine's output channel.
 * All methods are called from the engine thread, in order.
 */
public interface EngineOutput {

    /**
     * Delivers one output event.
     *
     * @param event the event
     */
    void publish(OutputEvent event);

    /**
     * Signals that the run finished after its {@link OutputEvent.Type#DONE} event.
     *
     * @param lines    number of lines that produced output
     * @param commands number of command lines emitted
     */
    void complete(int lines, long commands);

    /**
     * Signals that the run aborted. No event follows.
     *
     * @param cause the failure, a {@link java.util.concurrent.CancellationException} when cancelled
     */
    void fail(Throwable cause);

    /**
     * @return true once the consumer asked the run to stop
     */
    boolean isCancelled();
}
