package lw.raster.model;

/**
 * Statistics of a completed rasterization run.
 *
 * @param lines         number of lines that produced output
 * @param commands      number of command lines emitted, header excluded
 * @param elapsedMillis wall-clock time between submission and completion
 */
public record RasterSummary(int lines, long commands, long elapsedMillis) {}
