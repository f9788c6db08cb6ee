package lw.raster.utilities;

import lw.raster.model.PixelCoordinate;

import java.util.List;

/**
 * One line handed out by a scan generator, with the progress at which its output is reported.
 *
 * @param pixels  pixels in scan order
 * @param percent progress in percent
 */
public record ScanLine(List<PixelCoordinate> pixels, int percent) {}
