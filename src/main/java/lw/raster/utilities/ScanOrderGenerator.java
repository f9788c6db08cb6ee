package lw.raster.utilities;

import lw.raster.model.ImageSize;

import java.util.Iterator;

/**
 * Produces the lines of a scan, covering every pixel of the image exactly once.
 * Lines are created on demand and are not retained by the generator.
 */
public interface ScanOrderGenerator extends Iterator<ScanLine> {

    /**
     * @return short name of the scan order, for logging
     */
    String getName();

    /**
     * Creates the generator matching the scan mode.
     *
     * @param imageSize scaled image size
     * @param diagonal  true for the diagonal zigzag, false for row-major
     * @return a fresh generator positioned before the first line
     */
    static ScanOrderGenerator create(ImageSize imageSize, boolean diagonal) {
        return diagonal ? new DiagonalScanGenerator(imageSize) : new RowScanGenerator(imageSize);
    }
}
