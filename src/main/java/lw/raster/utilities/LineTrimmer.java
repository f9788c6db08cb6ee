package lw.raster.utilities;

import lw.raster.model.PixelCoordinate;

import java.util.List;

/**
 * Strips leading and trailing zero-power pixels from a line.
 *
 * <p>Both ends are scanned inward in the same pass, stopping as soon as the first
 * and the last burning pixel are both known.</p>
 */
public class LineTrimmer {

    private final PowerSource powerSource;

    public LineTrimmer(PowerSource powerSource) {
        this.powerSource = powerSource;
    }

    /**
     * @param line pixels in scan order
     * @return the sub-list between the first and last non-zero pixel (inclusive),
     *         or null if the line has no non-zero pixel
     */
    public List<PixelCoordinate> trim(List<PixelCoordinate> line) {
        int length = line.size();
        int start = -1;
        int end = -1;

        for (int i = 0, j = length - 1; i < length; i++, j--) {
            if (start < 0 && powerSource.getPower(line.get(i)) != 0) {
                start = i;
            }
            if (end < 0 && powerSource.getPower(line.get(j)) != 0) {
                end = j + 1;
            }
            if (start >= 0 && end >= 0) {
                return line.subList(start, end);
            }
        }

        // white line
        return null;
    }
}
