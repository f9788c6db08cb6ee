package lw.raster.utilities;

import lw.raster.model.ImageSize;
import lw.raster.model.PixelCoordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Row-major scan: one line per row, pixels in ascending x.
 * <p>
 * Alternate rows are reversed later, when the line is processed, which turns this
 * order into a boustrophedon path.
 */
public class RowScanGenerator implements ScanOrderGenerator {

    private final int width;
    private final int height;
    private int y;

    public RowScanGenerator(ImageSize imageSize) {
        this.width = imageSize.width();
        this.height = imageSize.height();
    }

    @Override
    public String getName() {
        return "horizontal";
    }

    @Override
    public boolean hasNext() {
        return width > 0 && y < height;
    }

    @Override
    public ScanLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Row scan finished");
        }
        List<PixelCoordinate> line = new ArrayList<>(width);
        for (int x = 0; x < width; x++) {
            line.add(new PixelCoordinate(x, y));
        }
        int percent = (int) Math.round((double) y / height * 100);
        y++;
        return new ScanLine(line, percent);
    }
}
