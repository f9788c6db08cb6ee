package lw.raster.utilities;

import lw.raster.model.ImageSize;
import lw.raster.model.PixelCoordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Diagonal zigzag scan along anti-diagonals.
 *
 * <p>The walker alternates direction with the parity of {@code x + y}: odd positions step
 * southwest ({@code x-1, y+1}), even positions step northeast ({@code x+1, y-1}). Hitting
 * an edge clamps the position onto the next diagonal and ends the current line.</p>
 *
 * <p>The step counter is seeded with {@code width * height + 1}; the extra step only
 * flushes the last diagonal, so every pixel is visited exactly once.</p>
 */
public class DiagonalScanGenerator implements ScanOrderGenerator {

    private final int width;
    private final int height;
    private final long total;
    private long remaining;

    private int x;
    private int y;
    private boolean endOfLine;
    private List<PixelCoordinate> line = new ArrayList<>();
    private ScanLine pending;

    public DiagonalScanGenerator(ImageSize imageSize) {
        this.width = imageSize.width();
        this.height = imageSize.height();
        this.total = imageSize.isEmpty() ? 0 : imageSize.pixelCount() + 1;
        this.remaining = total;
    }

    @Override
    public String getName() {
        return "diagonal";
    }

    /**
     * @return steps left before the walker reaches its terminal state
     */
    public long getRemaining() {
        return remaining;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public ScanLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Diagonal scan finished");
        }
        ScanLine result = pending;
        pending = null;
        return result;
    }

    private ScanLine advance() {
        while (remaining > 0) {
            remaining--;
            boolean odd = (x + y) % 2 != 0;
            ScanLine flushed = null;

            if (endOfLine || (remaining == 0 && !line.isEmpty())) {
                int percent = 100 - (int) Math.round((double) remaining / total * 100);
                flushed = new ScanLine(line, percent);
                line = new ArrayList<>();
                endOfLine = false;
            }

            // terminal step
            if (remaining > 0) {
                line.add(new PixelCoordinate(x, y));
                step(odd);
            }

            if (flushed != null) {
                return flushed;
            }
        }
        return null;
    }

    private void step(boolean odd) {
        if (odd) {
            // southwest
            x--;
            y++;
            if (y == height) {
                y--;
                x += 2;
                endOfLine = true;
            }
            if (x < 0) {
                x = 0;
                endOfLine = true;
            }
        } else {
            // northeast
            x++;
            y--;
            if (x == width) {
                x--;
                y += 2;
                endOfLine = true;
            }
            if (y < 0) {
                y = 0;
                endOfLine = true;
            }
        }
    }
}
