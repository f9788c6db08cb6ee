package lw.raster.utilities;

import static org.junit.jupiter.api.Assertions.*;

import lw.raster.model.ImageSize;
import lw.raster.model.PixelCoordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Unit tests for the row-major and diagonal scan generators.
 */
class ScanOrderGeneratorTest {

    private static List<ScanLine> drain(ScanOrderGenerator generator) {
        List<ScanLine> lines = new ArrayList<>();
        while (generator.hasNext()) {
            lines.add(generator.next());
        }
        return lines;
    }

    private static void assertCoversExactlyOnce(List<ScanLine> lines, int width, int height) {
        Set<PixelCoordinate> seen = new HashSet<>();
        int visited = 0;
        for (ScanLine line : lines) {
            for (PixelCoordinate pixel : line.pixels()) {
                assertTrue(pixel.x() >= 0 && pixel.x() < width, "x out of range: " + pixel);
                assertTrue(pixel.y() >= 0 && pixel.y() < height, "y out of range: " + pixel);
                assertTrue(seen.add(pixel), "Visited twice: " + pixel);
                visited++;
            }
        }
        assertEquals(width * height, visited);
    }

    private static void assertProgressNonDecreasing(List<ScanLine> lines) {
        int previous = 0;
        for (ScanLine line : lines) {
            assertTrue(line.percent() >= previous, "Progress went back to " + line.percent());
            assertTrue(line.percent() <= 100);
            previous = line.percent();
        }
    }

    // ==================== Row-major ====================

    @Test
    @DisplayName("Row scan yields one ascending line per row")
    void testRowScanOrder() {
        List<ScanLine> lines = drain(new RowScanGenerator(new ImageSize(3, 2)));

        assertEquals(2, lines.size());
        assertEquals(List.of(new PixelCoordinate(0, 0), new PixelCoordinate(1, 0), new PixelCoordinate(2, 0)),
                lines.get(0).pixels());
        assertEquals(List.of(new PixelCoordinate(0, 1), new PixelCoordinate(1, 1), new PixelCoordinate(2, 1)),
                lines.get(1).pixels());
    }

    @Test
    @DisplayName("Row scan progress is y / height")
    void testRowScanProgress() {
        List<ScanLine> lines = drain(new RowScanGenerator(new ImageSize(1, 4)));

        assertEquals(List.of(0, 25, 50, 75), lines.stream().map(ScanLine::percent).toList());
    }

    // ==================== Diagonal ====================

    @Test
    @DisplayName("Diagonal scan on 3 x 3 visits 9 unique pixels and reaches its terminal state")
    void testDiagonalThreeByThree() {
        DiagonalScanGenerator generator = new DiagonalScanGenerator(new ImageSize(3, 3));
        List<ScanLine> lines = drain(generator);

        assertCoversExactlyOnce(lines, 3, 3);
        assertEquals(0, generator.getRemaining());
        assertEquals(5, lines.size());

        assertEquals(List.of(new PixelCoordinate(0, 0)), lines.get(0).pixels());
        assertEquals(List.of(new PixelCoordinate(1, 0), new PixelCoordinate(0, 1)), lines.get(1).pixels());
        assertEquals(List.of(new PixelCoordinate(0, 2), new PixelCoordinate(1, 1), new PixelCoordinate(2, 0)),
                lines.get(2).pixels());
        assertEquals(List.of(new PixelCoordinate(2, 1), new PixelCoordinate(1, 2)), lines.get(3).pixels());
        assertEquals(List.of(new PixelCoordinate(2, 2)), lines.get(4).pixels());

        assertEquals(List.of(20, 40, 70, 90, 100), lines.stream().map(ScanLine::percent).toList());
    }

    @Test
    @DisplayName("Diagonal lines alternate direction")
    void testDiagonalAlternates() {
        List<ScanLine> lines = drain(new DiagonalScanGenerator(new ImageSize(4, 4)));

        for (ScanLine line : lines) {
            List<PixelCoordinate> pixels = line.pixels();
            for (int i = 1; i < pixels.size(); i++) {
                int dx = pixels.get(i).x() - pixels.get(i - 1).x();
                int dy = pixels.get(i).y() - pixels.get(i - 1).y();
                assertEquals(0, dx + dy, "Pixels of a line must share an anti-diagonal");
                assertEquals(1, Math.abs(dx));
            }
        }
    }

    // ==================== Coverage ====================

    @ParameterizedTest
    @CsvSource({
            "1, 1", "1, 5", "5, 1", "2, 2", "3, 3", "4, 7", "7, 4", "10, 10", "13, 6", "2, 9"
    })
    @DisplayName("Both scan orders cover every pixel exactly once with non-decreasing progress")
    void testCoverage(int width, int height) {
        for (boolean diagonal : new boolean[]{false, true}) {
            ScanOrderGenerator generator = ScanOrderGenerator.create(new ImageSize(width, height), diagonal);
            List<ScanLine> lines = drain(generator);

            assertCoversExactlyOnce(lines, width, height);
            assertProgressNonDecreasing(lines);
        }
    }

    @Test
    @DisplayName("Empty image yields no line")
    void testEmptyImage() {
        assertFalse(new RowScanGenerator(new ImageSize(0, 4)).hasNext());
        assertFalse(new DiagonalScanGenerator(new ImageSize(4, 0)).hasNext());
    }

    @Test
    @DisplayName("next() past the end throws")
    void testExhausted() {
        ScanOrderGenerator generator = ScanOrderGenerator.create(new ImageSize(1, 1), true);
        generator.next();
        assertThrows(NoSuchElementException.class, generator::next);
    }

    @Test
    @DisplayName("Factory picks the generator for the scan mode")
    void testFactory() {
        assertEquals("horizontal", ScanOrderGenerator.create(new ImageSize(1, 1), false).getName());
        assertEquals("diagonal", ScanOrderGenerator.create(new ImageSize(1, 1), true).getName());
    }
}
