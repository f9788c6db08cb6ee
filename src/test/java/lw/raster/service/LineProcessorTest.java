package lw.raster.service;

import static org.junit.jupiter.api.Assertions.*;

import lw.raster.TestImages;
import lw.raster.model.PixelCoordinate;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.PixelTileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit tests for LineProcessor direction handling and trimming.
 */
class LineProcessorTest {

    private static List<PixelCoordinate> row(int y, int width) {
        List<PixelCoordinate> line = new ArrayList<>();
        for (int x = 0; x < width; x++) {
            line.add(new PixelCoordinate(x, y));
        }
        return line;
    }

    private static RasterSettings.Builder verbose() {
        return new RasterSettings.Builder().verboseG(true).burnWhite(true);
    }

    @Test
    @DisplayName("Row mode alternates direction starting left to right")
    void testBoustrophedon() {
        PixelTileStore store = TestImages.store(TestImages.uniform(2, 2, 0), 2048);
        LineProcessor processor = new LineProcessor(verbose().trimLine(false).build(), store, new CommandState());

        String first = processor.process(row(0, 2));
        assertFalse(processor.isReverseLine());
        String second = processor.process(row(1, 2));
        assertTrue(processor.isReverseLine());

        assertTrue(first.startsWith("G0 X0.05 Y0.05 S0.0000"), first);
        assertTrue(first.endsWith("G1 X0.15 Y0.05 S1.0000"), first);
        assertTrue(second.startsWith("G0 X0.15 Y0.15 S0.0000"), second);
        assertTrue(second.endsWith("G1 X0.05 Y0.15 S1.0000"), second);
    }

    @Test
    @DisplayName("Lines removed by trimming do not flip the direction")
    void testTrimmedLineKeepsDirection() {
        // top row first: row 2 black, row 1 white, row 0 black
        PixelTileStore store = TestImages.store(TestImages.gray(new int[][]{
                {0, 0},
                {255, 255},
                {0, 0}
        }), 2048);
        LineProcessor processor = new LineProcessor(verbose().trimLine(true).build(), store, new CommandState());

        assertNotNull(processor.process(row(0, 2)));
        assertFalse(processor.isReverseLine());

        assertNull(processor.process(row(1, 2)));
        assertFalse(processor.isReverseLine());

        String third = processor.process(row(2, 2));
        assertTrue(processor.isReverseLine());
        assertTrue(third.startsWith("G0 X0.15 Y0.25"), third);
    }

    @Test
    @DisplayName("Trimming drops blank ends of a line")
    void testTrimmingEnds() {
        PixelTileStore store = TestImages.store(TestImages.gray(new int[][]{{255, 0, 0, 255}}), 2048);
        LineProcessor processor = new LineProcessor(verbose().trimLine(true).build(), store, new CommandState());

        String gcode = processor.process(row(0, 4));

        assertEquals(String.join("\n",
                "G0 X0.15 Y0.05 S0.0000",
                "G1 X0.15 Y0.05 S1.0000",
                "G1 X0.25 Y0.05 S1.0000"), gcode);
    }

    @Test
    @DisplayName("Diagonal mode keeps generator order even when the toggle is set")
    void testDiagonalNeverReverses() {
        PixelTileStore store = TestImages.store(TestImages.uniform(2, 2, 0), 2048);
        RasterSettings settings = verbose().trimLine(false).diagonal(true).build();
        LineProcessor processor = new LineProcessor(settings, store, new CommandState());

        processor.process(List.of(new PixelCoordinate(0, 0)));
        assertFalse(processor.isReverseLine());

        String second = processor.process(List.of(new PixelCoordinate(0, 1), new PixelCoordinate(1, 0)));
        assertTrue(processor.isReverseLine());
        assertTrue(second.startsWith("G0 X0.05 Y0.15"), second);
    }
}
