package lw.raster.service;

import static org.junit.jupiter.api.Assertions.*;

import lw.raster.TestImages;
import lw.raster.model.RasterSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GCodeHeader.
 */
class GCodeHeaderTest {

    @Test
    @DisplayName("Default settings render the full header")
    void testDefaultHeader() {
        RasterSettings settings = new RasterSettings.Builder().build();

        String header = GCodeHeader.render(settings, TestImages.geometry(100, 50, 2048), "1.0.0");

        assertEquals(String.join("\n",
                "; Generated by lw-rasterizer - 1.0.0",
                "; Size       : 10 x 5 mm",
                "; Resolution : 0.1 PPM - 254 PPI",
                "; Beam size  : 0.1 mm",
                "; Beam range : 0 to 1",
                "; Beam power : 0 to 100 %",
                "; Feed rate  : 1500 mm/min",
                "; Options    : trimLine, burnWhite, verboseG",
                "",
                "G0 F1500",
                "G1 F1500",
                ""), header);
    }

    @Test
    @DisplayName("Options line is omitted when no option is enabled")
    void testNoOptions() {
        RasterSettings settings = new RasterSettings.Builder()
                .trimLine(false).burnWhite(false).verboseG(false)
                .feedRate(2400.5)
                .build();

        String header = GCodeHeader.render(settings, TestImages.geometry(1, 1, 2048), "2.3.4");

        assertFalse(header.contains("; Options"));
        assertTrue(header.startsWith("; Generated by lw-rasterizer - 2.3.4\n"));
        assertTrue(header.contains("; Feed rate  : 2400.5 mm/min\n"));
        assertTrue(header.endsWith("\nG0 F2400.5\nG1 F2400.5\n"));
    }

    @Test
    @DisplayName("Beam range shows the effective range")
    void testEffectiveBeamRange() {
        RasterSettings settings = new RasterSettings.Builder()
                .beamRange(0, 1000)
                .beamPower(10, 50)
                .build();

        String header = GCodeHeader.render(settings, TestImages.geometry(1, 1, 2048), "1.0.0");

        assertTrue(header.contains("; Beam range : 100 to 500\n"), header);
        assertTrue(header.contains("; Beam power : 10 to 50 %\n"), header);
    }
}
