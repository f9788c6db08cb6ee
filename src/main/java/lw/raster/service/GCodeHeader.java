package lw.raster.service;

import lw.raster.model.ImageSize;
import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.GCodeFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the commented preamble of a run and its feed rate setup.
 */
public final class GCodeHeader {

    /** Name written on the first header line */
    public static final String GENERATOR = "lw-rasterizer";

    private GCodeHeader() {
    }

    /**
     * @param settings the run settings
     * @param geometry the run geometry
     * @param version  generator version
     * @return header text ending with a blank line
     */
    public static String render(RasterSettings settings, RasterGeometry geometry, String version) {
        ImageSize size = geometry.imageSize();
        RasterSettings.PowerRange range = settings.getEffectiveBeamRange();
        RasterSettings.PowerRange power = settings.getBeamPower();
        String feedRate = GCodeFormat.plain(settings.getFeedRate());

        List<String> headers = new ArrayList<>();
        headers.add("; Generated by " + GENERATOR + " - " + version);
        headers.add("; Size       : " + GCodeFormat.plain(size.width() * settings.getBeamSize())
                + " x " + GCodeFormat.plain(size.height() * settings.getBeamSize()) + " mm");
        headers.add("; Resolution : " + GCodeFormat.plain(geometry.ppm()) + " PPM - " + settings.getPpi() + " PPI");
        headers.add("; Beam size  : " + GCodeFormat.plain(settings.getBeamSize()) + " mm");
        headers.add("; Beam range : " + GCodeFormat.plain(range.min()) + " to " + GCodeFormat.plain(range.max()));
        headers.add("; Beam power : " + GCodeFormat.plain(power.min()) + " to " + GCodeFormat.plain(power.max()) + " %");
        headers.add("; Feed rate  : " + feedRate + " mm/min");

        List<String> options = settings.getEnabledOptions();
        if (!options.isEmpty()) {
            headers.add("; Options    : " + String.join(", ", options));
        }

        headers.add("");
        headers.add("G0 F" + feedRate);
        headers.add("G1 F" + feedRate);
        headers.add("");

        return String.join("\n", headers);
    }
}
