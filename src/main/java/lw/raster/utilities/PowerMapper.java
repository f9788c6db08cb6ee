package lw.raster.utilities;

import lw.raster.model.RasterSettings;

/**
 * Linear mapping of a raw power sample into the device power range.
 *
 * @param min device power for a raw sample of 0
 * @param max device power for a raw sample of 255
 */
public record PowerMapper(double min, double max) {

    /**
     * Creates a mapper over the effective beam range of the settings.
     *
     * @param settings the run settings
     * @return the mapper
     */
    public static PowerMapper forSettings(RasterSettings settings) {
        RasterSettings.PowerRange range = settings.getEffectiveBeamRange();
        return new PowerMapper(range.min(), range.max());
    }

    /**
     * @param raw raw sample in {@code [0, 255]}
     * @return {@code raw * (max - min) / 255 + min}
     */
    public double map(double raw) {
        return raw * (max - min) / 255 + min;
    }
}
