package lw.raster.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable settings for one rasterization run.
 * This class follows the builder pattern to avoid constructor parameter explosion
 * and validates every value once, in {@link Builder#build()}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * RasterSettings settings = new RasterSettings.Builder()
 *     .ppi(300)
 *     .beamSize(0.1)
 *     .beamRange(0, 1000)
 *     .beamPower(10, 80)
 *     .feedRate(3000)
 *     .burnWhite(false)
 *     .verboseG(false)
 *     .build();
 * }</pre>
 *
 * <p><strong>Defaults:</strong></p>
 * <ul>
 *   <li>ppi 254 (25.4 ppi == 1 pixel per millimeter at beam size 0.1)</li>
 *   <li>beamSize 0.1 mm, beamRange 0 to 1, beamPower 0 to 100 %</li>
 *   <li>feedRate 1500 mm/min, precision X2 Y2 S4, offsets 0/0</li>
 *   <li>trimLine, burnWhite and verboseG enabled; diagonal and smoothing disabled</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RasterSettings {
    private static final Logger logger = LoggerFactory.getLogger(RasterSettings.class);

    /** Decimal places used when rounding the derived ppm value */
    public static final int PPM_SCALE = 10;

    /** Highest precision accepted for an emitted value */
    public static final int MAX_PRECISION = 20;

    /**
     * Lower and upper bound pair, used for raw beam range and percentage beam power.
     */
    public record PowerRange(double min, double max) {}

    /**
     * Number of decimals emitted for each coordinate/power letter.
     */
    public record Precision(int x, int y, int s) {}

    /**
     * Global offsets added to every emitted X/Y coordinate, in millimeters.
     * They shift the whole job on the machine bed and never enter the pixel math; 0/0 keeps
     * coordinates at {@code pixel * beamSize + beamOffset}.
     */
    public record Offsets(double x, double y) {}

    private final int ppi;
    private final boolean smoothing;
    private final double beamSize;
    private final PowerRange beamRange;
    private final PowerRange beamPower;
    private final double feedRate;
    private final Precision precision;
    private final boolean trimLine;
    private final boolean burnWhite;
    private final boolean verboseG;
    private final boolean diagonal;
    private final Offsets offsets;

    private RasterSettings(Builder b) {
        this.ppi = b.ppi;
        this.smoothing = b.smoothing;
        this.beamSize = b.beamSize;
        this.beamRange = b.beamRange;
        this.beamPower = b.beamPower;
        this.feedRate = b.feedRate;
        this.precision = b.precision;
        this.trimLine = b.trimLine;
        this.burnWhite = b.burnWhite;
        this.verboseG = b.verboseG;
        this.diagonal = b.diagonal;
        this.offsets = b.offsets;
    }

    public int getPpi() { return ppi; }
    public boolean isSmoothing() { return smoothing; }
    public double getBeamSize() { return beamSize; }
    public PowerRange getBeamRange() { return beamRange; }
    public PowerRange getBeamPower() { return beamPower; }
    public double getFeedRate() { return feedRate; }
    public Precision getPrecision() { return precision; }
    public boolean isTrimLine() { return trimLine; }
    public boolean isBurnWhite() { return burnWhite; }
    public boolean isVerboseG() { return verboseG; }
    public boolean isDiagonal() { return diagonal; }
    public Offsets getOffsets() { return offsets; }

    /**
     * Resolution factor derived from {@link #getPpi()}: {@code 2540 / (ppi * 100)},
     * rounded to {@value #PPM_SCALE} decimals. This is the size of one source pixel
     * in millimeters.
     *
     * @return the derived ppm value
     */
    public double getPpm() {
        double ppm = 2540.0 / (ppi * 100.0);
        return BigDecimal.valueOf(ppm).setScale(PPM_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Ratio between source image pixels and beam-sized output pixels.
     *
     * @return {@code ppm / beamSize}
     */
    public double getScaleRatio() {
        return getPpm() / beamSize;
    }

    /**
     * Half-pixel offset that centers each command on its beam-sized pixel.
     *
     * @return {@code beamSize * 1000 / 2000}
     */
    public double getBeamOffset() {
        return beamSize * 1000 / 2000;
    }

    /**
     * Beam range actually used for power mapping.
     * <p>
     * Both bounds are percentages of the configured {@code beamRange.max}; the configured
     * {@code beamRange.min} does not take part in the calculation.
     *
     * @return the effective raw power range
     */
    public PowerRange getEffectiveBeamRange() {
        double max = beamRange.max();
        return new PowerRange(max / 100 * beamPower.min(), max / 100 * beamPower.max());
    }

    /**
     * Names of the enabled boolean options, in header order.
     *
     * @return list of option names, empty when none are enabled
     */
    public List<String> getEnabledOptions() {
        List<String> options = new ArrayList<>();
        if (smoothing) options.add("smoothing");
        if (trimLine) options.add("trimLine");
        if (burnWhite) options.add("burnWhite");
        if (verboseG) options.add("verboseG");
        if (diagonal) options.add("diagonal");
        return options;
    }

    /**
     * @return a builder pre-populated with the values of this instance
     */
    public Builder toBuilder() {
        return new Builder()
                .ppi(ppi)
                .smoothing(smoothing)
                .beamSize(beamSize)
                .beamRange(beamRange.min(), beamRange.max())
                .beamPower(beamPower.min(), beamPower.max())
                .feedRate(feedRate)
                .precision(precision.x(), precision.y(), precision.s())
                .trimLine(trimLine)
                .burnWhite(burnWhite)
                .verboseG(verboseG)
                .diagonal(diagonal)
                .offsets(offsets.x(), offsets.y());
    }

    @Override
    public String toString() {
        return String.format("RasterSettings[ppi=%d, beamSize=%s, beamRange=%s-%s, beamPower=%s-%s%%, "
                        + "feedRate=%s, options=%s]",
                ppi, beamSize, beamRange.min(), beamRange.max(),
                beamPower.min(), beamPower.max(), feedRate, getEnabledOptions());
    }

    /**
     * Builder class for constructing RasterSettings instances.
     * Setters only log suspicious values; all validation happens in {@link #build()}.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private int ppi = 254;
        private boolean smoothing = false;
        private double beamSize = 0.1;
        private PowerRange beamRange = new PowerRange(0, 1);
        private PowerRange beamPower = new PowerRange(0, 100);
        private double feedRate = 1500;
        private Precision precision = new Precision(2, 2, 4);
        private boolean trimLine = true;
        private boolean burnWhite = true;
        private boolean verboseG = true;
        private boolean diagonal = false;
        private Offsets offsets = new Offsets(0, 0);

        /**
         * Sets the source image resolution.
         *
         * @param ppi pixels per inch, must be positive
         * @return this builder instance for method chaining
         */
        public Builder ppi(int ppi) {
            logger.debug("Setting ppi: {}", ppi);
            if (ppi <= 0) {
                logger.warn("ppi must be positive, got {} - this will cause build validation to fail", ppi);
            }
            this.ppi = ppi;
            return this;
        }

        /**
         * Sets whether the source image is interpolated when scaled into tiles.
         *
         * @param smoothing true for bilinear interpolation, false for nearest neighbour
         * @return this builder instance for method chaining
         */
        public Builder smoothing(boolean smoothing) {
            logger.debug("Setting smoothing: {}", smoothing);
            this.smoothing = smoothing;
            return this;
        }

        /**
         * Sets the beam diameter, which is also the output pixel pitch.
         *
         * @param beamSize beam size in millimeters, must be positive
         * @return this builder instance for method chaining
         */
        public Builder beamSize(double beamSize) {
            logger.debug("Setting beam size: {} mm", beamSize);
            if (!(beamSize > 0)) {
                logger.warn("Beam size must be positive, got {} - this will cause build validation to fail", beamSize);
            }
            this.beamSize = beamSize;
            return this;
        }

        /**
         * Sets the firmware power range (S value bounds).
         *
         * @param min lowest raw power
         * @param max highest raw power
         * @return this builder instance for method chaining
         */
        public Builder beamRange(double min, double max) {
            logger.debug("Setting beam range: {} to {}", min, max);
            this.beamRange = new PowerRange(min, max);
            return this;
        }

        /**
         * Sets the beam power calibration as percentages of the beam range maximum.
         *
         * @param min lowest power in percent
         * @param max highest power in percent
         * @return this builder instance for method chaining
         */
        public Builder beamPower(double min, double max) {
            logger.debug("Setting beam power: {}% to {}%", min, max);
            if (min < 0 || max > 100) {
                logger.warn("Beam power should be between 0-100%, got {}% to {}%", min, max);
            }
            this.beamPower = new PowerRange(min, max);
            return this;
        }

        /**
         * @param feedRate feed rate in mm/min, must be positive
         * @return this builder instance for method chaining
         */
        public Builder feedRate(double feedRate) {
            logger.debug("Setting feed rate: {} mm/min", feedRate);
            this.feedRate = feedRate;
            return this;
        }

        /**
         * Sets the number of decimals emitted for X, Y and S values.
         *
         * @param x decimals for X
         * @param y decimals for Y
         * @param s decimals for S
         * @return this builder instance for method chaining
         */
        public Builder precision(int x, int y, int s) {
            logger.debug("Setting precision: X={}, Y={}, S={}", x, y, s);
            this.precision = new Precision(x, y, s);
            return this;
        }

        /**
         * @param trimLine true to strip leading and trailing white pixels from each line
         * @return this builder instance for method chaining
         */
        public Builder trimLine(boolean trimLine) {
            logger.debug("Setting trim line: {}", trimLine);
            this.trimLine = trimLine;
            return this;
        }

        /**
         * @param burnWhite true to emit {@code G1 S0} on inner white pixels, false to travel with {@code G0}
         * @return this builder instance for method chaining
         */
        public Builder burnWhite(boolean burnWhite) {
            logger.debug("Setting burn white: {}", burnWhite);
            this.burnWhite = burnWhite;
            return this;
        }

        /**
         * @param verboseG true to repeat every token on every command
         * @return this builder instance for method chaining
         */
        public Builder verboseG(boolean verboseG) {
            logger.debug("Setting verbose G: {}", verboseG);
            this.verboseG = verboseG;
            return this;
        }

        /**
         * @param diagonal true to scan along anti-diagonals instead of rows
         * @return this builder instance for method chaining
         */
        public Builder diagonal(boolean diagonal) {
            logger.debug("Setting diagonal: {}", diagonal);
            this.diagonal = diagonal;
            return this;
        }

        /**
         * @param x offset added to every X coordinate, in millimeters
         * @param y offset added to every Y coordinate, in millimeters
         * @return this builder instance for method chaining
         */
        public Builder offsets(double x, double y) {
            logger.debug("Setting offsets: X={}, Y={}", x, y);
            this.offsets = new Offsets(x, y);
            return this;
        }

        /**
         * Validates all values and creates the settings.
         *
         * @return the immutable settings
         * @throws RasterConfigurationException if any value is invalid
         */
        public RasterSettings build() {
            List<String> errors = new ArrayList<>();

            if (ppi <= 0) {
                errors.add("ppi must be positive: " + ppi);
            }
            if (!(beamSize > 0) || Double.isInfinite(beamSize)) {
                errors.add("beamSize must be a positive number: " + beamSize);
            }
            if (!(feedRate > 0) || Double.isInfinite(feedRate)) {
                errors.add("feedRate must be a positive number: " + feedRate);
            }
            if (beamRange == null || !isFinite(beamRange) || beamRange.min() > beamRange.max()) {
                errors.add("beamRange must satisfy min <= max: " + beamRange);
            }
            if (beamPower == null || !isFinite(beamPower) || beamPower.min() > beamPower.max()
                    || beamPower.min() < 0 || beamPower.max() > 100) {
                errors.add("beamPower must satisfy 0 <= min <= max <= 100: " + beamPower);
            }
            if (precision == null || !inPrecisionRange(precision.x())
                    || !inPrecisionRange(precision.y()) || !inPrecisionRange(precision.s())) {
                errors.add("precision values must be between 0 and " + MAX_PRECISION + ": " + precision);
            }
            if (offsets == null || !Double.isFinite(offsets.x()) || !Double.isFinite(offsets.y())) {
                errors.add("offsets must be finite numbers: " + offsets);
            }

            if (!errors.isEmpty()) {
                String message = "Invalid raster settings: " + String.join("; ", errors);
                logger.error(message);
                throw new RasterConfigurationException(message);
            }

            RasterSettings settings = new RasterSettings(this);
            RasterSettings.logger.debug("Built {}", settings);
            return settings;
        }

        private static boolean isFinite(PowerRange range) {
            return Double.isFinite(range.min()) && Double.isFinite(range.max());
        }

        private static boolean inPrecisionRange(int value) {
            return value >= 0 && value <= MAX_PRECISION;
        }
    }
}
