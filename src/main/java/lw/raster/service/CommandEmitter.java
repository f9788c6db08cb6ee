package lw.raster.service;

import lw.raster.model.PixelCoordinate;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.GCodeFormat;
import lw.raster.utilities.PowerMapper;
import lw.raster.utilities.PowerSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a line of pixels into motion and power commands.
 *
 * <p>Each line starts with a travel ({@code G0}) to its first pixel at power 0. Burning
 * pixels become {@code G1} commands at their mapped power; when {@code burnWhite} is off,
 * zero-power pixels become travel moves instead. A burn that follows a travel is preceded
 * by a travel to the same point, so the motion mode never changes mid-move.</p>
 *
 * <p>Tokens are formatted to their configured precision and written only when the value
 * differs from the one last written for that letter, unless {@code verboseG} is set.
 * The comparison state lives in the {@link CommandState} passed to each call.</p>
 *
 * @since 1.0.0
 */
public class CommandEmitter {

    private final PowerSource powerSource;
    private final PowerMapper powerMapper;
    private final double beamSize;
    private final double beamOffset;
    private final RasterSettings.Offsets offsets;
    private final RasterSettings.Precision precision;
    private final boolean burnWhite;
    private final boolean verbose;

    public CommandEmitter(RasterSettings settings, PowerSource powerSource) {
        this.powerSource = powerSource;
        this.powerMapper = PowerMapper.forSettings(settings);
        this.beamSize = settings.getBeamSize();
        this.beamOffset = settings.getBeamOffset();
        this.offsets = settings.getOffsets();
        this.precision = settings.getPrecision();
        this.burnWhite = settings.isBurnWhite();
        this.verbose = settings.isVerboseG();
    }

    /**
     * Emits the commands for one line.
     *
     * @param line  pixels in traversal order, already trimmed and oriented
     * @param state redundancy state of the run, updated by this call
     * @return newline-separated command lines, or null if nothing was written
     */
    public String emit(List<PixelCoordinate> line, CommandState state) {
        List<String> gcode = new ArrayList<>();

        for (int i = 0; i < line.size(); i++) {
            PixelCoordinate pixel = line.get(i);
            double raw = powerSource.getPower(pixel);

            double x = pixel.x() * beamSize + beamOffset + offsets.x();
            double y = pixel.y() * beamSize + beamOffset + offsets.y();

            if (i == 0) {
                add(gcode, command(state, 0, x, y, 0), state);
            }

            if (!burnWhite && raw == 0) {
                if (i > 0) {
                    add(gcode, command(state, 0, x, y, 0), state);
                }
            } else {
                double power = powerMapper.map(raw);

                if (i > 0 && state.isTravelMode()) {
                    add(gcode, command(state, 0, x, y, 0), state);
                }
                add(gcode, command(state, 1, x, y, power), state);
            }
        }

        return gcode.isEmpty() ? null : String.join("\n", gcode);
    }

    /**
     * Builds one command line from its four tokens, dropping unchanged ones.
     *
     * @param state redundancy state
     * @param g     motion mode, 0 for travel and 1 for burn
     * @param x     X coordinate in millimeters
     * @param y     Y coordinate in millimeters
     * @param s     power
     * @return the command line, or null if every token was dropped
     */
    String command(CommandState state, int g, double x, double y, double s) {
        StringBuilder sb = new StringBuilder();
        appendToken(sb, state, 'G', g, 0);
        appendToken(sb, state, 'X', x, precision.x());
        appendToken(sb, state, 'Y', y, precision.y());
        appendToken(sb, state, 'S', s, precision.s());
        return sb.length() == 0 ? null : sb.toString();
    }

    private void appendToken(StringBuilder sb, CommandState state, char letter, double value, int decimals) {
        String formatted = GCodeFormat.fixed(value, decimals);
        if (verbose || !formatted.equals(state.getLastValue(letter))) {
            state.record(letter, formatted);
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(letter).append(formatted);
        }
    }

    private static void add(List<String> gcode, String command, CommandState state) {
        if (command != null) {
            gcode.add(command);
            state.countCommand();
        }
    }
}
