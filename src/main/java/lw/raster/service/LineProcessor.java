package lw.raster.service;

import lw.raster.model.PixelCoordinate;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.LineTrimmer;
import lw.raster.utilities.PowerSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-line pipeline of the engine: trim, orient, emit.
 *
 * <p>The traversal direction flips once for every line that survives trimming, in both
 * scan modes. Lines are reversed on odd flips only in row-major mode, which yields the
 * boustrophedon path; diagonal lines already alternate by construction.</p>
 */
public class LineProcessor {

    private final boolean trimLine;
    private final boolean diagonal;
    private final LineTrimmer trimmer;
    private final CommandEmitter emitter;
    private final CommandState state;
    private boolean reverseLine = true;

    public LineProcessor(RasterSettings settings, PowerSource powerSource, CommandState state) {
        this.trimLine = settings.isTrimLine();
        this.diagonal = settings.isDiagonal();
        this.trimmer = new LineTrimmer(powerSource);
        this.emitter = new CommandEmitter(settings, powerSource);
        this.state = state;
    }

    /**
     * @param line pixels in generator order
     * @return the commands for the line, or null if it produced none
     */
    public String process(List<PixelCoordinate> line) {
        if (trimLine) {
            line = trimmer.trim(line);
            if (line == null) {
                return null;
            }
        }

        reverseLine = !reverseLine;

        if (!diagonal && reverseLine) {
            line = new ArrayList<>(line);
            Collections.reverse(line);
        }

        return emitter.emit(line, state);
    }

    /**
     * @return true if the last processed line was traversed in reverse
     */
    public boolean isReverseLine() {
        return reverseLine;
    }
}
