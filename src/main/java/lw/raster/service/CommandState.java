package lw.raster.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Last emitted value per command letter, used to drop unchanged tokens.
 * <p>
 * Owned by a single engine for the duration of one run and never shared.
 */
public class CommandState {

    private final Map<Character, String> lastValues = new HashMap<>();
    private long commandCount;

    /**
     * @param letter command letter ({@code G}, {@code X}, {@code Y} or {@code S})
     * @return the last formatted value written for the letter, or null if none yet
     */
    public String getLastValue(char letter) {
        return lastValues.get(letter);
    }

    /**
     * Records the formatted value just written for a letter.
     *
     * @param letter command letter
     * @param value  formatted value
     */
    public void record(char letter, String value) {
        lastValues.put(letter, value);
    }

    /**
     * @return true if the last motion command written was a travel ({@code G0})
     */
    public boolean isTravelMode() {
        return "0".equals(lastValues.get('G'));
    }

    /**
     * Counts one emitted command line.
     */
    public void countCommand() {
        commandCount++;
    }

    public long getCommandCount() {
        return commandCount;
    }

    public void reset() {
        lastValues.clear();
        commandCount = 0;
    }
}
