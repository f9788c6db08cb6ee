package lw.raster.model;

import java.util.Objects;

/**
 * One event of a rasterization run, as streamed from the engine to the caller.
 *
 * <p>A successful run yields exactly one {@link Type#HEADER}, zero or more
 * {@link Type#GCODE} events with non-decreasing percentages, and exactly one
 * terminal {@link Type#DONE}.</p>
 *
 * @since 1.0.0
 */
public final class OutputEvent {

    /**
     * Kind of output event.
     */
    public enum Type {
        /** Commented run metadata followed by the feed rate setup */
        HEADER,
        /** Commands produced for one scanned line */
        GCODE,
        /** Terminal event, nothing follows it */
        DONE
    }

    private static final OutputEvent DONE_EVENT = new OutputEvent(Type.DONE, null, 100);

    private final Type type;
    private final String text;
    private final int percent;

    private OutputEvent(Type type, String text, int percent) {
        this.type = type;
        this.text = text;
        this.percent = percent;
    }

    public static OutputEvent header(String text) {
        return new OutputEvent(Type.HEADER, Objects.requireNonNull(text, "text"), 0);
    }

    public static OutputEvent gcode(String text, int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Percent must be between 0 and 100: " + percent);
        }
        return new OutputEvent(Type.GCODE, Objects.requireNonNull(text, "text"), percent);
    }

    public static OutputEvent done() {
        return DONE_EVENT;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the event text, or null for {@link Type#DONE}
     */
    public String getText() {
        return text;
    }

    /**
     * @return progress in percent; 0 for the header and 100 for the terminal event
     */
    public int getPercent() {
        return percent;
    }

    public boolean isDone() {
        return type == Type.DONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputEvent)) return false;
        OutputEvent that = (OutputEvent) o;
        return percent == that.percent && type == that.type && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, percent);
    }

    @Override
    public String toString() {
        if (type == Type.DONE) {
            return "OutputEvent[DONE]";
        }
        int lines = text.isEmpty() ? 0 : text.split("\n", -1).length;
        return "OutputEvent[" + type + ", " + percent + "%, " + lines + " lines]";
    }
}
