package lw.raster.service;

import lw.raster.model.RasterGeometry;
import lw.raster.model.RasterSettings;
import lw.raster.utilities.Tile;

/**
 * Message posted by the controller to the engine.
 * Messages are consumed in posting order: one {@link Type#INIT}, one {@link Type#ADD_CELL}
 * per tile, then {@link Type#PARSE}.
 */
public final class EngineMessage {

    public enum Type {
        INIT,
        ADD_CELL,
        PARSE
    }

    private final Type type;
    private final RasterSettings settings;
    private final RasterGeometry geometry;
    private final String version;
    private final Tile tile;

    private EngineMessage(Type type, RasterSettings settings, RasterGeometry geometry, String version, Tile tile) {
        this.type = type;
        this.settings = settings;
        this.geometry = geometry;
        this.version = version;
        this.tile = tile;
    }

    public static EngineMessage init(RasterSettings settings, RasterGeometry geometry, String version) {
        return new EngineMessage(Type.INIT, settings, geometry, version, null);
    }

    /**
     * The tile buffer is transferred, not copied: the sender must not touch it afterwards.
     *
     * @param tile the tile to hand over
     * @return the message
     */
    public static EngineMessage addCell(Tile tile) {
        return new EngineMessage(Type.ADD_CELL, null, null, null, tile);
    }

    public static EngineMessage parse() {
        return new EngineMessage(Type.PARSE, null, null, null, null);
    }

    public Type getType() { return type; }
    public RasterSettings getSettings() { return settings; }
    public RasterGeometry getGeometry() { return geometry; }
    public String getVersion() { return version; }
    public Tile getTile() { return tile; }

    @Override
    public String toString() {
        if (type == Type.ADD_CELL) {
            return "EngineMessage[ADD_CELL (" + tile.gridX() + ", " + tile.gridY() + ")]";
        }
        return "EngineMessage[" + type + "]";
    }
}
