package lw.raster.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import lw.raster.model.RasterConfigurationException;
import lw.raster.model.RasterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * RasterConfigManager
 *
 * <p>Loads {@link RasterSettings} from YAML or JSON documents:
 *   - YAML is parsed with SnakeYAML, JSON with Gson, both into a nested Map.
 *   - The map is applied onto a {@link RasterSettings.Builder}, so absent keys keep their defaults.
 *   - Unknown keys are logged and ignored; wrongly typed values are rejected.
 *
 * <p>Recognized keys:</p>
 * <pre>
 * ppi: 254
 * smoothing: false
 * beamSize: 0.1
 * beamRange: { min: 0, max: 1 }
 * beamPower: { min: 0, max: 100 }
 * feedRate: 1500
 * trimLine: true
 * burnWhite: true
 * verboseG: true
 * diagonal: false
 * precision: { X: 2, Y: 2, S: 4 }
 * offsets: { X: 0, Y: 0 }
 * </pre>
 */
public class RasterConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(RasterConfigManager.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            "ppi", "smoothing", "beamSize", "beamRange", "beamPower", "feedRate",
            "trimLine", "burnWhite", "verboseG", "diagonal", "precision", "offsets");

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private RasterConfigManager() {
    }

    /**
     * Loads settings from a YAML file.
     *
     * @param path filesystem path to the YAML file
     * @return the validated settings
     * @throws IOException if the file cannot be read
     * @throws RasterConfigurationException if the content is not valid settings
     */
    public static RasterSettings loadYaml(Path path) throws IOException {
        logger.info("Loading raster settings from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return loadYaml(in);
        }
    }

    /**
     * Loads settings from a YAML stream. An empty document yields the default settings.
     *
     * @param in stream holding the YAML document, not closed by this method
     * @return the validated settings
     * @throws RasterConfigurationException if the content is not valid settings
     */
    public static RasterSettings loadYaml(InputStream in) {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new RasterConfigurationException("Malformed YAML settings: " + e.getMessage(), e);
        }
        return fromMap(asMap("<root>", loaded));
    }

    /**
     * Loads settings from a JSON object.
     *
     * @param json the JSON text
     * @return the validated settings
     * @throws RasterConfigurationException if the content is not valid settings
     */
    public static RasterSettings fromJson(String json) {
        Type type = new TypeToken<Map<String, Object>>() {}.getType();
        Map<String, Object> data;
        try {
            data = gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new RasterConfigurationException("Malformed JSON settings: " + e.getMessage(), e);
        }
        return fromMap(data);
    }

    /**
     * Renders settings as pretty-printed JSON using the recognized keys.
     *
     * @param settings the settings
     * @return JSON text that {@link #fromJson(String)} reads back
     */
    public static String toJson(RasterSettings settings) {
        return gson.toJson(toMap(settings));
    }

    /**
     * Converts settings to a nested map using the recognized keys.
     *
     * @param settings the settings
     * @return an ordered map
     */
    public static Map<String, Object> toMap(RasterSettings settings) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ppi", settings.getPpi());
        map.put("smoothing", settings.isSmoothing());
        map.put("beamSize", settings.getBeamSize());
        map.put("beamRange", pair("min", settings.getBeamRange().min(), "max", settings.getBeamRange().max()));
        map.put("beamPower", pair("min", settings.getBeamPower().min(), "max", settings.getBeamPower().max()));
        map.put("feedRate", settings.getFeedRate());
        map.put("trimLine", settings.isTrimLine());
        map.put("burnWhite", settings.isBurnWhite());
        map.put("verboseG", settings.isVerboseG());
        map.put("diagonal", settings.isDiagonal());
        Map<String, Object> precision = new LinkedHashMap<>();
        precision.put("X", settings.getPrecision().x());
        precision.put("Y", settings.getPrecision().y());
        precision.put("S", settings.getPrecision().s());
        map.put("precision", precision);
        map.put("offsets", pair("X", settings.getOffsets().x(), "Y", settings.getOffsets().y()));
        return map;
    }

    /**
     * Applies a nested settings map onto the defaults.
     *
     * @param data the settings map, null meaning all defaults
     * @return the validated settings
     * @throws RasterConfigurationException if a value has the wrong type or the result is invalid
     */
    public static RasterSettings fromMap(Map<String, Object> data) {
        RasterSettings.Builder builder = new RasterSettings.Builder();
        if (data == null) {
            logger.warn("Empty raster settings, using defaults");
            return builder.build();
        }

        for (String key : data.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("Ignoring unknown raster setting: {}", key);
            }
        }

        RasterSettings defaults = builder.build();

        if (data.containsKey("ppi")) builder.ppi(getInt(data, "ppi"));
        if (data.containsKey("smoothing")) builder.smoothing(getBoolean(data, "smoothing"));
        if (data.containsKey("beamSize")) builder.beamSize(getDouble(data, "beamSize"));
        if (data.containsKey("feedRate")) builder.feedRate(getDouble(data, "feedRate"));
        if (data.containsKey("trimLine")) builder.trimLine(getBoolean(data, "trimLine"));
        if (data.containsKey("burnWhite")) builder.burnWhite(getBoolean(data, "burnWhite"));
        if (data.containsKey("verboseG")) builder.verboseG(getBoolean(data, "verboseG"));
        if (data.containsKey("diagonal")) builder.diagonal(getBoolean(data, "diagonal"));

        if (data.containsKey("beamRange")) {
            Map<String, Object> range = asMap("beamRange", data.get("beamRange"));
            builder.beamRange(
                    getDouble(range, "min", defaults.getBeamRange().min()),
                    getDouble(range, "max", defaults.getBeamRange().max()));
        }
        if (data.containsKey("beamPower")) {
            Map<String, Object> power = asMap("beamPower", data.get("beamPower"));
            builder.beamPower(
                    getDouble(power, "min", defaults.getBeamPower().min()),
                    getDouble(power, "max", defaults.getBeamPower().max()));
        }
        if (data.get("precision") != null) {
            Map<String, Object> precision = asMap("precision", data.get("precision"));
            RasterSettings.Precision p = defaults.getPrecision();
            builder.precision(
                    precision.containsKey("X") ? getInt(precision, "X") : p.x(),
                    precision.containsKey("Y") ? getInt(precision, "Y") : p.y(),
                    precision.containsKey("S") ? getInt(precision, "S") : p.s());
        }
        if (data.containsKey("offsets")) {
            Map<String, Object> offsets = asMap("offsets", data.get("offsets"));
            builder.offsets(
                    getDouble(offsets, "X", defaults.getOffsets().x()),
                    getDouble(offsets, "Y", defaults.getOffsets().y()));
        }

        return builder.build();
    }

    private static Map<String, Object> pair(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new RasterConfigurationException(
                    "Setting '" + key + "' must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static double getDouble(Map<String, Object> map, String key, double fallback) {
        return map != null && map.containsKey(key) ? getDouble(map, key) : fallback;
    }

    private static double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new RasterConfigurationException("Setting '" + key + "' must be a number, got: " + value);
    }

    private static int getInt(Map<String, Object> map, String key) {
        double value = getDouble(map, key);
        if (value != Math.rint(value)) {
            throw new RasterConfigurationException("Setting '" + key + "' must be an integer, got: " + value);
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new RasterConfigurationException("Setting '" + key + "' is out of range, got: " + value);
        }
        return (int) value;
    }

    private static boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new RasterConfigurationException("Setting '" + key + "' must be true or false, got: " + value);
    }
}
