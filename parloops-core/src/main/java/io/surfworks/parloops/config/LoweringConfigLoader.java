package io.surfworks.parloops.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

/**
 * Loads and saves {@link LoweringOptions} as JSON.
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "attributePolicy": "strict",
 *   "dilationPolicy": "reject",
 *   "verifyAfterLowering": true
 * }
 * }</pre>
 *
 * <p>Absent keys keep their default. CLI flags are handled by the caller and
 * applied on top of the loaded options.
 */
public final class LoweringConfigLoader {

    private static final Logger LOG = Logger.getLogger(LoweringConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private LoweringConfigLoader() {
    }

    /**
     * Loads options from {@code parloops.json} in the working directory.
     *
     * @return the loaded options, or defaults if the file doesn't exist
     */
    public static LoweringOptions load() {
        return load(LoweringOptions.configFile());
    }

    /**
     * Loads options from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded options, or defaults if the file doesn't exist
     * @throws IllegalArgumentException if the file can't be read or isn't valid
     */
    public static LoweringOptions load(Path configFile) {
        if (!Files.exists(configFile)) {
            LOG.fine(() -> "No config at " + configFile + ", using defaults");
            return LoweringOptions.defaults();
        }
        String json;
        try {
            json = Files.readString(configFile);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config " + configFile + ": " + e.getMessage(), e);
        }
        return parse(json, configFile.toString());
    }

    /**
     * Parses options from a JSON string.
     *
     * @throws IllegalArgumentException if the JSON is malformed or names an unknown policy
     */
    public static LoweringOptions parse(String json, String source) {
        StoredOptions stored;
        try {
            stored = GSON.fromJson(json, StoredOptions.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed config " + source + ": " + e.getMessage(), e);
        }
        LoweringOptions options = LoweringOptions.defaults();
        if (stored == null) {
            return options;
        }
        if (stored.attributePolicy != null) {
            options = options.withAttributePolicy(
                    parseEnum(AttributePolicy.class, stored.attributePolicy, "attributePolicy", source));
        }
        if (stored.dilationPolicy != null) {
            options = options.withDilationPolicy(
                    parseEnum(DilationPolicy.class, stored.dilationPolicy, "dilationPolicy", source));
        }
        if (stored.verifyAfterLowering != null && !stored.verifyAfterLowering.isJsonNull()) {
            options = options.withVerifyAfterLowering(
                    parseBoolean(stored.verifyAfterLowering, "verifyAfterLowering", source));
        }
        return options;
    }

    /**
     * Saves options to a file, creating parent directories as needed.
     *
     * @throws IOException if writing fails
     */
    public static void save(LoweringOptions options, Path configFile) throws IOException {
        StoredOptions stored = new StoredOptions();
        stored.attributePolicy = options.attributePolicy().name().toLowerCase(Locale.ROOT);
        stored.dilationPolicy = options.dilationPolicy().name().toLowerCase(Locale.ROOT);
        stored.verifyAfterLowering = new JsonPrimitive(options.verifyAfterLowering());

        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configFile, GSON.toJson(stored));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key, String source) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(
                    "Unknown %s '%s' in %s", key, value, source), e);
        }
    }

    // JSON true/false only, no string or number forms.
    private static boolean parseBoolean(JsonElement value, String key, String source) {
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        throw new IllegalArgumentException(String.format(
                "Invalid %s '%s' in %s, expected true or false", key, value, source));
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class StoredOptions {
        String attributePolicy;
        String dilationPolicy;
        JsonElement verifyAfterLowering;
    }
}
