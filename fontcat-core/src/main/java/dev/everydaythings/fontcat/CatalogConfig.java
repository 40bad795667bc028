/*
 * Copyright (C) 2024 fontcat contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.fontcat;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable key/value settings for a catalog.
 *
 * <p>{@link #load()} reads the classpath resource {@code fontcat.properties}
 * and then lets system properties prefixed with {@code fontcat.} override it,
 * so {@code -Dfontcat.font.preload-names-list=Hiragino Sans} sets
 * {@code font.preload-names-list}.
 */
public final class CatalogConfig {

    private static final Logger log = Logger.getLogger(CatalogConfig.class.getName());

    public static final String RESOURCE = "fontcat.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "fontcat.";

    /** Prefix of per-face weight overrides, followed by the PostScript name. */
    public static final String WEIGHT_OVERRIDE_PREFIX = "font.weight-override.";
    public static final String PRELOAD_NAMES_LIST = "font.preload-names-list";
    public static final String SYSTEM_UI_CROSSOVER_SIZE = "font.system-ui.crossover-size";
    public static final String SPURIOUS_COVERAGE_FAMILIES = "font.shaping.spurious-coverage-families";
    public static final String PLACEHOLDER_FAMILIES = "font.fallback.placeholder-families";
    public static final String BAD_UNDERLINE_FAMILIES = "font.bad-underline-families";
    public static final String FREETYPE_DIRECTORIES = "font.freetype.directories";
    public static final String FREETYPE_FALLBACK_FAMILIES = "font.freetype.fallback-families";
    public static final String FREETYPE_SYSTEM_UI_FAMILIES = "font.freetype.system-ui-families";

    /** Size in CSS pixels at which the system UI font switches to its display family. */
    public static final double DEFAULT_CROSSOVER_SIZE = 20.0;

    public static final List<String> DEFAULT_PLACEHOLDER_FAMILIES = List.of("LastResort", ".LastResort");

    private static final CatalogConfig EMPTY = new CatalogConfig(Map.of());

    private final Map<String, String> values;

    private CatalogConfig(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CatalogConfig empty() {
        return EMPTY;
    }

    public static CatalogConfig of(Map<String, String> values) {
        return new CatalogConfig(new HashMap<>(values));
    }

    public static CatalogConfig fromProperties(Properties properties) {
        Map<String, String> values = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            values.put(key, properties.getProperty(key));
        }
        return new CatalogConfig(values);
    }

    /**
     * Classpath {@code fontcat.properties} overlaid with {@code fontcat.*}
     * system properties. A missing or unreadable resource is not an error.
     */
    public static CatalogConfig load() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = CatalogConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                log.fine(() -> "Loaded " + RESOURCE + " (" + properties.size() + " keys)");
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to read " + RESOURCE + ", using defaults", e);
        }

        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(key.substring(SYSTEM_PROPERTY_PREFIX.length()), system.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /** The raw value, or null. */
    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        String value = values.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * A comma-separated list, trimmed, with empty entries dropped. An absent key
     * yields {@code defaultValue}; a key set to an empty string yields an empty list.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return Collections.unmodifiableList(items);
    }

    public double getDouble(String key, double defaultValue) {
        String value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warning(() -> String.format("Ignoring %s=%s: not a number", key, value));
            return defaultValue;
        }
    }

    /**
     * Configured weight for a face, or 0 if there is no override.
     */
    public int weightOverride(String postscriptName) {
        String key = WEIGHT_OVERRIDE_PREFIX + postscriptName;
        String value = values.get(key);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warning(() -> String.format("Ignoring %s=%s: not an integer", key, value));
            return 0;
        }
    }

    public double crossoverSize() {
        return getDouble(SYSTEM_UI_CROSSOVER_SIZE, DEFAULT_CROSSOVER_SIZE);
    }

    public List<String> preloadNames() {
        return getList(PRELOAD_NAMES_LIST, List.of());
    }

    public List<String> spuriousCoverageFamilies() {
        return getList(SPURIOUS_COVERAGE_FAMILIES, List.copyOf(ComplexScriptFilter.DEFAULT_SPURIOUS_COVERAGE_FAMILIES));
    }

    public List<String> placeholderFamilies() {
        return getList(PLACEHOLDER_FAMILIES, DEFAULT_PLACEHOLDER_FAMILIES);
    }

    public List<String> badUnderlineFamilies() {
        return getList(BAD_UNDERLINE_FAMILIES, List.of());
    }

    @Override
    public String toString() {
        return "CatalogConfig" + values;
    }
}
