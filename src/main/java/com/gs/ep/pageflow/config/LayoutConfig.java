package com.gs.ep.pageflow.config;

import com.gs.ep.pageflow.LayoutException;
import com.gs.ep.pageflow.model.CellPadding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Loads pagination tuning values from pageflow.properties.
 */
public class LayoutConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutConfig.class);
    private static final String DEFAULT_CONFIG = "pageflow.properties";

    private final Properties properties = new Properties();

    public LayoutConfig() {
        this(DEFAULT_CONFIG);
    }

    public LayoutConfig(String configPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.warn("Unable to find {} on the classpath. Using defaults.", configPath);
                return;
            }
            properties.load(input);
            LOGGER.info("Loaded layout configuration from {}", configPath);
        } catch (IOException ex) {
            throw new LayoutException("Failed to read layout configuration " + configPath, ex);
        }
    }

    public LayoutConfig(Properties overrides) {
        properties.putAll(overrides);
    }

    /**
     * Configuration with built-in defaults only, without touching the classpath.
     */
    public static LayoutConfig defaults() {
        return new LayoutConfig(new Properties());
    }

    public boolean isBalancingEnabled() {
        return Boolean.parseBoolean(properties.getProperty("balancing.enabled", "true"));
    }

    public double getBalancingTolerance() {
        return getNonNegative("balancing.tolerance", 5);
    }

    public int getBalancingMaxIterations() {
        return (int) Math.max(1, getNonNegative("balancing.maxIterations", 10));
    }

    public double getMinColumnHeight() {
        return getNonNegative("balancing.minColumnHeight", 20);
    }

    public double getMinPartialRowHeight() {
        return getNonNegative("table.minPartialRowHeight", 20);
    }

    public CellPadding getDefaultCellPadding() {
        return CellPadding.of(
                getNonNegative("table.cellPadding.top", 2),
                getNonNegative("table.cellPadding.bottom", 2),
                getNonNegative("table.cellPadding.left", 4),
                getNonNegative("table.cellPadding.right", 4));
    }

    public double getMinTableColumnWidth() {
        return getNonNegative("table.minColumnWidth", 25);
    }

    public double getMaxMinTableColumnWidth() {
        return getNonNegative("table.maxMinColumnWidth", 200);
    }

    private double getNonNegative(String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value) || value < 0) {
                LOGGER.warn("Ignoring out-of-range value '{}' for {}, using {}", raw, key, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException ex) {
            LOGGER.warn("Ignoring malformed value '{}' for {}, using {}", raw, key, defaultValue);
            return defaultValue;
        }
    }
}
