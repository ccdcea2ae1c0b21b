package com.venn.config;

import com.venn.exception.ConfigurationException;
import com.venn.exception.SetExpressionException;
import com.venn.expression.SetExpressionParser;
import com.venn.expression.SetExpressionTokenizer;
import com.venn.membership.MembershipMap;
import com.venn.view.SetVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads visualizer configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Largest samples-per-axis value; the grid holds size * size points.
     */
    public static final int MAX_GRID_SIZE = 2000;

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static VennConfig load(String path) {
        log.info("Loading Venn configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static VennConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The settings can sit at the root or under a 'venn' key
        Map<String, Object> vennConfig = root.containsKey("venn")
                ? (Map<String, Object>) root.get("venn")
                : root;

        String name = getString(vennConfig, "name", "default");
        String defaultExpression = getString(vennConfig, "default-expression", null);
        if (defaultExpression == null) {
            defaultExpression = getString(vennConfig, "defaultExpression", SetVisualizer.DEFAULT_EXPRESSION);
        }

        GridConfig grid = parseGrid((Map<String, Object>) vennConfig.get("grid"));

        List<RegionConfig> regions = parseRegions((List<Map<String, Object>>) vennConfig.get("regions"));
        if (regions.isEmpty()) {
            log.warn("No regions configured, using default regions A, B and C");
            regions = RegionConfig.defaults();
        }

        validateExpression(defaultExpression, regions);

        VennConfig config = new VennConfig(name, defaultExpression, grid, regions);
        log.info("Loaded Venn configuration: {} with {} regions on a {}x{} grid, default expression '{}'",
                name, regions.size(), grid.size(), grid.size(), defaultExpression);
        return config;
    }

    private static GridConfig parseGrid(Map<String, Object> map) {
        if (map == null) {
            return GridConfig.defaults();
        }
        GridConfig defaults = GridConfig.defaults();
        int size = getInt(map, "size", defaults.size());
        double min = getDouble(map, "min", defaults.min());
        double max = getDouble(map, "max", defaults.max());

        if (size < 1 || size > MAX_GRID_SIZE) {
            throw new ConfigurationException("grid.size must be between 1 and " + MAX_GRID_SIZE
                    + ", got " + size);
        }
        if (!(min < max)) {
            throw new ConfigurationException("grid.min must be below grid.max, got [" + min + ", " + max + "]");
        }
        return new GridConfig(size, min, max);
    }

    private static List<RegionConfig> parseRegions(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<RegionConfig> regions = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            RegionConfig region = parseRegion(list.get(i), i);
            if (!names.add(region.name())) {
                throw new ConfigurationException("Duplicate region name '" + region.name() + "'");
            }
            regions.add(region);
            log.debug("Parsed region: name={}, center=({}, {}), radius={}",
                    region.name(), region.x(), region.y(), region.radius());
        }
        return regions;
    }

    private static RegionConfig parseRegion(Map<String, Object> map, int index) {
        String name = getString(map, "name", null);
        if (!MembershipMap.isValidSetName(name)) {
            throw new ConfigurationException("Region " + index + " has invalid name '" + name
                    + "': expected a single uppercase letter other than U");
        }

        Object centerObj = map.get("center");
        if (!(centerObj instanceof List<?> center) || center.size() != 2
                || !(center.get(0) instanceof Number) || !(center.get(1) instanceof Number)) {
            throw new ConfigurationException("Region '" + name + "' needs center: [x, y], got " + centerObj);
        }
        double x = ((Number) center.get(0)).doubleValue();
        double y = ((Number) center.get(1)).doubleValue();

        double radius = getDouble(map, "radius", 1.5);
        if (!(radius > 0)) {
            throw new ConfigurationException("Region '" + name + "' must have a positive radius, got " + radius);
        }
        String color = getString(map, "color", "black");

        return new RegionConfig(name, x, y, radius, color);
    }

    private static void validateExpression(String expression, List<RegionConfig> regions) {
        try {
            SetExpressionParser.parse(expression);
        } catch (SetExpressionException e) {
            throw new ConfigurationException("Invalid default-expression: " + e.getMessage(), e);
        }

        Set<String> names = new HashSet<>();
        for (RegionConfig region : regions) {
            names.add(region.name());
        }
        for (String referenced : SetExpressionTokenizer.referencedSets(expression)) {
            if (!names.contains(referenced)) {
                throw new ConfigurationException("Invalid default-expression: unknown set '"
                        + referenced + "' in '" + expression + "'");
            }
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got " + value, e);
        }
    }
}
