package com.venn.view;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venn.exception.VennException;
import com.venn.geometry.Point;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes renderings to JSON for an external presentation layer.
 * <p>
 * Shape: {@code {"expression", "pointCount", "visibleRegions", "error", "points": [[x, y], ...]}}.
 */
public class RenderingJsonWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public String write(Rendering rendering) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("expression", rendering.expression());
        root.put("pointCount", rendering.pointCount());
        root.put("visibleRegions", rendering.visibleRegions());
        root.put("error", rendering.error());

        List<double[]> points = new ArrayList<>(rendering.pointCount());
        for (Point point : rendering.points()) {
            points.add(new double[]{point.x(), point.y()});
        }
        root.put("points", points);

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new VennException("Failed to serialize rendering of '" + rendering.expression() + "'", e);
        }
    }
}
