package com.streetpano.depth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a depth map:
 * <pre>
 * { "size": [w, h], "labels": [...], "planes": [ [[nx, ny, nz], d], ... ] }
 * </pre>
 */
public final class DepthDataFile {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DepthDataFile() {
    }

    public static ObjectNode toJson(DepthMap map) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode size = root.putArray("size");
        size.add(map.getWidth());
        size.add(map.getHeight());

        ArrayNode labels = root.putArray("labels");
        for (int label : map.getLabels()) {
            labels.add(label);
        }

        ArrayNode planes = root.putArray("planes");
        for (Plane p : map.getPlanes()) {
            ArrayNode entry = planes.addArray();
            ArrayNode normal = entry.addArray();
            normal.add(p.getNx());
            normal.add(p.getNy());
            normal.add(p.getNz());
            entry.add(p.getDistance());
        }
        return root;
    }

    public static DepthMap fromJson(JsonNode root) throws IOException {
        JsonNode size = root.path("size");
        JsonNode labels = root.path("labels");
        JsonNode planes = root.path("planes");
        if (!size.isArray() || size.size() != 2 || !labels.isArray() || !planes.isArray()) {
            throw new IOException("Depth data must have 'size' [w, h], 'labels' and 'planes' arrays");
        }

        int width = intAt(size, 0, "size");
        int height = intAt(size, 1, "size");
        int[] lbls = new int[labels.size()];
        for (int i = 0; i < lbls.length; i++) {
            lbls[i] = intAt(labels, i, "labels");
        }
        List<Plane> list = new ArrayList<>(planes.size());
        for (JsonNode entry : planes) {
            JsonNode n = entry.path(0);
            if (!n.isArray() || n.size() != 3 || !entry.path(1).isNumber()
                    || !n.get(0).isNumber() || !n.get(1).isNumber() || !n.get(2).isNumber()) {
                throw new IOException("Malformed plane entry: " + entry);
            }
            list.add(new Plane(n.get(0).floatValue(), n.get(1).floatValue(), n.get(2).floatValue(), entry.get(1).floatValue()));
        }
        try {
            return new DepthMap(width, height, lbls, list);
        } catch (IllegalArgumentException e) {
            throw new IOException("Inconsistent depth data: " + e.getMessage(), e);
        }
    }

    // asInt() would turn "x" into 0 and 1.7 into 1
    private static int intAt(JsonNode array, int index, String field) throws IOException {
        JsonNode v = array.get(index);
        if (!v.isInt()) {
            throw new IOException("Expected an integer at " + field + "[" + index + "], got " + v);
        }
        return v.intValue();
    }

    public static void write(DepthMap map, Path file) throws IOException {
        MAPPER.writeValue(file.toFile(), toJson(map));
    }

    public static DepthMap read(Path file) throws IOException {
        return fromJson(MAPPER.readTree(Files.readAllBytes(file)));
    }
}
