package com.streetpano.depth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decoded depth map: a width x height grid of plane labels (row-major) and
 * the planes they point to. Immutable.
 */
public final class DepthMap {
    private final int width;
    private final int height;
    private final int[] labels;
    private final List<Plane> planes;

    public DepthMap(int width, int height, int[] labels, List<Plane> planes) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Depth map size must be positive, got " + width + "x" + height);
        }
        long pixels = (long) width * height;
        if (labels.length != pixels) {
            throw new IllegalArgumentException("Expected " + pixels + " labels, got " + labels.length);
        }
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < 0 || labels[i] >= planes.size()) {
                throw new IllegalArgumentException("Label " + labels[i] + " at pixel " + i + " has no plane (" + planes.size() + " planes)");
            }
        }
        this.width = width;
        this.height = height;
        this.labels = labels.clone();
        this.planes = Collections.unmodifiableList(new ArrayList<>(planes));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public int labelAt(int x, int y) {
        return labels[y * width + x];
    }

    public Plane planeAt(int x, int y) {
        return planes.get(labelAt(x, y));
    }

    public List<Plane> getPlanes() {
        return planes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepthMap)) return false;
        DepthMap other = (DepthMap) o;
        return width == other.width && height == other.height
                && Arrays.equals(labels, other.labels) && planes.equals(other.planes);
    }

    @Override
    public int hashCode() {
        int h = 31 * width + height;
        h = 31 * h + Arrays.hashCode(labels);
        return 31 * h + planes.hashCode();
    }

    @Override
    public String toString() {
        return "DepthMap[" + width + "x" + height + ", " + planes.size() + " planes]";
    }
}
