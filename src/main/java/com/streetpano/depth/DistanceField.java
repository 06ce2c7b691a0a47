package com.streetpano.depth;

/**
 * Per-pixel distance from the camera centre, row-major, same size as the
 * depth map it was projected from. Pixels without a depth estimate hold
 * {@link Double#NaN}, never 0.
 */
public final class DistanceField {
    public static final double NO_DATA = Double.NaN;

    private final int width;
    private final int height;
    private final double[] values;

    public DistanceField(int width, int height, double[] values) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Field size must not be negative, got " + width + "x" + height);
        }
        long pixels = (long) width * height;
        if (values.length != pixels) {
            throw new IllegalArgumentException("Expected " + pixels + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(int x, int y) {
        return values[y * width + x];
    }

    public boolean isNoData(int x, int y) {
        return Double.isNaN(get(x, y));
    }

    public double[] toArray() {
        return values.clone();
    }

    public int noDataCount() {
        int count = 0;
        for (double v : values) {
            if (Double.isNaN(v)) count++;
        }
        return count;
    }
}
