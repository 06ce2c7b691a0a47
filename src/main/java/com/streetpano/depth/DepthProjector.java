package com.streetpano.depth;

/**
 * Casts one ray per depth-map pixel from the camera centre and intersects it
 * with the pixel's plane.
 * <p>
 * Pixel (x, y) looks along
 * <pre>
 * yaw   = (w-1-x) * 2pi/(w-1) + pi/2
 * pitch = (h-1-y) * pi/(h-1)          0 down, pi/2 horizon, pi up
 * v     = (sin(pitch)cos(yaw), sin(pitch)sin(yaw), cos(pitch))
 * </pre>
 * and its distance is {@code d / |v . n|}.
 */
public final class DepthProjector {
    // |v.n| dưới ngưỡng này: tia song song với mặt phẳng
    static final double GRAZING_EPSILON = 1e-12;

    private DepthProjector() {
    }

    public static DistanceField project(DepthMap map) {
        int w = map.getWidth();
        int h = map.getHeight();
        double yawStep = w > 1 ? 2 * Math.PI / (w - 1) : 0;
        double pitchStep = h > 1 ? Math.PI / (h - 1) : 0;

        double[] out = new double[w * h];
        for (int y = 0; y < h; y++) {
            double pitch = (h - 1 - y) * pitchStep;
            double sinPitch = Math.sin(pitch);
            double vz = Math.cos(pitch);
            for (int x = 0; x < w; x++) {
                double yaw = (w - 1 - x) * yawStep + Math.PI / 2;
                double vx = sinPitch * Math.cos(yaw);
                double vy = sinPitch * Math.sin(yaw);
                out[y * w + x] = intersect(vx, vy, vz, map.planeAt(x, y));
            }
        }
        return new DistanceField(w, h, out);
    }

    /**
     * Distance along ray v to the plane, or NaN when the plane is empty or the
     * ray never meets it.
     */
    static double intersect(double vx, double vy, double vz, Plane plane) {
        if (plane.isEmpty()) {
            return DistanceField.NO_DATA;
        }
        double dot = Math.abs(vx * plane.getNx() + vy * plane.getNy() + vz * plane.getNz());
        if (dot < GRAZING_EPSILON) {
            return DistanceField.NO_DATA;
        }
        double distance = plane.getDistance() / dot;
        return Double.isFinite(distance) ? distance : DistanceField.NO_DATA;
    }
}
