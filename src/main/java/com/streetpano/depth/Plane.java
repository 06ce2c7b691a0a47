package com.streetpano.depth;

/**
 * A depth plane: normal (nx, ny, nz) exactly as decoded, not renormalized,
 * and its distance from the camera centre. Distance 0 means "no plane".
 */
public final class Plane {
    private final float nx;
    private final float ny;
    private final float nz;
    private final float distance;

    public Plane(float nx, float ny, float nz, float distance) {
        this.nx = nx;
        this.ny = ny;
        this.nz = nz;
        this.distance = distance;
    }

    public float getNx() {
        return nx;
    }

    public float getNy() {
        return ny;
    }

    public float getNz() {
        return nz;
    }

    public float getDistance() {
        return distance;
    }

    public float[] normal() {
        return new float[]{nx, ny, nz};
    }

    public boolean isEmpty() {
        return distance == 0f;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plane)) return false;
        Plane p = (Plane) o;
        return Float.compare(nx, p.nx) == 0 && Float.compare(ny, p.ny) == 0
                && Float.compare(nz, p.nz) == 0 && Float.compare(distance, p.distance) == 0;
    }

    @Override
    public int hashCode() {
        int h = Float.hashCode(nx);
        h = 31 * h + Float.hashCode(ny);
        h = 31 * h + Float.hashCode(nz);
        return 31 * h + Float.hashCode(distance);
    }

    @Override
    public String toString() {
        return "Plane[n=(" + nx + ", " + ny + ", " + nz + "), d=" + distance + "]";
    }
}
