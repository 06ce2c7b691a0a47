package com.streetpano.tile;

/**
 * Zoom nằm ngoài khoảng [0, 5]. Lỗi của caller, không bao giờ clamp.
 */
public class InvalidZoomException extends IllegalArgumentException {
    private final int zoom;

    public InvalidZoomException(int zoom) {
        super("Zoom level " + zoom + " is outside [" + ZoomGeometry.MIN_ZOOM + ", " + ZoomGeometry.MAX_ZOOM + "]");
        this.zoom = zoom;
    }

    public int getZoom() {
        return zoom;
    }
}
