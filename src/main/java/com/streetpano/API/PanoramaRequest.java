package com.streetpano.API;

import com.streetpano.tile.ZoomGeometry;

/**
 * Tham số của một lần gọi. Tạo mới cho mỗi request, không dùng chung.
 */
public final class PanoramaRequest {
    private final String panoId;
    private final int zoom;
    private final int threads;

    public PanoramaRequest(String panoId, int zoom, int threads) {
        if (panoId == null || panoId.trim().isEmpty()) {
            throw new IllegalArgumentException("panoId is required");
        }
        ZoomGeometry.checkZoom(zoom);
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be a positive integer, got " + threads);
        }
        this.panoId = panoId.trim();
        this.zoom = zoom;
        this.threads = threads;
    }

    public String getPanoId() {
        return panoId;
    }

    public int getZoom() {
        return zoom;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {
        return "PanoramaRequest[" + panoId + ", zoom=" + zoom + ", threads=" + threads + "]";
    }
}
