package com.streetpano.tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more tiles of a panorama could not be fetched or decoded.
 * No bitmap is produced when this is thrown.
 */
public class TileFetchException extends Exception {
    private final String panoId;
    private final int zoom;
    private final List<TileFailure> failures;

    public TileFetchException(String panoId, int zoom, List<TileFailure> failures) {
        super(buildMessage(panoId, zoom, failures), failures.isEmpty() ? null : failures.get(0).getCause());
        this.panoId = panoId;
        this.zoom = zoom;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    private static String buildMessage(String panoId, int zoom, List<TileFailure> failures) {
        String coords = failures.stream()
                .map(f -> "(" + f.getX() + "," + f.getY() + ")")
                .collect(Collectors.joining(" "));
        return failures.size() + " tile(s) failed for " + panoId + " at zoom " + zoom + ": " + coords;
    }

    public String getPanoId() {
        return panoId;
    }

    public int getZoom() {
        return zoom;
    }

    public List<TileFailure> getFailures() {
        return failures;
    }

    public static final class TileFailure {
        private final int x;
        private final int y;
        private final Throwable cause;

        public TileFailure(int x, int y, Throwable cause) {
            this.x = x;
            this.y = y;
            this.cause = cause;
        }

        public int getX() {
            return x;
        }

        public int getY() {
            return y;
        }

        public Throwable getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return "(" + x + "," + y + "): " + cause;
        }
    }
}
