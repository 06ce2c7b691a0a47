package com.streetpano.tile;

/**
 * Fixed per-zoom layout of a panorama: how many 512x512 tiles make up the
 * canvas and which rectangle of the stitched canvas is the real panorama.
 * <p>
 * The tables were measured against the tile server (padding at the bottom,
 * wrap-around overlap on the right edge), so they are kept as plain data.
 */
public final class ZoomGeometry {
    public static final int MIN_ZOOM = 0;
    public static final int MAX_ZOOM = 5;
    public static final int TILE_SIZE = 512;

    // {tilesX, tilesY}
    private static final int[][] TILE_GRIDS = {
            {1, 1},
            {2, 1},
            {4, 2},
            {7, 4},
            {13, 7},
            {26, 13}
    };

    // {right, bottom}, left = top = 0
    private static final int[][] CROP_SIZES = {
            {417, 208},
            {833, 416},
            {1665, 832},
            {3329, 1664},
            {6656, 3328},
            {13312, 6656}
    };

    private ZoomGeometry() {
    }

    public static void checkZoom(int zoom) {
        if (zoom < MIN_ZOOM || zoom > MAX_ZOOM) {
            throw new InvalidZoomException(zoom);
        }
    }

    public static TileGrid tileGrid(int zoom) {
        checkZoom(zoom);
        return new TileGrid(TILE_GRIDS[zoom][0], TILE_GRIDS[zoom][1]);
    }

    public static CropBox cropBox(int zoom) {
        checkZoom(zoom);
        return new CropBox(0, 0, CROP_SIZES[zoom][0], CROP_SIZES[zoom][1]);
    }

    // Kích thước canvas trước khi crop
    public static int canvasWidth(int zoom) {
        return TILE_SIZE * tileGrid(zoom).getTilesX();
    }

    public static int canvasHeight(int zoom) {
        return TILE_SIZE * tileGrid(zoom).getTilesY();
    }

    public static final class TileGrid {
        private final int tilesX;
        private final int tilesY;

        public TileGrid(int tilesX, int tilesY) {
            this.tilesX = tilesX;
            this.tilesY = tilesY;
        }

        public int getTilesX() {
            return tilesX;
        }

        public int getTilesY() {
            return tilesY;
        }

        public int tileCount() {
            return tilesX * tilesY;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TileGrid)) return false;
            TileGrid other = (TileGrid) o;
            return tilesX == other.tilesX && tilesY == other.tilesY;
        }

        @Override
        public int hashCode() {
            return 31 * tilesX + tilesY;
        }

        @Override
        public String toString() {
            return "TileGrid(" + tilesX + "x" + tilesY + ")";
        }
    }

    public static final class CropBox {
        private final int left;
        private final int top;
        private final int right;
        private final int bottom;

        public CropBox(int left, int top, int right, int bottom) {
            this.left = left;
            this.top = top;
            this.right = right;
            this.bottom = bottom;
        }

        public int getLeft() {
            return left;
        }

        public int getTop() {
            return top;
        }

        public int getRight() {
            return right;
        }

        public int getBottom() {
            return bottom;
        }

        public int width() {
            return right - left;
        }

        public int height() {
            return bottom - top;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CropBox)) return false;
            CropBox other = (CropBox) o;
            return left == other.left && top == other.top && right == other.right && bottom == other.bottom;
        }

        @Override
        public int hashCode() {
            int h = left;
            h = 31 * h + top;
            h = 31 * h + right;
            return 31 * h + bottom;
        }

        @Override
        public String toString() {
            return "CropBox(" + left + ", " + top + ", " + right + ", " + bottom + ")";
        }
    }
}
