package com.streetpano.tile;

import java.io.IOException;

/**
 * Nguồn tile ảnh. Retry/backoff là việc của implementation, stitcher chỉ gọi đúng 1 lần mỗi tile.
 */
public interface TileSource {

    /**
     * @return encoded image bytes (JPEG/PNG) of tile (x, y) at the given zoom
     */
    byte[] getTileBytes(String panoId, int zoom, int x, int y) throws IOException;
}
