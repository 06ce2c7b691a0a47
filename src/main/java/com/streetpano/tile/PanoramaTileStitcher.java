package com.streetpano.tile;

import com.streetpano.tile.TileFetchException.TileFailure;
import com.streetpano.tile.ZoomGeometry.CropBox;
import com.streetpano.tile.ZoomGeometry.TileGrid;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static com.streetpano.tile.ZoomGeometry.TILE_SIZE;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;

/**
 * Downloads every tile of a panorama with a bounded worker pool and pastes
 * them into one canvas, which is then cropped to the zoom's crop box.
 * <p>
 * Each task returns its own tile through its {@link Future}, so the tile for
 * cell (x, y) is only ever touched by the task that produced it and by the
 * assembling thread after the join. Assembly starts only once every future
 * has completed; if any tile failed the whole call fails.
 */
public class PanoramaTileStitcher {
    private static final Logger log = LoggerFactory.getLogger(PanoramaTileStitcher.class);

    private final TileSource tileSource;

    public PanoramaTileStitcher(TileSource tileSource) {
        this.tileSource = Objects.requireNonNull(tileSource, "tileSource");
    }

    /**
     * Fetches, stitches and crops the panorama.
     *
     * @param panoId      panorama identifier passed through to the tile source
     * @param zoom        zoom level in [0, 5]
     * @param concurrency requested worker count, clamped to the tile count
     * @return cropped BGR panorama, owned by the caller
     * @throws TileFetchException if at least one tile could not be fetched or decoded
     */
    public Mat fetchPanorama(String panoId, int zoom, int concurrency) throws TileFetchException {
        TileGrid grid = ZoomGeometry.tileGrid(zoom);
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
        }
        int tw = grid.getTilesX();
        int th = grid.getTilesY();
        int workers = Math.max(1, Math.min(concurrency, grid.tileCount()));
        log.info("Fetching panorama {} at zoom {}: {} tiles, {} worker(s)", panoId, zoom, grid.tileCount(), workers);

        Mat[][] tiles = new Mat[tw][th];
        List<TileFailure> failures = new ArrayList<>();
        List<Future<Mat>> futures = new ArrayList<>(grid.tileCount());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new TileThreadFactory(panoId));
        int joined = 0;
        try {
            // index = y + th * x
            for (int x = 0; x < tw; x++) {
                for (int y = 0; y < th; y++) {
                    final int tx = x;
                    final int ty = y;
                    futures.add(pool.submit(() -> fetchTile(panoId, zoom, tx, ty)));
                }
            }

            for (; joined < futures.size(); joined++) {
                int x = joined / th;
                int y = joined % th;
                try {
                    tiles[x][y] = futures.get(joined).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Tile ({}, {}) of {} failed: {}", x, y, panoId, cause.toString());
                    failures.add(new TileFailure(x, y, cause));
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while fetching {}, {} of {} tiles joined", panoId, joined, futures.size());
            List<TileFailure> pending = new ArrayList<>(failures);
            for (int i = joined; i < futures.size(); i++) {
                pending.add(abandon(futures.get(i), i / th, i % th, e));
            }
            releaseTiles(tiles);
            Thread.currentThread().interrupt();
            throw new TileFetchException(panoId, zoom, pending);
        } finally {
            pool.shutdownNow();
        }

        if (!failures.isEmpty()) {
            releaseTiles(tiles);
            throw new TileFetchException(panoId, zoom, failures);
        }

        Mat canvas = assemble(zoom, tiles);
        releaseTiles(tiles);
        Mat panorama = crop(canvas, zoom);
        canvas.release();
        log.info("Panorama {} stitched: {}x{}", panoId, panorama.cols(), panorama.rows());
        return panorama;
    }

    /**
     * Pastes decoded tiles into a black canvas of 512*tilesX by 512*tilesY
     * pixels, tile (x, y) at pixel offset (512*x, 512*y).
     *
     * @param tiles tiles indexed [x][y]; every cell must hold a 512x512 BGR tile
     */
    public static Mat assemble(int zoom, Mat[][] tiles) {
        TileGrid grid = ZoomGeometry.tileGrid(zoom);
        if (tiles.length != grid.getTilesX()) {
            throw new IllegalArgumentException("Expected " + grid.getTilesX() + " tile columns, got " + tiles.length);
        }
        Mat canvas = new Mat(ZoomGeometry.canvasHeight(zoom), ZoomGeometry.canvasWidth(zoom), CV_8UC3, new Scalar(0, 0, 0, 0));
        for (int x = 0; x < grid.getTilesX(); x++) {
            if (tiles[x].length != grid.getTilesY()) {
                throw new IllegalArgumentException("Expected " + grid.getTilesY() + " tile rows in column " + x + ", got " + tiles[x].length);
            }
            for (int y = 0; y < grid.getTilesY(); y++) {
                Mat tile = tiles[x][y];
                if (tile == null || tile.empty()) {
                    throw new IllegalArgumentException("Missing tile (" + x + ", " + y + ")");
                }
                checkTile(tile, x, y);
                // copyTo vào ROI ghi thẳng vào canvas (cùng kiểu, cùng kích thước)
                Mat roi = new Mat(canvas, new Rect(TILE_SIZE * x, TILE_SIZE * y, TILE_SIZE, TILE_SIZE));
                tile.copyTo(roi);
            }
        }
        return canvas;
    }

    /**
     * @return an independent copy of the crop box region of the canvas
     */
    public static Mat crop(Mat canvas, int zoom) {
        CropBox box = ZoomGeometry.cropBox(zoom);
        if (canvas.cols() < box.getRight() || canvas.rows() < box.getBottom()) {
            throw new IllegalArgumentException("Canvas " + canvas.cols() + "x" + canvas.rows() + " is smaller than " + box);
        }
        Mat view = new Mat(canvas, new Rect(box.getLeft(), box.getTop(), box.width(), box.height()));
        return view.clone();
    }

    /**
     * Decodes raw tile bytes into a 512x512 BGR image.
     */
    public static Mat decodeTile(byte[] bytes, int x, int y) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Empty payload for tile (" + x + ", " + y + ")");
        }
        Mat buf = new Mat(bytes);
        Mat img = imdecode(buf, IMREAD_COLOR);
        buf.release();
        if (img == null || img.empty()) {
            throw new IOException("Cannot decode tile (" + x + ", " + y + "), " + bytes.length + " bytes");
        }
        if (img.cols() != TILE_SIZE || img.rows() != TILE_SIZE) {
            int w = img.cols();
            int h = img.rows();
            img.release();
            throw new IOException("Tile (" + x + ", " + y + ") is " + w + "x" + h + ", expected " + TILE_SIZE + "x" + TILE_SIZE);
        }
        return img;
    }

    private Mat fetchTile(String panoId, int zoom, int x, int y) throws IOException {
        byte[] bytes = tileSource.getTileBytes(panoId, zoom, x, y);
        return decodeTile(bytes, x, y);
    }

    private static void checkTile(Mat tile, int x, int y) {
        if (tile.cols() != TILE_SIZE || tile.rows() != TILE_SIZE || tile.type() != CV_8UC3) {
            throw new IllegalArgumentException("Tile (" + x + ", " + y + ") must be a " + TILE_SIZE + "x" + TILE_SIZE + " 8-bit BGR image");
        }
    }

    /**
     * Cancels a task that was not joined before the interrupt. A task that
     * already finished cannot be cancelled: its tile is released, or its own
     * failure is kept when it failed.
     */
    private static TileFailure abandon(Future<Mat> future, int x, int y, InterruptedException interrupt) {
        if (future.cancel(true)) {
            return new TileFailure(x, y, interrupt);
        }
        try {
            Mat tile = future.get();
            if (tile != null) {
                tile.release();
            }
            return new TileFailure(x, y, interrupt);
        } catch (ExecutionException e) {
            return new TileFailure(x, y, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException | InterruptedException e) {
            return new TileFailure(x, y, interrupt);
        }
    }

    private static void releaseTiles(Mat[][] tiles) {
        for (Mat[] column : tiles) {
            for (int y = 0; y < column.length; y++) {
                if (column[y] != null) {
                    column[y].release();
                    column[y] = null;
                }
            }
        }
    }

    private static final class TileThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        private final String prefix;

        TileThreadFactory(String panoId) {
            this.prefix = "tile-" + panoId + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
