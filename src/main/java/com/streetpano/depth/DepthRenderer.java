package com.streetpano.depth;

import com.streetpano.tile.ZoomGeometry;
import com.streetpano.tile.ZoomGeometry.CropBox;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgproc.COLORMAP_VIRIDIS;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;
import static org.bytedeco.opencv.global.opencv_imgproc.applyColorMap;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * Turns a distance field into a BGR pseudocolour image. Finite distances are
 * scaled min..max onto the viridis colour map, no-data pixels are black.
 */
public final class DepthRenderer {

    private DepthRenderer() {
    }

    public static Mat render(DistanceField field) {
        int w = field.getWidth();
        int h = field.getHeight();

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : field.toArray()) {
            if (Double.isNaN(v)) continue;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double range = max - min;

        Mat gray = new Mat(h, w, CV_8UC1);
        UByteIndexer gi = gray.createIndexer();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = field.get(x, y);
                int level = 0;
                if (!Double.isNaN(v) && range > 0) {
                    level = (int) Math.round((v - min) / range * 255.0);
                }
                gi.put(y, x, level);
            }
        }
        gi.release();

        Mat color = new Mat();
        applyColorMap(gray, color, COLORMAP_VIRIDIS);
        gray.release();

        UByteIndexer ci = color.createIndexer();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (field.isNoData(x, y)) {
                    ci.put(y, x, 0, 0);
                    ci.put(y, x, 1, 0);
                    ci.put(y, x, 2, 0);
                }
            }
        }
        ci.release();
        return color;
    }

    /**
     * Renders and resizes with nearest-neighbour sampling so plane edges stay sharp.
     */
    public static Mat render(DistanceField field, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive, got " + width + "x" + height);
        }
        Mat img = render(field);
        if (img.cols() == width && img.rows() == height) {
            return img;
        }
        Mat resized = new Mat();
        resize(img, resized, new Size(width, height), 0, 0, INTER_NEAREST);
        img.release();
        return resized;
    }

    /**
     * Renders at the size of the panorama image for the given zoom.
     */
    public static Mat renderForZoom(DistanceField field, int zoom) {
        CropBox box = ZoomGeometry.cropBox(zoom);
        return render(field, box.width(), box.height());
    }
}
