package com.streetpano.API;

import com.streetpano.depth.DepthCodec;
import com.streetpano.depth.DepthDecodeException;
import com.streetpano.depth.DepthMap;
import com.streetpano.depth.DepthProjector;
import com.streetpano.depth.DepthRenderer;
import com.streetpano.depth.DistanceField;
import com.streetpano.source.MetadataSource;
import com.streetpano.source.PanoramaMetadata;
import com.streetpano.tile.PanoramaTileStitcher;
import com.streetpano.tile.TileFetchException;
import com.streetpano.tile.ZoomGeometry;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class PanoramaService {
    private static final Logger log = LoggerFactory.getLogger(PanoramaService.class);

    private final PanoramaTileStitcher stitcher;
    private final MetadataSource metadataSource;
    private final PanoramaStorageService storage;

    public PanoramaService(PanoramaTileStitcher stitcher, MetadataSource metadataSource, PanoramaStorageService storage) {
        this.stitcher = stitcher;
        this.metadataSource = metadataSource;
        this.storage = storage;
    }

    /**
     * Tải + ghép toàn bộ tile, lưu JPEG. Không lưu gì nếu có tile lỗi.
     */
    public ImageResult saveImage(PanoramaRequest request) throws TileFetchException, IOException {
        log.info("Stitching {}", request);
        Mat pano = stitcher.fetchPanorama(request.getPanoId(), request.getZoom(), request.getThreads());
        try {
            String fileName = PanoramaStorageService.baseName(request.getPanoId()) + "_z" + request.getZoom() + ".jpg";
            storage.saveImage(pano, fileName);
            return new ImageResult(storage.publicUrl(fileName), pano.cols(), pano.rows());
        } finally {
            pano.release();
        }
    }

    public DepthMap loadDepthMap(String panoId) throws IOException, DepthDecodeException {
        String blob = metadataSource.getDepthBlob(panoId);
        DepthMap map = DepthCodec.decode(blob);
        log.info("Decoded depth map of {}: {}", panoId, map);
        return map;
    }

    /**
     * Giải mã depth map, lưu ảnh depth + JSON. Nếu có zoom thì resize ảnh về kích thước panorama ở zoom đó.
     * Nếu một bước lưu lỗi thì xoá các file đã ghi, không để lại kết quả dở dang.
     */
    public DepthResult saveDepth(String panoId, Integer zoom) throws IOException, DepthDecodeException {
        if (zoom != null) {
            ZoomGeometry.checkZoom(zoom);
        }
        DepthMap map = loadDepthMap(panoId);
        DistanceField field = DepthProjector.project(map);

        Mat img = zoom != null ? DepthRenderer.renderForZoom(field, zoom) : DepthRenderer.render(field);
        String base = PanoramaStorageService.baseName(panoId);
        String imageName = base + "_depth" + (zoom != null ? "_z" + zoom : "") + ".jpg";
        String jsonName = base + "_depth.json";
        try {
            try {
                storage.saveImage(img, imageName);
                storage.saveDepthData(map, jsonName);
            } catch (IOException e) {
                discard(e, imageName, jsonName);
                throw e;
            }
            return new DepthResult(storage.publicUrl(jsonName), storage.publicUrl(imageName),
                    map.getWidth(), map.getHeight(), map.getPlanes().size(), field.noDataCount());
        } finally {
            img.release();
        }
    }

    /**
     * Lưu metadata JSON nguyên văn, trả về URL của file.
     */
    public String saveMetadata(String panoId) throws IOException {
        PanoramaMetadata metadata = metadataSource.getMetadata(panoId);
        String fileName = storage.saveMetadata(metadata.getRawJson(),
                PanoramaStorageService.baseName(panoId) + "_meta.json");
        return storage.publicUrl(fileName);
    }

    private void discard(IOException failure, String... fileNames) {
        for (String fileName : fileNames) {
            try {
                storage.delete(fileName);
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }

    public static final class ImageResult {
        private final String imageUrl;
        private final int width;
        private final int height;

        public ImageResult(String imageUrl, int width, int height) {
            this.imageUrl = imageUrl;
            this.width = width;
            this.height = height;
        }

        public String getImageUrl() {
            return imageUrl;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }
    }

    public static final class DepthResult {
        private final String dataUrl;
        private final String imageUrl;
        private final int width;
        private final int height;
        private final int planes;
        private final int noDataPixels;

        public DepthResult(String dataUrl, String imageUrl, int width, int height, int planes, int noDataPixels) {
            this.dataUrl = dataUrl;
            this.imageUrl = imageUrl;
            this.width = width;
            this.height = height;
            this.planes = planes;
            this.noDataPixels = noDataPixels;
        }

        public String getDataUrl() {
            return dataUrl;
        }

        public String getImageUrl() {
            return imageUrl;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }

        public int getPlanes() {
            return planes;
        }

        public int getNoDataPixels() {
            return noDataPixels;
        }
    }
}
