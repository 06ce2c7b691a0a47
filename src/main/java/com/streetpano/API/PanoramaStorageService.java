package com.streetpano.API;

import com.streetpano.depth.DepthDataFile;
import com.streetpano.depth.DepthMap;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

@Service
public class PanoramaStorageService {
    private static final Logger log = LoggerFactory.getLogger(PanoramaStorageService.class);

    // Thư mục lưu ảnh kết quả và depth json
    private final Path outputPath;
    private final String publicBaseUrl;

    public PanoramaStorageService(StreetPanoProperties props) {
        this.outputPath = Paths.get(props.getOutputDir());
        String base = props.getPublicBaseUrl();
        this.publicBaseUrl = base.endsWith("/") ? base : base + "/";
    }

    /**
     * Lưu ảnh (panorama hoặc depth) dạng JPEG, trả về tên file
     */
    public String saveImage(Mat image, String fileName) throws IOException {
        if (image == null || image.empty()) {
            throw new IOException("Refusing to save an empty image as " + fileName);
        }
        createDirectoryIfNotExists(outputPath);
        Path target = outputPath.resolve(fileName);
        if (!imwrite(target.toString(), image)) {
            throw new IOException("OpenCV could not write " + target.toAbsolutePath());
        }
        log.info("Saved image {} ({}x{})", target, image.cols(), image.rows());
        return fileName;
    }

    /**
     * Lưu depth data dạng JSON, trả về tên file
     */
    public String saveDepthData(DepthMap map, String fileName) throws IOException {
        createDirectoryIfNotExists(outputPath);
        Path target = outputPath.resolve(fileName);
        DepthDataFile.write(map, target);
        log.info("Saved depth data {} ({})", target, map);
        return fileName;
    }

    /**
     * Lưu metadata JSON nguyên văn như server trả về, trả về tên file
     */
    public String saveMetadata(String json, String fileName) throws IOException {
        createDirectoryIfNotExists(outputPath);
        Path target = outputPath.resolve(fileName);
        Files.writeString(target, json, StandardCharsets.UTF_8);
        log.info("Saved metadata {} ({} chars)", target, json.length());
        return fileName;
    }

    /**
     * Xoá file đã lưu (dùng khi một bước sau thất bại)
     */
    public void delete(String fileName) throws IOException {
        Path target = outputPath.resolve(fileName);
        if (Files.deleteIfExists(target)) {
            log.info("Deleted {}", target);
        }
    }

    public String publicUrl(String fileName) {
        return publicBaseUrl + fileName;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Tên file an toàn từ panoId (id có thể chứa ký tự bất kỳ)
     */
    public static String baseName(String panoId) {
        return panoId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private void createDirectoryIfNotExists(Path path) throws IOException {
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            log.info("Created output directory {}", path.toAbsolutePath());
        }
    }
}
