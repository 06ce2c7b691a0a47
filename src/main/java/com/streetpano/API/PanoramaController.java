package com.streetpano.API;

import com.streetpano.depth.DepthDecodeException;
import com.streetpano.tile.TileFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/panoramas")
@CrossOrigin(origins = "*")
public class PanoramaController {
    private static final Logger log = LoggerFactory.getLogger(PanoramaController.class);

    private final PanoramaService panoramaService;
    private final StreetPanoProperties props;

    public PanoramaController(PanoramaService panoramaService, StreetPanoProperties props) {
        this.panoramaService = panoramaService;
        this.props = props;
    }

    @PostMapping("/{panoId}/image")
    public ResponseEntity<?> saveImage(
            @PathVariable String panoId,
            @RequestParam(value = "zoom", required = false) Integer zoom,
            @RequestParam(value = "threads", required = false) Integer threads) {
        try {
            // Mỗi request một context riêng
            PanoramaRequest request = new PanoramaRequest(panoId,
                    zoom != null ? zoom : props.getDefaultZoom(),
                    threads != null ? threads : props.getDefaultThreads());
            PanoramaService.ImageResult result = panoramaService.saveImage(request);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("imageUrl", result.getImageUrl());
            response.put("zoom", request.getZoom());
            response.put("width", result.getWidth());
            response.put("height", result.getHeight());
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (TileFetchException e) {
            log.warn("Panorama {} not stitched: {}", panoId, e.getMessage());
            Map<String, Object> body = errorBody(e.getMessage());
            List<Map<String, Object>> failures = new ArrayList<>();
            for (TileFetchException.TileFailure f : e.getFailures()) {
                Map<String, Object> item = new HashMap<>();
                item.put("x", f.getX());
                item.put("y", f.getY());
                item.put("cause", String.valueOf(f.getCause()));
                failures.add(item);
            }
            body.put("failures", failures);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        } catch (IOException e) {
            log.error("Saving panorama {} failed", panoId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PostMapping("/{panoId}/depth")
    public ResponseEntity<?> saveDepth(
            @PathVariable String panoId,
            @RequestParam(value = "zoom", required = false) Integer zoom) {
        try {
            PanoramaService.DepthResult result = panoramaService.saveDepth(panoId, zoom);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("dataUrl", result.getDataUrl());
            response.put("imageUrl", result.getImageUrl());
            response.put("width", result.getWidth());
            response.put("height", result.getHeight());
            response.put("planes", result.getPlanes());
            response.put("noDataPixels", result.getNoDataPixels());
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (DepthDecodeException e) {
            log.warn("Depth map of {} rejected: {}", panoId, e.getMessage());
            Map<String, Object> body = errorBody(e.getMessage());
            body.put("stage", e.getStage().name().toLowerCase());
            return ResponseEntity.unprocessableEntity().body(body);
        } catch (IOException e) {
            log.warn("Depth map of {} unavailable: {}", panoId, e.getMessage());
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    @PostMapping("/{panoId}/metadata")
    public ResponseEntity<?> saveMetadata(@PathVariable String panoId) {
        try {
            String url = panoramaService.saveMetadata(panoId);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("metadataUrl", url);
            return ResponseEntity.ok().body(response);

        } catch (IOException e) {
            log.warn("Metadata of {} unavailable: {}", panoId, e.getMessage());
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(errorBody(message));
    }

    private static Map<String, Object> errorBody(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", "Lỗi: " + message);
        return error;
    }
}
