package com.streetpano.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Metadata document of one panorama: the raw JSON as served, kept verbatim
 * so it can be saved next to the other artifacts, and the depth blob read
 * from {@code model.depth_map}. No other field is interpreted.
 */
public final class PanoramaMetadata {
    private final String panoId;
    private final String rawJson;
    private final String depthBlob;

    public PanoramaMetadata(String panoId, String rawJson, String depthBlob) {
        this.panoId = Objects.requireNonNull(panoId, "panoId");
        this.rawJson = Objects.requireNonNull(rawJson, "rawJson");
        this.depthBlob = Objects.requireNonNull(depthBlob, "depthBlob");
    }

    /**
     * @throws IOException if the document is not JSON or has no non-empty {@code model.depth_map}
     */
    public static PanoramaMetadata parse(String panoId, String json, ObjectMapper objectMapper) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException(panoId + " has no metadata JSON", e);
        }
        JsonNode depth = root.path("model").path("depth_map");
        if (!depth.isTextual() || depth.asText().isEmpty()) {
            throw new IOException(panoId + " metadata carries no model.depth_map");
        }
        return new PanoramaMetadata(panoId, json, depth.asText());
    }

    public String getPanoId() {
        return panoId;
    }

    public String getRawJson() {
        return rawJson;
    }

    public String getDepthBlob() {
        return depthBlob;
    }

    @Override
    public String toString() {
        return "PanoramaMetadata{" + panoId + ", " + rawJson.length() + " chars, depth blob " + depthBlob.length() + " chars}";
    }
}
