package com.streetpano.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Reads panorama metadata as JSON; the depth blob is {@code model.depth_map}.
 * Only the compressed depth map variant is requested.
 */
public class HttpMetadataSource implements MetadataSource {
    private static final Logger log = LoggerFactory.getLogger(HttpMetadataSource.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String metadataUrl;
    private final String userAgent;
    private final int maxAttempts;

    public HttpMetadataSource(RestClient restClient, ObjectMapper objectMapper, String metadataUrl,
                              String userAgent, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.metadataUrl = metadataUrl;
        this.userAgent = userAgent;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public PanoramaMetadata getMetadata(String panoId) throws IOException {
        String json = fetchMetadata(panoId);
        return PanoramaMetadata.parse(panoId, json, objectMapper);
    }

    private String fetchMetadata(String panoId) throws IOException {
        URI uri = UriComponentsBuilder.fromHttpUrl(metadataUrl)
                .queryParam("output", "json")
                .queryParam("v", 4)
                .queryParam("cb_client", "apiv3")
                .queryParam("hl", "en-US")
                .queryParam("oe", "utf-8")
                .queryParam("dmz", 0)   // depth map nén
                .queryParam("pmz", 0)
                .queryParam("dm", 1)
                .queryParam("pm", 0)
                .queryParam("panoid", panoId)
                .build()
                .toUri();

        RestClientException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String body = restClient.get()
                        .uri(uri)
                        .header(HttpHeaders.USER_AGENT, userAgent)
                        .retrieve()
                        .body(String.class);
                if (body != null && !body.isEmpty()) {
                    return body;
                }
            } catch (RestClientException e) {
                last = e;
                log.debug("Metadata request for {} failed, attempt {}/{}: {}", panoId, attempt, maxAttempts, e.getMessage());
            }
        }
        throw new IOException("Metadata of " + panoId + " unavailable after " + maxAttempts + " attempts", last);
    }
}
