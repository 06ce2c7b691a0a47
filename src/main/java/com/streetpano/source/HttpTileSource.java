package com.streetpano.source;

import com.streetpano.tile.TileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Tile server client. A request that fails or answers with an error status is
 * repeated up to {@code maxAttempts} times before the last error is reported.
 */
public class HttpTileSource implements TileSource {
    private static final Logger log = LoggerFactory.getLogger(HttpTileSource.class);

    private final RestClient restClient;
    private final String tileUrl;
    private final String userAgent;
    private final int maxAttempts;

    public HttpTileSource(RestClient restClient, String tileUrl, String userAgent, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.restClient = restClient;
        this.tileUrl = tileUrl;
        this.userAgent = userAgent;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public byte[] getTileBytes(String panoId, int zoom, int x, int y) throws IOException {
        URI uri = UriComponentsBuilder.fromHttpUrl(tileUrl)
                .queryParam("output", "tile")
                .queryParam("zoom", zoom)
                .queryParam("x", x)
                .queryParam("y", y)
                .queryParam("panoid", panoId)
                .build()
                .toUri();

        RestClientException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                byte[] body = restClient.get()
                        .uri(uri)
                        .header(HttpHeaders.USER_AGENT, userAgent)
                        .retrieve()
                        .body(byte[].class);
                if (body != null && body.length > 0) {
                    return body;
                }
                log.debug("Empty tile body for {} ({}, {}) zoom {}, attempt {}/{}", panoId, x, y, zoom, attempt, maxAttempts);
            } catch (RestClientException e) {
                last = e;
                log.debug("Tile request {} failed, attempt {}/{}: {}", uri, attempt, maxAttempts, e.getMessage());
            }
        }
        if (last != null) {
            throw new IOException("Tile (" + x + ", " + y + ") of " + panoId + " failed after " + maxAttempts + " attempts", last);
        }
        throw new IOException("Tile (" + x + ", " + y + ") of " + panoId + " returned no data after " + maxAttempts + " attempts");
    }
}
