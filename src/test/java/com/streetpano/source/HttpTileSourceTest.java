package com.streetpano.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpTileSourceTest {
    private static final String TILE_URL = "https://tiles.example.test/cbk";
    private static final String EXPECTED = TILE_URL + "?output=tile&zoom=2&x=3&y=1&panoid=abc123";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void requestsTileWithQueryAndUserAgent() throws Exception {
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 1, 2, 3};
        server.expect(requestTo(EXPECTED))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("User-Agent", "test-agent"))
                .andRespond(withSuccess(jpeg, MediaType.IMAGE_JPEG));

        byte[] body = new HttpTileSource(restClient, TILE_URL, "test-agent", 3).getTileBytes("abc123", 2, 3, 1);

        assertThat(body).isEqualTo(jpeg);
        server.verify();
    }

    @Test
    void retriesUntilTheServerAnswers() throws Exception {
        server.expect(ExpectedCount.times(2), requestTo(EXPECTED)).andRespond(withServerError());
        server.expect(requestTo(EXPECTED)).andRespond(withSuccess(new byte[]{42}, MediaType.IMAGE_JPEG));

        byte[] body = new HttpTileSource(restClient, TILE_URL, "agent", 3).getTileBytes("abc123", 2, 3, 1);

        assertThat(body).containsExactly(42);
        server.verify();
    }

    @Test
    void failsAfterTheLastAttempt() {
        server.expect(ExpectedCount.times(3), requestTo(EXPECTED)).andRespond(withServerError());
        HttpTileSource source = new HttpTileSource(restClient, TILE_URL, "agent", 3);

        assertThatThrownBy(() -> source.getTileBytes("abc123", 2, 3, 1))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("after 3 attempts");
        server.verify();
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new HttpTileSource(restClient, TILE_URL, "agent", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
