package com.streetpano.API;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetpano.source.HttpMetadataSource;
import com.streetpano.source.MetadataSource;
import com.streetpano.tile.PanoramaTileStitcher;
import com.streetpano.tile.TileSource;
import com.streetpano.source.HttpTileSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class SourceConfig {

    @Bean
    public TileSource tileSource(RestClient.Builder builder, StreetPanoProperties props) {
        return new HttpTileSource(builder.build(), props.getTileUrl(), props.getUserAgent(), props.getMaxAttempts());
    }

    @Bean
    public MetadataSource metadataSource(RestClient.Builder builder, ObjectMapper objectMapper, StreetPanoProperties props) {
        return new HttpMetadataSource(builder.build(), objectMapper, props.getMetadataUrl(), props.getUserAgent(), props.getMaxAttempts());
    }

    @Bean
    public PanoramaTileStitcher panoramaTileStitcher(TileSource tileSource) {
        return new PanoramaTileStitcher(tileSource);
    }
}
