package com.streetpano.API;

import com.streetpano.depth.DepthDecodeException;
import com.streetpano.tile.TileFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PanoramaControllerTest {

    private PanoramaService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = mock(PanoramaService.class);
        StreetPanoProperties props = new StreetPanoProperties();
        props.setDefaultZoom(3);
        props.setDefaultThreads(8);
        mvc = MockMvcBuilders.standaloneSetup(new PanoramaController(service, props)).build();
    }

    @Test
    void imageUsesDefaultsWhenParametersAreMissing() throws Exception {
        when(service.saveImage(any())).thenReturn(new PanoramaService.ImageResult("http://host/panorama/p_z3.jpg", 3329, 1664));

        mvc.perform(post("/api/panoramas/p/image"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.imageUrl").value("http://host/panorama/p_z3.jpg"))
                .andExpect(jsonPath("$.width").value(3329))
                .andExpect(jsonPath("$.zoom").value(3));

        ArgumentCaptor<PanoramaRequest> captor = ArgumentCaptor.forClass(PanoramaRequest.class);
        verify(service).saveImage(captor.capture());
        assertThat(captor.getValue().getPanoId()).isEqualTo("p");
        assertThat(captor.getValue().getZoom()).isEqualTo(3);
        assertThat(captor.getValue().getThreads()).isEqualTo(8);
    }

    @Test
    void imageRejectsZoomOutOfRange() throws Exception {
        mvc.perform(post("/api/panoramas/p/image").param("zoom", "6"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(service, never()).saveImage(any());
    }

    @Test
    void imageRejectsNonPositiveThreads() throws Exception {
        mvc.perform(post("/api/panoramas/p/image").param("zoom", "1").param("threads", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void failedTilesAreListed() throws Exception {
        when(service.saveImage(any())).thenThrow(new TileFetchException("p", 1,
                List.of(new TileFetchException.TileFailure(1, 0, new IOException("timeout")))));

        mvc.perform(post("/api/panoramas/p/image").param("zoom", "1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.failures[0].x").value(1))
                .andExpect(jsonPath("$.failures[0].y").value(0));
    }

    @Test
    void depthReportsSavedArtifacts() throws Exception {
        when(service.saveDepth(eq("p"), eq(2))).thenReturn(
                new PanoramaService.DepthResult("http://host/panorama/p_depth.json", "http://host/panorama/p_depth_z2.jpg", 512, 256, 14, 300));

        mvc.perform(post("/api/panoramas/p/depth").param("zoom", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.planes").value(14))
                .andExpect(jsonPath("$.noDataPixels").value(300))
                .andExpect(jsonPath("$.imageUrl").value("http://host/panorama/p_depth_z2.jpg"));
    }

    @Test
    void depthWithoutZoomPassesNull() throws Exception {
        when(service.saveDepth(anyString(), isNull())).thenReturn(
                new PanoramaService.DepthResult("d", "i", 512, 256, 3, 0));

        mvc.perform(post("/api/panoramas/p/depth"))
                .andExpect(status().isOk());

        verify(service).saveDepth("p", null);
    }

    @Test
    void decodeFailureNamesTheStage() throws Exception {
        when(service.saveDepth(anyString(), any())).thenThrow(
                new DepthDecodeException(DepthDecodeException.Stage.LABELS, "out-of-range"));

        mvc.perform(post("/api/panoramas/p/depth"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.stage").value("labels"));
    }

    @Test
    void unreachableMetadataIsBadGateway() throws Exception {
        when(service.saveDepth(anyString(), any())).thenThrow(new IOException("metadata unavailable"));

        mvc.perform(post("/api/panoramas/p/depth"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void metadataReturnsTheSavedFileUrl() throws Exception {
        when(service.saveMetadata("p")).thenReturn("http://host/panorama/p_meta.json");

        mvc.perform(post("/api/panoramas/p/metadata"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadataUrl").value("http://host/panorama/p_meta.json"));
    }

    @Test
    void unreachableMetadataSaveIsBadGateway() throws Exception {
        when(service.saveMetadata(anyString())).thenThrow(new IOException("Metadata of p unavailable after 10 attempts"));

        mvc.perform(post("/api/panoramas/p/metadata"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false));
    }
}
