package com.streetpano.source;

import java.io.IOException;

/**
 * Supplies the metadata document of a panorama. Only the depth blob is read
 * from it, the rest is kept as raw JSON.
 */
public interface MetadataSource {

    PanoramaMetadata getMetadata(String panoId) throws IOException;

    default String getDepthBlob(String panoId) throws IOException {
        return getMetadata(panoId).getDepthBlob();
    }
}
