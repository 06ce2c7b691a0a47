package com.streetpano.API;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cấu hình {@code streetpano.*} trong application.properties.
 */
@ConfigurationProperties(prefix = "streetpano")
public class StreetPanoProperties {

    private String tileUrl = "https://geo2.ggpht.com/cbk";
    private String metadataUrl = "https://cbks1.google.com/cbk";
    private String userAgent = "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:42.0) Gecko/20100101 Firefox/42.0";
    // số lần thử lại mỗi request HTTP
    private int maxAttempts = 10;
    private int defaultZoom = 5;
    private int defaultThreads = 16;
    private String outputDir = "output";
    private String publicBaseUrl = "http://localhost:8080/panorama/";

    public String getTileUrl() {
        return tileUrl;
    }

    public void setTileUrl(String tileUrl) {
        this.tileUrl = tileUrl;
    }

    public String getMetadataUrl() {
        return metadataUrl;
    }

    public void setMetadataUrl(String metadataUrl) {
        this.metadataUrl = metadataUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getDefaultZoom() {
        return defaultZoom;
    }

    public void setDefaultZoom(int defaultZoom) {
        this.defaultZoom = defaultZoom;
    }

    public int getDefaultThreads() {
        return defaultThreads;
    }

    public void setDefaultThreads(int defaultThreads) {
        this.defaultThreads = defaultThreads;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }
}
