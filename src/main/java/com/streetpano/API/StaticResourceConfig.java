package com.streetpano.API;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {
    private final StreetPanoProperties props;

    public StaticResourceConfig(StreetPanoProperties props) {
        this.props = props;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Serve ảnh / json đã lưu tại /panorama/** → từ thư mục output
        String location = Paths.get(props.getOutputDir()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/panorama/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
