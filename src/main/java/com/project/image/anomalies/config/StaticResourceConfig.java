package com.project.image.anomalies.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.CacheControl;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Serves stored run artifacts (golden image, ROI mask, per-frame masks) under /uploads/**.
 * Every run writes into its own timestamped directory and never rewrites a file, so browsers may keep
 * them for {@code app.upload.cache-max-age}. They stay private because they sit behind the login.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final Path uploadDir;
    private final Duration cacheMaxAge;

    public StaticResourceConfig(@Value("${app.upload.dir:uploads}") String uploadDir,
                                @Value("${app.upload.cache-max-age:1h}") Duration cacheMaxAge) {
        this.uploadDir = Paths.get(uploadDir).toAbsolutePath().normalize();
        this.cacheMaxAge = cacheMaxAge;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations("file:" + uploadDir + "/")
                .setCacheControl(CacheControl.maxAge(cacheMaxAge).cachePrivate());
    }
}
