package app.threejs.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.sketchfab")
public record SketchfabProps(
        String apiUrl,
        String oauthUrl,
        String credentialsFile,
        Duration connectTimeout,
        Duration downloadTimeout
) {
}
