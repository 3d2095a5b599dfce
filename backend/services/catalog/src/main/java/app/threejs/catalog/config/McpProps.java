package app.threejs.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.mcp")
public record McpProps(
        boolean stdioEnabled,
        String serverName,
        String serverVersion
) {
}
