package app.threejs.catalog.mcp;

import app.threejs.catalog.config.McpProps;
import app.threejs.catalog.tool.ThreejsToolAdapter;
import app.threejs.catalog.tool.ToolDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Serves the catalog tools over MCP on stdin/stdout.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.mcp", name = "stdio-enabled", havingValue = "true", matchIfMissing = true)
public class McpServerConfig {

    private static final Logger log = LoggerFactory.getLogger(McpServerConfig.class);

    @Bean
    public StdioServerTransportProvider stdioServerTransportProvider(ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    @Bean(destroyMethod = "closeGracefully")
    public McpSyncServer threejsMcpServer(StdioServerTransportProvider transportProvider,
                                          ThreejsToolAdapter toolAdapter,
                                          McpProps props) {
        List<McpServerFeatures.SyncToolSpecification> tools = toolAdapter.availableTools().stream()
                .map(descriptor -> toSpecification(descriptor, toolAdapter))
                .toList();

        McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo(props.serverName(), props.serverVersion())
                .capabilities(McpSchema.ServerCapabilities.builder()
                        .tools(false)
                        .build())
                .tools(tools)
                .build();

        log.info("Server {} {} running with stdio transport, tools: {}",
                props.serverName(),
                props.serverVersion(),
                tools.stream().map(spec -> spec.tool().name()).toList());
        return server;
    }

    private McpServerFeatures.SyncToolSpecification toSpecification(ToolDescriptor descriptor,
                                                                   ThreejsToolAdapter toolAdapter) {
        McpSchema.Tool tool = new McpSchema.Tool(descriptor.name(), descriptor.description(), descriptor.inputSchema());
        return new McpServerFeatures.SyncToolSpecification(tool, (exchange, arguments) -> {
            String text = toolAdapter.invoke(descriptor.name(), arguments);
            return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false);
        });
    }
}
