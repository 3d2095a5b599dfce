package app.threejs.catalog.tool;

/**
 * Name, description and JSON Schema (as a JSON string) of one tool offered to the agent host.
 */
public record ToolDescriptor(
        String name,
        String description,
        String inputSchema
) {
}
