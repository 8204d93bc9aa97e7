package org.camunda.bpm.getstarted.autolayout.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

@Slf4j
public class LayoutConfigHelper {
    public static final String SCHEMA_RESOURCE = "layout/layout_config_schema.json";
    public static final String DEFAULT_CONFIG_RESOURCE = "layout/layout_config.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private LayoutConfigHelper() {
    }

    /**
     * Validates a layout configuration file against the bundled JSON schema.
     *
     * @param configFilePath path of the JSON file on disk
     * @throws IllegalArgumentException if the file does not satisfy the schema
     */
    public static void validateConfigFile(String configFilePath) {
        try {
            JsonNode configNode = mapper.readTree(new File(configFilePath));
            validateConfigNode(configNode, configFilePath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read layout config: " + configFilePath, e);
        }
    }

    /**
     * Reads, validates and binds a layout configuration file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file does not satisfy the schema
     */
    public static LayoutConfig loadConfigFile(String configFilePath) throws IOException {
        JsonNode configNode = mapper.readTree(new File(configFilePath));
        validateConfigNode(configNode, configFilePath);
        return mapper.treeToValue(configNode, LayoutConfig.class);
    }

    /**
     * Loads and validates a layout configuration from the classpath.
     *
     * @param resourcePath classpath location, e.g. "layout/layout_config.json"
     * @throws IllegalArgumentException if the resource is missing or invalid
     */
    public static LayoutConfig loadFromClasspath(String resourcePath) {
        ClassLoader cl = LayoutConfigHelper.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Layout config resource not found: " + resourcePath);
            }
            JsonNode configNode = mapper.readTree(in);
            validateConfigNode(configNode, resourcePath);
            return mapper.treeToValue(configNode, LayoutConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read layout config resource: " + resourcePath, e);
        }
    }

    public static LayoutConfig loadDefault() {
        return loadFromClasspath(DEFAULT_CONFIG_RESOURCE);
    }

    private static void validateConfigNode(JsonNode configNode, String origin) throws IOException {
        JsonSchema schema = loadSchema();
        Set<ValidationMessage> result = schema.validate(configNode);
        if (!result.isEmpty()) {
            result.forEach(message -> log.warn("Layout config {}: {}", origin, message.getMessage()));
            throw new IllegalArgumentException("Layout config is invalid: " + origin + " " + result);
        }
        log.debug("Layout config {} is valid", origin);
    }

    private static JsonSchema loadSchema() throws IOException {
        try (InputStream schemaStream = LayoutConfigHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        }
    }
}
