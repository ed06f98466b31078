package app.assistant.config;

import java.nio.file.Path;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.assistant.config.store.GlobalConfigStore;
import app.assistant.config.store.JsonFileGlobalConfigStore;
import app.assistant.mcp.config.McpProperties;

@Configuration
public class ConfigStoreConfig {

    @Bean
    public GlobalConfigStore globalConfigStore(McpProperties properties, ObjectMapper objectMapper) {
        return new JsonFileGlobalConfigStore(Path.of(properties.configFile()), objectMapper);
    }
}
