package app.assistant.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import app.assistant.mcp.config.McpProperties;
import app.assistant.security.AesGcmSecretEncryptor;
import app.assistant.security.SecretEncryptor;

/**
 * Encryption of secrets at rest, keyed by {@code mcp.encryption-key}.
 */
@Configuration
@EnableConfigurationProperties(McpProperties.class)
public class EncryptionConfig {

    @Bean
    public SecretEncryptor secretEncryptor(McpProperties properties) {
        return new AesGcmSecretEncryptor(properties.encryptionKey());
    }
}
