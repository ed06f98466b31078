package app.assistant.security;

import org.springframework.lang.Nullable;

/**
 * Encrypts secrets, such as OAuth client secrets and tokens, before they are written to durable
 * configuration.
 */
public interface SecretEncryptor {

    /**
     * @return the encrypted representation or {@code null} if the input is blank
     */
    @Nullable
    String encrypt(@Nullable String plainText);

    /**
     * @return the plain value or {@code null} if the input is blank
     * @throws EncryptionException if the value was not produced by {@link #encrypt(String)} with the same key
     */
    @Nullable
    String decrypt(@Nullable String cipherText);
}
