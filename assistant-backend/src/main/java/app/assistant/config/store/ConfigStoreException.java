package app.assistant.config.store;

public class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
