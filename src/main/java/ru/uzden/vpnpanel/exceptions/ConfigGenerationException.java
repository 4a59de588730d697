package ru.uzden.vpnpanel.exceptions;

public class ConfigGenerationException extends RuntimeException {

    public ConfigGenerationException(String message) {
        super(message);
    }

    public ConfigGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
