package ru.uzden.vpnpanel.exceptions;

/**
 * Базовая ошибка общения с удалённой панелью. statusCode - HTTP-статус ответа, если он был.
 */
public abstract class PanelException extends RuntimeException {

    private final Integer statusCode;

    protected PanelException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    protected PanelException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
