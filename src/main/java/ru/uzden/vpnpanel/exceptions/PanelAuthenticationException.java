package ru.uzden.vpnpanel.exceptions;

/**
 * Неверные или протухшие учётные данные панели (в т.ч. после повторного логина).
 */
public class PanelAuthenticationException extends PanelException {

    public PanelAuthenticationException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public PanelAuthenticationException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
