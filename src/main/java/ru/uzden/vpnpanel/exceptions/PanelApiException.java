package ru.uzden.vpnpanel.exceptions;

/**
 * Панель ответила не-2xx или success=false.
 */
public class PanelApiException extends PanelException {

    public PanelApiException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public boolean isNotFound() {
        Integer status = getStatusCode();
        if (status != null && status == 404) return true;
        String msg = getMessage();
        return msg != null && msg.toLowerCase().contains("not found");
    }
}
