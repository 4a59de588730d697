package ru.uzden.vpnpanel.exceptions;

public class PanelConnectionException extends PanelException {

    public PanelConnectionException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
