package ru.uzden.vpnpanel.exceptions;

public class CredentialVaultException extends RuntimeException {

    public CredentialVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
