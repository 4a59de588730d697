package ru.uzden.vpnpanel.exceptions;

/**
 * Нарушение бизнес-правила (например, удаление панели с активными клиентами).
 */
public class ServiceException extends RuntimeException {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
