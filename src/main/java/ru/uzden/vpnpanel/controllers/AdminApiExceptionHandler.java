package ru.uzden.vpnpanel.controllers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import ru.uzden.vpnpanel.exceptions.ConfigGenerationException;
import ru.uzden.vpnpanel.exceptions.CredentialVaultException;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.PanelApiException;
import ru.uzden.vpnpanel.exceptions.PanelAuthenticationException;
import ru.uzden.vpnpanel.exceptions.PanelConnectionException;
import ru.uzden.vpnpanel.exceptions.ServiceException;

@Slf4j
@RestControllerAdvice(assignableTypes = {AdminPanelController.class, AdminLocationController.class})
public class AdminApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<AdminViews.ErrorResponse> notFound(NotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<AdminViews.ErrorResponse> conflict(ServiceException e) {
        return error(HttpStatus.CONFLICT, "conflict", e.getMessage());
    }

    @ExceptionHandler(PanelAuthenticationException.class)
    public ResponseEntity<AdminViews.ErrorResponse> panelAuth(PanelAuthenticationException e) {
        log.warn("Admin API: panel authentication failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "panel_auth_failed", e.getMessage());
    }

    @ExceptionHandler(PanelApiException.class)
    public ResponseEntity<AdminViews.ErrorResponse> panelApi(PanelApiException e) {
        log.warn("Admin API: panel API error: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "panel_api_error", e.getMessage());
    }

    @ExceptionHandler(PanelConnectionException.class)
    public ResponseEntity<AdminViews.ErrorResponse> panelConnection(PanelConnectionException e) {
        log.warn("Admin API: panel unreachable: {}", e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, "panel_unreachable", e.getMessage());
    }

    @ExceptionHandler(ConfigGenerationException.class)
    public ResponseEntity<AdminViews.ErrorResponse> config(ConfigGenerationException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "config_generation_failed", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<AdminViews.ErrorResponse> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(CredentialVaultException.class)
    public ResponseEntity<AdminViews.ErrorResponse> vault(CredentialVaultException e) {
        log.error("Admin API: credential vault failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "credential_error", "credential vault failure");
    }

    private static ResponseEntity<AdminViews.ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new AdminViews.ErrorResponse(code, message));
    }
}
