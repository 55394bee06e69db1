package com.vtb.traffic.errors;

/**
 * Сервер ответил 403 на запрос с извлеченным токеном.
 */
public class ForbiddenException extends AutomationException {

    public ForbiddenException(String message) {
        super(message);
    }
}
