package com.vtb.traffic.errors;

/**
 * Сервер ответил 401: сессию нужно заново извлечь из трафика.
 */
public class AuthExpiredException extends AutomationException {

    public AuthExpiredException(String message) {
        super(message);
    }
}
