package com.vtb.traffic.errors;

/**
 * Некорректные данные для операции записи. Ничего не сохраняется.
 */
public class ValidationException extends TrafficException {

    public ValidationException(String message) {
        super(message);
    }
}
