package com.vtb.traffic.errors;

/**
 * Неподдерживаемый критерий или комбинация критериев запроса.
 */
public class InvalidQueryException extends TrafficException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
