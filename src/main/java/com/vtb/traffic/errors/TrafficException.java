package com.vtb.traffic.errors;

/**
 * Базовое исключение анализатора трафика.
 */
public class TrafficException extends RuntimeException {

    public TrafficException(String message) {
        super(message);
    }

    public TrafficException(String message, Throwable cause) {
        super(message, cause);
    }
}
