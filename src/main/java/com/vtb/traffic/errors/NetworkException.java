package com.vtb.traffic.errors;

/**
 * Транспортная ошибка при replay или автоматизации (connect, reset, DNS).
 */
public class NetworkException extends TrafficException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
