package com.vtb.traffic.errors;

/**
 * Ответ не получен за отведенное время (connect/read/call timeout).
 */
public class TransportTimeoutException extends NetworkException {

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
