package com.vtb.traffic.errors;

public class StoreException extends TrafficException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
