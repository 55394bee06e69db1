package com.vtb.traffic.errors;

/**
 * Хранилище не читается или схема не совпадает с ожидаемой. Фатально при старте.
 */
public class StoreCorruptedException extends StoreException {

    public StoreCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
