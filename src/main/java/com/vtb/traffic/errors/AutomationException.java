package com.vtb.traffic.errors;

public class AutomationException extends TrafficException {

    public AutomationException(String message) {
        super(message);
    }
}
