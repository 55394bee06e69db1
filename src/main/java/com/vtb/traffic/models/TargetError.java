package com.vtb.traffic.models;

public enum TargetError {
    AUTH_EXPIRED,
    FORBIDDEN,
    HTTP_STATUS,
    NETWORK,
    TIMEOUT;

    /**
     * После этих ошибок сессию нужно извлечь заново
     */
    public boolean requiresReauthentication() {
        return this == AUTH_EXPIRED || this == FORBIDDEN;
    }
}
