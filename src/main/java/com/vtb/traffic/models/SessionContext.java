package com.vtb.traffic.models;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Учетные данные, извлеченные из перехваченного трафика. Не сохраняется.
 */
@Data
@Builder
public class SessionContext {
    private String host;
    private String bearerCredential;
    private String scopeIdentifier;
    private long derivedFromTransactionId;
    private Instant derivedAt;

    /**
     * Токен для вывода в консоль: первые символы и многоточие
     */
    public String maskedCredential() {
        if (bearerCredential == null) {
            return null;
        }
        int visible = Math.min(20, bearerCredential.length() / 2);
        return bearerCredential.substring(0, visible) + "...";
    }
}
