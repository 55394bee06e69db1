package com.vtb.traffic.replay;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
public class ExecutedResponse {
    private int status;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private String body;
    private double durationSec;
    /** Время отправки, секунды с начала эпохи */
    private double startedAt;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
