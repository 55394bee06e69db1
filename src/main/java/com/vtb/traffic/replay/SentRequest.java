package com.vtb.traffic.replay;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Запрос в том виде, в котором он был (или был бы) отправлен
 */
@Data
@Builder
public class SentRequest {
    private String method;
    private String url;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private String body;
}
