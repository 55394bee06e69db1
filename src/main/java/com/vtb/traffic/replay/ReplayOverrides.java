package com.vtb.traffic.replay;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Изменения запроса при повторе. Незаданные поля берутся из исходной транзакции.
 * Заголовок со значением {@code null} удаляется.
 */
@Data
@Builder
public class ReplayOverrides {
    private String url;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private String body;

    public static ReplayOverrides none() {
        return ReplayOverrides.builder().build();
    }
}
