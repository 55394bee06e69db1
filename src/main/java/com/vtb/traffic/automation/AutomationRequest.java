package com.vtb.traffic.automation;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Параметры одного прогона автоматизации
 */
@Data
@Builder
public class AutomationRequest {
    private boolean dryRun;
    /** Задержка между запросами; {@code null} - из профиля */
    private Long delayMs;
    /** Явный список ресурсов; {@code null} - все найденные в трафике */
    private List<String> resourceIds;
    @Builder.Default
    private CancellationSignal cancellation = new CancellationSignal();

    public static AutomationRequest auto(boolean dryRun) {
        return AutomationRequest.builder().dryRun(dryRun).build();
    }
}
