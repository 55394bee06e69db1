package com.vtb.traffic.models;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Setter;

/**
 * Кандидат на удаленное действие, найденный в истории трафика.
 * Пересоздается на каждый запуск; переход из терминального состояния запрещен.
 */
@Data
@Builder
public class AutomationTarget {
    private String resourceId;
    private int partIndex;
    private boolean observedComplete;
    private Long sourceTransactionId;
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private TargetState state = TargetState.UNATTEMPTED;
    @Setter(AccessLevel.NONE)
    private Integer lastStatus;
    @Setter(AccessLevel.NONE)
    private TargetError error;
    @Setter(AccessLevel.NONE)
    private String errorMessage;

    public String key() {
        return resourceId + "#" + partIndex;
    }

    public void markInFlight() {
        requireState(TargetState.UNATTEMPTED, TargetState.IN_FLIGHT);
        state = TargetState.IN_FLIGHT;
    }

    public void markSkippedDryRun() {
        requireState(TargetState.UNATTEMPTED, TargetState.SKIPPED_DRY_RUN);
        state = TargetState.SKIPPED_DRY_RUN;
    }

    public void markSuccess(int status) {
        requireState(TargetState.IN_FLIGHT, TargetState.SUCCESS);
        state = TargetState.SUCCESS;
        lastStatus = status;
    }

    public void markFailed(TargetError reason, Integer status, String message) {
        requireState(TargetState.IN_FLIGHT, TargetState.FAILED);
        state = TargetState.FAILED;
        error = reason;
        lastStatus = status;
        errorMessage = message;
    }

    private void requireState(TargetState expected, TargetState next) {
        if (state != expected) {
            throw new IllegalStateException(
                "Недопустимый переход " + state + " → " + next + " для цели " + key());
        }
    }
}
