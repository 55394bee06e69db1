package com.vtb.traffic.models;

/**
 * Состояния цели: UNATTEMPTED → IN_FLIGHT → {SUCCESS, FAILED} либо UNATTEMPTED → SKIPPED_DRY_RUN.
 */
public enum TargetState {
    UNATTEMPTED,
    IN_FLIGHT,
    SUCCESS,
    FAILED,
    SKIPPED_DRY_RUN
}
