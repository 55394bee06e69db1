package com.vtb.traffic.automation;

import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.models.SessionContext;
import com.vtb.traffic.models.TargetError;
import com.vtb.traffic.models.TargetState;
import com.vtb.traffic.replay.SentRequest;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог прогона: состояние каждой цели и признак необходимости повторной аутентификации
 */
@Data
@Builder
public class AutomationRunResult {
    private SessionContext session;
    private boolean dryRun;
    /** Цели прогона, без уже выполненных */
    @Builder.Default
    private List<AutomationTarget> targets = new ArrayList<>();
    /** Цели, выполненные ранее по данным трафика */
    @Builder.Default
    private List<AutomationTarget> alreadyComplete = new ArrayList<>();
    /** Запросы, отправленные или запланированные (dry-run) */
    @Builder.Default
    private List<SentRequest> requests = new ArrayList<>();
    private int networkCalls;
    /** Полученные ответы, которые не удалось записать в хранилище */
    private int unrecordedResponses;
    private boolean sessionStale;
    private boolean requiresReauthentication;
    private TargetError stopReason;
    private boolean cancelled;

    public long count(TargetState state) {
        return targets.stream().filter(t -> t.getState() == state).count();
    }

    public long getSucceeded() {
        return count(TargetState.SUCCESS);
    }

    public long getFailed() {
        return count(TargetState.FAILED);
    }
}
