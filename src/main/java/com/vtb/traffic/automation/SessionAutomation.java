package com.vtb.traffic.automation;

import com.vtb.traffic.errors.AuthExpiredException;
import com.vtb.traffic.errors.ForbiddenException;
import com.vtb.traffic.errors.NetworkException;
import com.vtb.traffic.errors.NoSessionFoundException;
import com.vtb.traffic.errors.StoreException;
import com.vtb.traffic.errors.TransportTimeoutException;
import com.vtb.traffic.errors.ValidationException;
import com.vtb.traffic.models.AutomationTarget;
import com.vtb.traffic.models.SessionContext;
import com.vtb.traffic.models.TargetError;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.query.HostMatch;
import com.vtb.traffic.query.QueryCriteria;
import com.vtb.traffic.query.QueryEngine;
import com.vtb.traffic.query.TransactionQuery;
import com.vtb.traffic.replay.ExecutedResponse;
import com.vtb.traffic.replay.RequestExecutor;
import com.vtb.traffic.replay.SentRequest;
import com.vtb.traffic.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Прогон автоматизации: извлечь сессию, найти цели, отправить запросы завершения.
 *
 * <p>Запросы идут строго последовательно с задержкой между ними и без повторов.
 * Ответ 401 или 403 останавливает прогон: оставшиеся цели не трогаются.
 */
@Slf4j
public class SessionAutomation {

    private final QueryEngine queryEngine;
    private final TransactionStore store;
    private final RequestExecutor executor;
    private final AutomationProfile profile;
    private final CompletionRequestFactory requestFactory;
    private final Clock clock;

    public SessionAutomation(QueryEngine queryEngine, RequestExecutor executor, AutomationProfile profile) {
        this(queryEngine, executor, profile, Clock.systemUTC());
    }

    public SessionAutomation(QueryEngine queryEngine, RequestExecutor executor, AutomationProfile profile, Clock clock) {
        this.queryEngine = queryEngine;
        this.store = queryEngine.getStore();
        this.executor = executor;
        this.profile = profile;
        this.clock = clock;
        this.requestFactory = new CompletionRequestFactory(profile, clock);
    }

    /**
     * Снимок трафика к целевому хосту для поиска целей, от новых к старым
     */
    public List<Transaction> snapshot() {
        return hostTraffic().limit(profile.getScanLimit()).toList();
    }

    /**
     * Сессия ищется по всей истории хоста: страницы читаются лениво до первого Bearer-токена
     */
    public Optional<SessionContext> deriveSession() {
        return SessionDeriver.derive(hostTraffic(), profile, clock);
    }

    private TransactionQuery hostTraffic() {
        QueryCriteria criteria = QueryCriteria.builder()
            .host(profile.getTargetHost())
            .hostMatch(HostMatch.SUFFIX)
            .build();
        return queryEngine.find(criteria);
    }

    public List<AutomationTarget> enumerateTargets() {
        return TargetEnumerator.enumerate(snapshot(), profile);
    }

    /**
     * Выполнить прогон
     *
     * @throws NoSessionFoundException если в трафике нет авторизованного запроса к хосту
     */
    public AutomationRunResult run(AutomationRequest request) {
        long delayMs = request.getDelayMs() != null ? request.getDelayMs() : profile.getDelayMs();
        if (delayMs <= 0) {
            throw new ValidationException("Задержка между запросами должна быть положительной: " + delayMs);
        }
        CancellationSignal cancellation = request.getCancellation() != null
            ? request.getCancellation() : new CancellationSignal();

        SessionContext session = deriveSession()
            .orElseThrow(() -> new NoSessionFoundException(profile.getTargetHost()));
        log.info("Сессия извлечена из транзакции {} (токен {})",
            session.getDerivedFromTransactionId(), session.maskedCredential());

        List<AutomationTarget> discovered = TargetEnumerator.enumerate(snapshot(), profile);
        List<AutomationTarget> candidates = request.getResourceIds() != null
            ? select(discovered, request.getResourceIds())
            : discovered;

        List<AutomationTarget> pending = new ArrayList<>();
        List<AutomationTarget> alreadyComplete = new ArrayList<>();
        for (AutomationTarget target : candidates) {
            if (target.isObservedComplete()) {
                alreadyComplete.add(target);
            } else {
                pending.add(target);
            }
        }
        log.info("Целей: {} (выполнено ранее: {}, к обработке: {})",
            candidates.size(), alreadyComplete.size(), pending.size());

        AutomationRunResult result = AutomationRunResult.builder()
            .session(session)
            .dryRun(request.isDryRun())
            .targets(pending)
            .alreadyComplete(alreadyComplete)
            .build();

        if (request.isDryRun()) {
            for (AutomationTarget target : pending) {
                result.getRequests().add(requestFactory.build(target, session));
                target.markSkippedDryRun();
            }
            return result;
        }

        for (int i = 0; i < pending.size(); i++) {
            if (cancellation.isCancelled()) {
                log.info("Прогон отменен, необработанных целей: {}", pending.size() - i);
                result.setCancelled(true);
                break;
            }
            AutomationTarget target = pending.get(i);
            TargetError stop = process(target, session, result);
            if (stop != null) {
                markStale(result, stop);
                break;
            }
            if (i < pending.size() - 1 && cancellation.await(delayMs)) {
                log.info("Прогон отменен во время ожидания");
                result.setCancelled(true);
                break;
            }
        }

        log.info("Автоматизация завершена: успешно {}, с ошибкой {}, всего {}",
            result.getSucceeded(), result.getFailed(), pending.size());
        return result;
    }

    /**
     * То же, что {@link #run}, но ответ 401/403 превращается в исключение
     *
     * @throws AuthExpiredException при ответе 401
     * @throws ForbiddenException при ответе 403
     */
    public AutomationRunResult runOrThrow(AutomationRequest request) {
        AutomationRunResult result = run(request);
        if (result.getStopReason() == TargetError.AUTH_EXPIRED) {
            throw new AuthExpiredException("Сессия истекла (401), извлеките токен заново из свежего трафика");
        }
        if (result.getStopReason() == TargetError.FORBIDDEN) {
            throw new ForbiddenException("Доступ запрещен (403), извлеките токен заново из свежего трафика");
        }
        return result;
    }

    /**
     * @return причина остановки прогона или {@code null}
     */
    private TargetError process(AutomationTarget target, SessionContext session, AutomationRunResult result) {
        SentRequest sent = requestFactory.build(target, session);
        result.getRequests().add(sent);
        target.markInFlight();
        result.setNetworkCalls(result.getNetworkCalls() + 1);

        ExecutedResponse response;
        try {
            response = executor.execute(sent);
        } catch (TransportTimeoutException e) {
            target.markFailed(TargetError.TIMEOUT, null, e.getMessage());
            log.warn("Цель {}: таймаут", target.key());
            return null;
        } catch (NetworkException e) {
            target.markFailed(TargetError.NETWORK, null, e.getMessage());
            log.warn("Цель {}: сетевая ошибка {}", target.key(), e.getMessage());
            return null;
        }

        TargetError stop = classify(target, response);
        if (profile.isRecordResults()) {
            try {
                store.append(toTransaction(sent, response));
            } catch (StoreException e) {
                result.setUnrecordedResponses(result.getUnrecordedResponses() + 1);
                log.warn("Цель {}: ответ {} не сохранен в хранилище: {}",
                    target.key(), response.getStatus(), e.getMessage());
            }
        }
        return stop;
    }

    private TargetError classify(AutomationTarget target, ExecutedResponse response) {
        int status = response.getStatus();
        if (response.isSuccessful()) {
            target.markSuccess(status);
            log.info("Цель {} выполнена ({})", target.key(), status);
            return null;
        }
        if (status == 401) {
            target.markFailed(TargetError.AUTH_EXPIRED, status, "Сессия истекла");
            log.warn("Цель {}: 401, прогон остановлен", target.key());
            return TargetError.AUTH_EXPIRED;
        }
        if (status == 403) {
            target.markFailed(TargetError.FORBIDDEN, status, "Доступ запрещен");
            log.warn("Цель {}: 403, прогон остановлен", target.key());
            return TargetError.FORBIDDEN;
        }
        target.markFailed(TargetError.HTTP_STATUS, status, snippet(response.getBody()));
        log.warn("Цель {}: HTTP {}", target.key(), status);
        return null;
    }

    private void markStale(AutomationRunResult result, TargetError reason) {
        result.setStopReason(reason);
        result.setSessionStale(true);
        result.setRequiresReauthentication(reason.requiresReauthentication());
    }

    private List<AutomationTarget> select(List<AutomationTarget> discovered, List<String> resourceIds) {
        List<AutomationTarget> selected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : resourceIds) {
            String resourceId = raw == null ? "" : raw.trim();
            if (resourceId.isEmpty()) {
                throw new ValidationException("Пустой идентификатор ресурса");
            }
            if (!AutomationProfile.isValidResourceId(resourceId)) {
                throw new ValidationException("Недопустимый идентификатор ресурса: " + resourceId);
            }
            if (!seen.add(resourceId)) {
                continue;
            }
            boolean found = false;
            for (AutomationTarget target : discovered) {
                if (target.getResourceId().equals(resourceId)) {
                    selected.add(target);
                    found = true;
                }
            }
            if (!found) {
                selected.add(AutomationTarget.builder().resourceId(resourceId).partIndex(0).build());
            }
        }
        return selected;
    }

    private Transaction toTransaction(SentRequest sent, ExecutedResponse response) {
        HttpUrl url = HttpUrl.parse(sent.getUrl());
        return Transaction.builder()
            .timestamp(response.getStartedAt())
            .method(sent.getMethod())
            .url(sent.getUrl())
            .host(url != null ? url.host() : profile.getTargetHost())
            .protocol(url != null ? url.scheme() : null)
            .requestHeaders(new LinkedHashMap<>(sent.getHeaders()))
            .requestBody(sent.getBody())
            .responseStatus(response.getStatus())
            .responseHeaders(new LinkedHashMap<>(response.getHeaders()))
            .responseBody(response.getBody())
            .duration(response.getDurationSec())
            .notes("Автоматизация")
            .build();
    }

    private static String snippet(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
