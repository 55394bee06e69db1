package com.vtb.traffic.query;

import com.vtb.traffic.errors.InvalidQueryException;
import com.vtb.traffic.errors.TransactionNotFoundException;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TrafficStatistics;
import com.vtb.traffic.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Выборки из хранилища с учетом области хостов.
 * Область задается один раз и применяется ко всем запросам движка.
 */
@Slf4j
public class QueryEngine {

    private static final int DEFAULT_PAGE_SIZE = 200;

    private final TransactionStore store;
    private final HostScope scope;
    private final int pageSize;

    public QueryEngine(TransactionStore store) {
        this(store, HostScope.unrestricted(), DEFAULT_PAGE_SIZE);
    }

    public QueryEngine(TransactionStore store, HostScope scope, int pageSize) {
        if (store == null) {
            throw new IllegalArgumentException("Хранилище не задано");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Размер страницы должен быть положительным: " + pageSize);
        }
        this.store = store;
        this.scope = scope != null ? scope : HostScope.unrestricted();
        this.pageSize = pageSize;
    }

    public HostScope getScope() {
        return scope;
    }

    public TransactionStore getStore() {
        return store;
    }

    /**
     * Ленивая выборка по критериям
     *
     * @throws com.vtb.traffic.errors.InvalidQueryException при несогласованных критериях
     */
    public TransactionQuery find(QueryCriteria criteria) {
        QueryCriteria scoped = scoped(criteria);
        scoped.validate();
        log.debug("Запрос: {}", scoped);
        return new TransactionQuery(store, scoped, pageSize, -1);
    }

    public TransactionQuery findAll() {
        return find(QueryCriteria.all());
    }

    /**
     * Первая страница выборки, от новых к старым
     */
    public List<Transaction> list(QueryCriteria criteria, int limit) {
        return find(criteria).limit(limit).toList();
    }

    public List<Transaction> recent(int limit) {
        return list(QueryCriteria.all(), limit);
    }

    /**
     * Поиск подстроки в url, телах и заголовках
     */
    public List<Transaction> search(String text, int limit) {
        if (text == null || text.isEmpty()) {
            throw new InvalidQueryException("Пустая строка поиска");
        }
        return list(QueryCriteria.builder().text(text).build(), limit);
    }

    public long count(QueryCriteria criteria) {
        QueryCriteria scoped = scoped(criteria);
        scoped.validate();
        return store.count(scoped);
    }

    public TrafficStatistics statistics(QueryCriteria criteria, double slowThresholdSec, int topHosts) {
        QueryCriteria scoped = scoped(criteria);
        scoped.validate();
        return store.statistics(scoped, slowThresholdSec, topHosts);
    }

    /**
     * Транзакция по id; вне области хостов считается несуществующей
     */
    public Transaction get(long id) {
        Transaction transaction = store.get(id);
        if (!scope.allows(transaction.getHost())) {
            throw new TransactionNotFoundException(id);
        }
        return transaction;
    }

    private QueryCriteria scoped(QueryCriteria criteria) {
        QueryCriteria base = criteria != null ? criteria : QueryCriteria.all();
        return scope.isRestricted() ? base.withScope(scope) : base;
    }
}
