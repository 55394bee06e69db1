package com.vtb.traffic.store;

import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TrafficStatistics;
import com.vtb.traffic.query.QueryCriteria;

import java.util.List;

/**
 * Долговременное хранилище перехваченных транзакций.
 *
 * <p>Запись сериализуется между собой; чтение не ждет выполняющейся записи.
 * Экземпляр передается компонентам явно и закрывается владельцем.
 */
public interface TransactionStore extends AutoCloseable {

    /**
     * Добавить транзакцию
     *
     * @return назначенный id (строго возрастает, не переиспользуется)
     * @throws com.vtb.traffic.errors.ValidationException если нет method, url или host
     */
    long append(Transaction transaction);

    /**
     * @throws com.vtb.traffic.errors.TransactionNotFoundException если id не существует
     */
    Transaction get(long id);

    /**
     * Транзакции по критериям, от новых к старым (в порядке, обратном добавлению)
     */
    List<Transaction> list(QueryCriteria criteria, int limit, int offset);

    /**
     * Страница транзакций с id строго меньше {@code beforeId}, от новых к старым
     */
    List<Transaction> listBefore(QueryCriteria criteria, long beforeId, int limit);

    long count(QueryCriteria criteria);

    TrafficStatistics statistics(QueryCriteria criteria, double slowThresholdSec, int topHosts);

    void updateNotes(long id, String notes);

    void markAnalyzed(long id);

    /**
     * Удалить все транзакции одной операцией (все или ничего)
     *
     * @return количество удаленных записей
     */
    int clear();

    @Override
    void close();
}
