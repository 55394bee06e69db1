package com.vtb.traffic.query;

import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.store.TransactionStore;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ленивая конечная последовательность транзакций от новых к старым.
 *
 * <p>Страницы читаются по ключу id, поэтому добавления во время обхода не сдвигают
 * уже прочитанное. Каждый вызов {@link #iterator()} начинает обход заново.
 */
public class TransactionQuery implements Iterable<Transaction> {

    private final TransactionStore store;
    private final QueryCriteria criteria;
    private final int pageSize;
    private final long limit;

    TransactionQuery(TransactionStore store, QueryCriteria criteria, int pageSize, long limit) {
        this.store = store;
        this.criteria = criteria;
        this.pageSize = pageSize;
        this.limit = limit;
    }

    /**
     * Та же выборка, но не более {@code maxResults} транзакций
     */
    public TransactionQuery limit(long maxResults) {
        if (maxResults < 0) {
            throw new IllegalArgumentException("Лимит не может быть отрицательным: " + maxResults);
        }
        return new TransactionQuery(store, criteria, pageSize, maxResults);
    }

    public QueryCriteria getCriteria() {
        return criteria;
    }

    public List<Transaction> toList() {
        List<Transaction> result = new ArrayList<>();
        forEach(result::add);
        return result;
    }

    @Override
    public Iterator<Transaction> iterator() {
        return new PagingIterator();
    }

    private class PagingIterator implements Iterator<Transaction> {
        private List<Transaction> page = List.of();
        private int position;
        private long cursor = Long.MAX_VALUE;
        private long returned;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (limit >= 0 && returned >= limit) {
                return false;
            }
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            int size = pageSize;
            if (limit >= 0) {
                size = (int) Math.min(pageSize, limit - returned);
            }
            page = store.listBefore(criteria, cursor, size);
            position = 0;
            if (page.size() < size) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1).getId();
            }
            return !page.isEmpty();
        }

        @Override
        public Transaction next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            returned++;
            return page.get(position++);
        }
    }
}
