package com.vtb.traffic.store;

import com.vtb.traffic.query.QueryCriteria;
import org.sqlite.Function;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * SQL-функция {@code contains_text(haystack, needle)}: 1, если подстрока найдена без учета регистра.
 * Встроенный LIKE в SQLite игнорирует регистр только для ASCII.
 */
final class ContainsTextFunction extends Function {

    static final String NAME = "contains_text";

    static void register(Connection connection) throws SQLException {
        Function.create(connection, NAME, new ContainsTextFunction());
    }

    @Override
    protected void xFunc() throws SQLException {
        if (args() != 2) {
            throw new SQLException(NAME + " ожидает 2 аргумента, получено " + args());
        }
        result(QueryCriteria.containsIgnoreCase(value_text(0), value_text(1)) ? 1 : 0);
    }
}
