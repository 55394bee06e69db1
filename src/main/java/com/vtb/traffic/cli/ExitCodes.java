package com.vtb.traffic.cli;

import com.vtb.traffic.errors.InvalidQueryException;
import com.vtb.traffic.errors.TransactionNotFoundException;
import com.vtb.traffic.errors.ValidationException;
import picocli.CommandLine;

/**
 * Коды завершения CLI
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** Ошибка использования, валидации, запроса или отсутствующая транзакция */
    public static final int USAGE = 1;
    /** Ошибка выполнения: сеть, хранилище, автоматизация */
    public static final int RUNTIME = 2;

    private ExitCodes() {
    }

    public static int forException(Throwable error) {
        if (error instanceof ValidationException
            || error instanceof InvalidQueryException
            || error instanceof TransactionNotFoundException
            || error instanceof CommandLine.ParameterException
            || error instanceof IllegalArgumentException) {
            return USAGE;
        }
        return RUNTIME;
    }
}
