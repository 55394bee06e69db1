package com.vtb.traffic.errors;

/**
 * В трафике нет авторизованного запроса к целевому хосту.
 * Фатально для запуска автоматизации, но не для хранилища.
 */
public class NoSessionFoundException extends AutomationException {

    public NoSessionFoundException(String host) {
        super("Не найдено авторизованных запросов к " + host + " в перехваченном трафике");
    }
}
