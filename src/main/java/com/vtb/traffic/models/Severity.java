package com.vtb.traffic.models;

/**
 * Уровни критичности находок. Порядок объявления задает порядок: INFO &lt; WARNING &lt; HIGH.
 */
public enum Severity {
    INFO("Информационный", 1),
    WARNING("Предупреждение", 3),
    HIGH("Высокий", 10);

    private final String russianName;
    private final int weight;

    Severity(String russianName, int weight) {
        this.russianName = russianName;
        this.weight = weight;
    }

    public String getRussianName() {
        return russianName;
    }

    /**
     * Вес для ранжирования транзакций в сводке сессии
     */
    public int getWeight() {
        return weight;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
