package com.vtb.traffic.models;

public enum FindingCategory {
    SECURITY("security"),
    PERFORMANCE("performance"),
    BEST_PRACTICE("best_practice");

    private final String code;

    FindingCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
