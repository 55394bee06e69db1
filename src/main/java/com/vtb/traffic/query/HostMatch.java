package com.vtb.traffic.query;

import java.util.Locale;

public enum HostMatch {
    EXACT,
    /** Хост совпадает или является поддоменом: {@code a.example} ⊃ {@code api.a.example} */
    SUFFIX;

    public boolean matches(String host, String pattern) {
        if (host == null || pattern == null) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        String p = normalize(pattern);
        if (this == EXACT) {
            return h.equals(p);
        }
        return h.equals(p) || h.endsWith("." + p);
    }

    static String normalize(String pattern) {
        String p = pattern.trim().toLowerCase(Locale.ROOT);
        while (p.startsWith(".")) {
            p = p.substring(1);
        }
        return p;
    }

    public static HostMatch parse(String value) {
        if (value == null) {
            return SUFFIX;
        }
        try {
            return HostMatch.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
