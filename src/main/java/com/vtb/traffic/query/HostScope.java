package com.vtb.traffic.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ограничение области по семейству хостов (суффиксы доменов).
 * Один экземпляр разделяется запросами, анализатором, экспортом и автоматизацией.
 */
public final class HostScope {

    private static final HostScope UNRESTRICTED = new HostScope(List.of());

    private final List<String> suffixes;

    private HostScope(List<String> suffixes) {
        this.suffixes = suffixes;
    }

    public static HostScope unrestricted() {
        return UNRESTRICTED;
    }

    public static HostScope of(List<String> suffixes) {
        if (suffixes == null || suffixes.isEmpty()) {
            return UNRESTRICTED;
        }
        List<String> normalized = new ArrayList<>();
        for (String suffix : suffixes) {
            if (suffix == null || suffix.isBlank()) {
                continue;
            }
            String value = HostMatch.normalize(suffix);
            if (!value.isEmpty() && !normalized.contains(value)) {
                normalized.add(value);
            }
        }
        return normalized.isEmpty() ? UNRESTRICTED : new HostScope(Collections.unmodifiableList(normalized));
    }

    public boolean isRestricted() {
        return !suffixes.isEmpty();
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public boolean allows(String host) {
        if (!isRestricted()) {
            return true;
        }
        for (String suffix : suffixes) {
            if (HostMatch.SUFFIX.matches(host, suffix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HostScope)) return false;
        return suffixes.equals(((HostScope) o).suffixes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(suffixes);
    }

    @Override
    public String toString() {
        return isRestricted() ? "HostScope" + suffixes : "HostScope[*]";
    }
}
