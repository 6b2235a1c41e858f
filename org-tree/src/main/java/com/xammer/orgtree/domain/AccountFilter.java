package com.xammer.orgtree.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Environment selection for the flat account listing.
 */
public enum AccountFilter {
    ALL(null),
    PROD(Environment.PROD),
    NON_PROD(Environment.NON_PROD);

    private final String label;
    private final Environment environment;

    AccountFilter(Environment environment) {
        this.label = environment == null ? "ALL" : environment.getLabel();
        this.environment = environment;
    }

    public String getLabel() {
        return label;
    }

    public boolean matches(Environment candidate) {
        return environment == null || environment == candidate;
    }

    /**
     * Resolves a filter from its label, ignoring case.
     *
     * @throws IllegalArgumentException if the label names no filter
     */
    public static AccountFilter fromLabel(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid environment '" + value + "', expected one of " + labels()));
    }

    public static String labels() {
        return Arrays.stream(values()).map(AccountFilter::getLabel).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return label;
    }
}
