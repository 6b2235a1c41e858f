package com.xammer.orgtree.domain;

public enum Environment {
    PROD("PROD"),
    NON_PROD("NON-PROD");

    private final String label;

    Environment(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
