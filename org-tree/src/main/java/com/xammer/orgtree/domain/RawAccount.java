package com.xammer.orgtree.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Account record as returned by the Organizations API, before any correction or filtering.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class RawAccount {

    public static final String STATUS_ACTIVE = "ACTIVE";

    private final String id;
    private final String name;
    private final String email;
    private final String status;

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }
}
