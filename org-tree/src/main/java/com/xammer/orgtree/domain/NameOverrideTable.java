package com.xammer.orgtree.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display names that replace the alias of accounts created with a wrong name, keyed by the
 * account's root email. Matching is exact.
 */
public final class NameOverrideTable {

    private static final NameOverrideTable EMPTY = new NameOverrideTable(Collections.emptyMap());

    private final Map<String, String> namesByEmail;

    public NameOverrideTable(Map<String, String> namesByEmail) {
        this.namesByEmail = Collections.unmodifiableMap(new LinkedHashMap<>(namesByEmail));
    }

    public static NameOverrideTable empty() {
        return EMPTY;
    }

    public RawAccount apply(RawAccount account) {
        if (account.getEmail() == null) {
            return account;
        }
        String replacement = namesByEmail.get(account.getEmail());
        if (replacement == null) {
            return account;
        }
        return account.toBuilder().name(replacement).build();
    }

    public int size() {
        return namesByEmail.size();
    }
}
