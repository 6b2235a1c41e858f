package com.xammer.orgtree.service;

import com.xammer.orgtree.domain.AccountFilter;
import com.xammer.orgtree.domain.ClassifiedAccount;
import com.xammer.orgtree.domain.RawAccount;
import org.springframework.stereotype.Component;

/**
 * Renders active accounts one per line as {@code NN,name,id,email}, numbered from 01 over the
 * lines actually printed.
 */
@Component
public class FlatRenderer {

    private final AccountClassifier accountClassifier;

    public FlatRenderer(AccountClassifier accountClassifier) {
        this.accountClassifier = accountClassifier;
    }

    public String render(Iterable<RawAccount> accounts, AccountFilter filter) {
        StringBuilder out = new StringBuilder();
        int counter = 0;
        for (ClassifiedAccount account : accountClassifier.classify(accounts)) {
            if (!filter.matches(account.getEnvironment())) {
                continue;
            }
            counter++;
            out.append(String.format("%02d,%s,%s,%s\n", counter,
                    account.getName(), nullToEmpty(account.getId()), nullToEmpty(account.getEmail())));
        }
        return out.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
