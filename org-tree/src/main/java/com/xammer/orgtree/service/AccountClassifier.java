package com.xammer.orgtree.service;

import com.xammer.orgtree.config.OrgTreeProperties;
import com.xammer.orgtree.domain.ClassifiedAccount;
import com.xammer.orgtree.domain.Environment;
import com.xammer.orgtree.domain.NameOverrideTable;
import com.xammer.orgtree.domain.RawAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw account records into the active, environment-tagged, name-sorted accounts shown to
 * the user. Name overrides are applied before the status filter and before sorting.
 */
@Component
public class AccountClassifier {

    private static final Logger logger = LoggerFactory.getLogger(AccountClassifier.class);

    private static final Comparator<ClassifiedAccount> BY_NAME = Comparator.comparing(ClassifiedAccount::getName);

    private final NameOverrideTable nameOverrides;
    private final String nonProdMarker;

    @Autowired
    public AccountClassifier(OrgTreeProperties properties) {
        this(properties.nameOverrideTable(), properties.getClassification().getNonProdMarker());
    }

    public AccountClassifier(NameOverrideTable nameOverrides, String nonProdMarker) {
        this.nameOverrides = nameOverrides;
        this.nonProdMarker = nonProdMarker;
        logger.debug("Account classifier configured with {} name override(s), non-prod marker '{}'",
                nameOverrides.size(), nonProdMarker);
    }

    public List<ClassifiedAccount> classify(Iterable<RawAccount> accounts) {
        List<ClassifiedAccount> active = new ArrayList<>();
        int dropped = 0;
        for (RawAccount raw : accounts) {
            RawAccount corrected = nameOverrides.apply(raw);
            if (!corrected.isActive()) {
                dropped++;
                continue;
            }
            String name = corrected.getName() == null ? "" : corrected.getName();
            active.add(new ClassifiedAccount(corrected.getId(), name, corrected.getEmail(), environmentOf(name)));
        }
        // List.sort is stable: equal names keep provider order.
        active.sort(BY_NAME);
        if (dropped > 0) {
            logger.debug("Skipped {} account(s) that are not {}", dropped, RawAccount.STATUS_ACTIVE);
        }
        return active;
    }

    public Environment environmentOf(String accountName) {
        return accountName.contains(nonProdMarker) ? Environment.NON_PROD : Environment.PROD;
    }
}
