package com.xammer.orgtree.service;

import com.xammer.orgtree.domain.ClassifiedAccount;
import com.xammer.orgtree.domain.OrgNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collects the entries shown under one organizational unit.
 */
@Component
public class TreeBuilder {

    private final AccountClassifier accountClassifier;

    public TreeBuilder(AccountClassifier accountClassifier) {
        this.accountClassifier = accountClassifier;
    }

    /**
     * Returns the child OUs of {@code parentId} in provider order followed, when
     * {@code includeAccounts} is set, by its active accounts in ascending name order.
     * Accounts are not requested at all when {@code includeAccounts} is false.
     */
    public List<OrgNode> buildEntries(OrganizationsGateway gateway, String parentId, boolean includeAccounts) {
        List<OrgNode> entries = gateway.listOrganizationalUnitsForParent(parentId).toList();
        if (includeAccounts) {
            for (ClassifiedAccount account : accountClassifier.classify(gateway.listAccountsForParent(parentId))) {
                entries.add(account.toNode());
            }
        }
        return entries;
    }
}
