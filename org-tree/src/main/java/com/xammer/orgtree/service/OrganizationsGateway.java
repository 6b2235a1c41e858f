package com.xammer.orgtree.service;

import com.xammer.orgtree.domain.OrgNode;
import com.xammer.orgtree.domain.RawAccount;
import com.xammer.orgtree.fetch.PagedSequence;

/**
 * Read-only view of an AWS Organization. Each list call returns a fresh, lazily paged sequence;
 * failures surface while the sequence is iterated.
 */
public interface OrganizationsGateway extends AutoCloseable {

    String describeOrganization();

    PagedSequence<String> listRoots();

    PagedSequence<OrgNode> listOrganizationalUnitsForParent(String parentId);

    PagedSequence<RawAccount> listAccountsForParent(String parentId);

    PagedSequence<RawAccount> listAccounts();

    @Override
    default void close() {
    }
}
