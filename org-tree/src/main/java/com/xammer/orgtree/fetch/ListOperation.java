package com.xammer.orgtree.fetch;

/**
 * Paged list calls of the Organizations API that the traversal depends on.
 */
public enum ListOperation {
    LIST_ROOTS("ListRoots"),
    LIST_ORGANIZATIONAL_UNITS_FOR_PARENT("ListOrganizationalUnitsForParent"),
    LIST_ACCOUNTS_FOR_PARENT("ListAccountsForParent"),
    LIST_ACCOUNTS("ListAccounts");

    private final String apiName;

    ListOperation(String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }
}
