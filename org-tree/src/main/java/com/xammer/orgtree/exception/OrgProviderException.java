package com.xammer.orgtree.exception;

/**
 * A remote Organizations call failed. Carries the API operation and the id it was scoped to,
 * or {@code null} for organization-wide calls.
 */
public class OrgProviderException extends OrgTreeException {

    private final String operation;
    private final String scope;

    public OrgProviderException(String operation, String scope, Throwable cause) {
        super(scope == null
                ? String.format("%s failed: %s", operation, cause.getMessage())
                : String.format("%s for %s failed: %s", operation, scope, cause.getMessage()), cause);
        this.operation = operation;
        this.scope = scope;
    }

    public String getOperation() {
        return operation;
    }

    public String getScope() {
        return scope;
    }
}
