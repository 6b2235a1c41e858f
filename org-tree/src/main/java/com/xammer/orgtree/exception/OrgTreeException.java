package com.xammer.orgtree.exception;

/**
 * Base type for failures that abort an organization tree or account listing run.
 */
public class OrgTreeException extends RuntimeException {

    public OrgTreeException(String message) {
        super(message);
    }

    public OrgTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
