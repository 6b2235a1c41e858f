package com.xammer.orgtree.domain;

public enum NodeType {
    OU,
    ACCOUNT
}
