package com.xammer.orgtree.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ClassifiedAccount {

    private final String id;
    private final String name;
    private final String email;
    private final Environment environment;

    public OrgNode toNode() {
        return OrgNode.account(id, name);
    }
}
