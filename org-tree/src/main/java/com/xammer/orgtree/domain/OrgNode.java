package com.xammer.orgtree.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry of an organization tree level: either an organizational unit or an account leaf.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrgNode {

    private final NodeType type;
    private final String id;
    private final String name;

    public static OrgNode ou(String id, String name) {
        return new OrgNode(NodeType.OU, id, name);
    }

    public static OrgNode account(String id, String name) {
        return new OrgNode(NodeType.ACCOUNT, id, name);
    }

    public boolean isOrganizationalUnit() {
        return type == NodeType.OU;
    }
}
