package com.xammer.orgtree.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class OrganizationSummary {

    private final String organizationId;
    private final String rootId;
}
