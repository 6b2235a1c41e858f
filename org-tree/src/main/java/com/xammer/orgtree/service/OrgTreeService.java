package com.xammer.orgtree.service;

import com.xammer.orgtree.domain.AccountFilter;
import com.xammer.orgtree.domain.OrganizationSummary;
import com.xammer.orgtree.exception.OrgTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;

/**
 * Entry points for the two display modes. Both return the complete text of the run; nothing is
 * produced when a remote call fails part way.
 */
@Service
public class OrgTreeService {

    private static final Logger logger = LoggerFactory.getLogger(OrgTreeService.class);

    private final TreeRenderer treeRenderer;
    private final FlatRenderer flatRenderer;

    public OrgTreeService(TreeRenderer treeRenderer, FlatRenderer flatRenderer) {
        this.treeRenderer = treeRenderer;
        this.flatRenderer = flatRenderer;
    }

    public OrganizationSummary describe(OrganizationsGateway gateway) {
        String organizationId = gateway.describeOrganization();
        Iterator<String> roots = gateway.listRoots().iterator();
        if (!roots.hasNext()) {
            throw new OrgTreeException("Organization " + organizationId + " has no root");
        }
        return new OrganizationSummary(organizationId, roots.next());
    }

    public String displayTree(OrganizationsGateway gateway, boolean ouOnly) {
        OrganizationSummary summary = describe(gateway);
        logger.info("Displaying organization {} from root {}{}", summary.getOrganizationId(),
                summary.getRootId(), ouOnly ? " (OUs only)" : "");
        return treeRenderer.render(gateway, summary, !ouOnly);
    }

    public String displayAccounts(OrganizationsGateway gateway, AccountFilter filter) {
        logger.info("Listing active accounts for environment {}", filter);
        return flatRenderer.render(gateway.listAccounts(), filter);
    }
}
