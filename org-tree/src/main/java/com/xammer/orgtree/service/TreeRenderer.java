package com.xammer.orgtree.service;

import com.xammer.orgtree.config.OrgTreeProperties;
import com.xammer.orgtree.domain.OrgNode;
import com.xammer.orgtree.domain.OrganizationSummary;
import com.xammer.orgtree.exception.OrgTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders an organization as an indented tree, depth first.
 * <p>
 * Each level's entries are visited from the end of the list built by {@link TreeBuilder}: accounts
 * in descending name order first, then child OUs in reverse provider order. An entry is drawn
 * with {@link #ELBOW} when no entry is left to visit after it, with {@link #TEE} otherwise.
 */
@Component
public class TreeRenderer {

    private static final Logger logger = LoggerFactory.getLogger(TreeRenderer.class);

    public static final String ELBOW = "└── ";
    public static final String TEE = "├── ";
    public static final String PIPE = "│   ";
    public static final String SPACE = "    ";

    private static final String NEWLINE = "\n";

    private final TreeBuilder treeBuilder;
    private final int maxDepth;

    @Autowired
    public TreeRenderer(TreeBuilder treeBuilder, OrgTreeProperties properties) {
        this(treeBuilder, properties.getTree().getMaxDepth());
    }

    public TreeRenderer(TreeBuilder treeBuilder, int maxDepth) {
        this.treeBuilder = treeBuilder;
        this.maxDepth = maxDepth;
    }

    public String render(OrganizationsGateway gateway, OrganizationSummary summary, boolean includeAccounts) {
        StringBuilder out = new StringBuilder();
        appendHeader(out, summary);
        int nodes = renderLevel(gateway, summary.getRootId(), "", includeAccounts, 1, out);
        logger.info("Rendered {} node(s) under root {}", nodes, summary.getRootId());
        return out.toString();
    }

    void appendHeader(StringBuilder out, OrganizationSummary summary) {
        out.append(NEWLINE)
                .append("Organization ID: ").append(summary.getOrganizationId()).append(NEWLINE)
                .append(NEWLINE)
                .append("/ Root OU [ Id: ").append(summary.getRootId()).append(" ]").append(NEWLINE)
                .append(PIPE).append(NEWLINE);
    }

    private int renderLevel(OrganizationsGateway gateway, String parentId, String prefix,
                            boolean includeAccounts, int depth, StringBuilder out) {
        if (depth > maxDepth) {
            throw new OrgTreeException(String.format(
                    "Organization nesting below %s exceeds the maximum depth of %d", parentId, maxDepth));
        }
        List<OrgNode> entries = treeBuilder.buildEntries(gateway, parentId, includeAccounts);
        int rendered = 0;

        for (int i = entries.size() - 1; i >= 0; i--) {
            OrgNode entry = entries.get(i);
            boolean lastSibling = i == 0;
            String fork = lastSibling ? ELBOW : TEE;

            if (entry.isOrganizationalUnit()) {
                out.append(prefix).append(PIPE).append(NEWLINE);
            }
            out.append(prefix).append(fork)
                    .append("< ").append(nullToEmpty(entry.getId())).append(" > | ")
                    .append(nullToEmpty(entry.getName()))
                    .append(NEWLINE);
            rendered++;

            if (entry.isOrganizationalUnit()) {
                String childPrefix = prefix + (lastSibling ? SPACE : PIPE);
                rendered += renderLevel(gateway, entry.getId(), childPrefix, includeAccounts, depth + 1, out);
            }
        }
        return rendered;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
