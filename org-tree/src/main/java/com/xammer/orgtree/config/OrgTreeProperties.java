package com.xammer.orgtree.config;

import com.xammer.orgtree.domain.NameOverrideTable;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "orgtree")
public class OrgTreeProperties {

    private static final Logger logger = LoggerFactory.getLogger(OrgTreeProperties.class);

    private Aws aws = new Aws();
    private Classification classification = new Classification();
    private Tree tree = new Tree();

    /**
     * Builds the override table from the configured entries. A later entry for the same email
     * replaces an earlier one.
     */
    public NameOverrideTable nameOverrideTable() {
        Map<String, String> namesByEmail = new LinkedHashMap<>();
        for (NameOverride override : classification.getNameOverrides()) {
            String previous = namesByEmail.put(override.getEmail(), override.getName());
            if (previous != null) {
                logger.warn("Duplicate name override for {}: '{}' replaces '{}'",
                        override.getEmail(), override.getName(), previous);
            }
        }
        return new NameOverrideTable(namesByEmail);
    }

    @Data
    public static class Aws {
        /** Profile from ~/.aws/config of the Organization management account. */
        private String profile = "default";
        private String region = "ap-southeast-2";
    }

    @Data
    public static class Classification {
        /** Account names containing this marker are tagged NON-PROD. */
        private String nonProdMarker = "-non-prod";
        private List<NameOverride> nameOverrides = new ArrayList<>();
    }

    @Data
    public static class Tree {
        private int maxDepth = 64;
    }

    @Data
    @NoArgsConstructor
    public static class NameOverride {
        private String email;
        private String name;

        public NameOverride(String email, String name) {
            this.email = email;
            this.name = name;
        }
    }
}
