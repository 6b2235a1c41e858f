package com.xammer.orgtree.exception;

/**
 * Raised when no usable AWS session can be built from the requested profile and region.
 */
public class OrgSessionException extends OrgTreeException {

    private final String profile;
    private final String region;

    public OrgSessionException(String profile, String region, Throwable cause) {
        super(String.format("AWS session for profile '%s' in region '%s' failed: %s",
                profile, region, cause.getMessage()), cause);
        this.profile = profile;
        this.region = region;
    }

    public String getProfile() {
        return profile;
    }

    public String getRegion() {
        return region;
    }
}
