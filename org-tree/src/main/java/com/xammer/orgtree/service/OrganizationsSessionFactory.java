package com.xammer.orgtree.service;

import com.xammer.orgtree.exception.OrgSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * Opens an Organizations session for one run. Credentials are resolved eagerly so that an
 * unknown profile or missing credentials fail before any traversal starts.
 */
@Service
public class OrganizationsSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(OrganizationsSessionFactory.class);

    static final String DEFAULT_CHAIN = "<default chain>";

    public OrganizationsGateway openSession(String profile, String region, boolean useDefaultChain) {
        String credentialsSource = useDefaultChain ? DEFAULT_CHAIN : profile;
        logger.info("Opening Organizations session with profile {} in region {}", credentialsSource, region);

        AwsCredentialsProvider credentialsProvider = null;
        try {
            credentialsProvider = getCredentialsProvider(profile, useDefaultChain);
            credentialsProvider.resolveCredentials();

            OrganizationsClient client = OrganizationsClient.builder()
                    .region(Region.of(region))
                    .credentialsProvider(credentialsProvider)
                    .overrideConfiguration(c -> c.retryPolicy(RetryPolicy.none()))
                    .build();
            return new AwsOrganizationsGateway(client, credentialsProvider);
        } catch (SdkException | IllegalArgumentException e) {
            logger.debug("Failed to open Organizations session for profile {} in region {}: {}",
                    credentialsSource, region, e.getMessage());
            closeQuietly(credentialsProvider);
            throw new OrgSessionException(credentialsSource, region, e);
        }
    }

    private AwsCredentialsProvider getCredentialsProvider(String profile, boolean useDefaultChain) {
        if (useDefaultChain) {
            // create() hands out a shared instance; this one is owned and closed by the gateway
            return DefaultCredentialsProvider.builder().build();
        }
        return ProfileCredentialsProvider.create(profile);
    }

    /**
     * Closes providers that hold resources of their own, such as the STS client behind a
     * {@code role_arn} profile.
     */
    static void closeQuietly(AwsCredentialsProvider credentialsProvider) {
        if (credentialsProvider instanceof SdkAutoCloseable) {
            try {
                ((SdkAutoCloseable) credentialsProvider).close();
            } catch (RuntimeException e) {
                logger.debug("Closing credentials provider failed: {}", e.getMessage());
            }
        }
    }
}
