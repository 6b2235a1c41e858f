package com.xammer.orgtree.service;

import com.xammer.orgtree.domain.OrgNode;
import com.xammer.orgtree.domain.RawAccount;
import com.xammer.orgtree.exception.OrgProviderException;
import com.xammer.orgtree.fetch.ListOperation;
import com.xammer.orgtree.fetch.Page;
import com.xammer.orgtree.fetch.PagedSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.utils.SdkAutoCloseable;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Account;
import software.amazon.awssdk.services.organizations.model.ListAccountsForParentRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsForParentResponse;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsResponse;
import software.amazon.awssdk.services.organizations.model.ListOrganizationalUnitsForParentRequest;
import software.amazon.awssdk.services.organizations.model.ListOrganizationalUnitsForParentResponse;
import software.amazon.awssdk.services.organizations.model.ListRootsRequest;
import software.amazon.awssdk.services.organizations.model.ListRootsResponse;
import software.amazon.awssdk.services.organizations.model.Root;

import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link OrganizationsGateway} backed by the AWS SDK v2 Organizations client. Owns the client and
 * its credentials provider and closes both with the gateway.
 */
public class AwsOrganizationsGateway implements OrganizationsGateway {

    private static final Logger logger = LoggerFactory.getLogger(AwsOrganizationsGateway.class);

    private final OrganizationsClient organizationsClient;
    private final AwsCredentialsProvider credentialsProvider;

    public AwsOrganizationsGateway(OrganizationsClient organizationsClient, AwsCredentialsProvider credentialsProvider) {
        this.organizationsClient = organizationsClient;
        this.credentialsProvider = credentialsProvider;
    }

    @Override
    public String describeOrganization() {
        return call("DescribeOrganization", null,
                () -> organizationsClient.describeOrganization().organization().id());
    }

    @Override
    public PagedSequence<String> listRoots() {
        ListOperation operation = ListOperation.LIST_ROOTS;
        return new PagedSequence<>(operation, null, nextToken -> {
            ListRootsResponse response = call(operation.getApiName(), null,
                    () -> organizationsClient.listRoots(ListRootsRequest.builder()
                            .nextToken(nextToken)
                            .build()));
            return Page.of(response.roots().stream().map(Root::id).collect(Collectors.toList()),
                    response.nextToken());
        });
    }

    @Override
    public PagedSequence<OrgNode> listOrganizationalUnitsForParent(String parentId) {
        ListOperation operation = ListOperation.LIST_ORGANIZATIONAL_UNITS_FOR_PARENT;
        return new PagedSequence<>(operation, parentId, nextToken -> {
            ListOrganizationalUnitsForParentResponse response = call(operation.getApiName(), parentId,
                    () -> organizationsClient.listOrganizationalUnitsForParent(
                            ListOrganizationalUnitsForParentRequest.builder()
                                    .parentId(parentId)
                                    .nextToken(nextToken)
                                    .build()));
            return Page.of(response.organizationalUnits().stream()
                            .map(ou -> OrgNode.ou(ou.id(), ou.name()))
                            .collect(Collectors.toList()),
                    response.nextToken());
        });
    }

    @Override
    public PagedSequence<RawAccount> listAccountsForParent(String parentId) {
        ListOperation operation = ListOperation.LIST_ACCOUNTS_FOR_PARENT;
        return new PagedSequence<>(operation, parentId, nextToken -> {
            ListAccountsForParentResponse response = call(operation.getApiName(), parentId,
                    () -> organizationsClient.listAccountsForParent(ListAccountsForParentRequest.builder()
                            .parentId(parentId)
                            .nextToken(nextToken)
                            .build()));
            return Page.of(response.accounts().stream()
                            .map(AwsOrganizationsGateway::toRawAccount)
                            .collect(Collectors.toList()),
                    response.nextToken());
        });
    }

    @Override
    public PagedSequence<RawAccount> listAccounts() {
        ListOperation operation = ListOperation.LIST_ACCOUNTS;
        return new PagedSequence<>(operation, null, nextToken -> {
            ListAccountsResponse response = call(operation.getApiName(), null,
                    () -> organizationsClient.listAccounts(ListAccountsRequest.builder()
                            .nextToken(nextToken)
                            .build()));
            return Page.of(response.accounts().stream()
                            .map(AwsOrganizationsGateway::toRawAccount)
                            .collect(Collectors.toList()),
                    response.nextToken());
        });
    }

    @Override
    public void close() {
        try {
            organizationsClient.close();
        } finally {
            OrganizationsSessionFactory.closeQuietly(credentialsProvider);
        }
    }

    static RawAccount toRawAccount(Account account) {
        return RawAccount.builder()
                .id(account.id())
                .name(account.name())
                .email(account.email())
                .status(account.statusAsString())
                .build();
    }

    private <T> T call(String operation, String scope, Supplier<T> request) {
        logger.debug("Calling {} for {}", operation, scope == null ? "organization" : scope);
        try {
            return request.get();
        } catch (SdkException e) {
            logger.debug("{} failed for {}: {}", operation, scope == null ? "organization" : scope, e.getMessage());
            throw new OrgProviderException(operation, scope, e);
        }
    }
}
