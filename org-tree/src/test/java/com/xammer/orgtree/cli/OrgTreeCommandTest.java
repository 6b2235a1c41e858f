package com.xammer.orgtree.cli;

import com.xammer.orgtree.config.OrgTreeProperties;
import com.xammer.orgtree.exception.OrgProviderException;
import com.xammer.orgtree.exception.OrgSessionException;
import com.xammer.orgtree.exception.OrgTreeExceptionHandler;
import com.xammer.orgtree.fetch.ListOperation;
import com.xammer.orgtree.service.AccountClassifier;
import com.xammer.orgtree.service.FlatRenderer;
import com.xammer.orgtree.service.InMemoryOrganizationsGateway;
import com.xammer.orgtree.service.OrgTreeService;
import com.xammer.orgtree.service.OrganizationsSessionFactory;
import com.xammer.orgtree.service.TreeBuilder;
import com.xammer.orgtree.service.TreeRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrgTreeCommandTest {

    @Mock
    private OrganizationsSessionFactory sessionFactory;

    private InMemoryOrganizationsGateway gateway;
    private CommandLine commandLine;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        OrgTreeProperties properties = new OrgTreeProperties();
        AccountClassifier classifier = new AccountClassifier(properties);
        OrgTreeService service = new OrgTreeService(
                new TreeRenderer(new TreeBuilder(classifier), properties), new FlatRenderer(classifier));

        gateway = new InMemoryOrganizationsGateway("o-exampleorg", "r-0000", 2)
                .addOu("r-0000", "ou-1111", "Sandbox")
                .addActiveAccount("r-0000", "111111111111", "Alpha")
                .addActiveAccount("r-0000", "222222222222", "Zeta-non-prod");

        commandLine = new OrgTreeRunner(new OrgTreeCommand(sessionFactory, service, properties),
                new OrgTreeExceptionHandler()).newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void printsTreeWithConfiguredSessionDefaults() {
        when(sessionFactory.openSession("default", "ap-southeast-2", false)).thenReturn(gateway);

        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).isEqualTo("\n"
                + "Organization ID: o-exampleorg\n"
                + "\n"
                + "/ Root OU [ Id: r-0000 ]\n"
                + "│   \n"
                + "├── < 222222222222 > | Zeta-non-prod\n"
                + "├── < 111111111111 > | Alpha\n"
                + "│   \n"
                + "└── < ou-1111 > | Sandbox\n");
        assertThat(gateway.isClosed()).isTrue();
    }

    @Test
    void ouOnlyLeavesAccountsOut() {
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean())).thenReturn(gateway);

        int exitCode = commandLine.execute("--ou_only");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).doesNotContain("Alpha").endsWith("└── < ou-1111 > | Sandbox\n");
    }

    @Test
    void negatedOuOnlyKeepsAccounts() {
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean())).thenReturn(gateway);

        commandLine.execute("--no-ou_only");

        assertThat(out.toString()).contains("< 111111111111 > | Alpha");
    }

    @Test
    void accountOnlyFiltersEnvironmentIgnoringCase() {
        when(sessionFactory.openSession("mgmt", "us-east-1", false)).thenReturn(gateway);

        int exitCode = commandLine.execute("--account_only", "-e", "non-prod", "-p", "mgmt", "-r", "us-east-1");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).isEqualTo("01,Zeta-non-prod,222222222222,zeta-non-prod@example.com\n");
    }

    @Test
    void accountOnlyWinsOverOuOnly() {
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean())).thenReturn(gateway);

        commandLine.execute("--ou_only", "--account_only");

        assertThat(out.toString()).isEqualTo("01,Alpha,111111111111,alpha@example.com\n"
                + "02,Zeta-non-prod,222222222222,zeta-non-prod@example.com\n");
    }

    @Test
    void defaultCredentialsFlagIsPassedToSessionFactory() {
        when(sessionFactory.openSession("default", "ap-southeast-2", true)).thenReturn(gateway);

        assertThat(commandLine.execute("--default-credentials", "--account_only")).isEqualTo(ExitCodes.OK);
        verify(sessionFactory).openSession("default", "ap-southeast-2", true);
    }

    @Test
    void sessionFailureExitsWithSessionCode() {
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean()))
                .thenThrow(new OrgSessionException("missing", "ap-southeast-2",
                        SdkClientException.create("Profile file contained no credentials for profile 'missing'")));

        int exitCode = commandLine.execute("-p", "missing");

        assertThat(exitCode).isEqualTo(ExitCodes.SESSION_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
                .startsWith("ERROR | AWS session failed with error message below:")
                .contains("profile 'missing'");
    }

    @Test
    void providerFailurePrintsNothingAndExitsWithProviderCode() {
        gateway.failOn(ListOperation.LIST_ACCOUNTS_FOR_PARENT, "ou-1111");
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean())).thenReturn(gateway);

        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(ExitCodes.PROVIDER_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("ERROR | ListAccountsForParent for ou-1111 failed");
        assertThat(gateway.isClosed()).isTrue();
    }

    @Test
    void structuralFailureExitsWithGenericCode() {
        InMemoryOrganizationsGateway rootless = new InMemoryOrganizationsGateway("o-exampleorg", null, 1);
        when(sessionFactory.openSession(anyString(), anyString(), anyBoolean())).thenReturn(rootless);

        assertThat(commandLine.execute()).isEqualTo(ExitCodes.FAILURE);
        assertThat(err.toString()).contains("has no root");
    }

    @Test
    void unknownEnvironmentIsUsageError() {
        int exitCode = commandLine.execute("--account_only", "-e", "STAGING");

        assertThat(exitCode).isEqualTo(ExitCodes.USAGE);
        assertThat(err.toString()).contains("Invalid environment 'STAGING'");
        verifyNoInteractions(sessionFactory);
    }

    @Test
    void helpListsOptions() {
        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString())
                .contains("--[no-]ou_only")
                .contains("--[no-]account_only")
                .contains("--environment");
        verifyNoInteractions(sessionFactory);
    }
}
