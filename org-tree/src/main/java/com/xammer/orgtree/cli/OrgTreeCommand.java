package com.xammer.orgtree.cli;

import com.xammer.orgtree.config.OrgTreeProperties;
import com.xammer.orgtree.domain.AccountFilter;
import com.xammer.orgtree.service.OrganizationsGateway;
import com.xammer.orgtree.service.OrganizationsSessionFactory;
import com.xammer.orgtree.service.OrgTreeService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Component
@CommandLine.Command(
        name = "org-tree",
        mixinStandardHelpOptions = true,
        version = "org-tree 1.0.0",
        description = "Display AWS Organization tree and/or AWS Accounts. Only active accounts will be displayed.",
        exitCodeOnInvalidInput = ExitCodes.USAGE,
        sortOptions = false
)
public class OrgTreeCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--ou_only", negatable = true, defaultValue = "false",
            description = "Display Organization Units (OUs) only. Default: ${DEFAULT-VALUE}")
    private boolean ouOnly;

    @CommandLine.Option(names = "--account_only", negatable = true, defaultValue = "false",
            description = "Display AWS Accounts list. Default: ${DEFAULT-VALUE}")
    private boolean accountOnly;

    @CommandLine.Option(names = {"-p", "--profile"},
            description = "AWS cli profile name of your root Organization account from ~/.aws/config. "
                    + "Default: orgtree.aws.profile (default)")
    private String profile;

    @CommandLine.Option(names = {"-r", "--region"},
            description = "AWS Region. Default: orgtree.aws.region (ap-southeast-2)")
    private String region;

    @CommandLine.Option(names = {"-e", "--environment"}, defaultValue = "ALL",
            converter = AccountFilterConverter.class,
            description = "Display AWS Accounts by environment type in your own name convention: "
                    + "ALL, PROD or NON-PROD. Default: ${DEFAULT-VALUE}")
    private AccountFilter environment;

    @CommandLine.Option(names = "--default-credentials",
            description = "Ignore the profile and use the default AWS credential chain "
                    + "(environment variables, container or instance role).")
    private boolean defaultCredentials;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final OrganizationsSessionFactory sessionFactory;
    private final OrgTreeService orgTreeService;
    private final OrgTreeProperties properties;

    public OrgTreeCommand(OrganizationsSessionFactory sessionFactory, OrgTreeService orgTreeService,
                          OrgTreeProperties properties) {
        this.sessionFactory = sessionFactory;
        this.orgTreeService = orgTreeService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        String resolvedProfile = profile != null ? profile : properties.getAws().getProfile();
        String resolvedRegion = region != null ? region : properties.getAws().getRegion();

        String output;
        try (OrganizationsGateway gateway = sessionFactory.openSession(resolvedProfile, resolvedRegion, defaultCredentials)) {
            if (accountOnly) {
                output = orgTreeService.displayAccounts(gateway, environment);
            } else {
                output = orgTreeService.displayTree(gateway, ouOnly);
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        out.print(output);
        out.flush();
        return ExitCodes.OK;
    }
}
