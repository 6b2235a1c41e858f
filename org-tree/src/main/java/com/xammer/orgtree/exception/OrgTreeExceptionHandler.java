package com.xammer.orgtree.exception;

import com.xammer.orgtree.cli.ExitCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Single place where a failed run is reported and turned into a process exit code.
 */
@Component
public class OrgTreeExceptionHandler implements CommandLine.IExecutionExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(OrgTreeExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        int exitCode = exitCodeFor(ex);
        logger.debug("Run failed with exit code {}", exitCode, ex);

        if (ex instanceof OrgSessionException) {
            commandLine.getErr().println("ERROR | AWS session failed with error message below:\n " + ex.getMessage());
        } else {
            commandLine.getErr().println("ERROR | " + ex.getMessage());
        }
        commandLine.getErr().flush();
        return exitCode;
    }

    public int exitCodeFor(Throwable ex) {
        if (ex instanceof OrgSessionException) {
            return ExitCodes.SESSION_ERROR;
        }
        if (ex instanceof OrgProviderException) {
            return ExitCodes.PROVIDER_ERROR;
        }
        return ExitCodes.FAILURE;
    }
}
