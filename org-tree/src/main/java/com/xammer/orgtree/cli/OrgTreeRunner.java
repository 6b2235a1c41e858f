package com.xammer.orgtree.cli;

import com.xammer.orgtree.exception.OrgTreeExceptionHandler;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Runs the picocli command with the process arguments and keeps its exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class OrgTreeRunner implements CommandLineRunner, ExitCodeGenerator {

    private final OrgTreeCommand command;
    private final OrgTreeExceptionHandler exceptionHandler;
    private int exitCode;

    public OrgTreeRunner(OrgTreeCommand command, OrgTreeExceptionHandler exceptionHandler) {
        this.command = command;
        this.exceptionHandler = exceptionHandler;
    }

    @Override
    public void run(String... args) {
        exitCode = newCommandLine().execute(args);
    }

    /**
     * Tree glyphs are written as UTF-8 whatever the platform default charset is.
     */
    CommandLine newCommandLine() {
        return new CommandLine(command)
                .setExecutionExceptionHandler(exceptionHandler)
                .setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true))
                .setErr(new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
