package com.entitygen;

import com.entitygen.cli.GenerateCommand;
import com.entitygen.cli.IntrospectCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "entitygen",
        description = "Generate JPA entity classes from a database's INFORMATION_SCHEMA",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                GenerateCommand.class,
                IntrospectCommand.class
        }
)
public class EntitygenCli implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_TABLE_FAILURES = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_CATALOG = 3;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new EntitygenCli());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
