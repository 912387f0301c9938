package com.clinical.phenotype.cli;

import picocli.CommandLine;

/**
 * Command line entry point: {@code phenotype validate <script>} and
 * {@code phenotype run <script> --documents <fixture.json>}.
 */
@CommandLine.Command(
        name = "phenotype",
        description = "Validate and run clinical phenotype scripts.",
        mixinStandardHelpOptions = true,
        version = "phenotype-engine 1.0.0",
        subcommands = {ValidateCommand.class, RunCommand.class}
)
public final class PhenotypeCli implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new PhenotypeCli())
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
