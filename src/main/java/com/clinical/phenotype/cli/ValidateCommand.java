package com.clinical.phenotype.cli;

import com.clinical.phenotype.binder.CompiledPhenotype;
import com.clinical.phenotype.binder.SymbolBinder;
import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.script.ScriptParser;
import com.clinical.phenotype.task.builtin.BuiltinTasks;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "validate",
        description = "Parse and validate a script, then print its execution plan.",
        mixinStandardHelpOptions = true
)
final class ValidateCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "SCRIPT", description = "Phenotype script file.")
    private Path script;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        String source = Files.readString(script, StandardCharsets.UTF_8);
        try {
            CompiledPhenotype compiled = new SymbolBinder(BuiltinTasks.registry()).bind(ScriptParser.parse(source));
            spec.commandLine().getOut().println(compiled.describePlan());
            return 0;
        } catch (PhenotypeValidationException e) {
            spec.commandLine().getErr().println(script + ": " + e.getMessage());
            return 1;
        }
    }
}
