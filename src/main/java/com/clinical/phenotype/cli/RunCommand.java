package com.clinical.phenotype.cli;

import com.clinical.phenotype.aggregate.PhenotypeMembership;
import com.clinical.phenotype.api.EngineOptions;
import com.clinical.phenotype.api.PhenotypeEngine;
import com.clinical.phenotype.api.RunResult;
import com.clinical.phenotype.execution.SubjectFailure;
import com.clinical.phenotype.task.builtin.BuiltinTasks;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "run",
        description = "Run a script against documents and cohorts loaded from a JSON fixture.",
        mixinStandardHelpOptions = true,
        showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Parameters(index = "0", paramLabel = "SCRIPT", description = "Phenotype script file.")
    private Path script;

    @CommandLine.Option(names = {"-d", "--documents"}, required = true, paramLabel = "JSON",
            description = "Fixture with documents and cohorts.")
    private Path documents;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Worker threads.")
    private int workers = EngineOptions.defaults().getWorkerThreads();

    @CommandLine.Option(names = "--timeout-ms", description = "Deadline of one task unit in milliseconds.")
    private long timeoutMs = EngineOptions.defaults().getTaskTimeout().toMillis();

    @CommandLine.Option(names = "--debug", description = "Log the execution plan and per-define diagnostics.")
    private boolean debug;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        String source = Files.readString(script, StandardCharsets.UTF_8);
        DocumentFixture fixture = DocumentFixture.load(documents);
        EngineOptions options = EngineOptions.builder()
                .workerThreads(workers)
                .taskTimeout(Duration.ofMillis(timeoutMs))
                .debug(debug)
                .build();

        try (PhenotypeEngine engine = PhenotypeEngine.builder()
                .taskRegistry(BuiltinTasks.registry())
                .documentStore(fixture.documentStore())
                .cohortResolver(fixture.cohortResolver())
                .options(options)
                .build()) {
            RunResult result = engine.run(source);
            spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(toOutput(result)));
            return result.isComplete() ? 0 : 1;
        }
    }

    private static Map<String, Object> toOutput(RunResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("runId", result.runId());
        out.put("phenotype", result.phenotype());
        out.put("state", result.state().name());
        result.getFailure().ifPresent(f -> out.put("error", f.getMessage()));
        out.put("memberships", result.memberships().stream().map(PhenotypeMembership::toMap).toList());
        out.put("failures", result.failures().stream().map(RunCommand::failureToMap).toList());
        out.put("unitsDispatched", result.unitsDispatched());
        out.put("durationMs", result.duration().toMillis());
        return out;
    }

    private static Map<String, Object> failureToMap(SubjectFailure failure) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("define", failure.define());
        map.put("subject", failure.subjectKey());
        map.put("message", failure.message());
        return map;
    }
}
