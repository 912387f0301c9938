package com.clinical.phenotype.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PhenotypeCliTest {

    private static final String SCRIPT = """
            phenotype "Low EF" version "1";
            include ClarityCore called Clarity;
            termset Terms: ["LVEF", "EF"];
            define Ef: Clarity.ValueExtraction({termset: [Terms]});
            define final Low: Ef.value < 40;
            """;

    private static final String FIXTURE = """
            {
              "documents": [
                {"id": "d1", "subject": "p1", "reportType": "Echo", "text": "LVEF is 35%."},
                {"id": "d2", "subject": "p2", "reportType": "Echo", "text": "EF 55"}
              ],
              "cohorts": {"6": ["p1", "p2"]}
            }
            """;

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        cli = PhenotypeCli.newCommandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("Should print the execution plan of a valid script")
        void testValid() throws IOException {
            Path script = write("low.phen", SCRIPT);

            int exit = cli.execute("validate", script.toString());

            assertEquals(0, exit);
            String plan = out.toString();
            assertTrue(plan.startsWith("phenotype Low EF version 1"), plan);
            assertTrue(plan.contains("Low [final] <- Ef"), plan);
        }

        @Test
        @DisplayName("Should report validation errors with their position")
        void testInvalid() throws IOException {
            Path script = write("bad.phen", SCRIPT.replace("Ef.value < 40", "Missing < 40"));

            int exit = cli.execute("validate", script.toString());

            assertEquals(1, exit);
            assertTrue(err.toString().contains("Missing"), err.toString());
            assertTrue(err.toString().contains("(line 5"), err.toString());
            assertEquals("", out.toString());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("Should print memberships as JSON")
        void testRun() throws IOException {
            Path script = write("low.phen", SCRIPT);
            Path fixture = write("docs.json", FIXTURE);

            int exit = cli.execute("run", script.toString(), "--documents", fixture.toString(), "-w", "2");

            assertEquals(0, exit, err.toString());
            JsonNode json = new ObjectMapper().readTree(out.toString());
            assertEquals("COMPLETE", json.get("state").asText());
            assertEquals("Low EF", json.get("phenotype").asText());
            JsonNode memberships = json.get("memberships");
            assertEquals(2, memberships.size());
            assertEquals("p1", memberships.get(0).get("subject").asText());
            assertTrue(memberships.get(0).get("qualifies").asBoolean());
            assertFalse(memberships.get(1).get("qualifies").asBoolean());
            assertEquals(35.0, memberships.get(0).get("supportingValues").get("Ef").get(0).get("value").asDouble());
        }

        @Test
        @DisplayName("A script that does not parse should exit with 1 and report the error")
        void testFailedRun() throws IOException {
            Path script = write("broken.phen", "phenotype \"Broken\" version \"1\"");
            Path fixture = write("docs.json", FIXTURE);

            int exit = cli.execute("run", script.toString(), "-d", fixture.toString());

            assertEquals(1, exit);
            JsonNode json = new ObjectMapper().readTree(out.toString());
            assertEquals("FAILED", json.get("state").asText());
            assertTrue(json.get("error").asText().startsWith("Syntax error"));
        }

        @Test
        @DisplayName("Should reject a missing documents option as a usage error")
        void testMissingFixture() throws IOException {
            Path script = write("low.phen", SCRIPT);

            int exit = cli.execute("run", script.toString());

            assertEquals(2, exit);
            assertTrue(err.toString().contains("--documents"), err.toString());
        }
    }

    @Test
    @DisplayName("Should require a subcommand")
    void testNoSubcommand() {
        assertEquals(2, cli.execute());
        assertTrue(err.toString().contains("Missing required subcommand"));
    }
}
