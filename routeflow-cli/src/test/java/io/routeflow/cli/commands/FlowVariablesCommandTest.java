package io.routeflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowVariablesCommandTest extends BaseFlowCommandTest {

    @TempDir Path tempDir;

    private FlowVariablesCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = prepare(new FlowVariablesCommand(), tempDir);
    }

    @Test
    void shouldListSystemAndSessionVariables() throws Exception {
        writeGraph(tempDir, "tier.json", createTierCheck());
        injectField(command, "flowFile", "tier.json");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("NAME");
        assertThat(output).containsPattern("tier\\s+system");
        assertThat(output).containsPattern("channel\\s+session");
        assertThat(output).contains("condition_2");
        assertThat(output).contains("Defaults: -c tier=1 -c channel=test_value");
    }

    @Test
    void shouldSkipVariablesBoundByInputNodes() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");

        command.run();

        assertThat(outContent.toString()).contains("No test variables referenced.");
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        injectField(command, "flowFile", "missing.json");

        command.run();

        assertThat(errContent.toString()).contains("File not found");
    }
}
