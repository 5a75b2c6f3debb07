package io.routeflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.Position;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowValidateCommandTest extends BaseFlowCommandTest {

    @TempDir Path tempDir;

    private FlowValidateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = prepare(new FlowValidateCommand(), tempDir);
    }

    @Test
    void shouldReportValidFlow() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[OK] Flow is valid!");
        assertThat(output).contains("Name: Age check");
        assertThat(output).contains("Nodes: 5");
        assertThat(output).contains("Reachable: 5");
    }

    @Test
    void shouldListErrorsAndWarnings() throws Exception {
        FlowGraph graph =
                createTierCheck()
                        .withNode(EndNode.builder().id("end_9").label("Orphan").build());
        writeGraph(tempDir, "tier.json", graph);
        injectField(command, "flowFile", "tier.json");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[FAIL] Flow has 1 error(s)");
        assertThat(output).contains("[orphaned_end]");
        assertThat(output).contains("[missing_false_path]");
        assertThat(output).contains("Name: tier");
    }

    @Test
    void shouldReportOverlapsOnRequest() throws Exception {
        FlowGraph graph =
                createAgeCheck("25")
                        .withNode(
                                EndNode.builder()
                                        .id("end_5")
                                        .label("Minor")
                                        .position(new Position(110, 410))
                                        .build());
        writeGraph(tempDir, "age.json", graph);
        injectField(command, "flowFile", "age.json");
        injectField(command, "overlaps", true);

        command.run();

        assertThat(outContent.toString())
                .contains("Nodes \"Adult\" and \"Minor\" are overlapping");
    }

    @Test
    void shouldPrintJsonWithoutBanner() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");
        injectField(command, "json", true);

        command.run();

        JsonNode json = new ObjectMapper().readTree(outContent.toString());
        assertThat(json.get("isValid").asBoolean()).isTrue();
        assertThat(json.get("summary").get("edgeCount").asInt()).isEqualTo(4);
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        injectField(command, "flowFile", "missing.json");

        command.run();

        assertThat(errContent.toString()).contains("Validation failed").contains("File not found");
    }

    @Test
    void shouldFailOnMalformedFile() throws Exception {
        Files.writeString(tempDir.resolve("broken.json"), "{\"nodes\": [{\"id\": 1}]");
        injectField(command, "flowFile", "broken.json");

        command.run();

        assertThat(errContent.toString()).contains("Invalid flow file broken.json");
    }
}
