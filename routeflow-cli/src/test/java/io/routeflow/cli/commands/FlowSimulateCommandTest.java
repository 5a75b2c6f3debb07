package io.routeflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.routeflow.cli.execution.ConsoleSimulationListener;
import io.routeflow.core.RouteflowEnvironment;
import io.routeflow.core.RouteflowFactory;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.execution.FlowSimulator;
import io.routeflow.core.execution.SimulationListener;
import io.routeflow.core.graph.FlowGraph;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class FlowSimulateCommandTest extends BaseFlowCommandTest {

    @TempDir Path tempDir;

    private FlowSimulateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = prepare(new FlowSimulateCommand(), tempDir);
    }

    @Test
    void shouldReportCompletedEnd() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("Simulated Age check");
        assertThat(output).contains("Completed at: Adult");
        assertThat(output).doesNotContain("Completed at: Minor");
        assertThat(output).contains("Steps: 7");
    }

    @Test
    void shouldFollowFalseBranchForMinor() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("12"));
        injectField(command, "flowFile", "age.json");

        command.run();

        assertThat(outContent.toString()).contains("Completed at: Minor");
    }

    @Test
    void shouldUseConfiguredVariables() throws Exception {
        writeGraph(tempDir, "tier.json", createTierCheck());
        injectField(command, "flowFile", "tier.json");
        injectField(command, "configuration", Map.of("tier", "gold", "channel", "web"));

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("Variables: ");
        assertThat(output).contains("Completed at: Gold");
    }

    @Test
    void shouldWarnWhenDefaultsTakeMissingBranch() throws Exception {
        writeGraph(tempDir, "tier.json", createTierCheck());
        injectField(command, "flowFile", "tier.json");
        injectField(command, "useDefaults", true);

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("tier=1");
        assertThat(output).contains("channel=test_value");
        assertThat(output).contains("No End node reached");
        assertThat(output).contains("[condition_2] No FALSE path connected from this condition");
    }

    @Test
    void shouldReportConditionErrorWithSuggestion() throws Exception {
        writeGraph(tempDir, "tier.json", createTierCheck());
        injectField(command, "flowFile", "tier.json");
        injectField(command, "configuration", Map.of("channel", "web"));

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[condition_2] Error evaluating condition");
        assertThat(output).contains("No End node reached");
    }

    @Test
    void shouldPrintEveryStepWhenVerbose() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");
        injectField(command, "verbose", true);

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("INFO  [start_1] Executing start node");
        assertThat(output).contains("INFO  [input_2] Set age = 25");
    }

    @Test
    void shouldPrintTraceJson() throws Exception {
        writeGraph(tempDir, "age.json", createAgeCheck("25"));
        injectField(command, "flowFile", "age.json");
        injectField(command, "json", true);

        command.run();

        JsonNode json = new ObjectMapper().readTree(outContent.toString());
        JsonNode steps = json.get("steps");
        assertThat(steps).hasSize(7);
        assertThat(steps.get(0).get("nodeId").asText()).isEqualTo("start_1");
        assertThat(steps.get(6).get("code").asText()).isEqualTo("flow_completed");
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        injectField(command, "flowFile", "missing.json");

        command.run();

        assertThat(errContent.toString()).contains("Simulation failed").contains("File not found");
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockedSimulator {

        @Mock private RouteflowEnvironment environment;

        @Mock private FlowSimulator simulator;

        @BeforeEach
        void setUp() throws Exception {
            injectField(command, "environment", environment);
            when(environment.getSimulator()).thenReturn(simulator);
            when(simulator.simulate(any(FlowGraph.class), any(), any()))
                    .thenReturn(new ExecutionTrace(List.of()));
            writeGraph(tempDir, "tier.json", createTierCheck());
            injectField(command, "flowFile", "tier.json");
        }

        @Test
        void shouldLetConfiguredValuesOverrideDefaults() throws Exception {
            when(environment.getVariableDetector())
                    .thenReturn(RouteflowFactory.createEnvironment().getVariableDetector());
            injectField(command, "useDefaults", true);
            injectField(command, "configuration", Map.of("tier", "gold"));

            command.run();

            verify(simulator)
                    .simulate(
                            any(FlowGraph.class),
                            eq(Map.of("tier", "gold", "channel", "test_value")),
                            eq(SimulationListener.NOOP));
            assertThat(outContent.toString()).contains("Steps: 0");
        }

        @Test
        void shouldPassConsoleListenerWhenVerbose() throws Exception {
            injectField(command, "verbose", true);

            command.run();

            verify(simulator)
                    .simulate(
                            any(FlowGraph.class),
                            eq(Map.of()),
                            isA(ConsoleSimulationListener.class));
        }
    }
}
