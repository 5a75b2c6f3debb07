package io.routeflow.cli.commands;

import io.routeflow.core.RouteflowFactory;
import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.GraphMetadata;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Position;
import io.routeflow.core.graph.node.StartNode;
import io.routeflow.serialization.FlowSerializer;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/// Base class for CLI command tests with common utilities.
abstract class BaseFlowCommandTest {

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    /// Injects a value into a field, searching up the class hierarchy.
    protected void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = findField(target.getClass(), fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private Field findField(Class<?> clazz, String fieldName) throws NoSuchFieldException {
        Class<?> current = clazz;
        while (current != null) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                current = current.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    /// Wires a command the way CDI would, against a real default environment.
    protected <T extends FlowCommand> T prepare(T command, Path workingDir) throws Exception {
        injectField(command, "environment", RouteflowFactory.createEnvironment());
        injectField(command, "workingDirPath", workingDir);
        injectField(command, "color", false);
        return command;
    }

    /// Writes a graph as graph JSON.
    protected Path writeGraph(Path dir, String fileName, FlowGraph graph) throws Exception {
        Path file = dir.resolve(fileName);
        Files.writeString(file, FlowSerializer.toJson(graph));
        return file;
    }

    /// Start → Input(age) → Condition(age >= 18) with both branches ending.
    protected FlowGraph createAgeCheck(String age) {
        return FlowGraph.builder()
                .node(StartNode.builder().id("start_1").position(new Position(200, 50)).build())
                .node(
                        InputNode.builder()
                                .id("input_2")
                                .label("Age")
                                .position(new Position(200, 150))
                                .variableName("age")
                                .literalValue(age)
                                .build())
                .node(
                        ConditionNode.builder()
                                .id("condition_3")
                                .label("Adult?")
                                .position(new Position(200, 250))
                                .expression("age >= 18")
                                .build())
                .node(
                        EndNode.builder()
                                .id("end_4")
                                .label("Adult")
                                .position(new Position(100, 400))
                                .build())
                .node(
                        EndNode.builder()
                                .id("end_5")
                                .label("Minor")
                                .position(new Position(300, 400))
                                .build())
                .edge("start_1", "input_2")
                .edge("input_2", "condition_3")
                .edge("condition_3", "end_4", Branch.TRUE)
                .edge("condition_3", "end_5", Branch.FALSE)
                .metadata(new GraphMetadata("Age check", null))
                .build();
    }

    /// Start → Condition over configured variables, with only a TRUE path.
    protected FlowGraph createTierCheck() {
        return FlowGraph.builder()
                .node(StartNode.builder().id("start_1").position(new Position(200, 50)).build())
                .node(
                        ConditionNode.builder()
                                .id("condition_2")
                                .label("Gold?")
                                .position(new Position(200, 200))
                                .expression("${tier} == 'gold' && session['channel'] == 'web'")
                                .build())
                .node(
                        EndNode.builder()
                                .id("end_3")
                                .label("Gold")
                                .position(new Position(200, 350))
                                .build())
                .edge("start_1", "condition_2")
                .edge("condition_2", "end_3", Branch.TRUE)
                .build();
    }
}
