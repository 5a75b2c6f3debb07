package io.routeflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class VariableEnvironmentTest {

    @Test
    void shouldNormalizeNumbersOnBind() {
        VariableEnvironment env = new VariableEnvironment();

        env.bind("age", 25);

        assertThat(env.asMap()).containsEntry("age", 25.0);
    }

    @Test
    void shouldIsolateCopies() {
        VariableEnvironment env = new VariableEnvironment();
        env.bind("tier", "gold");

        VariableEnvironment copy = env.copy();
        copy.bind("tier", "silver");

        assertThat(env.asMap()).containsEntry("tier", "gold");
        assertThat(copy.asMap()).containsEntry("tier", "silver");
    }

    @Test
    void shouldFreezeSnapshots() {
        VariableEnvironment env = new VariableEnvironment();
        env.bind("a", 1);
        Map<String, Object> snapshot = env.snapshot();

        env.merge(Map.of("b", 2));

        assertThat(snapshot).containsOnlyKeys("a");
        assertThat(env.asMap()).containsOnlyKeys("a", "b");
    }
}
