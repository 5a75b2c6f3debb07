package io.routeflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeflow.core.expression.ExpressionSyntaxException;
import io.routeflow.core.expression.UnresolvedReferenceException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FunctionBodyEvaluatorTest {

    private final FunctionBodyEvaluator evaluator = new FunctionBodyEvaluator();

    @Test
    void shouldReturnLastExpressionWithoutReturn() {
        assertThat(evaluator.evaluate("price * quantity", Map.of("price", 2.5, "quantity", 4.0)))
                .isEqualTo(10.0);
    }

    @Test
    void shouldStopAtFirstReturn() {
        assertThat(evaluator.evaluate("return 1; return 2;", Map.of())).isEqualTo(1.0);
        assertThat(evaluator.evaluate("return;", Map.of())).isNull();
    }

    @Test
    void shouldSupportLocalsAndAssignment() {
        Object result =
                evaluator.evaluate(
                        "const base = 10;\n"
                                + "let total = base;\n"
                                + "total = total + bonus;\n"
                                + "return { total: total };",
                        Map.of("bonus", 5.0));

        assertThat(result).isEqualTo(Map.of("total", 15.0));
    }

    @Test
    void shouldNotModifyCallerVariables() {
        Map<String, Object> variables = new HashMap<>(Map.of("count", 1.0));

        evaluator.evaluate("count = count + 1", variables);

        assertThat(variables).containsEntry("count", 1.0);
    }

    @Test
    void shouldRejectAssignmentToUndeclaredName() {
        assertThatThrownBy(() -> evaluator.evaluate("total = 1", Map.of()))
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessage("total is not defined");
    }

    @Test
    void shouldNotBindHelperNamespaces() {
        assertThatThrownBy(() -> evaluator.evaluate("queue.AgentStaffed('Sales')", Map.of()))
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessage("queue is not defined");
    }

    @Test
    void shouldReportSyntaxErrors() {
        assertThatThrownBy(() -> evaluator.evaluate("return {", Map.of()))
                .isInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    void shouldReturnNullForEmptyBody() {
        assertThat(evaluator.evaluate("", Map.of())).isNull();
    }
}
