package io.routeflow.core.expression;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpressionDiagnosticsTest {

    @Test
    void shouldListAvailableVariablesSorted() {
        ExpressionError error =
                ExpressionDiagnostics.diagnose(
                        UnresolvedReferenceException.variable("score"), List.of("tier", "age"));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNRESOLVED_REFERENCE);
        assertThat(error.identifier()).isEqualTo("score");
        assertThat(error.message()).isEqualTo("score is not defined");
        assertThat(error.suggestion())
                .isEqualTo("Variable \"score\" not found. Available variables: age, tier");
    }

    @Test
    void shouldSayNoneWhenNothingIsBound() {
        ExpressionError error =
                ExpressionDiagnostics.diagnose(UnresolvedReferenceException.variable("x"), Set.of());

        assertThat(error.suggestion()).endsWith("Available variables: none");
    }

    @Test
    void shouldHintAtQuotingOnSyntaxErrors() {
        ExpressionError error =
                ExpressionDiagnostics.diagnose(
                        new ExpressionSyntaxException("Unexpected end of input", 7), Set.of("age"));

        assertThat(error.kind()).isEqualTo(ErrorKind.SYNTAX);
        assertThat(error.suggestion()).isEqualTo(ExpressionDiagnostics.SYNTAX_HINT);
    }

    @Test
    void shouldHintAtVariableNamesOnNullAccess() {
        ExpressionError error =
                ExpressionDiagnostics.diagnose(ExpressionException.nullAccess("tier"), Set.of());

        assertThat(error.suggestion()).isEqualTo(ExpressionDiagnostics.NULL_ACCESS_HINT);
    }
}
