package io.routeflow.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

    private static Object eval(String source) {
        return ExpressionParser.parseExpression(source)
                .evaluate(EvaluationScope.variablesOnly(Map.of()));
    }

    @Nested
    class Expressions {

        @Test
        void shouldRespectPrecedence() {
            assertThat(eval("1 + 2 * 3")).isEqualTo(7.0);
            assertThat(eval("(1 + 2) * 3")).isEqualTo(9.0);
            assertThat(eval("10 - 4 - 3")).isEqualTo(3.0);
        }

        @Test
        void shouldBindAndTighterThanOr() {
            assertThat(eval("true || false && false")).isEqualTo(true);
        }

        @Test
        void shouldParseConditionalExpression() {
            assertThat(eval("2 > 1 ? 'yes' : 'no'")).isEqualTo("yes");
        }

        @Test
        void shouldTolerateTrailingSemicolon() {
            assertThat(eval("1 < 2;")).isEqualTo(true);
        }

        @Test
        void shouldParseSessionReference() {
            assertThat(ExpressionParser.parseExpression("session['channel']"))
                    .isEqualTo(new Expr.SessionRef("channel"));
        }

        @Test
        void shouldBuildObjectLiterals() {
            assertThat(eval("{ tier: 'gold', 'score': 1 + 1, }"))
                    .isEqualTo(Map.of("tier", "gold", "score", 2.0));
        }

        @Test
        void shouldRejectEmptyExpression() {
            assertThatThrownBy(() -> ExpressionParser.parseExpression("   "))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageStartingWith("Empty expression");
        }

        @Test
        void shouldRejectTrailingTokens() {
            assertThatThrownBy(() -> ExpressionParser.parseExpression("age >= 18 18"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Unexpected '18'");
        }

        @Test
        void shouldRejectStatementKeywordsInExpressions() {
            assertThatThrownBy(() -> ExpressionParser.parseExpression("return 1"))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }
    }

    @Nested
    class Programs {

        @Test
        void shouldParseStatements() {
            Program program =
                    ExpressionParser.parseProgram(
                            "let total = price * 2; total = total + 1; return total;");

            assertThat(program.statements()).hasSize(3);
            assertThat(program.statements().get(0)).isInstanceOf(Statement.Declare.class);
            assertThat(program.statements().get(1)).isInstanceOf(Statement.Assign.class);
            assertThat(program.statements().get(2)).isInstanceOf(Statement.Return.class);
        }

        @Test
        void shouldAcceptBlankBody() {
            assertThat(ExpressionParser.parseProgram("").statements()).isEmpty();
        }

        @Test
        void shouldRejectDeclarationWithoutName() {
            assertThatThrownBy(() -> ExpressionParser.parseProgram("let = 3"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Expected identifier");
        }
    }
}
