package io.routeflow.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeflow.core.expression.helper.QueueDefaults;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ExpressionEvaluator")
class ExpressionEvaluatorTest {

    // Saturday, 10:30 UTC
    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2024-06-15T10:30:00Z"), ZoneOffset.UTC);

    private final ExpressionEvaluator evaluator =
            new ExpressionEvaluator(CLOCK, QueueDefaults.DEFAULT);

    private boolean holds(String expression) {
        return evaluator.evaluate(expression, Map.of(), Map.of()).value();
    }

    @Nested
    class Conditions {

        @Test
        void shouldSubstituteEnvironmentIntoDisplay() {
            ConditionResult result = evaluator.evaluate("age >= 18", Map.of("age", 25), Map.of());

            assertThat(result.value()).isTrue();
            assertThat(result.displayExpression()).isEqualTo("25 >= 18");
        }

        @Test
        void shouldResolveSystemAndSessionReferences() {
            ConditionResult result =
                    evaluator.evaluate(
                            "${tier} == 'gold' && session['channel'] == 'web'",
                            Map.of(),
                            Map.of("tier", "gold", "channel", "web"));

            assertThat(result.value()).isTrue();
            assertThat(result.displayExpression()).isEqualTo("'gold' == 'gold' && 'web' == 'web'");
        }

        @Test
        void shouldCompareConfiguredDigitStringsNumerically() {
            ConditionResult result =
                    evaluator.evaluate("${score} > 700", Map.of(), Map.of("score", "720"));

            assertThat(result.value()).isTrue();
            assertThat(result.displayExpression()).isEqualTo("'720' > 700");
        }

        @Test
        void shouldCallStringMethodsOnConfiguredDigitStrings() {
            ConditionResult ani =
                    evaluator.evaluate(
                            "${ani}.startsWith('44')", Map.of(), Map.of("ani", "447700900123"));
            ConditionResult zip =
                    evaluator.evaluate("zip.startsWith('02')", Map.of(), Map.of("zip", "02134"));

            assertThat(ani.value()).isTrue();
            assertThat(ani.displayExpression()).isEqualTo("'447700900123'.startsWith('44')");
            assertThat(zip.value()).isTrue();
            assertThat(zip.displayExpression()).isEqualTo("'02134'.startsWith('02')");
        }

        @ParameterizedTest
        @CsvSource({"jane@gmail.com, true", "jane@yahoo.com, false"})
        void shouldMatchConfiguredEmailDomain(String email, boolean expected) {
            ConditionResult result =
                    evaluator.evaluate(
                            "email.includes(\"@gmail.com\")", Map.of(), Map.of("email", email));

            assertThat(result.value()).isEqualTo(expected);
            assertThat(result.displayExpression())
                    .isEqualTo("'" + email + "'.includes(\"@gmail.com\")");
        }

        @Test
        void shouldPreferEnvironmentOverConfiguration() {
            ConditionResult result =
                    evaluator.evaluate("age < 18", Map.of("age", 30), Map.of("age", "12"));

            assertThat(result.value()).isFalse();
        }

        @ParameterizedTest
        @CsvSource(
                delimiterString = " | ",
                quoteCharacter = '"',
                value = {
                    "'5' == 5 | true",
                    "'5' === 5 | false",
                    "null == 0 | false",
                    "'abc' < 'abd' | true",
                    "'x' > 1 | false",
                    "!'' | true",
                    "0 || 'fallback' | true",
                    "'Gold'.toLowerCase() == 'gold' | true",
                    "'Premium Plus'.includes('Plus') | true",
                    "'abc'.length === 3 | true",
                    "/^vip/i.test('VIP-42') | true",
                    "10 % 4 == 2 | true"
                })
        void shouldFollowLooseValueSemantics(String expression, boolean expected) {
            assertThat(holds(expression)).isEqualTo(expected);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldReportUnboundIdentifier() {
            assertThatThrownBy(() -> evaluator.evaluate("score > 5", Map.of("age", 1), Map.of()))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessage("score is not defined")
                    .extracting(e -> ((ExpressionException) e).getIdentifier())
                    .isEqualTo("score");
        }

        @Test
        void shouldReportUnconfiguredSystemReference() {
            assertThatThrownBy(() -> evaluator.evaluate("${tier} == 'gold'", Map.of(), Map.of()))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessage("${tier} is not configured");
        }

        @Test
        void shouldReportUnconfiguredSessionKey() {
            assertThatThrownBy(
                            () -> evaluator.evaluate("session['lang'] == 'en'", Map.of(), Map.of()))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .extracting(e -> ((ExpressionException) e).getIdentifier())
                    .isEqualTo("lang");
        }

        @Test
        void shouldReportNullAccess() {
            Map<String, Object> environment = new HashMap<>();
            environment.put("customer", null);

            assertThatThrownBy(() -> evaluator.evaluate("customer.tier", environment, Map.of()))
                    .isInstanceOf(ExpressionException.class)
                    .extracting(e -> ((ExpressionException) e).getKind())
                    .isEqualTo(ErrorKind.NULL_ACCESS);
        }

        @Test
        void shouldReportSyntaxError() {
            assertThatThrownBy(() -> holds("age >= "))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }

        @Test
        void shouldNotReachHostApis() {
            assertThatThrownBy(() -> holds("java.lang.System.exit(0)"))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessage("java is not defined");
            assertThatThrownBy(() -> holds("'x'.getClass()"))
                    .isInstanceOf(ExpressionException.class)
                    .extracting(e -> ((ExpressionException) e).getKind())
                    .isEqualTo(ErrorKind.TYPE_ERROR);
        }

        @Test
        void shouldRejectCallsOnPlainValues() {
            assertThatThrownBy(() -> holds("limit(3)"))
                    .isInstanceOf(UnresolvedReferenceException.class);
            assertThatThrownBy(() -> evaluator.evaluate("age()", Map.of("age", 3), Map.of()))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessage("number is not a function");
        }
    }

    @Nested
    class Helpers {

        @Test
        void shouldUseQueueDefaults() {
            assertThat(holds("queue.AgentStaffed('Sales') == 2")).isTrue();
            assertThat(holds("queue.QueueDepth('Sales') == 5")).isTrue();
            assertThat(holds("queue.LongestWaitTime('Sales') == 15")).isTrue();
        }

        @Test
        void shouldPreferConfiguredQueueFigures() {
            Map<String, String> configuration = Map.of("Sales", "7", "queue.QueueDepth", "9");

            assertThat(
                            evaluator
                                    .evaluate("queue.AgentStaffed('Sales') == 7", Map.of(), configuration)
                                    .value())
                    .isTrue();
            assertThat(
                            evaluator
                                    .evaluate("queue.QueueDepth('Support') == 9", Map.of(), configuration)
                                    .value())
                    .isTrue();
        }

        @Test
        void shouldCompareDatesAgainstClock() {
            assertThat(holds("date.After('2024-01-01')")).isTrue();
            assertThat(holds("date.Before('2024-01-01')")).isFalse();
            assertThat(holds("date.Equals('2024-06-15T08:00:00')")).isTrue();
        }

        @Test
        void shouldPreferConfiguredDate() {
            ConditionResult result =
                    evaluator.evaluate(
                            "date.After('2024-01-01')", Map.of(), Map.of("date", "2023-12-31"));

            assertThat(result.value()).isFalse();
            assertThat(result.displayExpression()).isEqualTo("date.After('2024-01-01')");
        }

        @Test
        void shouldCompareTimeOfDay() {
            assertThat(holds("now.After('09:00') && now.Before('17:00')")).isTrue();
            assertThat(
                            evaluator
                                    .evaluate("now.After('09:00')", Map.of(), Map.of("now", "08:15"))
                                    .value())
                    .isFalse();
        }

        @Test
        void shouldMatchWeekdays() {
            assertThat(holds("today.Equals('SAT', 'SUN')")).isTrue();
            assertThat(holds("today.Equals('Monday')")).isFalse();
            assertThat(
                            evaluator
                                    .evaluate("today.Equals('mon')", Map.of(), Map.of("today", "MON"))
                                    .value())
                    .isTrue();
        }

        @Test
        void shouldRejectUnknownHelperMethod() {
            assertThatThrownBy(() -> holds("queue.Abandoned('Sales') > 1"))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessage("queue.Abandoned is not a function");
        }

        @Test
        void shouldRejectUnparseableDate() {
            assertThatThrownBy(() -> holds("date.After('soon')"))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessage("date.After cannot interpret 'soon'");
        }

        @Test
        void shouldLetVariablesShadowHelpers() {
            assertThat(evaluator.evaluate("queue == 3", Map.of("queue", 3), Map.of()).value())
                    .isTrue();
        }
    }
}
