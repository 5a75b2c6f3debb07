package io.routeflow.core.expression;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionSubstitutorTest {

    private final ExpressionSubstitutor substitutor = new ExpressionSubstitutor();

    @Test
    void shouldInlineBoundIdentifiers() {
        String substituted =
                substitutor.substitute(
                        "age >= 18 && name == 'Bob'", Map.of("age", 25.0, "name", "Bob"), Map.of());

        assertThat(substituted).isEqualTo("25 >= 18 && 'Bob' == 'Bob'");
    }

    @Test
    void shouldLeaveUnknownReferencesAsWritten() {
        String expression = "${tier} == level && session['k'] == 1";

        assertThat(substitutor.substitute(expression, Map.of(), Map.of())).isEqualTo(expression);
    }

    @Test
    void shouldAcceptBothSessionQuoteStyles() {
        String expression = "session[\"lang\"] == session['lang']";

        assertThat(substitutor.substitute(expression, Map.of(), Map.of("lang", "en")))
                .isEqualTo("'en' == 'en'");
    }

    @Test
    void shouldSkipStringsMembersKeysAndHelpers() {
        String expression = "{ age: age }.age == age && 'age' != queue.QueueDepth(age)";

        assertThat(substitutor.substitute(expression, Map.of("age", 3), Map.of()))
                .isEqualTo("{ age: 3 }.age == 3 && 'age' != queue.QueueDepth(3)");
    }

    @Test
    void shouldQuoteAndEscapeStrings() {
        assertThat(substitutor.substitute("note", Map.of("note", "it's"), Map.of()))
                .isEqualTo("'it\\'s'");
    }

    @Test
    void shouldReturnTextUnchangedWhenLexingFails() {
        assertThat(substitutor.substitute("name == 'open", Map.of("name", "x"), Map.of()))
                .isEqualTo("name == 'open");
    }

    @Test
    void shouldLetEnvironmentWinOverConfiguration() {
        assertThat(ExpressionSubstitutor.merge(Map.of("x", 1), Map.of("x", "2", "y", "true")))
                .containsEntry("x", 1.0)
                .containsEntry("y", "true");
    }

    @Test
    void shouldInlineConfiguredValuesAsStrings() {
        String substituted =
                substitutor.substitute(
                        "${zip} == session['ani'] && level",
                        Map.of(),
                        Map.of("zip", "02134", "ani", "4477", "level", "3"));

        assertThat(substituted).isEqualTo("'02134' == '4477' && '3'");
    }
}
