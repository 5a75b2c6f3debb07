package io.routeflow.core.expression.helper;

import io.routeflow.core.expression.Values;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/// `today` namespace: weekday checks such as `today.Equals('SAT', 'SUN')`.
///
/// Days match on their first three letters, case-insensitively, so `MON`, `mon` and `Monday`
/// are equivalent. The current weekday is the configuration key `today` when present,
/// otherwise the context clock.
final class TodayHelper implements HelperNamespace {

    private final HelperContext context;

    TodayHelper(HelperContext context) {
        this.context = context;
    }

    @Override
    public String name() {
        return "today";
    }

    @Override
    public Object invoke(String method, List<Object> arguments) {
        if (!method.equals("Equals")) {
            throw HelperNamespaces.unknownMethod(name(), method);
        }
        HelperNamespaces.argument(arguments, 0, name(), method);
        String current = currentDay();
        for (Object argument : arguments) {
            if (abbreviate(Values.toDisplayString(argument)).equals(current)) {
                return true;
            }
        }
        return false;
    }

    private String currentDay() {
        String configured = context.configured(name());
        if (configured != null) {
            return abbreviate(configured);
        }
        DayOfWeek day = LocalDate.now(context.clock()).getDayOfWeek();
        return abbreviate(day.name());
    }

    private static String abbreviate(String day) {
        String upper = day.trim().toUpperCase(Locale.ROOT);
        return upper.length() > 3 ? upper.substring(0, 3) : upper;
    }
}
