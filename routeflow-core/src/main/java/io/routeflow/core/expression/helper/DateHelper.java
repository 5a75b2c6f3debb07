package io.routeflow.core.expression.helper;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/// `date` namespace: compares the current date with ISO dates (`yyyy-MM-dd`).
///
/// The current date is the configuration key `date` when present, otherwise the context clock.
final class DateHelper implements HelperNamespace {

    private final HelperContext context;

    DateHelper(HelperContext context) {
        this.context = context;
    }

    @Override
    public String name() {
        return "date";
    }

    @Override
    public Object invoke(String method, List<Object> arguments) {
        if (!method.equals("After") && !method.equals("Before") && !method.equals("Equals")) {
            throw HelperNamespaces.unknownMethod(name(), method);
        }
        Object raw = HelperNamespaces.argument(arguments, 0, name(), method);
        LocalDate other = parse(raw);
        if (other == null) {
            throw HelperNamespaces.invalidArgument(name(), method, raw);
        }
        LocalDate today = currentDate();
        return switch (method) {
            case "After" -> today.isAfter(other);
            case "Before" -> today.isBefore(other);
            default -> today.isEqual(other);
        };
    }

    private LocalDate currentDate() {
        LocalDate configured = parse(context.configured(name()));
        return configured != null ? configured : LocalDate.now(context.clock());
    }

    private static LocalDate parse(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (text.length() > 10 && text.charAt(10) == 'T') {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
