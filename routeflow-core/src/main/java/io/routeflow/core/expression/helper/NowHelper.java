package io.routeflow.core.expression.helper;

import io.routeflow.core.expression.Values;
import java.time.LocalTime;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// `now` namespace: compares the current time of day with `HH:mm` times.
///
/// The current time is the configuration key `now` when present, otherwise the context clock.
final class NowHelper implements HelperNamespace {

    private static final Pattern TIME = Pattern.compile("^(\\d{1,2}):?(\\d{2})$");

    private final HelperContext context;

    NowHelper(HelperContext context) {
        this.context = context;
    }

    @Override
    public String name() {
        return "now";
    }

    @Override
    public Object invoke(String method, List<Object> arguments) {
        if (!method.equals("After") && !method.equals("Before")) {
            throw HelperNamespaces.unknownMethod(name(), method);
        }
        Object raw = HelperNamespaces.argument(arguments, 0, name(), method);
        String text = raw instanceof Double d ? Values.formatNumber(d) : String.valueOf(raw);
        LocalTime other = parse(text);
        if (other == null) {
            throw HelperNamespaces.invalidArgument(name(), method, raw);
        }
        LocalTime current = currentTime();
        return method.equals("After") ? current.isAfter(other) : current.isBefore(other);
    }

    private LocalTime currentTime() {
        LocalTime configured = parse(context.configured(name()));
        return configured != null
                ? configured
                : LocalTime.now(context.clock()).withSecond(0).withNano(0);
    }

    /// Accepts `HH:mm`, `H:mm` and `HHmm`.
    static LocalTime parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = TIME.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            return null;
        }
        return LocalTime.of(hour, minute);
    }
}
