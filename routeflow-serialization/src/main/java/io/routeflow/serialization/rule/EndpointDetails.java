package io.routeflow.serialization.rule;

import io.routeflow.core.expression.Values;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Queue routing carried by an endpoint rule, and its encoding as a Function node body.
///
/// @param queueName target queue, not null
/// @param isDefault whether the queue is the default route
public record EndpointDetails(String queueName, boolean isDefault) {

    public static final String DEFAULT_QUEUE = "DefaultQueue";

    private static final Pattern QUEUE_NAME =
            Pattern.compile("queueName:\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^'\\\\]|\\\\.)*)')");
    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");
    private static final Pattern IS_DEFAULT = Pattern.compile("isDefault:\\s*(true|false)");

    /// Renders the Function body an imported endpoint rule gets. The queue name is written as an
    /// escaped string literal, so any name yields a body that parses.
    public String toFunctionBody() {
        return "// Queue: " + queueName.replaceAll("[\\r\\n]+", " ") + "\n"
                + "// Is Default: " + isDefault + "\n"
                + "\n"
                + "return {\n"
                + "  queueName: " + Values.toJson(queueName) + ",\n"
                + "  isDefault: " + isDefault + "\n"
                + "};";
    }

    /// Reads queue routing back out of a Function body.
    ///
    /// Looks for `queueName: "..."` (or single-quoted) and `isDefault: true|false` anywhere in the
    /// text; a missing value falls back to {@link #DEFAULT_QUEUE} and `false`. Backslash escapes
    /// in the queue name are undone.
    ///
    /// @param body function body, may be null
    /// @return details, never null
    public static EndpointDetails fromFunctionBody(String body) {
        if (body == null) {
            return new EndpointDetails(DEFAULT_QUEUE, false);
        }
        Matcher queue = QUEUE_NAME.matcher(body);
        Matcher isDefault = IS_DEFAULT.matcher(body);
        return new EndpointDetails(
                queue.find() ? unescape(queue.group(1) != null ? queue.group(1) : queue.group(2))
                        : DEFAULT_QUEUE,
                isDefault.find() && isDefault.group(1).equals("true"));
    }

    private static String unescape(String literal) {
        return ESCAPE.matcher(literal).replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
    }
}
