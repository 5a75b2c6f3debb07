package io.routeflow.core.expression.helper;

import io.routeflow.core.expression.Values;
import java.util.List;

/// `queue` namespace: staffing and backlog figures for a contact-center queue.
///
/// A figure is resolved from the configuration key equal to the queue identifier, then from
/// `queue.<Method>`, then from {@link QueueDefaults}.
final class QueueHelper implements HelperNamespace {

    private final HelperContext context;

    QueueHelper(HelperContext context) {
        this.context = context;
    }

    @Override
    public String name() {
        return "queue";
    }

    @Override
    public Object invoke(String method, List<Object> arguments) {
        double fallback =
                switch (method) {
                    case "AgentStaffed" -> context.queueDefaults().agentStaffed();
                    case "QueueDepth" -> context.queueDefaults().queueDepth();
                    case "LongestWaitTime" -> context.queueDefaults().longestWaitTime();
                    default -> throw HelperNamespaces.unknownMethod(name(), method);
                };
        if (!arguments.isEmpty()) {
            Double byQueue = numeric(context.configured(Values.toDisplayString(arguments.get(0))));
            if (byQueue != null) {
                return byQueue;
            }
        }
        Double byMethod = numeric(context.configured(name() + "." + method));
        return byMethod != null ? byMethod : fallback;
    }

    private static Double numeric(String text) {
        if (text == null) {
            return null;
        }
        double value = Values.toNumber(text);
        return Double.isNaN(value) ? null : value;
    }
}
