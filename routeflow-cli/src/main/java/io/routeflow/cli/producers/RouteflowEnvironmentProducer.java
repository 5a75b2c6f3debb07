package io.routeflow.cli.producers;

import io.routeflow.core.RouteflowConfig;
import io.routeflow.core.RouteflowEnvironment;
import io.routeflow.core.RouteflowFactory;
import io.routeflow.core.expression.helper.QueueDefaults;
import io.routeflow.serialization.rule.RuleDocumentConverter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the Routeflow engine environment and the rule document converter.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `routeflow.simulation.max-steps` | int | `1000` | Node visits allowed per simulation |
/// | `routeflow.queue.agent-staffed` | int | `2` | `Queue.AgentStaffed` fallback |
/// | `routeflow.queue.depth` | int | `5` | `Queue.QueueDepth` fallback |
/// | `routeflow.queue.longest-wait-time` | int | `15` | `Queue.LongestWaitTime` fallback |
///
/// @implNote Application-scoped. Products are `@Singleton` because the engine types are final
/// and cannot be proxied; they are stateless.
/// @see io.routeflow.core.RouteflowFactory
@ApplicationScoped
public class RouteflowEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(RouteflowEnvironmentProducer.class.getName());

    @Inject
    @ConfigProperty(name = "routeflow.simulation.max-steps", defaultValue = "1000")
    int maxSteps;

    @Inject
    @ConfigProperty(name = "routeflow.queue.agent-staffed", defaultValue = "2")
    int agentStaffed;

    @Inject
    @ConfigProperty(name = "routeflow.queue.depth", defaultValue = "5")
    int queueDepth;

    @Inject
    @ConfigProperty(name = "routeflow.queue.longest-wait-time", defaultValue = "15")
    int longestWaitTime;

    /// Produces the engine environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @Singleton
    public RouteflowEnvironment routeflowEnvironment() {
        RouteflowConfig config =
                RouteflowConfig.builder()
                        .maxSteps(maxSteps)
                        .queueDefaults(new QueueDefaults(agentStaffed, queueDepth, longestWaitTime))
                        .build();
        logger.info("Configured RouteflowEnvironment with maxSteps=" + maxSteps);
        return RouteflowFactory.createEnvironment(config);
    }

    /// Produces the rule document converter.
    ///
    /// @return converter, never null
    @Produces
    @Singleton
    public RuleDocumentConverter ruleDocumentConverter() {
        return new RuleDocumentConverter();
    }
}
