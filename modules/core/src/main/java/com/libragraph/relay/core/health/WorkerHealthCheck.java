package com.libragraph.relay.core.health;

import com.libragraph.relay.core.backend.BackendClient;
import com.libragraph.relay.core.worker.WorkerLoop;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the worker loop's state. A process with the worker disabled is a
 * broker-only process and always reports UP.
 */
@Readiness
@ApplicationScoped
public class WorkerHealthCheck implements HealthCheck {

    @Inject
    WorkerLoop workerLoop;

    @Inject
    BackendClient backendClient;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("worker")
                .withData("enabled", workerLoop.enabled());
        if (!workerLoop.enabled()) {
            return response.up().build();
        }

        response.withData("state", workerLoop.state().name())
                .withData("consecutiveErrors", workerLoop.consecutiveErrors())
                .withData("jobsProcessed", workerLoop.jobsProcessed())
                .withData("backendReachable", backendClient.ping());
        if (workerLoop.isRunning()) {
            return response.up().build();
        }
        Throwable failure = workerLoop.lastFailure();
        if (failure != null) {
            response.withData("error", String.valueOf(failure.getMessage()));
        }
        return response.down().build();
    }
}
