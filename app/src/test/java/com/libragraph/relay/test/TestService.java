package com.libragraph.relay.test;

import com.libragraph.relay.core.service.AbstractManagedService;
import com.libragraph.relay.core.service.DependsOn;
import com.libragraph.relay.core.workflow.WorkflowCatalog;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Test-only service that {@code @DependsOn(WorkflowCatalog)} to exercise
 * dependency checks and failure cascade.
 */
@ApplicationScoped
@DependsOn(WorkflowCatalog.class)
public class TestService extends AbstractManagedService {

    @Override
    public String serviceId() {
        return "test-service";
    }

    @Override
    protected void doStart() {
        log.info("TestService started");
    }

    @Override
    protected void doStop() {
        log.info("TestService stopped");
    }
}
