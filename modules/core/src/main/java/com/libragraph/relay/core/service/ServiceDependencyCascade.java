package com.libragraph.relay.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Observes {@link ServiceStateChangedEvent} and fails every service that
 * declares {@code @DependsOn} on the one that just failed.
 * <p>
 * Lives outside {@link AbstractManagedService} so event delivery during
 * {@code @PostConstruct} does not recurse into bean creation.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    @Inject
    Instance<ManagedService> allServices;

    void onServiceFailed(@Observes ServiceStateChangedEvent event) {
        if (event.newState() != ManagedService.State.FAILED) {
            return;
        }

        for (ManagedService svc : allServices) {
            if (svc instanceof AbstractManagedService managed) {
                for (Class<? extends ManagedService> dep : managed.getDependencies()) {
                    if (failedServiceIs(event.serviceId(), dep)) {
                        log.warnf("Dependency '%s' failed, cascading failure to '%s'",
                                event.serviceId(), svc.serviceId());
                        svc.fail(new IllegalStateException(
                                "Dependency '" + event.serviceId() + "' failed: " + event.detail()));
                    }
                }
            }
        }
    }

    private boolean failedServiceIs(String serviceId, Class<? extends ManagedService> depClass) {
        for (ManagedService svc : allServices) {
            if (depClass.isInstance(svc) && svc.serviceId().equals(serviceId)) {
                return true;
            }
        }
        return false;
    }
}
