package com.e2eq.access.runtime;

import com.e2eq.access.core.AccessManagerOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Exposes {@link AccessManagerOptions} built from configuration for injection across the application.
 * <p>
 * Applications construct their own {@link com.e2eq.access.core.AccessManager} with their user, group,
 * component and access level types, passing the injected options in. The module only contributes CDI beans
 * when an application depends on it.
 * </p>
 */
@ApplicationScoped
public class AccessManagerProducer {
    private static final Logger LOG = Logger.getLogger(AccessManagerProducer.class);

    private final AccessManagerOptions options;

    @Inject
    public AccessManagerProducer(@ConfigProperty(name = "quantum.access.reject-circular-group-mappings", defaultValue = "true")
                                 boolean rejectCircularGroupMappings,
                                 @ConfigProperty(name = "quantum.access.fair-locking", defaultValue = "false")
                                 boolean fairLocking) {
        this.options = new AccessManagerOptions(rejectCircularGroupMappings, fairLocking);
        if (!rejectCircularGroupMappings) {
            LOG.warn("quantum.access.reject-circular-group-mappings is false; circular group mappings will be admitted");
        }
    }

    @Produces
    public AccessManagerOptions options() {
        return options;
    }
}
