package dev.quillbench.agent.registry;

import dev.quillbench.agent.ContentController;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.agent.ControllerFactory;
import dev.quillbench.domain.enums.ErrorKind;
import dev.quillbench.domain.valueobject.ErrorDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps controller type ids to factories. Populated once from every
 * {@link ControllerRegistration} bean and read-only afterwards.
 * Adding a controller = declare a registration bean. No lookup by class name.
 */
@Component
public class ControllerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ControllerRegistry.class);

    private final Map<String, ControllerRegistration> registrations;

    public ControllerRegistry(List<ControllerRegistration> registrations) {
        Map<String, ControllerRegistration> map = new LinkedHashMap<>();
        for (ControllerRegistration registration : registrations) {
            if (map.putIfAbsent(registration.typeId(), registration) != null) {
                throw new IllegalStateException("Duplicate controller type: " + registration.typeId());
            }
        }
        this.registrations = Collections.unmodifiableMap(map);
        log.info("Controller registry ready with types {}", this.registrations.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the controller for {@code typeId}. Unknown types and factory
     * failures come back as {@link Resolution.Unresolved}; this method never throws
     * for those.
     */
    public Resolution resolve(String typeId, ControllerConfig config) {
        ControllerRegistration registration = typeId != null ? registrations.get(typeId) : null;
        if (registration == null) {
            log.warn("Unknown controller type: {}", typeId);
            return new Resolution.Unresolved(String.valueOf(typeId),
                    ErrorDetail.resolution("Unknown controller type: " + typeId));
        }
        try {
            ContentController controller = registration.factory().create(config);
            if (controller == null) {
                return new Resolution.Unresolved(typeId,
                        ErrorDetail.resolution("Factory for " + typeId + " returned no controller"));
            }
            return new Resolution.Resolved(typeId, controller);
        } catch (RuntimeException e) {
            log.error("Failed to build controller '{}': {}", typeId, e.getMessage());
            String message = "Failed to build controller " + typeId + ": "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return new Resolution.Unresolved(typeId,
                    new ErrorDetail(ErrorKind.RESOLUTION, message,
                            e.getClass().getSimpleName()));
        }
    }

    /** Registered type ids in registration order. */
    public List<String> registeredTypes() {
        return List.copyOf(registrations.keySet());
    }

    public boolean isRegistered(String typeId) {
        return registrations.containsKey(typeId);
    }

    /** Human-readable description, or the id itself for unknown types. */
    public String description(String typeId) {
        ControllerRegistration registration = registrations.get(typeId);
        return registration != null ? registration.description() : typeId;
    }

    public static final class Builder {
        private final List<ControllerRegistration> registrations = new ArrayList<>();

        private Builder() {}

        public Builder register(String typeId, String description,
                                ControllerFactory factory) {
            registrations.add(new ControllerRegistration(typeId, description, factory));
            return this;
        }

        public ControllerRegistry build() {
            return new ControllerRegistry(registrations);
        }
    }
}
