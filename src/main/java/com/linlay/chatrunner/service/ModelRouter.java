package com.linlay.chatrunner.service;

import com.linlay.chatrunner.config.RoutingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Gradual rollout of a target model behind the source model id.
 * <p>
 * Users are bucketed by a stable hash of their id into 0..99; buckets below
 * {@code traffic-percentage} get the target model, so one user always sees the same model while
 * the percentage is unchanged. Ids other than the source and target are served as requested.
 */
@Service
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    private final RoutingProperties properties;
    private final ModelCatalog modelCatalog;

    public ModelRouter(RoutingProperties properties, ModelCatalog modelCatalog) {
        this.properties = properties;
        this.modelCatalog = modelCatalog;
    }

    public RoutingDecision route(String requestedModelId, String userId) {
        String requested = StringUtils.hasText(requestedModelId)
                ? requestedModelId.trim()
                : modelCatalog.defaultModelId();
        String selected = select(requested, userId);
        if (!selected.equals(requested) && !modelCatalog.isConfigured(selected)) {
            log.warn("Routing target '{}' is not configured, serving '{}'", selected, requested);
            selected = requested;
        }
        boolean routed = !selected.equals(requested);
        if (routed) {
            log.info("Model routing: {} -> {} for user {}", requested, selected, userId);
        }
        return new RoutingDecision(requested, selected, routed);
    }

    private String select(String requested, String userId) {
        String source = properties.getSourceModelId();
        String target = properties.getTargetModelId();
        if (requested.equals(target)) {
            return properties.isEnabled() ? target : source;
        }
        if (!requested.equals(source) || !properties.isEnabled()) {
            return requested;
        }
        if (StringUtils.hasText(properties.getForceModelId())) {
            return properties.getForceModelId().trim();
        }
        return bucket(userId) < properties.getTrafficPercentage() ? target : source;
    }

    static int bucket(String userId) {
        String identifier = userId == null ? "" : userId;
        return (int) (Math.abs((long) identifier.hashCode()) % 100);
    }
}
