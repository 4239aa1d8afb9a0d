package com.linlay.chatrunner.service;

import com.linlay.chatrunner.config.RoutingProperties;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ModelRouterTest {

    private final ModelCatalog catalog = TestModels.catalog();

    @Test
    void disabledRoutingShouldServeRequestedModel() {
        ModelRouter router = new ModelRouter(new RoutingProperties(), catalog);

        assertThat(router.route("chat-model", "user-1")).isEqualTo(new RoutingDecision("chat-model", "chat-model", false));
        assertThat(router.route(null, "user-1").selectedModel()).isEqualTo("chat-model");
    }

    @Test
    void disabledRoutingShouldMapTargetBackToSource() {
        ModelRouter router = new ModelRouter(new RoutingProperties(), catalog);

        RoutingDecision decision = router.route("gemini-flash-lite", "user-1");

        assertThat(decision.selectedModel()).isEqualTo("chat-model");
        assertThat(decision.routed()).isTrue();
    }

    @Test
    void fullTrafficShouldRouteEveryUserToTarget() {
        RoutingProperties properties = enabled(100);
        ModelRouter router = new ModelRouter(properties, catalog);

        assertThat(IntStream.range(0, 50).mapToObj(i -> router.route("chat-model", "user-" + i)))
                .allSatisfy(decision -> {
                    assertThat(decision.selectedModel()).isEqualTo("gemini-flash-lite");
                    assertThat(decision.routed()).isTrue();
                });
    }

    @Test
    void sameUserShouldAlwaysLandInSameBucket() {
        ModelRouter router = new ModelRouter(enabled(50), catalog);
        String first = router.route("chat-model", "stable-user").selectedModel();

        assertThat(IntStream.range(0, 20).mapToObj(i -> router.route("chat-model", "stable-user").selectedModel()))
                .containsOnly(first);
        assertThat(ModelRouter.bucket("stable-user")).isBetween(0, 99);
        assertThat(ModelRouter.bucket(null)).isZero();
    }

    @Test
    void forcedModelShouldWinWhenConfigured() {
        RoutingProperties properties = enabled(0);
        properties.setForceModelId("chat-model-reasoning");

        RoutingDecision decision = new ModelRouter(properties, catalog).route("chat-model", "user-1");

        assertThat(decision.selectedModel()).isEqualTo("chat-model-reasoning");
    }

    @Test
    void unconfiguredTargetShouldFallBackToRequestedModel() {
        RoutingProperties properties = enabled(100);
        properties.setTargetModelId("not-configured");

        RoutingDecision decision = new ModelRouter(properties, catalog).route("chat-model", "user-1");

        assertThat(decision).isEqualTo(new RoutingDecision("chat-model", "chat-model", false));
    }

    @Test
    void otherModelsShouldBeServedAsRequested() {
        ModelRouter router = new ModelRouter(enabled(100), catalog);

        assertThat(router.route("chat-model-reasoning", "user-1").routed()).isFalse();
    }

    private static RoutingProperties enabled(int percentage) {
        RoutingProperties properties = new RoutingProperties();
        properties.setEnabled(true);
        properties.setTrafficPercentage(percentage);
        return properties;
    }
}
