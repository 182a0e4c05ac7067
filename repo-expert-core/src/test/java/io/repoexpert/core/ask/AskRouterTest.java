package io.repoexpert.core.ask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AskRouterTest {

    private final AskRouter router = new AskRouter(Duration.ofSeconds(20), Duration.ofSeconds(8));

    @Test
    void shouldRouteSimpleQuestionToFastModelInAutoMode() {
        AskRoutePlan plan = router.plan(AskRoutingMode.AUTO, "Where is main?", "openai/gpt-4.1-mini");

        assertThat(plan.primaryOverrideModel()).isEqualTo("openai/gpt-4.1-mini");
        assertThat(plan.primaryTimeout()).isEqualTo(Duration.ofSeconds(8));
        assertThat(plan.fallbackTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(plan.enableFallback()).isTrue();
    }

    @Test
    void shouldUseDefaultModelForComplexQuestionsAndQualityMode() {
        AskRoutePlan complex = router.plan(AskRoutingMode.AUTO, "Compare the two designs", "fast");
        AskRoutePlan quality = router.plan(AskRoutingMode.QUALITY, "Where is main?", "fast");

        assertThat(complex.primaryOverrideModel()).isNull();
        assertThat(complex.enableFallback()).isFalse();
        assertThat(quality.primaryOverrideModel()).isNull();
        assertThat(quality.primaryTimeout()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void shouldAlwaysUseFastModelInSpeedModeWhenConfigured() {
        assertThat(router.plan(AskRoutingMode.SPEED, "Compare the two designs", "fast").primaryOverrideModel())
            .isEqualTo("fast");
        assertThat(router.plan(AskRoutingMode.SPEED, "Compare the two designs", " ").primaryOverrideModel())
            .isNull();
    }

    @Test
    void shouldParseRoutingModes() {
        assertThat(AskRoutingMode.parse(null)).isEqualTo(AskRoutingMode.AUTO);
        assertThat(AskRoutingMode.parse(" Speed ")).isEqualTo(AskRoutingMode.SPEED);
        assertThatThrownBy(() -> AskRoutingMode.parse("turbo"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("auto, quality, speed");
    }
}
