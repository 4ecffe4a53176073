package io.layerwarm.core.merge;

import static io.layerwarm.core.testkit.TestNodes.appBase;
import static io.layerwarm.core.testkit.TestNodes.appEnv;
import static io.layerwarm.core.testkit.TestNodes.baseline;
import static io.layerwarm.core.testkit.TestNodes.provider;
import static io.layerwarm.core.testkit.TestNodes.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Mode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceCompositor")
class ServiceCompositorTest {

    private final ServiceCompositor compositor = new ServiceCompositor();

    @Nested
    @DisplayName("Left-wins union")
    class Union {

        @Test
        @DisplayName("Left operand keeps its entry on collision")
        void leftWins() {
            ObjectNode result = compositor.union(yaml("svc: Left"), yaml("svc: Right\nother: Other"));

            assertThat(result).isEqualTo(yaml("svc: Left\nother: Other"));
        }

        @Test
        @DisplayName("Operands are not mutated")
        void operandsUntouched() {
            ObjectNode left = yaml("a: A");
            ObjectNode right = yaml("b: B");

            compositor.union(left, right).put("c", "C");

            assertThat(left).isEqualTo(yaml("a: A"));
            assertThat(right).isEqualTo(yaml("b: B"));
        }
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("Later provider beats earlier provider and baseline")
        void laterProviderWins() {
            ObjectNode merged = compositor.mergeServices(
                    yaml("svc: Base"), List.of(yaml("svc: P1"), yaml("svc: P2")), null);

            assertThat(merged.get("svc").asText()).isEqualTo("P2");
        }

        @Test
        @DisplayName("Application beats every provider")
        void appWins() {
            ObjectNode merged = compositor.mergeServices(
                    yaml("svc: Base"), List.of(yaml("svc: P1"), yaml("svc: P2")), yaml("svc: AppImpl"));

            assertThat(merged.get("svc").asText()).isEqualTo("AppImpl");
        }

        @Test
        @DisplayName("Winning definition replaces the loser whole, options are not merged")
        void wholeDefinitionReplaced() {
            ObjectNode merged = compositor.mergeServices(
                    yaml("mailer: {class: SmtpMailer, options: {host: localhost, port: 25}}"),
                    List.of(yaml("mailer: {class: ApiMailer, options: {token: abc}}")),
                    null);

            assertThat(merged.get("mailer")).isEqualTo(yaml("{class: ApiMailer, options: {token: abc}}"));
        }

        @Test
        @DisplayName("Definitions only the baseline declares survive")
        void baselineOnlyKept() {
            ObjectNode merged = compositor.mergeServices(
                    yaml("logger: DefaultLogger\nsvc: Base"), List.of(yaml("svc: P1")), yaml("cache: RedisCache"));

            assertThat(merged.fieldNames()).toIterable().containsExactlyInAnyOrder("logger", "svc", "cache");
        }
    }

    @Nested
    @DisplayName("Layer composition")
    class LayerComposition {

        @Test
        @DisplayName("Origins point at the layer whose definition won")
        void originsFollowWinner() {
            Composition composition = compositor.compose(
                    Mode.HTTP,
                    List.of(
                            baseline("svc: Base\nlogger: DefaultLogger"),
                            provider(1, "p1", "svc: P1"),
                            provider(2, "p2", "svc: P2"),
                            appBase(3, "cache: RedisCache")));

            assertThat(composition.origins())
                    .containsEntry("svc", 2)
                    .containsEntry("logger", 0)
                    .containsEntry("cache", 3);
        }

        @Test
        @DisplayName("An environment overlay layer is rejected")
        void envOverlayRejected() {
            assertThatThrownBy(() -> compositor.compose(Mode.HTTP, List.of(baseline("a: A"), appEnv(3, "a: B"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no environment overlay");
        }

        @Test
        @DisplayName("Missing baseline and application contribute nothing")
        void providersOnly() {
            Composition composition = compositor.compose(Mode.CLI, List.of(provider(1, "p1", "svc: P1")));

            assertThat(composition.tree()).isEqualTo(yaml("svc: P1"));
        }
    }
}
