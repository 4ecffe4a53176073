package io.layerwarm.core.merge;

import static io.layerwarm.core.testkit.TestNodes.appBase;
import static io.layerwarm.core.testkit.TestNodes.appEnv;
import static io.layerwarm.core.testkit.TestNodes.baseline;
import static io.layerwarm.core.testkit.TestNodes.provider;
import static io.layerwarm.core.testkit.TestNodes.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.CompositionResult;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.Mode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigCompositor")
class ConfigCompositorTest {

    private final ConfigCompositor compositor = new ConfigCompositor();

    @Nested
    @DisplayName("Deep merge")
    class DeepMergeRules {

        @Test
        @DisplayName("Nested mappings merge key by key, later layer wins")
        void nestedMappingsMerge() {
            ObjectNode merged = compositor.mergeConfig(List.of(yaml("a: {x: 1, y: 2}"), yaml("a: {y: 3, z: 4}")));

            assertThat(merged).isEqualTo(yaml("a: {x: 1, y: 3, z: 4}"));
        }

        @Test
        @DisplayName("Lists are replaced wholesale, never concatenated")
        void listsReplaced() {
            ObjectNode merged = compositor.mergeConfig(List.of(yaml("a: [1, 2, 3]"), yaml("a: [9]")));

            assertThat(merged).isEqualTo(yaml("a: [9]"));
        }

        @Test
        @DisplayName("Explicit empty mapping clears the inherited subtree")
        void emptyMappingClears() {
            ObjectNode merged = compositor.mergeConfig(
                    List.of(yaml("session: {driver: file, cookie: {secure: true}}"), yaml("session: {}")));

            assertThat(merged.get("session").isObject()).isTrue();
            assertThat(merged.get("session").size()).isZero();
        }

        @Test
        @DisplayName("Explicit null is a scalar that overwrites")
        void nullOverwrites() {
            ObjectNode merged = compositor.mergeConfig(List.of(yaml("a: {x: 1}"), yaml("a: null")));

            assertThat(merged.get("a").isNull()).isTrue();
        }

        @Test
        @DisplayName("Scalar over mapping and mapping over scalar both replace")
        void typeChangeReplaces() {
            assertThat(compositor.mergeConfig(List.of(yaml("a: {x: 1}"), yaml("a: 5"))))
                    .isEqualTo(yaml("a: 5"));
            assertThat(compositor.mergeConfig(List.of(yaml("a: 5"), yaml("a: {x: 1}"))))
                    .isEqualTo(yaml("a: {x: 1}"));
        }

        @Test
        @DisplayName("No layers yields an empty mapping")
        void noLayers() {
            assertThat(compositor.mergeConfig(List.of()).size()).isZero();
        }

        @Test
        @DisplayName("Inputs are not mutated and the output shares no nodes with them")
        void inputsUntouched() {
            ObjectNode base = yaml("a: {x: 1, list: [1]}");
            ObjectNode overlay = yaml("a: {y: 2}");
            ObjectNode baseBefore = base.deepCopy();

            ObjectNode merged = compositor.mergeConfig(List.of(base, overlay));
            ((ObjectNode) merged.get("a")).put("x", 99);

            assertThat(base).isEqualTo(baseBefore);
            assertThat(overlay).isEqualTo(yaml("a: {y: 2}"));
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Merging the same list twice yields byte-identical canonical output")
        void idempotent() {
            List<Layer> layers = List.of(
                    baseline("app: {name: demo, debug: false}"), provider(1, "blog", "blog: {per_page: 10}"));

            CompositionResult first = compositor.compose(Mode.HTTP, layers).toResult();
            CompositionResult second = compositor.compose(Mode.HTTP, layers).toResult();

            assertThat(first.toCanonicalBytes()).isEqualTo(second.toCanonicalBytes());
            assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        }

        @Test
        @DisplayName("Key order inside a layer does not change the result")
        void keyOrderIndependent() {
            CompositionResult ordered = compositor
                    .compose(Mode.HTTP, List.of(baseline("a: 1\nb: {c: 2, d: 3}")))
                    .toResult();
            CompositionResult shuffled = compositor
                    .compose(Mode.HTTP, List.of(baseline("b: {d: 3, c: 2}\na: 1")))
                    .toResult();

            assertThat(ordered.toCanonicalBytes()).isEqualTo(shuffled.toCanonicalBytes());
        }
    }

    @Nested
    @DisplayName("Origins")
    class Origins {

        @Test
        @DisplayName("Each top-level key is attributed to the last layer that set it")
        void lastWriterIsOrigin() {
            Composition composition = compositor.compose(
                    Mode.HTTP,
                    List.of(
                            baseline("app: {name: demo}\nlog: {level: info}"),
                            provider(1, "blog", "blog: {per_page: 10}"),
                            appBase(2, "app: {name: shop}"),
                            appEnv(3, "log: {level: warning}")));

            assertThat(composition.kind()).isEqualTo(ArtifactKind.CONFIG);
            assertThat(composition.origins())
                    .containsEntry("app", 2)
                    .containsEntry("blog", 1)
                    .containsEntry("log", 3);
            assertThat(composition.originOf("blog")).get().extracting(Layer::id).isEqualTo("blog");
        }

        @Test
        @DisplayName("Layers out of order are rejected")
        void outOfOrderRejected() {
            assertThatThrownBy(() -> compositor.compose(Mode.HTTP, List.of(appBase(2, "a: 1"), baseline("a: 2"))))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
