package io.layerwarm.core.merge;

import static io.layerwarm.core.testkit.TestNodes.appBase;
import static io.layerwarm.core.testkit.TestNodes.appEnv;
import static io.layerwarm.core.testkit.TestNodes.baseline;
import static io.layerwarm.core.testkit.TestNodes.provider;
import static io.layerwarm.core.testkit.TestNodes.yaml;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Mode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RouteCompositor")
class RouteCompositorTest {

    private final RouteCompositor compositor = new RouteCompositor();

    @Test
    @DisplayName("A later layer overrides single fields of a route and keeps the rest")
    void lastWinsPerField() {
        ObjectNode merged = compositor.mergeRoutes(List.of(
                yaml("/x: {controller: A, action: f, methods: [GET]}"), yaml("/x: {action: g}")));

        assertThat(merged).isEqualTo(yaml("/x: {controller: A, action: g, methods: [GET]}"));
    }

    @Test
    @DisplayName("Pattern-route list is replaced wholesale by a later layer")
    void patternListReplaced() {
        ObjectNode merged = compositor.mergeRoutes(List.of(
                yaml("""
                        regex:
                          - {pattern: '^/a', controller: A, action: a, methods: [GET]}
                          - {pattern: '^/b', controller: B, action: b, methods: [GET]}
                        """),
                yaml("""
                        regex:
                          - {pattern: '^/c', controller: C, action: c, methods: [POST]}
                        """)));

        assertThat(merged.get("regex")).hasSize(1);
        assertThat(merged.get("regex").get(0).get("pattern").asText()).isEqualTo("^/c");
    }

    @Test
    @DisplayName("Routes declared only by earlier layers survive")
    void unrelatedPathsKept() {
        ObjectNode merged = compositor.mergeRoutes(List.of(
                yaml("/health: {controller: H, action: s, methods: [GET]}"),
                yaml("/posts: {controller: P, action: i, methods: [GET]}")));

        assertThat(merged.has("/health")).isTrue();
        assertThat(merged.has("/posts")).isTrue();
    }

    @Test
    @DisplayName("Environment overlay is applied last")
    void overlayAppliedLast() {
        Composition composition = compositor.compose(
                Mode.HTTP,
                List.of(
                        baseline("/x: {controller: A, action: f, methods: [GET]}"),
                        provider(1, "blog", "/x: {controller: B}"),
                        appBase(2, "/x: {methods: [GET, POST]}"),
                        appEnv(3, "/x: {action: debug}")));

        assertThat(composition.tree().get("/x"))
                .isEqualTo(yaml("{controller: B, action: debug, methods: [GET, POST]}"));
        assertThat(composition.origins()).containsEntry("/x", 3);
    }
}
