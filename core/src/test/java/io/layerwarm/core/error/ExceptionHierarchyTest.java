package io.layerwarm.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.validate.Violation;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the abstract tiers, common fields, and every
 * concrete exception type.
 */
class ExceptionHierarchyTest {

    private static final Violation VIOLATION =
            new Violation(ArtifactKind.ROUTES, 2, "blog", "/posts", "missing or empty 'methods'");

    // --- Hierarchy structure ---

    @Test
    void compositionExceptionIsAbstractAndRoot() {
        assertThat(CompositionException.class).isAbstract();
        assertThat(CompositionException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void layerAndValidationTiersAreAbstract() {
        assertThat(LayerException.class).isAbstract();
        assertThat(LayerException.class.getSuperclass()).isEqualTo(CompositionException.class);
        assertThat(ValidationException.class).isAbstract();
        assertThat(ValidationException.class.getSuperclass()).isEqualTo(CompositionException.class);
    }

    // --- Build-time exceptions ---

    @Test
    void layerResolutionExceptionCarriesLayer() {
        var cause = new IOException("no such directory");
        var ex = new LayerResolutionException("cannot read", cause, ArtifactKind.CONFIG, 1, "blog");

        assertThat(ex).isInstanceOf(LayerException.class);
        assertThat(ex.layerPosition()).isEqualTo(1);
        assertThat(ex.layerId()).isEqualTo("blog");
        assertThat(ex.kind()).isEqualTo(ArtifactKind.CONFIG);
        assertThat(ex.phase()).isEqualTo(CompositionException.Phase.BUILD);
        assertThat(ex.detail()).isEqualTo("cannot read");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void missingRouteFieldExceptionIsRoutesValidation() {
        var ex = new MissingRouteFieldException("invalid routes", List.of(VIOLATION));

        assertThat(ex).isInstanceOf(ValidationException.class);
        assertThat(ex.kind()).isEqualTo(ArtifactKind.ROUTES);
        assertThat(ex.phase()).isEqualTo(CompositionException.Phase.BUILD);
        assertThat(ex.violations()).containsExactly(VIOLATION);
    }

    @Test
    void unresolvableServiceDefinitionExceptionIsServicesValidation() {
        var ex = new UnresolvableServiceDefinitionException("invalid services", List.of(VIOLATION));

        assertThat(ex).isInstanceOf(ValidationException.class);
        assertThat(ex.kind()).isEqualTo(ArtifactKind.SERVICES);
    }

    @Test
    void malformedPayloadExceptionKeepsKind() {
        var ex = new MalformedPayloadException("not a mapping", ArtifactKind.CONFIG, List.of(VIOLATION));

        assertThat(ex).isInstanceOf(ValidationException.class);
        assertThat(ex.kind()).isEqualTo(ArtifactKind.CONFIG);
    }

    @Test
    void violationsAreACopy() {
        List<Violation> violations = new ArrayList<>(List.of(VIOLATION));
        var ex = new MissingRouteFieldException("invalid routes", violations);

        violations.clear();

        assertThat(ex.violations()).hasSize(1);
    }

    // --- Persist and load exceptions ---

    @Test
    void cacheWriteExceptionIsPersistPhase() {
        Path identity = Path.of("var/cache/routes.http.json");
        var ex = new CacheWriteException("swap failed", new IOException("EXDEV"), ArtifactKind.ROUTES, identity);

        assertThat(ex.phase()).isEqualTo(CompositionException.Phase.PERSIST);
        assertThat(ex.identity()).isEqualTo(identity);
    }

    @Test
    void loadExceptionsAreLoadPhase() {
        Path identity = Path.of("var/cache/config.cli.json");
        var notFound = new ArtifactNotFoundException("not warmed", ArtifactKind.CONFIG, identity);
        var unreadable = new ArtifactReadException("bad json", ArtifactKind.CONFIG, identity);

        assertThat(notFound.phase()).isEqualTo(CompositionException.Phase.LOAD);
        assertThat(notFound.identity()).isEqualTo(identity);
        assertThat(unreadable.phase()).isEqualTo(CompositionException.Phase.LOAD);
        assertThat(unreadable.identity()).isEqualTo(identity);
    }

    @Test
    void violationDescribesLayerPosition() {
        assertThat(VIOLATION.describe()).contains("#2", "blog", "/posts", "methods");
        assertThat(new Violation(ArtifactKind.SERVICES, null, null, "svc", "x").describe())
                .contains("layer unknown");
    }
}
