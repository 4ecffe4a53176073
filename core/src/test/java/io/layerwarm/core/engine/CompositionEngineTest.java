package io.layerwarm.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.layerwarm.core.cache.ArtifactInvalidator;
import io.layerwarm.core.cache.ArtifactStore;
import io.layerwarm.core.cache.CacheWriter;
import io.layerwarm.core.cache.RuntimeLoader;
import io.layerwarm.core.error.LayerResolutionException;
import io.layerwarm.core.error.MissingRouteFieldException;
import io.layerwarm.core.error.UnresolvableServiceDefinitionException;
import io.layerwarm.core.layer.InMemoryLayerSource;
import io.layerwarm.core.layer.LayerSource;
import io.layerwarm.core.layer.LayerSourceReader;
import io.layerwarm.core.layer.LayerStack;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.CacheArtifact;
import io.layerwarm.core.model.CompositionBundle;
import io.layerwarm.core.model.CompositionResult;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.spi.CompositionListener;
import io.layerwarm.core.spi.CompositionListener.ArtifactBuiltEvent;
import io.layerwarm.core.spi.CompositionListener.ArtifactWrittenEvent;
import io.layerwarm.core.spi.CompositionListener.BuildRejectedEvent;
import io.layerwarm.core.validate.Violation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

@DisplayName("CompositionEngine")
class CompositionEngineTest {

    private static final LayerSource BASELINE = InMemoryLayerSource.builder("baseline")
            .yaml(Mode.HTTP, ArtifactKind.CONFIG, "app: {name: vendor, debug: false}\nlog: {level: info}")
            .yaml(Mode.HTTP, ArtifactKind.ROUTES, "/health: {controller: Health, action: status, methods: [GET]}")
            .yaml(Mode.HTTP, ArtifactKind.SERVICES, "logger: vendor.Logger\nmailer: vendor.Mailer")
            .yaml(Mode.CLI, ArtifactKind.CONFIG, "app: {name: vendor}")
            .yaml(Mode.CLI, ArtifactKind.SERVICES, "logger: vendor.StderrLogger")
            .build();

    private static final LayerSource BLOG = InMemoryLayerSource.builder("blog")
            .yaml(Mode.HTTP, ArtifactKind.CONFIG, "blog: {per_page: 10}")
            .yaml(Mode.HTTP, ArtifactKind.ROUTES, """
                    /posts: {controller: PostController, action: index, methods: [GET]}
                    regex:
                      - {pattern: '^/posts/(\\d+)$', controller: PostController, action: show, methods: [GET]}
                    """)
            .yaml(Mode.HTTP, ArtifactKind.SERVICES, "mailer: blog.QueuedMailer")
            .build();

    private static final LayerSource APP = InMemoryLayerSource.builder("app")
            .yaml(Mode.HTTP, ArtifactKind.CONFIG, "app: {name: shop}")
            .yaml(Mode.HTTP, ArtifactKind.ROUTES, "/posts: {action: list}")
            .yaml(Mode.HTTP, ArtifactKind.SERVICES, "cache: {class: app.RedisCache, options: {host: redis}}")
            .build();

    private static final LayerSource APP_PROD = InMemoryLayerSource.builder("app:prod")
            .yaml(Mode.HTTP, ArtifactKind.CONFIG, "log: {level: warning}")
            .build();

    private static final LayerSource BROKEN_ROUTES = InMemoryLayerSource.builder("broken")
            .yaml(Mode.HTTP, ArtifactKind.ROUTES, "/admin: {controller: Admin, action: index}")
            .build();

    @TempDir
    Path tempDir;

    private ArtifactStore store;
    private ArtifactInvalidator invalidator;
    private CompositionListener listener;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(tempDir.resolve("cache"));
        invalidator = mock(ArtifactInvalidator.class);
        listener = mock(CompositionListener.class);
    }

    private CompositionEngine engine(String... providers) {
        Map<String, LayerSource> available = Map.of("blog", BLOG, "broken", BROKEN_ROUTES);
        LayerStack stack = LayerStack.builder()
                .baseline(BASELINE)
                .providers(List.of(providers))
                .resolver(name -> Optional.ofNullable(available.get(name)))
                .appBase(APP)
                .appEnv(APP_PROD)
                .build();
        return new CompositionEngine(new LayerSourceReader(stack), new CacheWriter(store, invalidator), listener);
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("Config: deep last-wins with the environment overlay on top")
        void config() {
            CompositionResult result = engine("blog").build(Mode.HTTP, ArtifactKind.CONFIG);

            assertThat(result.get("app").get("name").asText()).isEqualTo("shop");
            assertThat(result.get("app").get("debug").asBoolean()).isFalse();
            assertThat(result.get("log").get("level").asText()).isEqualTo("warning");
            assertThat(result.get("blog").get("per_page").asInt()).isEqualTo(10);
        }

        @Test
        @DisplayName("Routes: per-field override, pattern routes from the provider")
        void routes() {
            CompositionResult result = engine("blog").build(Mode.HTTP, ArtifactKind.ROUTES);

            assertThat(result.get("/posts").get("controller").asText()).isEqualTo("PostController");
            assertThat(result.get("/posts").get("action").asText()).isEqualTo("list");
            assertThat(result.get("regex")).hasSize(1);
            assertThat(result.has("/health")).isTrue();
        }

        @Test
        @DisplayName("Services: provider beats baseline, app adds its own")
        void services() {
            CompositionResult result = engine("blog").build(Mode.HTTP, ArtifactKind.SERVICES);

            assertThat(result.get("mailer").asText()).isEqualTo("blog.QueuedMailer");
            assertThat(result.get("logger").asText()).isEqualTo("vendor.Logger");
            assertThat(result.get("cache").get("class").asText()).isEqualTo("app.RedisCache");
        }

        @Test
        @DisplayName("A mode with no layers for a kind builds an empty artifact")
        void emptyKind() {
            CompositionResult result = engine().build(Mode.CLI, ArtifactKind.ROUTES);

            assertThat(result.size()).isZero();
        }

        @Test
        @DisplayName("Notifies the listener of a successful build")
        void listenerBuilt() {
            CompositionResult result = engine("blog").build(Mode.HTTP, ArtifactKind.ROUTES);

            ArgumentCaptor<ArtifactBuiltEvent> captor = ArgumentCaptor.forClass(ArtifactBuiltEvent.class);
            verify(listener).onArtifactBuilt(captor.capture());
            assertThat(captor.getValue().kind()).isEqualTo(ArtifactKind.ROUTES);
            assertThat(captor.getValue().layerCount()).isEqualTo(3);
            assertThat(captor.getValue().fingerprint()).isEqualTo(result.fingerprint());
        }

        @Test
        @DisplayName("Invalid routes are rejected with every violation and reported to the listener")
        void invalidRoutes() {
            CompositionEngine engine = engine("broken");

            // /admin lacks methods; the application's partial /posts lacks controller and methods
            assertThatThrownBy(() -> engine.build(Mode.HTTP, ArtifactKind.ROUTES))
                    .isInstanceOfSatisfying(MissingRouteFieldException.class, e -> {
                        assertThat(e.violations()).extracting(Violation::key).containsExactlyInAnyOrder(
                                "/admin", "/posts", "/posts");
                        assertThat(e.violations())
                                .filteredOn(v -> v.key().equals("/admin"))
                                .singleElement()
                                .satisfies(v -> {
                                    assertThat(v.layerPosition()).isEqualTo(1);
                                    assertThat(v.layerId()).isEqualTo("broken");
                                    assertThat(v.detail()).contains("methods");
                                });
                        assertThat(e.violations())
                                .filteredOn(v -> v.key().equals("/posts"))
                                .extracting(Violation::detail)
                                .anySatisfy(detail -> assertThat(detail).contains("controller"))
                                .anySatisfy(detail -> assertThat(detail).contains("methods"));
                    });

            ArgumentCaptor<BuildRejectedEvent> captor = ArgumentCaptor.forClass(BuildRejectedEvent.class);
            verify(listener).onBuildRejected(captor.capture());
            assertThat(captor.getValue().violations()).hasSize(3);
        }

        @Test
        @DisplayName("Listener failures do not change the outcome")
        void listenerFailureIgnored() {
            doThrow(new IllegalStateException("metrics down")).when(listener).onArtifactBuilt(any());

            assertThat(engine().build(Mode.HTTP, ArtifactKind.CONFIG).has("app")).isTrue();
        }
    }

    @Nested
    @DisplayName("buildAll")
    class BuildAll {

        @Test
        @DisplayName("Returns all three kinds for the mode")
        void allKinds() {
            CompositionBundle bundle = engine("blog").buildAll(Mode.HTTP);

            assertThat(bundle.mode()).isEqualTo(Mode.HTTP);
            assertThat(bundle.routeTable().route("/posts")).isPresent();
            assertThat(bundle.serviceRegistry().definition("mailer"))
                    .get()
                    .satisfies(d -> assertThat(d.className()).isEqualTo("blog.QueuedMailer"));
            assertThat(bundle.configTree().string("app.name", "?")).isEqualTo("shop");
        }

        @Test
        @DisplayName("Failures of several kinds are all reported")
        void multipleFailures() {
            LayerSource badServices = InMemoryLayerSource.builder("app")
                    .yaml(Mode.HTTP, ArtifactKind.SERVICES, "mailer: {options: {host: x}}")
                    .build();
            LayerStack stack = LayerStack.builder()
                    .baseline(BASELINE)
                    .provider("broken")
                    .resolver(name -> Optional.of(BROKEN_ROUTES))
                    .appBase(badServices)
                    .build();
            CompositionEngine engine = new CompositionEngine(
                    new LayerSourceReader(stack), new CacheWriter(store, invalidator), listener);

            assertThatThrownBy(() -> engine.buildAll(Mode.HTTP))
                    .isInstanceOf(MissingRouteFieldException.class)
                    .satisfies(e -> assertThat(e.getSuppressed())
                            .singleElement()
                            .isInstanceOf(UnresolvableServiceDefinitionException.class));
        }
    }

    @Nested
    @DisplayName("warm")
    class Warm {

        @Test
        @DisplayName("Writes all three artifacts, loadable without any layer")
        void writesAll() {
            List<CacheArtifact> written = engine("blog").warm(Mode.HTTP, true, true);

            assertThat(written)
                    .extracting(CacheArtifact::kind)
                    .containsExactly(ArtifactKind.CONFIG, ArtifactKind.ROUTES, ArtifactKind.SERVICES);
            assertThat(new RuntimeLoader(store).loadAll(Mode.HTTP).routes().has("/posts")).isTrue();
            verify(invalidator, times(3)).invalidate(any());
            verify(listener, times(3)).onArtifactWritten(any(ArtifactWrittenEvent.class));
        }

        @Test
        @DisplayName("A single invalid route aborts the warm and leaves previous artifacts byte-identical")
        void noPartialWrites() throws IOException {
            engine("blog").warm(Mode.HTTP, true, true);
            Path routes = store.identity(ArtifactKind.ROUTES, Mode.HTTP);
            Path config = store.identity(ArtifactKind.CONFIG, Mode.HTTP);
            byte[] routesBefore = Files.readAllBytes(routes);
            byte[] configBefore = Files.readAllBytes(config);

            CompositionEngine broken = engine("blog", "broken");
            assertThatThrownBy(() -> broken.warm(Mode.HTTP, true, true)).isInstanceOf(MissingRouteFieldException.class);

            assertThat(Files.readAllBytes(routes)).isEqualTo(routesBefore);
            assertThat(Files.readAllBytes(config)).isEqualTo(configBefore);
        }

        @Test
        @DisplayName("Without overwrite, existing artifacts are skipped and not returned")
        void overwriteSkip() throws IOException {
            CompositionEngine engine = engine("blog");
            engine.warm(Mode.HTTP, true, false);
            Files.delete(store.identity(ArtifactKind.SERVICES, Mode.HTTP));

            List<CacheArtifact> written = engine.warm(Mode.HTTP, false, false);

            assertThat(written).extracting(CacheArtifact::kind).containsExactly(ArtifactKind.SERVICES);
            assertThat(engine.warm(Mode.HTTP, false, false)).isEmpty();
        }

        @Test
        @DisplayName("Without invalidation, the invalidator is never called")
        void noInvalidation() {
            engine("blog").warm(Mode.HTTP, true, false);

            verify(invalidator, never()).invalidate(any());
        }

        @Test
        @DisplayName("Unresolvable provider aborts before anything is written")
        void missingProvider() {
            CompositionEngine engine = engine("forum");

            assertThatThrownBy(() -> engine.warm(Mode.HTTP, true, true)).isInstanceOf(LayerResolutionException.class);
            assertThat(store.exists(ArtifactKind.CONFIG, Mode.HTTP)).isFalse();
        }

        @Test
        @DisplayName("warmAll writes every mode independently")
        void warmAll() {
            List<CacheArtifact> written = engine("blog").warmAll(List.of(Mode.HTTP, Mode.CLI), true, true);

            assertThat(written).hasSize(6);
            assertThat(store.exists(ArtifactKind.ROUTES, Mode.CLI)).isTrue();
            assertThat(new RuntimeLoader(store).loadConfig(Mode.CLI).string("app.name", "?"))
                    .isEqualTo("vendor");
        }
    }

    @Nested
    @DisplayName("Logging")
    class Logging {

        private ListAppender<ILoggingEvent> appender;
        private Logger engineLogger;

        @BeforeEach
        void attach() {
            engineLogger = (Logger) LoggerFactory.getLogger(CompositionEngine.class);
            appender = new ListAppender<>();
            appender.start();
            engineLogger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            engineLogger.detachAppender(appender);
            appender.stop();
        }

        @Test
        @DisplayName("Each build logs kind, mode and layer count at INFO")
        void buildLogged() {
            engine("blog").build(Mode.HTTP, ArtifactKind.CONFIG);

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anySatisfy(m -> assertThat(m).contains("kind=config", "mode=http", "layers=4"));
        }

        @Test
        @DisplayName("Listener failures are logged at WARN")
        void listenerFailureLogged() {
            doThrow(new IllegalStateException("metrics down")).when(listener).onArtifactBuilt(any());

            engine().build(Mode.HTTP, ArtifactKind.CONFIG);

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("CompositionListener.onArtifactBuilt failed");
        }
    }
}
