package ca.gc.cra.scribe.application.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.events.EventHandler;
import ca.gc.cra.scribe.application.state.StateManager;
import ca.gc.cra.scribe.domain.component.Activatable;
import ca.gc.cra.scribe.domain.component.Cleanable;
import ca.gc.cra.scribe.domain.component.ComponentScope;
import ca.gc.cra.scribe.domain.component.ComponentState;
import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.domain.component.Disposable;
import ca.gc.cra.scribe.domain.component.Initializable;
import ca.gc.cra.scribe.domain.component.LifecycleHookType;
import ca.gc.cra.scribe.domain.events.ComponentFailedEvent;
import ca.gc.cra.scribe.domain.events.ComponentRegisteredEvent;
import ca.gc.cra.scribe.domain.events.ComponentStateChangedEvent;
import ca.gc.cra.scribe.domain.events.ComponentUnregisteredEvent;
import ca.gc.cra.scribe.testutil.InMemoryStatePersistence;
import ca.gc.cra.scribe.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ComponentRegistryTest {
  private final List<String> reports = new ArrayList<>();
  private final List<ComponentStateChangedEvent> transitions = new ArrayList<>();
  private final List<ComponentFailedEvent> failures = new ArrayList<>();
  private final List<String> membership = new ArrayList<>();
  private final EventHandler<ComponentStateChangedEvent> transitionHandler = transitions::add;
  private final EventHandler<ComponentFailedEvent> failureHandler = failures::add;
  private final EventHandler<ComponentRegisteredEvent> registeredHandler =
      event -> membership.add("+" + event.componentId());
  private final EventHandler<ComponentUnregisteredEvent> unregisteredHandler =
      event -> membership.add("-" + event.componentId());

  private EventBus bus;
  private StateManager state;
  private RecordingMetricsPort metrics;
  private ComponentRegistry registry;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    bus = new EventBus(500, metrics);
    bus.registerHandler(ComponentStateChangedEvent.class, transitionHandler);
    bus.registerHandler(ComponentFailedEvent.class, failureHandler);
    bus.registerHandler(ComponentRegisteredEvent.class, registeredHandler);
    bus.registerHandler(ComponentUnregisteredEvent.class, unregisteredHandler);
    state = new StateManager(bus, new InMemoryStatePersistence());
    registry = new ComponentRegistry(bus, state,
        (type, message, cause) -> reports.add(type + ": " + message),
        java.time.Instant::now, metrics);
    TrackingService.events.clear();
    FlakyService.failActivation = false;
    FlakyService.disposed.clear();
  }

  @Test
  void registerIndexesAndPublishes() {
    String id = registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("documents")
        .tags("core", "io", "core")
        .build());

    assertEquals("documents", id);
    ComponentMetadata metadata = registry.getComponent(id).orElseThrow();
    assertEquals("DocumentService", metadata.name());
    assertEquals(ComponentState.REGISTERED, metadata.state());
    assertEquals(List.of("core", "io"), metadata.tags());
    assertEquals(List.of(metadata), registry.getComponentsByType(ComponentType.SERVICE));
    assertEquals(List.of(metadata), registry.getComponentsByTag("io"));
    assertEquals(List.of(metadata), registry.getComponentsByClass(DocumentService.class));
    assertEquals(List.of("core", "io"), registry.getAllTags());
    assertEquals(List.of("+documents"), membership);
    assertEquals(1, metrics.count("registry.components.registered"));
  }

  @Test
  void blankIdIsGenerated() {
    String id = registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).build());

    assertTrue(id.matches("DocumentService_[0-9a-f-]{8}"), id);
  }

  @Test
  void duplicateIdKeepsFirstRegistration() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).id("svc").build());
    String id = registry.register(
        ComponentDescriptor.builder(TrackingService.class, ComponentType.UTILITY).id("svc").build());

    assertEquals("svc", id);
    assertEquals(DocumentService.class, registry.getComponent("svc").orElseThrow().componentClass());
    assertEquals(1, registry.getAllComponents().size());
  }

  @Test
  void singletonIsSharedAndInitializedOnce() {
    registry.register(ComponentDescriptor.builder(TrackingService.class, ComponentType.SERVICE)
        .id("tracking").build());

    Object first = registry.createInstance("tracking");
    Object second = registry.createInstance("tracking");

    assertSame(first, second);
    assertSame(first, registry.getInstance("tracking"));
    assertEquals(List.of("init"), TrackingService.events);
    assertEquals(ComponentState.INITIALIZED, registry.getComponentState("tracking").orElseThrow());
    assertTrue(registry.getComponent("tracking").orElseThrow().initializedAt().isPresent());
    assertEquals(List.of(ComponentState.INITIALIZING, ComponentState.INITIALIZED),
        transitions.stream().map(ComponentStateChangedEvent::newState).toList());
  }

  @Test
  void transientCreatesNewInstanceEachTime() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").scope(ComponentScope.TRANSIENT).build());

    Object first = registry.createInstance("docs");
    Object second = registry.getInstance("docs");

    assertNotNull(first);
    assertNotSame(first, second);
  }

  @Test
  void scopedInstancesAreSharedPerScope() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").scope(ComponentScope.SCOPED).build());

    Object windowA = registry.createInstance("docs", "window-a");
    Object windowAagain = registry.createInstance("docs", "window-a");
    Object windowB = registry.createInstance("docs", "window-b");

    assertSame(windowA, windowAagain);
    assertNotSame(windowA, windowB);
    assertSame(windowB, registry.getInstance("docs", "window-b"));
    assertNull(registry.getInstance("docs", "window-c"));
  }

  @Test
  void dependenciesAreInjectedWithCommonServices() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("documentService").build());
    registry.register(ComponentDescriptor.builder(ExplorerView.class, ComponentType.VIEW)
        .id("explorer")
        .dependsOn("documentService")
        .config(Map.of("showHidden", true))
        .build());

    ExplorerView view = (ExplorerView) registry.createInstance("explorer");

    assertSame(registry.getInstance("documentService"), view.documents);
    assertSame(bus, view.dependencies.eventBus());
    assertSame(state, view.dependencies.stateManager());
    assertSame(registry, view.dependencies.registry());
    assertEquals(true, view.dependencies.config().get("showHidden"));
    assertEquals(ComponentState.INITIALIZED, registry.getComponentState("documentService").orElseThrow());
  }

  @Test
  void factoryIsPreferredOverConstructor() {
    DocumentService prebuilt = new DocumentService();
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").factory(deps -> prebuilt).build());

    assertSame(prebuilt, registry.createInstance("docs"));
    assertTrue(registry.getComponentFactory("docs").isPresent());

    registry.setComponentFactory("docs", null);
    assertFalse(registry.getComponentFactory("docs").isPresent());
  }

  @Test
  void componentConfigCanBeReplaced() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).id("docs").build());

    assertTrue(registry.setComponentConfig("docs", Map.of("cache", 10)));

    assertEquals(Map.of("cache", 10), registry.getComponentConfig("docs").orElseThrow());
    assertFalse(registry.setComponentConfig("unknown", Map.of()));
  }

  @Test
  void failingInitializeMovesToError() {
    registry.register(ComponentDescriptor.builder(BrokenService.class, ComponentType.SERVICE).id("broken").build());

    assertNull(registry.createInstance("broken"));

    assertEquals(ComponentState.ERROR, registry.getComponentState("broken").orElseThrow());
    assertEquals("cannot open workspace", registry.getComponentError("broken").orElseThrow());
    assertEquals(1, failures.size());
    assertEquals("createInstance", failures.get(0).operation());
    assertEquals(1, metrics.count("registry.components.failed"));
    assertTrue(reports.get(0).startsWith("ComponentLifecycle: "));
    assertNull(registry.getInstance("broken"));
  }

  @Test
  void classWithoutUsableConstructorFails() {
    registry.register(ComponentDescriptor.builder(NoUsableConstructor.class, ComponentType.UTILITY)
        .id("odd").build());

    assertNull(registry.createInstance("odd"));
    assertEquals(ComponentState.ERROR, registry.getComponentState("odd").orElseThrow());
  }

  @Test
  void dependencyCycleFailsEveryMember() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("a").dependsOn("b").build());
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("b").dependsOn("a").build());

    assertNull(registry.createInstance("a"));

    assertEquals(ComponentState.ERROR, registry.getComponentState("a").orElseThrow());
    assertEquals(ComponentState.ERROR, registry.getComponentState("b").orElseThrow());
    assertTrue(registry.getComponentError("a").orElseThrow().contains("a -> b -> a"));
  }

  @Test
  void missingDependencyIsSkipped() {
    registry.register(ComponentDescriptor.builder(ExplorerView.class, ComponentType.VIEW)
        .id("explorer").dependsOn("documentService").build());

    ExplorerView view = (ExplorerView) registry.createInstance("explorer");

    assertNotNull(view);
    assertNull(view.documents);
  }

  @Test
  void lifecycleRunsActivateDeactivateAndDispose() {
    registry.register(ComponentDescriptor.builder(TrackingService.class, ComponentType.SERVICE)
        .id("tracking").build());
    List<String> hooks = new ArrayList<>();
    registry.addLifecycleHook("tracking", LifecycleHookType.AFTER_INITIALIZE, instance -> hooks.add("afterInit"));
    registry.addLifecycleHook("tracking", LifecycleHookType.AFTER_ACTIVATE, instance -> hooks.add("afterActivate"));
    registry.addLifecycleHook("tracking", LifecycleHookType.BEFORE_DEACTIVATE,
        instance -> hooks.add("beforeDeactivate"));
    registry.addLifecycleHook("tracking", LifecycleHookType.BEFORE_DISPOSE, instance -> hooks.add("beforeDispose"));

    registry.createInstance("tracking");
    assertTrue(registry.activate("tracking"));
    assertFalse(registry.activate("tracking"));
    assertTrue(registry.deactivate("tracking"));
    assertTrue(registry.dispose("tracking"));

    assertEquals(List.of("init", "activate", "deactivate", "dispose"), TrackingService.events);
    assertEquals(List.of("afterInit", "afterActivate", "beforeDeactivate", "beforeDispose"), hooks);
    ComponentMetadata metadata = registry.getComponent("tracking").orElseThrow();
    assertEquals(ComponentState.DISPOSED, metadata.state());
    assertTrue(metadata.lastActiveAt().isPresent());
    assertTrue(metadata.disposedAt().isPresent());
    assertNull(registry.getInstance("tracking"));
  }

  @Test
  void disposeFallsBackToCleanup() {
    registry.register(ComponentDescriptor.builder(CleanableView.class, ComponentType.VIEW).id("view").build());
    CleanableView view = (CleanableView) registry.createInstance("view");

    registry.dispose("view");

    assertTrue(view.cleaned);
  }

  @Test
  void disposeRequiresLiveComponent() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).id("docs").build());

    assertFalse(registry.dispose("docs"));
    assertFalse(registry.deactivate("docs"));
  }

  @Test
  void failingHookIsReportedButTransitionSucceeds() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).id("docs").build());
    LifecycleHook failing = instance -> {
      throw new IllegalStateException("hook broke");
    };
    registry.addLifecycleHook("docs", LifecycleHookType.AFTER_INITIALIZE, failing);

    assertNotNull(registry.createInstance("docs"));

    assertEquals(ComponentState.INITIALIZED, registry.getComponentState("docs").orElseThrow());
    assertTrue(reports.get(0).startsWith("ComponentLifecycleHook: "));
    assertTrue(registry.removeLifecycleHook("docs", LifecycleHookType.AFTER_INITIALIZE, failing));
    assertFalse(registry.removeLifecycleHook("docs", LifecycleHookType.AFTER_INITIALIZE, failing));
  }

  @Test
  void unregisterIsRefusedWhileChildrenOrDependentsExist() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE).id("docs").build());
    registry.register(ComponentDescriptor.builder(ExplorerView.class, ComponentType.VIEW)
        .id("explorer").dependsOn("docs").parent("docs").build());

    assertFalse(registry.unregister("docs"));
    assertEquals(List.of("explorer"), registry.getComponentDependents("docs"));
    assertEquals(List.of("explorer"), registry.getComponentChildren("docs"));

    assertTrue(registry.unregister("explorer"));
    assertTrue(registry.unregister("docs"));
    assertFalse(registry.unregister("docs"));
    assertTrue(registry.getAllComponents().isEmpty());
    assertTrue(registry.getAllTags().isEmpty());
    assertEquals(List.of("+docs", "+explorer", "-explorer", "-docs"), membership);
  }

  @Test
  void unregisterDisposesLiveComponent() {
    registry.register(ComponentDescriptor.builder(TrackingService.class, ComponentType.SERVICE)
        .id("tracking").build());
    registry.createInstance("tracking");

    assertTrue(registry.unregister("tracking"));

    assertEquals(List.of("init", "dispose"), TrackingService.events);
  }

  @Test
  void hierarchyAndTreeFollowParents() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.VIEW).id("main").build());
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.VIEW)
        .id("sidebar").parent("main").build());
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.VIEW)
        .id("outline").parent("sidebar").build());
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.VIEW)
        .id("orphan").parent("missing").build());

    assertEquals(List.of("main", "sidebar", "outline"), registry.getComponentHierarchy("outline"));
    assertEquals("sidebar", registry.getComponentParent("outline").orElseThrow());
    assertFalse(registry.getComponentParent("orphan").isPresent());

    Map<String, Object> tree = registry.getComponentTree("main");
    assertEquals("main", tree.get("componentId"));
    @SuppressWarnings("unchecked")
    Map<String, Object> children = (Map<String, Object>) tree.get("children");
    assertEquals(List.of("sidebar"), List.copyOf(children.keySet()));

    Map<String, Object> forest = registry.getComponentTree(null);
    assertEquals(List.of("main", "orphan"), List.copyOf(forest.keySet()));
    assertTrue(registry.getComponentTree("missing").isEmpty());
  }

  @Test
  void metadataMapUsesStableKeys() {
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").version("2.1.0").build());

    Map<String, Object> map = registry.getComponent("docs").orElseThrow().toMap();

    assertEquals("docs", map.get("componentId"));
    assertEquals("SERVICE", map.get("componentType"));
    assertEquals("2.1.0", map.get("version"));
    assertEquals("REGISTERED", map.get("state"));
    assertNull(map.get("initializedAt"));
    assertNotNull(map.get("createdAt"));
  }

  @Test
  void clearDisposesEverything() {
    registry.register(ComponentDescriptor.builder(TrackingService.class, ComponentType.SERVICE)
        .id("tracking").build());
    registry.createInstance("tracking");
    registry.addDiscoveryPath(java.nio.file.Path.of("plugins"));

    registry.clear();

    assertEquals(List.of("init", "dispose"), TrackingService.events);
    assertTrue(registry.getAllComponents().isEmpty());
    assertTrue(registry.getDiscoveryPaths().isEmpty());
  }

  @Test
  void recreatingDisposedSingletonInitializesAgain() {
    registry.register(ComponentDescriptor.builder(TrackingService.class, ComponentType.SERVICE)
        .id("tracking").build());
    Object first = registry.createInstance("tracking");
    registry.dispose("tracking");

    Object second = registry.createInstance("tracking");

    assertNotSame(first, second);
    assertEquals(ComponentState.INITIALIZED, registry.getComponentState("tracking").orElseThrow());
  }

  @Test
  void failedActivationReleasesInstanceAndAllowsRetry() {
    registry.register(ComponentDescriptor.builder(FlakyService.class, ComponentType.SERVICE)
        .id("flaky").build());
    FlakyService first = (FlakyService) registry.createInstance("flaky");
    FlakyService.failActivation = true;

    assertFalse(registry.activate("flaky"));

    assertEquals(ComponentState.ERROR, registry.getComponentState("flaky").orElseThrow());
    assertNull(registry.getComponent("flaky").orElseThrow().instance());
    assertEquals(List.of(first), FlakyService.disposed);

    FlakyService.failActivation = false;
    Object retried = registry.createInstance("flaky");

    assertNotNull(retried);
    assertNotSame(first, retried);
    assertEquals(ComponentState.INITIALIZED, registry.getComponentState("flaky").orElseThrow());
    assertTrue(registry.activate("flaky"));
  }

  @Test
  void failedScopedCreationDisposesInstancesInOtherScopes() {
    List<Object> disposed = new ArrayList<>();
    ComponentFactory factory = dependencies -> {
      if ("window-b".equals(dependencies.scopeId())) {
        throw new IllegalStateException("window-b unavailable");
      }
      return new DocumentService();
    };
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").scope(ComponentScope.SCOPED).factory(factory).build());
    registry.addLifecycleHook("docs", LifecycleHookType.BEFORE_DISPOSE, disposed::add);
    Object windowA = registry.createInstance("docs", "window-a");

    assertNull(registry.createInstance("docs", "window-b"));

    assertEquals(List.of(windowA), disposed);
    assertTrue(registry.unregister("docs"));
    registry.register(ComponentDescriptor.builder(DocumentService.class, ComponentType.SERVICE)
        .id("docs").scope(ComponentScope.SCOPED).build());
    Object fresh = registry.createInstance("docs", "window-a");

    assertNotNull(fresh);
    assertNotSame(windowA, fresh);
    assertEquals(List.of(windowA), disposed);
  }

  @Test
  void lifecycleFailureIsLoggedOnceAsWarning() {
    Logger logger = (Logger) LoggerFactory.getLogger(ComponentRegistry.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      registry.register(ComponentDescriptor.builder(BrokenService.class, ComponentType.SERVICE)
          .id("broken").build());

      registry.createInstance("broken");
    } finally {
      logger.detachAppender(appender);
    }

    List<ILoggingEvent> failuresLogged = appender.list.stream()
        .filter(event -> event.getFormattedMessage().startsWith("Error during createInstance"))
        .toList();
    assertEquals(1, failuresLogged.size());
    assertEquals(Level.WARN, failuresLogged.get(0).getLevel());
    assertNull(failuresLogged.get(0).getThrowableProxy());
    assertTrue(appender.list.stream().noneMatch(event -> event.getLevel() == Level.ERROR));
  }

  public static final class DocumentService {
  }

  public static final class ExplorerView {
    final ResolvedDependencies dependencies;
    final DocumentService documents;

    public ExplorerView(ResolvedDependencies dependencies) {
      this.dependencies = dependencies;
      this.documents = dependencies.dependency("documentService", DocumentService.class);
    }
  }

  public static final class TrackingService implements Initializable, Activatable, Disposable {
    static final List<String> events = new ArrayList<>();

    @Override
    public void initialize() {
      events.add("init");
    }

    @Override
    public void activate() {
      events.add("activate");
    }

    @Override
    public void deactivate() {
      events.add("deactivate");
    }

    @Override
    public void dispose() {
      events.add("dispose");
    }
  }

  public static final class FlakyService implements Activatable, Disposable {
    static boolean failActivation;
    static final List<FlakyService> disposed = new ArrayList<>();

    @Override
    public void activate() {
      if (failActivation) {
        throw new IllegalStateException("display lost");
      }
    }

    @Override
    public void deactivate() {
    }

    @Override
    public void dispose() {
      disposed.add(this);
    }
  }

  public static final class CleanableView implements Cleanable {
    boolean cleaned;

    @Override
    public void cleanup() {
      cleaned = true;
    }
  }

  public static final class BrokenService implements Initializable {
    @Override
    public void initialize() throws Exception {
      throw new java.io.IOException("cannot open workspace");
    }
  }

  public static final class NoUsableConstructor {
    public NoUsableConstructor(String unused) {
    }
  }
}
