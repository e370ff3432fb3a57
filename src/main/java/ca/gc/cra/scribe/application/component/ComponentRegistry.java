package ca.gc.cra.scribe.application.component;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.ErrorReporter;
import ca.gc.cra.scribe.application.port.MetricsPort;
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
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dependency-injection container and lifecycle manager for SCRIBE UI components.
 * <p><strong>Why:</strong> Views, view models and services are registered once and wired by id, so no
 * component constructs or looks up another directly.</p>
 * <p><strong>Role:</strong> Application service on top of the {@link EventBus} and {@link StateManager};
 * hands both, itself and the {@link ErrorReporter} to every component as common services.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register components and index them by type, tag, class, dependency and parent.</li>
 *   <li>Create instances per {@link ComponentScope}, resolving declared dependencies depth-first and
 *   failing fast on dependency cycles.</li>
 *   <li>Drive the lifecycle state machine and run {@link LifecycleHook}s.</li>
 *   <li>Discover annotated components on the class path.</li>
 * </ul>
 * <p><strong>Error policy:</strong> Exceptions raised by component code are caught at this boundary. The
 * component moves to {@link ComponentState#ERROR}, a {@code ComponentFailedEvent} is published, the error
 * is reported, and the operation returns {@code null} or {@code false}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the UI thread.</p>
 * <p><strong>Observability:</strong> Counts {@code registry.components.registered} and
 * {@code registry.components.failed}; publishes a {@code ComponentStateChangedEvent} per transition.</p>
 *
 * @since 0.1.0
 */
public final class ComponentRegistry {
  private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

  /** Scope id used when callers do not name one. */
  public static final String DEFAULT_SCOPE = "default";

  static final String LIFECYCLE_ERROR_TYPE = "ComponentLifecycle";
  static final String HOOK_ERROR_TYPE = "ComponentLifecycleHook";
  static final String DISCOVERY_ERROR_TYPE = "ComponentDiscovery";

  private final EventBus eventBus;
  private final StateManager stateManager;
  private final ErrorReporter errorReporter;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final Map<String, ComponentMetadata> components = new LinkedHashMap<>();
  private final Map<ComponentType, Set<String>> componentsByType = new EnumMap<>(ComponentType.class);
  private final Map<String, Set<String>> componentsByTag = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> scopes = new LinkedHashMap<>();
  private final Map<String, Map<LifecycleHookType, List<LifecycleHook>>> lifecycleHooks = new HashMap<>();
  private final List<Path> discoveryPaths = new ArrayList<>();
  private final List<String> resolving = new ArrayList<>();
  private final ComponentScanner scanner = new ComponentScanner(ComponentRegistry.class.getClassLoader());

  /**
   * Creates a registry with the system clock and no metrics.
   */
  public ComponentRegistry(EventBus eventBus, StateManager stateManager, ErrorReporter errorReporter) {
    this(eventBus, stateManager, errorReporter, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Creates a registry.
   *
   * @param eventBus bus receiving component events and injected into components
   * @param stateManager state store injected into components
   * @param errorReporter sink for lifecycle failures, also injected into components
   * @param clock time source for lifecycle timestamps
   * @param metrics metrics sink
   */
  public ComponentRegistry(
      EventBus eventBus,
      StateManager stateManager,
      ErrorReporter errorReporter,
      ClockPort clock,
      MetricsPort metrics) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
    this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  // Registration

  /**
   * Registers a component.
   *
   * <p>A blank id is replaced by {@code SimpleClassName_xxxxxxxx}; a blank name by the simple class name.
   * Registering an id that is already present logs a warning and leaves the registry unchanged.</p>
   *
   * @param descriptor registration request; never {@code null}
   * @return the component id
   */
  public String register(ComponentDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    String simpleName = descriptor.componentClass().getSimpleName();
    String componentId = descriptor.componentId().isEmpty()
        ? simpleName + '_' + UUID.randomUUID().toString().substring(0, 8)
        : descriptor.componentId();
    String name = descriptor.name().isEmpty() ? simpleName : descriptor.name();

    if (components.containsKey(componentId)) {
      log.warn("Component with ID {} is already registered", componentId);
      return componentId;
    }

    ComponentMetadata metadata = new ComponentMetadata(componentId, name, descriptor, clock.now());
    String parentId = descriptor.parentId();
    if (!parentId.isEmpty()) {
      ComponentMetadata parent = components.get(parentId);
      if (parent == null) {
        log.warn("Parent component with ID {} not found for {}", parentId, componentId);
      } else {
        metadata.setParentId(parentId);
        parent.addChild(componentId);
      }
    }

    components.put(componentId, metadata);
    componentsByType.computeIfAbsent(metadata.componentType(), type -> new LinkedHashSet<>()).add(componentId);
    for (String tag : metadata.tags()) {
      componentsByTag.computeIfAbsent(tag, key -> new LinkedHashSet<>()).add(componentId);
    }

    metrics.increment("registry.components.registered");
    eventBus.emit(new ComponentRegisteredEvent(componentId, metadata.componentType(), name));
    log.debug("Component {} registered", componentId);
    return componentId;
  }

  /**
   * Removes a component. Refused, with a warning, when the component has children or another component
   * lists it as a dependency. A live component is disposed first.
   *
   * @return {@code true} if the component was removed
   */
  public boolean unregister(String componentId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    if (metadata.hasChildren()) {
      log.warn("Component {} has children and cannot be unregistered", componentId);
      return false;
    }
    List<String> dependents = getComponentDependents(componentId);
    if (!dependents.isEmpty()) {
      log.warn("Component {} is a dependency for {} and cannot be unregistered", componentId, dependents);
      return false;
    }

    if (metadata.state().isLive()) {
      dispose(componentId);
    }
    releaseInstances(metadata, true);
    metadata.parentId().map(components::get).ifPresent(parent -> parent.removeChild(componentId));

    components.remove(componentId);
    Set<String> sameType = componentsByType.get(metadata.componentType());
    if (sameType != null) {
      sameType.remove(componentId);
    }
    for (String tag : metadata.tags()) {
      Set<String> tagged = componentsByTag.get(tag);
      if (tagged != null && tagged.remove(componentId) && tagged.isEmpty()) {
        componentsByTag.remove(tag);
      }
    }
    lifecycleHooks.remove(componentId);

    eventBus.emit(new ComponentUnregisteredEvent(componentId, metadata.componentType(), metadata.name()));
    log.debug("Component {} unregistered", componentId);
    return true;
  }

  // Instances

  public Object createInstance(String componentId) {
    return createInstance(componentId, DEFAULT_SCOPE);
  }

  /**
   * Returns an instance of the component, creating it when the scope does not already hold one.
   *
   * <p>Singletons and scoped components return their cached instance when present. Otherwise declared
   * dependencies are resolved depth-first in the same scope, the instance is built by its factory or by
   * direct construction, {@link Initializable#initialize()} and the
   * {@link LifecycleHookType#AFTER_INITIALIZE} hooks run, and the instance is cached per scope.</p>
   *
   * @param componentId registered id
   * @param scopeId scope bucket for {@link ComponentScope#SCOPED} components
   * @return the instance, or {@code null} if the component is unknown or creation failed
   */
  public Object createInstance(String componentId, String scopeId) {
    Objects.requireNonNull(scopeId, "scopeId");
    try {
      return instantiate(componentId, scopeId);
    } catch (DependencyCycleException ex) {
      log.warn("Instance of {} not created: {}", componentId, ex.getMessage());
      return null;
    }
  }

  /**
   * Typed variant of {@link #createInstance(String, String)}.
   *
   * @throws ClassCastException if the instance is not a {@code type}
   */
  public <T> T createInstance(String componentId, String scopeId, Class<T> type) {
    return type.cast(createInstance(componentId, scopeId));
  }

  public Object getInstance(String componentId) {
    return getInstance(componentId, DEFAULT_SCOPE);
  }

  /**
   * Returns an existing instance of a live component. Transient components always yield a new instance.
   *
   * @return the instance, or {@code null} if the component is unknown, not live, or has no instance in
   *     {@code scopeId}
   */
  public Object getInstance(String componentId, String scopeId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return null;
    }
    if (!metadata.state().isLive()) {
      log.warn("Component {} is not initialized (state {})", componentId, metadata.state());
      return null;
    }
    return switch (metadata.scope()) {
      case SINGLETON -> metadata.instance();
      case SCOPED -> {
        Map<String, Object> bucket = scopes.get(scopeId);
        if (bucket == null) {
          log.warn("Scope with ID {} not found", scopeId);
          yield null;
        }
        yield bucket.get(componentId);
      }
      case TRANSIENT -> createInstance(componentId, scopeId);
    };
  }

  public <T> T getInstance(String componentId, String scopeId, Class<T> type) {
    return type.cast(getInstance(componentId, scopeId));
  }

  // Lifecycle

  /**
   * Disposes every live instance of the component: {@link LifecycleHookType#BEFORE_DISPOSE} hooks run,
   * then {@link Disposable#dispose()}, or {@link Cleanable#cleanup()} when the instance is not
   * {@link Disposable}.
   *
   * @return {@code true} if the component reached {@link ComponentState#DISPOSED}
   */
  public boolean dispose(String componentId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    if (!metadata.state().isLive()) {
      log.warn("Component {} is not initialized (state {})", componentId, metadata.state());
      return false;
    }

    transition(metadata, ComponentState.DISPOSING);
    try {
      if (metadata.scope() == ComponentScope.SINGLETON && metadata.instance() != null) {
        disposeInstance(componentId, metadata.instance());
        metadata.setInstance(null);
      } else if (metadata.scope() == ComponentScope.SCOPED) {
        Iterator<Map<String, Object>> buckets = scopes.values().iterator();
        while (buckets.hasNext()) {
          Map<String, Object> bucket = buckets.next();
          Object instance = bucket.get(componentId);
          if (instance != null) {
            disposeInstance(componentId, instance);
            bucket.remove(componentId);
          }
          if (bucket.isEmpty()) {
            buckets.remove();
          }
        }
      }
      metadata.markDisposed(clock.now());
      transition(metadata, ComponentState.DISPOSED);
      log.debug("Component {} disposed", componentId);
      return true;
    } catch (Exception ex) {
      fail(metadata, "dispose", ex);
      return false;
    }
  }

  /**
   * Moves an initialized or inactive component to {@link ComponentState#ACTIVE}, calling
   * {@link Activatable#activate()} on held instances and then the {@link LifecycleHookType#AFTER_ACTIVATE}
   * hooks.
   *
   * @return {@code true} on success
   */
  public boolean activate(String componentId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    if (metadata.state() != ComponentState.INITIALIZED && metadata.state() != ComponentState.INACTIVE) {
      log.warn("Component {} cannot be activated from state {}", componentId, metadata.state());
      return false;
    }
    try {
      List<Object> instances = heldInstances(metadata);
      for (Object instance : instances) {
        if (instance instanceof Activatable activatable) {
          activatable.activate();
        }
      }
      runHooksForInstances(componentId, LifecycleHookType.AFTER_ACTIVATE, instances);
      metadata.markActive(clock.now());
      transition(metadata, ComponentState.ACTIVE);
      log.debug("Component {} activated", componentId);
      return true;
    } catch (Exception ex) {
      fail(metadata, "activate", ex);
      return false;
    }
  }

  /**
   * Moves an active component to {@link ComponentState#INACTIVE}, running the
   * {@link LifecycleHookType#BEFORE_DEACTIVATE} hooks and then {@link Activatable#deactivate()}.
   *
   * @return {@code true} on success
   */
  public boolean deactivate(String componentId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    if (metadata.state() != ComponentState.ACTIVE) {
      log.warn("Component {} is not active (state {})", componentId, metadata.state());
      return false;
    }
    try {
      List<Object> instances = heldInstances(metadata);
      runHooksForInstances(componentId, LifecycleHookType.BEFORE_DEACTIVATE, instances);
      for (Object instance : instances) {
        if (instance instanceof Activatable activatable) {
          activatable.deactivate();
        }
      }
      transition(metadata, ComponentState.INACTIVE);
      log.debug("Component {} deactivated", componentId);
      return true;
    } catch (Exception ex) {
      fail(metadata, "deactivate", ex);
      return false;
    }
  }

  /**
   * Adds a hook for a registered component. Hooks of one type run in registration order.
   *
   * @return {@code false} if the component is unknown
   */
  public boolean addLifecycleHook(String componentId, LifecycleHookType hookType, LifecycleHook hook) {
    Objects.requireNonNull(hookType, "hookType");
    Objects.requireNonNull(hook, "hook");
    if (!components.containsKey(componentId)) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    lifecycleHooks
        .computeIfAbsent(componentId, id -> new EnumMap<>(LifecycleHookType.class))
        .computeIfAbsent(hookType, type -> new ArrayList<>())
        .add(hook);
    log.debug("Added {} hook for component {}", hookType, componentId);
    return true;
  }

  public boolean removeLifecycleHook(String componentId, LifecycleHookType hookType, LifecycleHook hook) {
    Map<LifecycleHookType, List<LifecycleHook>> hooks = lifecycleHooks.get(componentId);
    if (hooks == null) {
      return false;
    }
    List<LifecycleHook> ofType = hooks.get(hookType);
    if (ofType == null || !ofType.remove(hook)) {
      return false;
    }
    if (ofType.isEmpty()) {
      hooks.remove(hookType);
    }
    log.debug("Removed {} hook for component {}", hookType, componentId);
    return true;
  }

  // Configuration and factories

  public boolean setComponentConfig(String componentId, Map<String, Object> config) {
    Objects.requireNonNull(config, "config");
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    metadata.setConfig(config);
    return true;
  }

  public Optional<Map<String, Object>> getComponentConfig(String componentId) {
    return getComponent(componentId).map(ComponentMetadata::config);
  }

  /**
   * Replaces the factory used for future instances of the component.
   *
   * @param factory new factory; {@code null} restores direct construction
   * @return {@code false} if the component is unknown
   */
  public boolean setComponentFactory(String componentId, ComponentFactory factory) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return false;
    }
    metadata.setFactory(factory);
    return true;
  }

  public Optional<ComponentFactory> getComponentFactory(String componentId) {
    return getComponent(componentId).flatMap(ComponentMetadata::factory);
  }

  // Discovery

  public void addDiscoveryPath(Path path) {
    Objects.requireNonNull(path, "path");
    if (!discoveryPaths.contains(path)) {
      discoveryPaths.add(path);
      log.debug("Discovery path added: {}", path);
    }
  }

  public boolean removeDiscoveryPath(Path path) {
    if (discoveryPaths.remove(path)) {
      log.debug("Discovery path removed: {}", path);
      return true;
    }
    log.warn("Discovery path not found: {}", path);
    return false;
  }

  public List<Path> getDiscoveryPaths() {
    return List.copyOf(discoveryPaths);
  }

  /**
   * Registers annotated components found under every discovery path.
   *
   * @return ids of the discovered components
   */
  public List<String> discoverComponents() {
    List<String> discovered = new ArrayList<>();
    for (Path path : List.copyOf(discoveryPaths)) {
      discovered.addAll(discoverComponents(path, ""));
    }
    return discovered;
  }

  public List<String> discoverComponents(Path root) {
    return discoverComponents(root, "");
  }

  /**
   * Registers annotated components found under {@code root}, optionally restricted to one package.
   *
   * @param root class-path root directory
   * @param packagePrefix package name such as {@code com.example.views}, or empty for the whole root
   * @return ids of the discovered components
   */
  public List<String> discoverComponents(Path root, String packagePrefix) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(packagePrefix, "packagePrefix");
    List<Class<?>> types;
    try {
      types = scanner.scan(root, packagePrefix);
    } catch (IOException ex) {
      log.error("Error discovering components in {}", root, ex);
      errorReporter.report(DISCOVERY_ERROR_TYPE, "Discovering components in " + root, ex);
      return List.of();
    }
    List<String> discovered = new ArrayList<>();
    for (Class<?> type : types) {
      try {
        discovered.add(register(ComponentDescriptor.fromAnnotation(type)));
      } catch (RuntimeException ex) {
        log.error("Error registering discovered component {}", type.getName(), ex);
        errorReporter.report(DISCOVERY_ERROR_TYPE, "Registering discovered component " + type.getName(), ex);
      }
    }
    log.info("Discovered {} components under {}", discovered.size(), root);
    return discovered;
  }

  // Queries

  public Optional<ComponentMetadata> getComponent(String componentId) {
    return Optional.ofNullable(components.get(componentId));
  }

  public List<ComponentMetadata> getComponentsByType(ComponentType componentType) {
    return metadataFor(componentsByType.get(componentType));
  }

  public List<ComponentMetadata> getComponentsByTag(String tag) {
    return metadataFor(componentsByTag.get(tag));
  }

  public List<ComponentMetadata> getComponentsByClass(Class<?> componentClass) {
    List<ComponentMetadata> matches = new ArrayList<>();
    for (ComponentMetadata metadata : components.values()) {
      if (metadata.componentClass().equals(componentClass)) {
        matches.add(metadata);
      }
    }
    return matches;
  }

  public Optional<ComponentState> getComponentState(String componentId) {
    return getComponent(componentId).map(ComponentMetadata::state);
  }

  public Optional<String> getComponentError(String componentId) {
    return getComponent(componentId).flatMap(ComponentMetadata::error);
  }

  public List<String> getComponentDependencies(String componentId) {
    return getComponent(componentId).map(ComponentMetadata::dependencies).orElse(List.of());
  }

  /**
   * Returns the ids of components that list {@code componentId} as a dependency.
   */
  public List<String> getComponentDependents(String componentId) {
    List<String> dependents = new ArrayList<>();
    for (ComponentMetadata metadata : components.values()) {
      if (!metadata.componentId().equals(componentId) && metadata.dependencies().contains(componentId)) {
        dependents.add(metadata.componentId());
      }
    }
    return dependents;
  }

  public List<String> getComponentChildren(String componentId) {
    return getComponent(componentId).map(ComponentMetadata::childrenIds).orElse(List.of());
  }

  public Optional<String> getComponentParent(String componentId) {
    return getComponent(componentId).flatMap(ComponentMetadata::parentId);
  }

  /**
   * Returns the chain of ids from the root ancestor down to {@code componentId}.
   */
  public List<String> getComponentHierarchy(String componentId) {
    if (!components.containsKey(componentId)) {
      log.warn("Component with ID {} not found", componentId);
      return List.of(componentId);
    }
    List<String> hierarchy = new ArrayList<>();
    String current = componentId;
    while (current != null && !hierarchy.contains(current)) {
      hierarchy.add(0, current);
      current = getComponentParent(current).orElse(null);
    }
    return hierarchy;
  }

  /**
   * Returns the component tree. Each node is {@link ComponentMetadata#toMap()} plus a {@code children}
   * map keyed by child id.
   *
   * @param rootId root of the subtree, or {@code null} for a forest keyed by every parentless component
   * @return nested maps; empty when {@code rootId} is unknown
   */
  public Map<String, Object> getComponentTree(String rootId) {
    if (rootId != null) {
      if (!components.containsKey(rootId)) {
        log.warn("Component with ID {} not found", rootId);
        return Map.of();
      }
      return buildTree(rootId);
    }
    Map<String, Object> forest = new LinkedHashMap<>();
    for (ComponentMetadata metadata : components.values()) {
      if (metadata.parentId().isEmpty()) {
        forest.put(metadata.componentId(), buildTree(metadata.componentId()));
      }
    }
    return forest;
  }

  public Map<String, ComponentMetadata> getAllComponents() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(components));
  }

  public List<String> getAllTags() {
    return List.copyOf(componentsByTag.keySet());
  }

  /**
   * Disposes every live component and empties the registry, including hooks and discovery paths.
   */
  public void clear() {
    for (String componentId : List.copyOf(components.keySet())) {
      if (components.get(componentId).state().isLive()) {
        dispose(componentId);
      }
    }
    components.clear();
    componentsByType.clear();
    componentsByTag.clear();
    scopes.clear();
    lifecycleHooks.clear();
    discoveryPaths.clear();
    scanner.close();
    log.debug("Component registry cleared");
  }

  private Object instantiate(String componentId, String scopeId) {
    ComponentMetadata metadata = components.get(componentId);
    if (metadata == null) {
      log.warn("Component with ID {} not found", componentId);
      return null;
    }
    if (metadata.scope() == ComponentScope.SINGLETON && metadata.instance() != null) {
      return metadata.instance();
    }
    if (metadata.scope() == ComponentScope.SCOPED) {
      Map<String, Object> bucket = scopes.get(scopeId);
      if (bucket != null && bucket.containsKey(componentId)) {
        return bucket.get(componentId);
      }
    }
    int position = resolving.indexOf(componentId);
    if (position >= 0) {
      List<String> cycle = new ArrayList<>(resolving.subList(position, resolving.size()));
      cycle.add(componentId);
      throw new DependencyCycleException(cycle);
    }

    ComponentState previous = metadata.state();
    ComponentState settled = previous.isLive() ? previous : ComponentState.INITIALIZED;
    transition(metadata, ComponentState.INITIALIZING);
    resolving.add(componentId);
    try {
      ResolvedDependencies dependencies = resolveDependencies(metadata, scopeId);
      Object instance = construct(metadata, dependencies);
      if (instance instanceof Initializable initializable) {
        initializable.initialize();
      }
      runHooks(componentId, LifecycleHookType.AFTER_INITIALIZE, instance);

      if (metadata.scope() == ComponentScope.SINGLETON) {
        metadata.setInstance(instance);
      } else if (metadata.scope() == ComponentScope.SCOPED) {
        scopes.computeIfAbsent(scopeId, id -> new LinkedHashMap<>()).put(componentId, instance);
      }
      metadata.markInitialized(clock.now());
      transition(metadata, settled);
      log.debug("Component {} initialized", componentId);
      return instance;
    } catch (DependencyCycleException ex) {
      fail(metadata, "createInstance", ex);
      throw ex;
    } catch (Exception ex) {
      fail(metadata, "createInstance", ex);
      return null;
    } finally {
      resolving.remove(resolving.size() - 1);
    }
  }

  private ResolvedDependencies resolveDependencies(ComponentMetadata metadata, String scopeId) {
    Map<String, Object> resolved = new LinkedHashMap<>();
    for (String dependencyId : metadata.dependencies()) {
      ComponentMetadata dependency = components.get(dependencyId);
      if (dependency == null) {
        log.warn("Missing dependency {} for component {}", dependencyId, metadata.componentId());
        continue;
      }
      Object instance = dependency.state().isLive() && dependency.scope() != ComponentScope.TRANSIENT
          ? getInstance(dependencyId, scopeId)
          : null;
      if (instance == null) {
        instance = instantiate(dependencyId, scopeId);
      }
      if (instance == null) {
        log.warn("Dependency {} for component {} could not be resolved", dependencyId, metadata.componentId());
      } else {
        resolved.put(dependencyId, instance);
      }
    }
    return new ResolvedDependencies(
        metadata.componentId(), scopeId, resolved, metadata.config(),
        eventBus, stateManager, this, errorReporter);
  }

  private static Object construct(ComponentMetadata metadata, ResolvedDependencies dependencies)
      throws Exception {
    Optional<ComponentFactory> factory = metadata.factory();
    Object instance;
    if (factory.isPresent()) {
      instance = factory.get().create(dependencies);
    } else {
      instance = constructDirectly(metadata.componentClass(), dependencies);
    }
    if (instance == null) {
      throw new ComponentInstantiationException(
          "Factory for " + metadata.componentId() + " returned null");
    }
    return instance;
  }

  private static Object constructDirectly(Class<?> type, ResolvedDependencies dependencies)
      throws Exception {
    Constructor<?> injecting = findConstructor(type, ResolvedDependencies.class);
    Constructor<?> noArg = findConstructor(type);
    try {
      if (injecting != null) {
        return injecting.newInstance(dependencies);
      }
      if (noArg != null) {
        return noArg.newInstance();
      }
    } catch (InvocationTargetException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      throw ex;
    }
    throw new ComponentInstantiationException(type.getName()
        + " has neither a public (ResolvedDependencies) constructor nor a public no-arg constructor");
  }

  private static Constructor<?> findConstructor(Class<?> type, Class<?>... parameterTypes) {
    for (Constructor<?> constructor : type.getConstructors()) {
      if (Arrays.equals(constructor.getParameterTypes(), parameterTypes)) {
        return constructor;
      }
    }
    return null;
  }

  private void disposeInstance(String componentId, Object instance) throws Exception {
    runHooks(componentId, LifecycleHookType.BEFORE_DISPOSE, instance);
    if (instance instanceof Disposable disposable) {
      disposable.dispose();
    } else if (instance instanceof Cleanable cleanable) {
      cleanable.cleanup();
    }
  }

  /**
   * Drops every held instance of the component, singleton slot and scope buckets alike, optionally
   * disposing each one first. Disposal failures are logged and do not stop the release.
   */
  private void releaseInstances(ComponentMetadata metadata, boolean runDisposal) {
    String componentId = metadata.componentId();
    List<Object> instances = heldInstances(metadata);
    metadata.setInstance(null);
    Iterator<Map<String, Object>> buckets = scopes.values().iterator();
    while (buckets.hasNext()) {
      Map<String, Object> bucket = buckets.next();
      bucket.remove(componentId);
      if (bucket.isEmpty()) {
        buckets.remove();
      }
    }
    if (!runDisposal) {
      return;
    }
    for (Object instance : instances) {
      try {
        disposeInstance(componentId, instance);
      } catch (Exception ex) {
        log.warn("Could not dispose released instance of component {}: {}", componentId, ex.getMessage());
        errorReporter.report(
            LIFECYCLE_ERROR_TYPE, "Error during release of component " + componentId, ex);
      }
    }
  }

  private List<Object> heldInstances(ComponentMetadata metadata) {
    List<Object> instances = new ArrayList<>();
    if (metadata.scope() == ComponentScope.SINGLETON) {
      if (metadata.instance() != null) {
        instances.add(metadata.instance());
      }
    } else if (metadata.scope() == ComponentScope.SCOPED) {
      for (Map<String, Object> bucket : scopes.values()) {
        Object instance = bucket.get(metadata.componentId());
        if (instance != null) {
          instances.add(instance);
        }
      }
    }
    return instances;
  }

  private void runHooksForInstances(String componentId, LifecycleHookType hookType, List<Object> instances) {
    if (instances.isEmpty()) {
      runHooks(componentId, hookType, null);
      return;
    }
    for (Object instance : instances) {
      runHooks(componentId, hookType, instance);
    }
  }

  private void runHooks(String componentId, LifecycleHookType hookType, Object instance) {
    Map<LifecycleHookType, List<LifecycleHook>> hooks = lifecycleHooks.get(componentId);
    if (hooks == null || !hooks.containsKey(hookType)) {
      return;
    }
    for (LifecycleHook hook : List.copyOf(hooks.get(hookType))) {
      try {
        hook.run(instance);
      } catch (Exception ex) {
        log.warn("Error in lifecycle hook {} for component {}: {}", hookType, componentId, ex.getMessage());
        errorReporter.report(
            HOOK_ERROR_TYPE, "Lifecycle hook " + hookType + " for component " + componentId, ex);
      }
    }
  }

  private void transition(ComponentMetadata metadata, ComponentState newState) {
    ComponentState previous = metadata.setState(newState);
    if (previous != newState) {
      eventBus.emit(new ComponentStateChangedEvent(metadata.componentId(), previous, newState));
    }
  }

  private void fail(ComponentMetadata metadata, String operation, Exception ex) {
    String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    transition(metadata, ComponentState.ERROR);
    metadata.setError(message);
    metrics.increment("registry.components.failed");
    log.warn("Error during {} of component {}: {}", operation, metadata.componentId(), message);
    // A failed dispose already ran disposal on whatever it reached.
    releaseInstances(metadata, !"dispose".equals(operation));
    eventBus.emit(new ComponentFailedEvent(metadata.componentId(), operation, message));
    errorReporter.report(
        LIFECYCLE_ERROR_TYPE, "Error during " + operation + " of component " + metadata.componentId()
            + ": " + message, ex);
  }

  private Map<String, Object> buildTree(String componentId) {
    ComponentMetadata metadata = components.get(componentId);
    Map<String, Object> node = metadata.toMap();
    Map<String, Object> children = new LinkedHashMap<>();
    for (String childId : metadata.childrenIds()) {
      if (components.containsKey(childId)) {
        children.put(childId, buildTree(childId));
      }
    }
    node.put("children", children);
    return node;
  }

  private List<ComponentMetadata> metadataFor(Set<String> ids) {
    if (ids == null) {
      return List.of();
    }
    List<ComponentMetadata> result = new ArrayList<>(ids.size());
    for (String id : ids) {
      ComponentMetadata metadata = components.get(id);
      if (metadata != null) {
        result.add(metadata);
      }
    }
    return result;
  }
}
