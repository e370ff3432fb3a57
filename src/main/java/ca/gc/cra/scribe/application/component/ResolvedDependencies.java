package ca.gc.cra.scribe.application.component;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.port.ErrorReporter;
import ca.gc.cra.scribe.application.state.StateManager;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Everything the registry hands a component at construction time.
 * <p><strong>Why:</strong> Components declare their dependency ids up front and read them here by id,
 * instead of having constructor parameters matched by name.</p>
 * <p><strong>Contents:</strong>
 * <ul>
 *   <li>Instances of the declared dependencies that could be resolved. Missing or failed dependencies
 *   are absent.</li>
 *   <li>The four common services: event bus, state manager, component registry, error reporter.</li>
 *   <li>The component's configuration map.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ResolvedDependencies {
  private final String componentId;
  private final String scopeId;
  private final Map<String, Object> dependencies;
  private final Map<String, Object> config;
  private final EventBus eventBus;
  private final StateManager stateManager;
  private final ComponentRegistry registry;
  private final ErrorReporter errorReporter;

  ResolvedDependencies(
      String componentId,
      String scopeId,
      Map<String, Object> dependencies,
      Map<String, Object> config,
      EventBus eventBus,
      StateManager stateManager,
      ComponentRegistry registry,
      ErrorReporter errorReporter) {
    this.componentId = Objects.requireNonNull(componentId, "componentId");
    this.scopeId = Objects.requireNonNull(scopeId, "scopeId");
    this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
    this.config = config;
    this.eventBus = eventBus;
    this.stateManager = stateManager;
    this.registry = registry;
    this.errorReporter = errorReporter;
  }

  public String componentId() {
    return componentId;
  }

  public String scopeId() {
    return scopeId;
  }

  /**
   * Returns the resolved instance of a declared dependency.
   *
   * @param dependencyId id listed in the component's dependencies
   * @param type expected instance type
   * @param <T> expected instance type
   * @return the instance, or {@code null} when it could not be resolved
   * @throws ClassCastException if the instance is not a {@code type}
   */
  public <T> T dependency(String dependencyId, Class<T> type) {
    Object value = dependencies.get(dependencyId);
    return value == null ? null : type.cast(value);
  }

  public <T> Optional<T> findDependency(String dependencyId, Class<T> type) {
    return Optional.ofNullable(dependency(dependencyId, type));
  }

  public boolean hasDependency(String dependencyId) {
    return dependencies.containsKey(dependencyId);
  }

  public Set<String> dependencyIds() {
    return dependencies.keySet();
  }

  /**
   * Returns the component configuration registered with the descriptor or through
   * {@link ComponentRegistry#setComponentConfig(String, Map)}.
   */
  public Map<String, Object> config() {
    return config;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public StateManager stateManager() {
    return stateManager;
  }

  public ComponentRegistry registry() {
    return registry;
  }

  public ErrorReporter errorReporter() {
    return errorReporter;
  }
}
