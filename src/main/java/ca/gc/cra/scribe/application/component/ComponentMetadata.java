package ca.gc.cra.scribe.application.component;

import ca.gc.cra.scribe.domain.component.ComponentScope;
import ca.gc.cra.scribe.domain.component.ComponentState;
import ca.gc.cra.scribe.domain.component.ComponentType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry-owned record of a registered component.
 *
 * <p>Created by {@link ComponentRegistry#register(ComponentDescriptor)} and mutated only by the
 * registry; callers see read-only accessors. The singleton instance slot is populated only while the
 * component is live, and the error message only while it is in {@link ComponentState#ERROR}.</p>
 *
 * @since 0.1.0
 */
public final class ComponentMetadata {
  private final String componentId;
  private final ComponentType componentType;
  private final Class<?> componentClass;
  private final String name;
  private final String description;
  private final String version;
  private final ComponentScope scope;
  private final List<String> dependencies;
  private final List<String> tags;
  private final List<String> childrenIds = new ArrayList<>();
  private final Instant createdAt;
  private Map<String, Object> config;
  private ComponentFactory factory;
  private String parentId;
  private ComponentState state = ComponentState.REGISTERED;
  private Object instance;
  private String error;
  private Instant initializedAt;
  private Instant disposedAt;
  private Instant lastActiveAt;

  ComponentMetadata(String componentId, String name, ComponentDescriptor descriptor, Instant createdAt) {
    this.componentId = componentId;
    this.componentType = descriptor.componentType();
    this.componentClass = descriptor.componentClass();
    this.name = name;
    this.description = descriptor.description();
    this.version = descriptor.version();
    this.scope = descriptor.scope();
    this.dependencies = descriptor.dependencies();
    this.tags = descriptor.tags();
    this.config = descriptor.config();
    this.factory = descriptor.factory();
    this.createdAt = createdAt;
  }

  public String componentId() {
    return componentId;
  }

  public ComponentType componentType() {
    return componentType;
  }

  public Class<?> componentClass() {
    return componentClass;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public String version() {
    return version;
  }

  public ComponentScope scope() {
    return scope;
  }

  public List<String> dependencies() {
    return dependencies;
  }

  public List<String> tags() {
    return tags;
  }

  public Map<String, Object> config() {
    return config;
  }

  public Optional<ComponentFactory> factory() {
    return Optional.ofNullable(factory);
  }

  public Optional<String> parentId() {
    return Optional.ofNullable(parentId);
  }

  public List<String> childrenIds() {
    return List.copyOf(childrenIds);
  }

  public ComponentState state() {
    return state;
  }

  public Optional<String> error() {
    return Optional.ofNullable(error);
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Optional<Instant> initializedAt() {
    return Optional.ofNullable(initializedAt);
  }

  public Optional<Instant> disposedAt() {
    return Optional.ofNullable(disposedAt);
  }

  public Optional<Instant> lastActiveAt() {
    return Optional.ofNullable(lastActiveAt);
  }

  /**
   * Renders the metadata as a map of strings, lists and nested maps, suitable for inspectors and JSON
   * export. Absent timestamps and parent map to {@code null}.
   *
   * @return new mutable map in a stable key order
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("componentId", componentId);
    map.put("componentType", componentType.name());
    map.put("componentClass", componentClass.getSimpleName());
    map.put("name", name);
    map.put("description", description);
    map.put("version", version);
    map.put("scope", scope.name());
    map.put("dependencies", dependencies);
    map.put("tags", tags);
    map.put("config", config);
    map.put("state", state.name());
    map.put("parentId", parentId);
    map.put("childrenIds", childrenIds());
    map.put("createdAt", isoOrNull(createdAt));
    map.put("initializedAt", isoOrNull(initializedAt));
    map.put("disposedAt", isoOrNull(disposedAt));
    map.put("lastActiveAt", isoOrNull(lastActiveAt));
    return map;
  }

  @Override
  public String toString() {
    return "ComponentMetadata{" + componentId + ", " + componentType + ", " + state + '}';
  }

  Object instance() {
    return instance;
  }

  void setInstance(Object instance) {
    this.instance = instance;
  }

  /**
   * Sets the lifecycle state. Leaving {@link ComponentState#ERROR} clears the recorded error.
   *
   * @return the previous state
   */
  ComponentState setState(ComponentState newState) {
    ComponentState previous = state;
    state = newState;
    if (newState != ComponentState.ERROR) {
      error = null;
    }
    return previous;
  }

  void setError(String error) {
    this.error = error;
  }

  void setConfig(Map<String, Object> config) {
    this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }

  void setFactory(ComponentFactory factory) {
    this.factory = factory;
  }

  void setParentId(String parentId) {
    this.parentId = parentId;
  }

  void addChild(String childId) {
    childrenIds.add(childId);
  }

  void removeChild(String childId) {
    childrenIds.remove(childId);
  }

  boolean hasChildren() {
    return !childrenIds.isEmpty();
  }

  void markInitialized(Instant at) {
    initializedAt = at;
  }

  void markDisposed(Instant at) {
    disposedAt = at;
  }

  void markActive(Instant at) {
    lastActiveAt = at;
  }

  private static String isoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
