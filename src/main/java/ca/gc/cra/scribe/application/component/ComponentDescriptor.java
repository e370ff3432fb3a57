package ca.gc.cra.scribe.application.component;

import ca.gc.cra.scribe.domain.component.ComponentScope;
import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.domain.component.ScribeComponent;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registration request for a component.
 *
 * <p>Blank {@code componentId} and {@code name} are filled in by the registry. Tags are de-duplicated
 * keeping first occurrence order.</p>
 *
 * @param componentId unique id, or empty to have one generated
 * @param componentClass implementation class; never {@code null}
 * @param componentType component role; never {@code null}
 * @param name display name, or empty for the simple class name
 * @param description free-form description; never {@code null}
 * @param version component version; defaults to {@value #DEFAULT_VERSION}
 * @param scope instance-sharing policy; defaults to {@link ComponentScope#SINGLETON}
 * @param dependencies ids of components injected at construction, in resolution order
 * @param tags classification tags
 * @param config component configuration passed through {@link ResolvedDependencies#config()}
 * @param factory optional factory; {@code null} for direct construction
 * @param parentId id of the parent component, or empty for a root
 * @since 0.1.0
 */
public record ComponentDescriptor(
    String componentId,
    Class<?> componentClass,
    ComponentType componentType,
    String name,
    String description,
    String version,
    ComponentScope scope,
    List<String> dependencies,
    List<String> tags,
    Map<String, Object> config,
    ComponentFactory factory,
    String parentId) {

  /** Version assigned when none is given. */
  public static final String DEFAULT_VERSION = "1.0.0";

  public ComponentDescriptor {
    componentClass = Objects.requireNonNull(componentClass, "componentClass");
    componentType = Objects.requireNonNull(componentType, "componentType");
    componentId = componentId == null ? "" : componentId.trim();
    name = name == null ? "" : name.trim();
    description = description == null ? "" : description;
    version = version == null || version.isBlank() ? DEFAULT_VERSION : version.trim();
    scope = scope == null ? ComponentScope.SINGLETON : scope;
    dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    config = config == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    parentId = parentId == null ? "" : parentId.trim();
  }

  public static Builder builder(Class<?> componentClass, ComponentType componentType) {
    return new Builder(componentClass, componentType);
  }

  /**
   * Builds a descriptor from a {@link ScribeComponent} annotation.
   *
   * @param type annotated class
   * @return descriptor mirroring the annotation attributes
   * @throws IllegalArgumentException if {@code type} is not annotated
   */
  public static ComponentDescriptor fromAnnotation(Class<?> type) {
    ScribeComponent annotation = type.getAnnotation(ScribeComponent.class);
    if (annotation == null) {
      throw new IllegalArgumentException(type.getName() + " is not annotated with @ScribeComponent");
    }
    return builder(type, annotation.type())
        .id(annotation.id())
        .name(annotation.name())
        .description(annotation.description())
        .version(annotation.version())
        .scope(annotation.scope())
        .dependencies(Arrays.asList(annotation.dependencies()))
        .tags(Arrays.asList(annotation.tags()))
        .parent(annotation.parent())
        .build();
  }

  /** Fluent builder for {@link ComponentDescriptor}. */
  public static final class Builder {
    private final Class<?> componentClass;
    private final ComponentType componentType;
    private String componentId;
    private String name;
    private String description;
    private String version;
    private ComponentScope scope;
    private List<String> dependencies;
    private List<String> tags;
    private Map<String, Object> config;
    private ComponentFactory factory;
    private String parentId;

    private Builder(Class<?> componentClass, ComponentType componentType) {
      this.componentClass = Objects.requireNonNull(componentClass, "componentClass");
      this.componentType = Objects.requireNonNull(componentType, "componentType");
    }

    public Builder id(String componentId) {
      this.componentId = componentId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder scope(ComponentScope scope) {
      this.scope = scope;
      return this;
    }

    public Builder dependencies(List<String> dependencies) {
      this.dependencies = dependencies;
      return this;
    }

    public Builder dependsOn(String... dependencyIds) {
      return dependencies(Arrays.asList(dependencyIds));
    }

    public Builder tags(List<String> tags) {
      this.tags = tags;
      return this;
    }

    public Builder tags(String... tags) {
      return tags(Arrays.asList(tags));
    }

    public Builder config(Map<String, Object> config) {
      this.config = config;
      return this;
    }

    public Builder factory(ComponentFactory factory) {
      this.factory = factory;
      return this;
    }

    public Builder parent(String parentId) {
      this.parentId = parentId;
      return this;
    }

    public ComponentDescriptor build() {
      return new ComponentDescriptor(
          componentId, componentClass, componentType, name, description, version, scope,
          dependencies, tags, config, factory, parentId);
    }
  }
}
