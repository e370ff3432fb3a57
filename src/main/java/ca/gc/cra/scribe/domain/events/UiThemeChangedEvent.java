package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when the active UI theme changes.
 *
 * @param themeName name of the newly active theme; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#UI}
 * @since 0.1.0
 */
public record UiThemeChangedEvent(String themeName, EventMetadata metadata) implements UiEvent {

  public UiThemeChangedEvent {
    themeName = Objects.requireNonNull(themeName, "themeName");
    metadata = EventMetadata.forCategory(metadata, EventCategory.UI);
  }

  public UiThemeChangedEvent(String themeName) {
    this(themeName, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.UI_THEME_CHANGED;
  }

  @Override
  public UiThemeChangedEvent withMetadata(EventMetadata metadata) {
    return new UiThemeChangedEvent(themeName, Objects.requireNonNull(metadata, "metadata"));
  }
}
