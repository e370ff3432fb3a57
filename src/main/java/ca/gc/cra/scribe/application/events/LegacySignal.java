package ca.gc.cra.scribe.application.events;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Positional payload delivered on a {@link LegacyChannel}.
 *
 * @param channel originating channel; never {@code null}
 * @param args positional arguments; unmodifiable, elements may be {@code null}
 * @since 0.1.0
 */
public record LegacySignal(LegacyChannel channel, List<Object> args) {

  public LegacySignal {
    channel = Objects.requireNonNull(channel, "channel");
    args = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args.toArray()));
  }

  static LegacySignal of(LegacyChannel channel, Object... args) {
    return new LegacySignal(channel, Arrays.asList(args));
  }

  /**
   * Returns the argument at {@code index}.
   *
   * @param index zero-based position
   * @return argument value; may be {@code null}
   * @throws IndexOutOfBoundsException when the channel carries fewer arguments
   */
  public Object arg(int index) {
    return args.get(index);
  }
}
