package ca.gc.cra.scribe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("theme", Strings.requireNonBlank("key", "  theme "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("key", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("key", "the\u0007me"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("key", null));
  }

  @Test
  void splitCsvDropsEmptyEntries() {
    assertEquals(List.of("theme", "zoom"), Strings.splitCsv("keys", " theme,, zoom ,"));
    assertEquals(List.of(), Strings.splitCsv("keys", null));
  }
}
