package properties.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class PartialResultTest {

  @Test
  void viewTracksBackingMapButSnapshotDoesNot() {
    Map<PropertyName, Object> backing = new LinkedHashMap<>();
    PartialResult view = PartialResult.viewOf(backing);
    backing.put(PropertyName.of("p"), 3);

    Map<PropertyName, Object> snapshot = view.snapshot();
    backing.put(PropertyName.of("q"), 10);

    assertEquals(2, view.size(), "View sees later bindings");
    assertEquals(Map.of(PropertyName.of("p"), 3), snapshot, "Snapshot is frozen");
    assertEquals(10, view.get("q", Integer.class));
  }

  @Test
  void viewIsReadOnly() {
    PartialResult view = PartialResult.viewOf(new LinkedHashMap<>());

    assertThrows(
        UnsupportedOperationException.class,
        () -> view.boundNames().add(PropertyName.of("x")),
        "Clauses cannot mutate the partial result");
  }

  @Test
  void unboundLookupFails() {
    PartialResult empty = PartialResult.empty();

    assertFalse(empty.contains("p"));
    assertTrue(empty.find(PropertyName.of("p")).isEmpty());
    assertThrows(IllegalStateException.class, () -> empty.get("p"));
  }

  @Test
  void typedLookupChecksType() {
    Map<PropertyName, Object> backing = new LinkedHashMap<>();
    backing.put(PropertyName.of("p"), "three");

    assertThrows(
        IllegalStateException.class, () -> PartialResult.viewOf(backing).get("p", Integer.class));
  }

  @Test
  void patternsReadBoundValues() {
    Map<PropertyName, Object> backing = new LinkedHashMap<>();
    backing.put(PropertyName.of("p"), 3);
    PartialResult view = PartialResult.viewOf(backing);

    assertTrue(Patterns.any().matches(view));
    assertTrue(Patterns.bound("p").matches(view));
    assertFalse(Patterns.bound("q").matches(view));
    assertTrue(Patterns.equalTo("p", 3).matches(view));
    assertFalse(Patterns.equalTo("p", 4).matches(view));
    assertFalse(Patterns.equalTo("q", 3).matches(view), "Unbound names never match");
    assertTrue(Patterns.matches("p", v -> (Integer) v > 2).matches(view));
    assertFalse(
        Patterns.allOf(Patterns.bound("p"), Patterns.bound("q")).matches(view),
        "allOf requires every pattern");
    assertEquals(List.of(PropertyName.of("p")), List.copyOf(view.boundNames()));
  }
}
