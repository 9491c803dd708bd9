package properties.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class PropertyDeclarationTest {

  @Test
  void requiredNamesUnionAllClauses() {
    PropertyDeclaration<Integer> declaration =
        PropertyDeclaration.<Integer>builder("r")
            .requires("extra")
            .clause(Clause.<Integer>builder().whenBound("p").body((i, r) -> 1))
            .clause(Clause.<Integer>builder().requires("q", "p").body((i, r) -> 2))
            .build();

    assertEquals(
        Set.of(PropertyName.of("extra"), PropertyName.of("p"), PropertyName.of("q")),
        declaration.requiredNames());
    assertEquals(2, declaration.clauses().size(), "Clause order is preserved");
  }

  @Test
  void mergeAppendsClausesInOrder() {
    Clause<Integer> first = Clause.of((i, r) -> 1);
    Clause<Integer> second = Clause.<Integer>builder().whenBound("p").body((i, r) -> 2);
    PropertyDeclaration<Integer> a =
        PropertyDeclaration.<Integer>builder("q").type(Integer.class).clause(first).build();
    PropertyDeclaration<Integer> b =
        PropertyDeclaration.<Integer>builder("q").clause(second).build();

    PropertyDeclaration<Integer> merged = a.mergedWith(b);

    assertEquals(List.of(first, second), merged.clauses());
    assertEquals(Set.of(PropertyName.of("p")), merged.requiredNames());
    assertEquals(Integer.class, merged.valueType(), "Explicit type survives the merge");
  }

  @Test
  void mergeRejectsConflictingTypes() {
    PropertyDeclaration<Integer> a =
        PropertyDeclaration.<Integer>builder("q").type(Integer.class).always((i, r) -> 1).build();
    PropertyDeclaration<Integer> b =
        PropertyDeclaration.<Integer>builder("q").type(String.class).always((i, r) -> "x").build();

    assertThrows(IllegalArgumentException.class, () -> a.mergedWith(b));
  }

  @Test
  void mergeRejectsDifferentNames() {
    PropertyDeclaration<Integer> a = PropertyDeclaration.<Integer>builder("a").build();
    PropertyDeclaration<Integer> b = PropertyDeclaration.<Integer>builder("b").build();

    assertThrows(IllegalArgumentException.class, () -> a.mergedWith(b));
  }

  @Test
  void primitiveTypesAreWrapped() {
    PropertyDeclaration<Integer> declaration =
        PropertyDeclaration.<Integer>builder("p").type(int.class).always((i, r) -> i).build();

    assertEquals(Integer.class, declaration.valueType());
    assertTrue(declaration.hasDeclaredType());
  }

  @Test
  void untypedDeclarationAcceptsAnyValue() {
    PropertyDeclaration<Integer> declaration =
        PropertyDeclaration.of("p", List.of(Clause.of((i, r) -> i)));

    assertEquals(Object.class, declaration.valueType());
    assertFalse(declaration.hasDeclaredType());
  }

  @Test
  void namesAreInterned() {
    assertSame(PropertyName.of("p"), PropertyName.of("p"));
    assertThrows(IllegalArgumentException.class, () -> PropertyName.of(" "));
  }
}
