package properties.core;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.Objects;

/**
 * Identifier of a property within a schema.
 *
 * <p>{@link #of} interns through a weak interner, so names stay shared while some declaration
 * holds them and are released afterwards. Read-only lookups use {@link #key}, which never
 * interns.
 */
public record PropertyName(String value) {
  private static final Interner<PropertyName> INTERNER = Interners.newWeakInterner();

  public PropertyName {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("property name must not be blank");
    }
  }

  /** Canonical instance for {@code value}; use when declaring properties. */
  public static PropertyName of(String value) {
    return INTERNER.intern(new PropertyName(value));
  }

  /** Uninterned name for lookups by string; equal to, but not the same as, {@link #of}. */
  public static PropertyName key(String value) {
    return new PropertyName(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
