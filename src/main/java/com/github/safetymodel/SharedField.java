package com.github.safetymodel;

import java.util.List;

/**
 * Immutable descriptor of one attribute that must be identical across every instance of a logical
 * identity. Values are stored on the node by {@link #getName()} so that a snapshot can carry them
 * as plain primitives.
 */
public final class SharedField<T> {
  private final String name;
  private final Class<T> type;
  private final Class<?> elementType;
  private final T defaultValue;
  private final boolean nullable;

  private SharedField(final String name, final Class<T> type, final Class<?> elementType,
      final T defaultValue, final boolean nullable) {
    this.name = name;
    this.type = type;
    this.elementType = elementType;
    this.defaultValue = defaultValue;
    this.nullable = nullable;
  }

  public static SharedField<String> ofString(final String name, final String defaultValue) {
    return new SharedField<>(name, String.class, null, defaultValue, false);
  }

  public static SharedField<Boolean> ofBoolean(final String name, final boolean defaultValue) {
    return new SharedField<>(name, Boolean.class, null, defaultValue, false);
  }

  public static SharedField<Double> ofDouble(final String name, final Double defaultValue,
      final boolean nullable) {
    return new SharedField<>(name, Double.class, null, defaultValue, nullable);
  }

  public static SharedField<Integer> ofInteger(final String name, final Integer defaultValue,
      final boolean nullable) {
    return new SharedField<>(name, Integer.class, null, defaultValue, nullable);
  }

  @SuppressWarnings("unchecked")
  public static SharedField<List<String>> ofStringList(final String name) {
    return new SharedField<>(name, (Class<List<String>>) (Class<?>) List.class, String.class,
        List.of(), false);
  }

  public String getName() {
    return name;
  }

  public Class<T> getType() {
    return type;
  }

  public T getDefaultValue() {
    return defaultValue;
  }

  public boolean isNullable() {
    return nullable;
  }

  /**
   * True iff the raw value may be stored in this field. Lists are checked element by element.
   */
  public boolean accepts(final Object value) {
    if (value == null) {
      return nullable;
    }
    if (!type.isInstance(value)) {
      return false;
    }
    if (elementType != null) {
      for (Object element : (List<?>) value) {
        if (element == null || !elementType.isInstance(element)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Lenient conversion applied when reading a snapshot: integral numbers are widened for Double
   * fields. Anything else is returned unchanged, accepted or not.
   */
  Object coerce(final Object value) {
    if (value instanceof Number && type == Double.class && !(value instanceof Double)) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Long && type == Integer.class) {
      final long longValue = (Long) value;
      if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
        return (int) longValue;
      }
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  T cast(final Object value) {
    return (T) value;
  }

  @Override
  public String toString() {
    return "SharedField [name=" + name + ", type=" + type.getSimpleName() + "]";
  }
}
