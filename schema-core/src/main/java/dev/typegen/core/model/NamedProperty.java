package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A named field of an {@link ObjectDefinition}.
 *
 * @param overrideValue when non-empty, the literal expression assigned to the field at construction
 *                      time instead of the value coerced from the constructor argument
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NamedProperty(
    String name,
    Type type,
    boolean required,
    String description,
    String overrideValue
) {

  public NamedProperty {
    Objects.requireNonNull(name, "name is required");
    Objects.requireNonNull(type, name + ": type is required");
    if (description == null) description = "";
    // An empty override is the same as none.
    if (overrideValue != null && overrideValue.isEmpty()) overrideValue = null;
  }

  public NamedProperty(String name, Type type, boolean required) {
    this(name, type, required, "", null);
  }

  public static NamedProperty required(String name, Type type) {
    return new NamedProperty(name, type, true);
  }

  public static NamedProperty optional(String name, Type type) {
    return new NamedProperty(name, type, false);
  }

  public NamedProperty withDescription(String description) {
    return new NamedProperty(name, type, required, description, overrideValue);
  }

  public NamedProperty withOverrideValue(String overrideValue) {
    return new NamedProperty(name, type, required, description, overrideValue);
  }
}
