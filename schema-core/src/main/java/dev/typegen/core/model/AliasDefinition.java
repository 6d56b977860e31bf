package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A named alias for another type, e.g. {@code Quantity = string}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AliasDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("package") String pkg,
    @JsonProperty("description") String description,
    @JsonProperty("type") Type type
) implements Definition {

  public AliasDefinition {
    Objects.requireNonNull(name, "name is required");
    Objects.requireNonNull(pkg, name + ": package is required");
    Objects.requireNonNull(type, name + ": type is required");
    if (description == null) description = "";
  }

  @Override
  public DefinitionMeta meta() {
    return new DefinitionMeta(pkg, name);
  }

  @Override
  public List<Ref> imports() {
    return type.refs();
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitAlias(this);
  }
}
