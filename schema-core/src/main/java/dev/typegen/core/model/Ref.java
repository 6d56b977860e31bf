package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A pointer to another definition, scoped by package.
 * Also used as the key of the {@link dev.typegen.core.RefRegistry}.
 */
public record Ref(@JsonProperty("package") String pkg, @JsonProperty("name") String name) implements Type {

  public Ref {
    Objects.requireNonNull(pkg, "package is required");
    Objects.requireNonNull(name, "name is required");
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitRef(this);
  }

  @Override
  public List<Ref> refs() {
    return List.of(this);
  }

  @Override
  public String toString() {
    return pkg + "." + name;
  }
}
