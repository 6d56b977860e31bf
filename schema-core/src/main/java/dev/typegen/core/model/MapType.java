package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** String-keyed map. */
public record MapType(@JsonProperty("values") Type values) implements Type {

  public MapType {
    Objects.requireNonNull(values, "values is required");
  }

  public static MapType of(Type values) {
    return new MapType(values);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitMap(this);
  }

  @Override
  public List<Ref> refs() {
    return values.refs();
  }
}
