package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record ArrayType(@JsonProperty("items") Type items) implements Type {

  public ArrayType {
    Objects.requireNonNull(items, "items is required");
  }

  public static ArrayType of(Type items) {
    return new ArrayType(items);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitArray(this);
  }

  @Override
  public List<Ref> refs() {
    return items.refs();
  }
}
