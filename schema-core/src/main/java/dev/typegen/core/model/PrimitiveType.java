package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record PrimitiveType(@JsonProperty("kind") PrimitiveKind kind) implements Type {

  public PrimitiveType {
    Objects.requireNonNull(kind, "kind is required");
  }

  public static PrimitiveType of(PrimitiveKind kind) {
    return new PrimitiveType(kind);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitPrimitive(this);
  }

  @Override
  public List<Ref> refs() {
    return List.of();
  }
}
