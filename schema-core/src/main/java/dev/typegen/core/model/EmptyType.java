package dev.typegen.core.model;

import java.util.List;

/** Untyped value: anything goes. */
public record EmptyType() implements Type {

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitEmpty(this);
  }

  @Override
  public List<Ref> refs() {
    return List.of();
  }
}
