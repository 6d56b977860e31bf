package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * The type of a property or alias.
 *
 * <p>The set of variants is closed: every renderer dispatches through {@link Visitor}, so adding a
 * variant without handling it everywhere fails to compile.
 *
 * <p>Types only form cycles through {@link Ref}, which names another definition and is never inlined.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmptyType.class, name = "empty"),
    @JsonSubTypes.Type(value = PrimitiveType.class, name = "primitive"),
    @JsonSubTypes.Type(value = Ref.class, name = "ref"),
    @JsonSubTypes.Type(value = ArrayType.class, name = "array"),
    @JsonSubTypes.Type(value = MapType.class, name = "map")
})
public sealed interface Type permits EmptyType, PrimitiveType, Ref, ArrayType, MapType {

  <R> R accept(Visitor<R> visitor);

  /**
   * Every {@link Ref} reachable from this type, without following the refs themselves.
   */
  List<Ref> refs();

  interface Visitor<R> {
    R visitEmpty(EmptyType empty);

    R visitPrimitive(PrimitiveType primitive);

    R visitRef(Ref ref);

    R visitArray(ArrayType array);

    R visitMap(MapType map);
  }
}
