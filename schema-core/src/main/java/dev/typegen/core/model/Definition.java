package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A top-level schema definition: either an object or an alias.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "definition")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ObjectDefinition.class, name = "object"),
    @JsonSubTypes.Type(value = AliasDefinition.class, name = "alias")
})
public sealed interface Definition permits ObjectDefinition, AliasDefinition {

  DefinitionMeta meta();

  /**
   * Refs this definition depends on. May contain duplicates and refs into the definition's own package.
   */
  List<Ref> imports();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitObject(ObjectDefinition object);

    R visitAlias(AliasDefinition alias);
  }
}
