package dev.typegen.core.model;

public record DefinitionMeta(String pkg, String name) {

  public Ref toRef() {
    return new Ref(pkg, name);
  }
}
