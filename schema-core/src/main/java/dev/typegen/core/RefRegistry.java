package dev.typegen.core;

import dev.typegen.core.model.Definition;
import dev.typegen.core.model.ObjectDefinition;
import dev.typegen.core.model.Ref;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only index of the top-level object definitions of a model, keyed by the {@link Ref} that names them.
 */
public final class RefRegistry {

  private final Map<Ref, ObjectDefinition> objects;

  public RefRegistry(Map<Ref, ObjectDefinition> objects) {
    this.objects = Map.copyOf(objects);
  }

  /**
   * Index every {@link ObjectDefinition} among {@code definitions}. Aliases are not indexed.
   */
  public static RefRegistry of(Collection<? extends Definition> definitions) {
    Map<Ref, ObjectDefinition> objects = new LinkedHashMap<>();
    for (Definition definition : definitions) {
      if (definition instanceof ObjectDefinition o) {
        objects.put(o.meta().toRef(), o);
      }
    }
    return new RefRegistry(objects);
  }

  public static RefRegistry empty() {
    return new RefRegistry(Map.of());
  }

  public Optional<ObjectDefinition> resolve(Ref ref) {
    return Optional.ofNullable(objects.get(ref));
  }

  /**
   * Whether {@code ref} names an object satisfying the {@code KubernetesObject} contract.
   * Unknown refs are not Kubernetes objects.
   */
  public boolean isKubernetesObject(Ref ref) {
    return resolve(ref).map(ObjectDefinition::kubernetesObject).orElse(false);
  }

  public int size() {
    return objects.size();
  }
}
