package dev.typegen.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A structured schema type with named properties.
 *
 * <p>Properties keep their declaration order, which is the order fields are rendered in.
 * Nested types belong to this object and are only ever rendered inside its namespace.
 *
 * @param namespace         names of the enclosing objects, outermost first; empty for top-level objects
 * @param groupVersionKinds resource kinds this object represents; only the first one is used for identity
 * @param kubernetesObject  whether the object satisfies the shared {@code KubernetesObject} contract
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectDefinition(
    String name,
    String pkg,
    List<String> namespace,
    String description,
    Map<String, NamedProperty> properties,
    List<ObjectDefinition> nestedTypes,
    List<GroupVersionKind> groupVersionKinds,
    boolean kubernetesObject
) implements Definition {

  public ObjectDefinition {
    Objects.requireNonNull(name, "name is required");
    Objects.requireNonNull(pkg, name + ": package is required");
    namespace = namespace == null ? List.of() : List.copyOf(namespace);
    if (description == null) description = "";
    // Map.copyOf would lose declaration order.
    properties = properties == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    nestedTypes = nestedTypes == null ? List.of() : List.copyOf(nestedTypes);
    groupVersionKinds = groupVersionKinds == null ? List.of() : List.copyOf(groupVersionKinds);
  }

  @JsonCreator
  public static ObjectDefinition fromJson(
      @JsonProperty("name") String name,
      @JsonProperty("package") String pkg,
      @JsonProperty("namespace") List<String> namespace,
      @JsonProperty("description") String description,
      @JsonProperty("properties") List<NamedProperty> properties,
      @JsonProperty("nestedTypes") List<ObjectDefinition> nestedTypes,
      @JsonProperty("groupVersionKinds") List<GroupVersionKind> groupVersionKinds,
      @JsonProperty("kubernetesObject") boolean kubernetesObject) {
    Map<String, NamedProperty> byName = new LinkedHashMap<>();
    if (properties != null) {
      for (NamedProperty property : properties) {
        byName.put(property.name(), property);
      }
    }
    return new ObjectDefinition(name, pkg, namespace, description, byName, nestedTypes, groupVersionKinds,
        kubernetesObject);
  }

  public static Builder builder(String pkg, String name) {
    return new Builder(pkg, name);
  }

  @Override
  public DefinitionMeta meta() {
    return new DefinitionMeta(pkg, name);
  }

  /**
   * Properties in declaration order.
   */
  public List<NamedProperty> namedProperties() {
    return List.copyOf(properties.values());
  }

  public boolean hasRequiredFields() {
    return properties.values().stream().anyMatch(NamedProperty::required);
  }

  /**
   * The primary kind of this object, if it has any.
   */
  public Optional<GroupVersionKind> groupVersionKind() {
    return groupVersionKinds.stream().findFirst();
  }

  /**
   * Refs of every property type, then the imports of each nested type.
   */
  @Override
  public List<Ref> imports() {
    List<Ref> refs = new ArrayList<>();
    for (NamedProperty property : properties.values()) {
      refs.addAll(property.type().refs());
    }
    for (ObjectDefinition nested : nestedTypes) {
      refs.addAll(nested.imports());
    }
    return refs;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitObject(this);
  }

  public static final class Builder {
    private final String pkg;
    private final String name;
    private final List<String> namespace = new ArrayList<>();
    private String description = "";
    private final Map<String, NamedProperty> properties = new LinkedHashMap<>();
    private final List<ObjectDefinition> nestedTypes = new ArrayList<>();
    private final List<GroupVersionKind> groupVersionKinds = new ArrayList<>();
    private boolean kubernetesObject;

    private Builder(String pkg, String name) {
      this.pkg = pkg;
      this.name = name;
    }

    public Builder namespace(String... enclosing) {
      namespace.addAll(List.of(enclosing));
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder property(NamedProperty property) {
      properties.put(property.name(), property);
      return this;
    }

    public Builder nestedType(ObjectDefinition nested) {
      nestedTypes.add(nested);
      return this;
    }

    public Builder groupVersionKind(String group, String version, String kind) {
      groupVersionKinds.add(new GroupVersionKind(group, version, kind));
      return this;
    }

    public Builder kubernetesObject(boolean kubernetesObject) {
      this.kubernetesObject = kubernetesObject;
      return this;
    }

    public ObjectDefinition build() {
      return new ObjectDefinition(name, pkg, namespace, description, properties, nestedTypes, groupVersionKinds,
          kubernetesObject);
    }
  }
}
