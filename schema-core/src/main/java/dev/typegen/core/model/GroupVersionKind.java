package dev.typegen.core.model;

import java.util.Objects;

/**
 * Identity of a resource kind. An empty group is the Kubernetes core group.
 */
public record GroupVersionKind(String group, String version, String kind) {

  public GroupVersionKind {
    if (group == null) group = "";
    Objects.requireNonNull(version, "version is required");
    Objects.requireNonNull(kind, "kind is required");
  }

  /**
   * The value of the {@code apiVersion} field of objects of this kind, e.g. {@code apps/v1} or {@code v1}.
   */
  public String apiVersion() {
    if (group.isEmpty()) {
      return version;
    }
    return group + "/" + version;
  }
}
