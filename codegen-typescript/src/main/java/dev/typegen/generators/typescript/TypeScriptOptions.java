package dev.typegen.generators.typescript;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings for {@link TypeScriptGenerator}. Missing values take their defaults.
 *
 * @param kubernetesObjectModule module the {@code KubernetesObject} interface is imported from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeScriptOptions(String kubernetesObjectModule) {

    public static final String DEFAULT_KUBERNETES_OBJECT_MODULE = "@googlecontainertools/kpt-functions";

    public static final TypeScriptOptions DEFAULT = new TypeScriptOptions(DEFAULT_KUBERNETES_OBJECT_MODULE);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonCreator
    public TypeScriptOptions(
        @JsonProperty("kubernetesObjectModule") String kubernetesObjectModule
    ) {
        this.kubernetesObjectModule = kubernetesObjectModule == null || kubernetesObjectModule.isEmpty()
            ? DEFAULT_KUBERNETES_OBJECT_MODULE
            : kubernetesObjectModule;
    }

    public static TypeScriptOptions load(Path path) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(path), TypeScriptOptions.class);
    }
}
