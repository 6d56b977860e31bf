package dev.typegen.generators.typescript;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class TypeScriptOptionsTest {

  @TempDir
  Path tempDir;

  @Test
  void defaultsToKptFunctionsModule() {
    assertThat(TypeScriptOptions.DEFAULT.kubernetesObjectModule()).isEqualTo("@googlecontainertools/kpt-functions");
    assertThat(new TypeScriptOptions(null)).isEqualTo(TypeScriptOptions.DEFAULT);
    assertThat(new TypeScriptOptions("")).isEqualTo(TypeScriptOptions.DEFAULT);
  }

  @Test
  void shouldLoadOptionsFromJson() throws IOException {
    Path file = tempDir.resolve("typegen.json");
    Files.writeString(file, """
        { "kubernetesObjectModule": "@acme/kubernetes", "unknownSetting": true }
        """);

    TypeScriptOptions options = TypeScriptOptions.load(file);

    assertThat(options.kubernetesObjectModule()).isEqualTo("@acme/kubernetes");
  }

  @Test
  void missingSettingsTakeDefaults() throws IOException {
    Path file = tempDir.resolve("typegen.json");
    Files.writeString(file, "{}");

    assertThat(TypeScriptOptions.load(file)).isEqualTo(TypeScriptOptions.DEFAULT);
  }

  @Test
  void shouldRejectInvalidJson() throws IOException {
    Path file = tempDir.resolve("typegen.json");
    Files.writeString(file, "{ kubernetesObjectModule");

    assertThatThrownBy(() -> TypeScriptOptions.load(file)).isInstanceOf(IOException.class);
  }
}
