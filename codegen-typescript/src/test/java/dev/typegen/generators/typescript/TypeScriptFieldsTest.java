package dev.typegen.generators.typescript;

import dev.typegen.core.RefRegistry;
import dev.typegen.core.model.ArrayType;
import dev.typegen.core.model.EmptyType;
import dev.typegen.core.model.MapType;
import dev.typegen.core.model.NamedProperty;
import dev.typegen.core.model.ObjectDefinition;
import dev.typegen.core.model.PrimitiveKind;
import dev.typegen.core.model.PrimitiveType;
import dev.typegen.core.model.Ref;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class TypeScriptFieldsTest {

  private static final String CORE = "io.k8s.api.core.v1";
  private static final String APPS = "io.k8s.api.apps.v1";
  private static final String META = "io.k8s.apimachinery.pkg.apis.meta.v1";

  private static final Ref POD = new Ref(CORE, "Pod");
  private static final Ref POD_SPEC = new Ref(CORE, "PodSpec");
  private static final Ref DEPLOYMENT = new Ref(APPS, "Deployment");

  private TypeScriptFields fields;

  @BeforeEach
  void setUp() {
    RefRegistry registry = RefRegistry.of(List.of(
        ObjectDefinition.builder(CORE, "Pod").groupVersionKind("", "v1", "Pod").kubernetesObject(true).build(),
        ObjectDefinition.builder(CORE, "PodSpec").build(),
        ObjectDefinition.builder(APPS, "Deployment").groupVersionKind("apps", "v1", "Deployment")
            .kubernetesObject(true).build()));
    fields = new TypeScriptFields(registry);
  }

  // =========================================================================
  // Declarations
  // =========================================================================

  @Test
  void optionalMarkerOnlyOnOptionalFields() {
    assertThat(TypeScriptFields.typesField(CORE, NamedProperty.required("spec", POD_SPEC)))
        .isEqualTo("public spec: PodSpec;");
    assertThat(TypeScriptFields.typesField(CORE, NamedProperty.optional("spec", POD_SPEC)))
        .isEqualTo("public spec?: PodSpec;");
    assertThat(TypeScriptFields.interfaceField(CORE, NamedProperty.required("spec", POD_SPEC)))
        .isEqualTo("spec: PodSpec;");
    assertThat(TypeScriptFields.interfaceField(CORE, NamedProperty.optional("spec", POD_SPEC)))
        .isEqualTo("spec?: PodSpec;");
  }

  @Test
  void fieldsUseImportAliasForOtherPackages() {
    NamedProperty metadata = NamedProperty.required("metadata", new Ref(META, "ObjectMeta"));

    assertThat(TypeScriptFields.typesField(CORE, metadata)).isEqualTo("public metadata: apisMetaV1.ObjectMeta;");
    assertThat(TypeScriptFields.interfaceField(CORE, metadata)).isEqualTo("metadata: apisMetaV1.ObjectMeta;");
  }

  @Test
  void descriptionLinesBecomeComments() {
    NamedProperty replicas = NamedProperty.optional("replicas", PrimitiveType.of(PrimitiveKind.INTEGER))
        .withDescription("Number of desired pods.\nDefaults to 1.");

    assertThat(TypeScriptFields.typesField(APPS, replicas)).isEqualTo("""
        // Number of desired pods.
        // Defaults to 1.
        public replicas?: number;""");
    assertThat(TypeScriptFields.interfaceField(APPS, replicas)).isEqualTo("""
        // Number of desired pods.
        // Defaults to 1.
        replicas?: number;""");
  }

  @Test
  void printDescriptionOfEmptyTextIsEmpty() {
    assertThat(TypeScriptFields.printDescription("")).isEmpty();
    assertThat(TypeScriptFields.printDescription(null)).isEmpty();
    assertThat(TypeScriptFields.printDescription("one")).isEqualTo("// one\n");
    assertThat(TypeScriptFields.printDescription("one\n\nthree")).isEqualTo("// one\n// \n// three\n");
  }

  // =========================================================================
  // Constructor Expressions
  // =========================================================================

  @Test
  void scalarsAndPlainObjectsPassThrough() {
    assertThat(fields.constructorExpression(CORE, new EmptyType(), "desc.x")).isEqualTo("desc.x");
    assertThat(fields.constructorExpression(CORE, PrimitiveType.of(PrimitiveKind.STRING), "desc.x"))
        .isEqualTo("desc.x");
    assertThat(fields.constructorExpression(CORE, POD_SPEC, "desc.spec")).isEqualTo("desc.spec");
    assertThat(fields.constructorExpression(CORE, new Ref(META, "ObjectMeta"), "desc.metadata"))
        .isEqualTo("desc.metadata");
  }

  @Test
  void kubernetesObjectsAreConstructed() {
    assertThat(fields.constructorExpression(CORE, POD, "desc.pod")).isEqualTo("new Pod(desc.pod)");
    assertThat(fields.constructorExpression(CORE, DEPLOYMENT, "desc.deployment"))
        .isEqualTo("new apiAppsV1.Deployment(desc.deployment)");
  }

  @Test
  void arraysOfKubernetesObjectsAreMapped() {
    assertThat(fields.constructorExpression(CORE, ArrayType.of(POD), "desc.items"))
        .isEqualTo("desc.items.map((i) => new Pod(i))");
    assertThat(fields.constructorExpression(APPS, ArrayType.of(POD), "desc.items"))
        .isEqualTo("desc.items.map((i) => new apiCoreV1.Pod(i))");
    assertThat(fields.constructorExpression(CORE, ArrayType.of(POD_SPEC), "desc.specs"))
        .isEqualTo("desc.specs");
  }

  @Test
  void nestedArraysAndMapsOfKubernetesObjectsAreNotConstructed() {
    assertThat(fields.constructorExpression(CORE, ArrayType.of(ArrayType.of(POD)), "desc.x")).isEqualTo("desc.x");
    assertThat(fields.constructorExpression(CORE, MapType.of(POD), "desc.x")).isEqualTo("desc.x");
  }

  @Test
  void constructorFieldAssignsCoercedDescriptorValue() {
    assertThat(fields.constructorField(CORE, NamedProperty.required("items", ArrayType.of(POD)), null))
        .isEqualTo("\nthis.items = desc.items.map((i) => new Pod(i));");
    assertThat(fields.constructorField(CORE, NamedProperty.optional("spec", POD_SPEC), null))
        .isEqualTo("\nthis.spec = desc.spec;");
  }

  @Test
  void optionalArrayOfKubernetesObjectsIsGuarded() {
    assertThat(fields.constructorField(CORE, NamedProperty.optional("items", ArrayType.of(POD)), null))
        .isEqualTo("\nthis.items = (desc.items !== undefined) ? desc.items.map((i) => new Pod(i)) : undefined;");
  }

  @Test
  void optionalKubernetesObjectIsNotGuarded() {
    assertThat(fields.constructorField(CORE, NamedProperty.optional("pod", POD), null))
        .isEqualTo("\nthis.pod = new Pod(desc.pod);");
  }

  @Test
  void overridesReplaceDescriptorValue() {
    NamedProperty kind = NamedProperty.optional("kind", PrimitiveType.of(PrimitiveKind.STRING));
    NamedProperty preset = kind.withOverrideValue("'Pod'");

    assertThat(fields.constructorField(CORE, kind, "Pod.kind")).isEqualTo("\nthis.kind = Pod.kind;");
    assertThat(fields.constructorField(CORE, preset, null)).isEqualTo("\nthis.kind = 'Pod';");
    assertThat(fields.constructorField(CORE, preset, "Pod.kind")).isEqualTo("\nthis.kind = Pod.kind;");
    assertThat(preset.overrideValue()).isEqualTo("'Pod'");
  }

  @Test
  void emptyOverrideFallsBackToDescriptorValue() {
    NamedProperty kind = NamedProperty.optional("kind", PrimitiveType.of(PrimitiveKind.STRING));
    NamedProperty blank = kind.withOverrideValue("");

    assertThat(blank.overrideValue()).isNull();
    assertThat(fields.constructorField(CORE, blank, null)).isEqualTo("\nthis.kind = desc.kind;");
    assertThat(fields.constructorField(CORE, kind, "")).isEqualTo("\nthis.kind = desc.kind;");
  }
}
