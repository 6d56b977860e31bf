package dev.typegen.generators.typescript;

import dev.typegen.core.RefRegistry;
import dev.typegen.core.model.AliasDefinition;
import dev.typegen.core.model.Definition;
import dev.typegen.core.model.GroupVersionKind;
import dev.typegen.core.model.NamedProperty;
import dev.typegen.core.model.ObjectDefinition;
import dev.typegen.core.model.Ref;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TypeScript code generator for schema definitions.
 *
 * Definitions of one package share one file, {@code <package>.ts}. A file is an import header
 * followed by one declaration per definition:
 * - Objects become classes whose constructor takes a plain descriptor and constructs nested
 *   Kubernetes objects from it
 * - Objects with a group/version/kind get an {@code isName} type guard, and a namespace holding
 *   the kind constants and an {@code Interface} describing the descriptor
 * - Kubernetes objects whose only required field is {@code metadata} get a {@code named(name)} factory
 * - Nested types are rendered inside the namespace of the object owning them
 * - Aliases become {@code export type} declarations
 *
 * Output is deterministic: properties keep declaration order, imports and nested types are sorted.
 */
public class TypeScriptGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeScriptGenerator.class);

    // Fields supplied by the class itself rather than by the descriptor.
    private static final String API_VERSION = "apiVersion";
    private static final String KIND = "kind";
    private static final String METADATA = "metadata";
    private static final Set<String> SUPPLIED_BY_NAME = Set.of(METADATA, API_VERSION, KIND);

    private final RefRegistry refObjects;
    private final TypeScriptOptions options;
    private final TypeScriptFields fields;

    public TypeScriptGenerator(RefRegistry refObjects) {
        this(refObjects, TypeScriptOptions.DEFAULT);
    }

    public TypeScriptGenerator(RefRegistry refObjects, TypeScriptOptions options) {
        this.refObjects = Objects.requireNonNull(refObjects, "refObjects");
        this.options = Objects.requireNonNull(options, "options");
        this.fields = new TypeScriptFields(refObjects);
    }

    // =========================================================================
    // Files
    // =========================================================================

    /**
     * Name of the file {@code definition} is generated into.
     */
    public String file(Definition definition) {
        return definition.meta().pkg() + ".ts";
    }

    /**
     * Render every definition, one file per package. Files are ordered by name; definitions keep
     * their relative order within a file.
     */
    public List<GeneratedFile> generate(Collection<? extends Definition> definitions) {
        Map<String, List<Definition>> byFile = new TreeMap<>();
        for (Definition definition : definitions) {
            byFile.computeIfAbsent(file(definition), k -> new ArrayList<>()).add(definition);
        }

        List<GeneratedFile> files = new ArrayList<>();
        for (Map.Entry<String, List<Definition>> entry : byFile.entrySet()) {
            files.add(new GeneratedFile(entry.getKey(), renderFile(entry.getValue())));
        }
        LOGGER.debug("Generated {} files from {} definitions", files.size(), definitions.size());
        return files;
    }

    /**
     * Render the header and then each definition, separated by blank lines.
     * All definitions must belong to the same package.
     */
    public String renderFile(List<? extends Definition> definitions) {
        if (definitions.isEmpty()) {
            return "";
        }
        LOGGER.debug("Rendering {} definitions of package {}", definitions.size(), definitions.get(0).meta().pkg());

        List<String> parts = new ArrayList<>();
        String header = printHeader(definitions);
        if (!header.isEmpty()) {
            parts.add(header);
        }
        for (Definition definition : definitions) {
            parts.add(printDefinition(definition));
        }
        return String.join("\n\n", parts) + "\n";
    }

    // =========================================================================
    // Imports
    // =========================================================================

    /**
     * Import block for a file holding {@code definitions}, or an empty string when there is nothing to import.
     *
     * <p>Every package referenced by a definition, other than the file's own, is imported once under
     * its {@link TypeScriptTypes#packageAlias alias}, in lexicographic order. {@code KubernetesObject}
     * is imported first when one of the definitions is a Kubernetes object.
     */
    public String printHeader(List<? extends Definition> definitions) {
        if (definitions.isEmpty()) {
            return "";
        }
        String currentPackage = definitions.get(0).meta().pkg();

        SortedSet<String> packages = new TreeSet<>();
        for (Definition definition : definitions) {
            for (Ref ref : definition.imports()) {
                if (!ref.pkg().equals(currentPackage)) {
                    packages.add(ref.pkg());
                }
            }
        }

        List<String> lines = new ArrayList<>();
        boolean hasKubernetesObject = definitions.stream()
            .anyMatch(d -> refObjects.isKubernetesObject(d.meta().toRef()));
        if (hasKubernetesObject) {
            lines.add("import { KubernetesObject } from '" + options.kubernetesObjectModule() + "';");
        }
        for (String pkg : packages) {
            lines.add("import * as " + TypeScriptTypes.packageAlias(pkg) + " from './" + pkg + "';");
        }
        return String.join("\n", lines);
    }

    // =========================================================================
    // Definitions
    // =========================================================================

    public String printDefinition(Definition definition) {
        return definition.accept(new Definition.Visitor<>() {
            @Override
            public String visitObject(ObjectDefinition object) {
                return printObject(object);
            }

            @Override
            public String visitAlias(AliasDefinition alias) {
                return printAlias(alias);
            }
        });
    }

    private static String printAlias(AliasDefinition alias) {
        return TypeScriptFields.printDescription(alias.description())
            + "export type " + alias.name() + " = " + TypeScriptTypes.tsType(alias.pkg(), alias.type()) + ";";
    }

    private String printObject(ObjectDefinition o) {
        List<String> fieldLines = new ArrayList<>();
        StringBuilder constructorLines = new StringBuilder();
        for (NamedProperty property : o.namedProperties()) {
            fieldLines.add(TypeScriptFields.typesField(o.pkg(), property));
            constructorLines.append(indent(fields.constructorField(o.pkg(), property, identityOverride(o, property))));
        }

        List<String> descPath = new ArrayList<>(o.namespace());
        descPath.add(o.name());
        String descType = String.join(".", descPath);
        if (o.kubernetesObject()) {
            descType = descType + ".Interface";
        }

        String constructor = "";
        if (o.hasRequiredFields()) {
            // Unreachable "?": the constructor only exists when a field is required.
            String optionalDesc = o.hasRequiredFields() ? "" : "?";
            constructor = indent("\n\nconstructor(desc" + optionalDesc + ": " + descType + ") {"
                + constructorLines + "\n}");
        }

        String isType = o.groupVersionKind()
            .map(gvk -> "\n\nexport function is" + o.name() + "(o: any): o is " + o.name() + " {\n"
                + "  return o && o.apiVersion === " + o.name() + ".apiVersion && o.kind === " + o.name() + ".kind;\n"
                + "}")
            .orElse("");

        String implementsClause = o.kubernetesObject() ? " implements KubernetesObject" : "";

        return TypeScriptFields.printDescription(o.description())
            + "export class " + o.name() + implementsClause + " {\n"
            + indent(String.join("\n\n", fieldLines))
            + constructor
            + "\n}"
            + isType
            + printNamespace(o);
    }

    /**
     * Objects with a kind always carry their own {@code apiVersion} and {@code kind}, whatever the descriptor says.
     */
    private static String identityOverride(ObjectDefinition o, NamedProperty property) {
        if (o.groupVersionKinds().isEmpty()) {
            return null;
        }
        return switch (property.name()) {
            case API_VERSION -> o.name() + ".apiVersion";
            case KIND -> o.name() + ".kind";
            default -> null;
        };
    }

    // =========================================================================
    // Namespaces
    // =========================================================================

    private String printNamespace(ObjectDefinition o) {
        if (o.nestedTypes().isEmpty() && !o.kubernetesObject() && o.groupVersionKinds().isEmpty()) {
            return "";
        }
        Optional<GroupVersionKind> gvk = o.groupVersionKind();

        List<String> classes = new ArrayList<>();
        if (gvk.isPresent()) {
            classes.add(indent(printInterface(o)));
        }
        List<ObjectDefinition> nestedTypes = new ArrayList<>(o.nestedTypes());
        nestedTypes.sort(Comparator.comparing(ObjectDefinition::name));
        for (ObjectDefinition nested : nestedTypes) {
            classes.add(indent(printObject(nested)));
        }

        String constants = gvk
            .map(k -> indent("export const apiVersion = " + quote(k.apiVersion()) + ";\n"
                + "export const group = " + quote(k.group()) + ";\n"
                + "export const version = " + quote(k.version()) + ";\n"
                + "export const kind = " + quote(k.kind()) + ";\n"
                + "\n"))
            .orElse("");

        String namedFunc = "";
        if (o.kubernetesObject() && onlyMetadataRequired(o)) {
            namedFunc = indent("// named constructs a " + o.name() + " with metadata.name set to name.\n"
                + "export function named(name: string): " + o.name() + " {\n"
                + "  return new " + o.name() + "({metadata: {name}});\n"
                + "}\n");
        }

        return "\n\nexport namespace " + o.name() + " {\n"
            + constants
            + namedFunc
            + String.join("\n", classes)
            + "\n}";
    }

    private static boolean onlyMetadataRequired(ObjectDefinition o) {
        return o.namedProperties().stream()
            .filter(NamedProperty::required)
            .allMatch(p -> SUPPLIED_BY_NAME.contains(p.name()));
    }

    /**
     * The {@code Interface} of a kind: every property except the ones the class fills in itself.
     */
    private static String printInterface(ObjectDefinition o) {
        List<String> properties = new ArrayList<>();
        for (NamedProperty property : o.namedProperties()) {
            if (o.groupVersionKind().isPresent()
                && (API_VERSION.equals(property.name()) || KIND.equals(property.name()))) {
                continue;
            }
            properties.add(TypeScriptFields.interfaceField(o.pkg(), property));
        }
        return TypeScriptFields.printDescription(o.description())
            + "export interface Interface {\n"
            + indent(String.join("\n\n", properties))
            + "\n}";
    }

    // =========================================================================
    // Utility Methods
    // =========================================================================

    /**
     * Prefix every non-empty line with two spaces.
     */
    static String indent(String s) {
        String[] lines = s.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                lines[i] = "  " + lines[i];
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Double-quoted TypeScript string literal.
     *
     * <p>Printable characters are kept as they are. Control characters use their short escape where
     * TypeScript has one and {@code \xNN} otherwise; other non-printable characters, such as
     * {@code U+2028} or a no-break space, become <code>&#92;uNNNN</code> or <code>&#92;u{NNNNN}</code>.
     */
    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0x0B -> sb.append("\\v");
                default -> {
                    if (cp < 0x20 || cp == 0x7F) {
                        sb.append(String.format("\\x%02x", cp));
                    } else if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (Character.isBmpCodePoint(cp)) {
                        sb.append(String.format("\\u%04x", cp));
                    } else {
                        sb.append(String.format("\\u{%x}", cp));
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.SPACE_SEPARATOR, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                 Character.CONTROL, Character.FORMAT, Character.PRIVATE_USE, Character.SURROGATE,
                 Character.UNASSIGNED -> false;
            default -> true;
        };
    }
}
