package dev.typegen.generators.typescript;

import dev.typegen.core.RefRegistry;
import dev.typegen.core.model.ArrayType;
import dev.typegen.core.model.EmptyType;
import dev.typegen.core.model.MapType;
import dev.typegen.core.model.NamedProperty;
import dev.typegen.core.model.PrimitiveType;
import dev.typegen.core.model.Ref;
import dev.typegen.core.model.Type;

import java.util.Objects;

/**
 * Renders single properties: class fields, interface members, and the constructor lines that
 * turn a plain descriptor value into a typed field value.
 */
public final class TypeScriptFields {

    private final RefRegistry refObjects;

    public TypeScriptFields(RefRegistry refObjects) {
        this.refObjects = Objects.requireNonNull(refObjects, "refObjects");
    }

    // =========================================================================
    // Declarations
    // =========================================================================

    /**
     * Field of a generated class, e.g. {@code public spec?: PodSpec;}.
     */
    public static String typesField(String currentPackage, NamedProperty property) {
        return printDescription(property.description())
            + "public " + property.name() + optionalMarker(property) + ": "
            + TypeScriptTypes.tsType(currentPackage, property.type()) + ";";
    }

    /**
     * Member of a generated interface, e.g. {@code spec?: PodSpec;}.
     */
    public static String interfaceField(String currentPackage, NamedProperty property) {
        return printDescription(property.description())
            + property.name() + optionalMarker(property) + ": "
            + TypeScriptTypes.tsType(currentPackage, property.type()) + ";";
    }

    /**
     * One {@code // } comment line per line of {@code description}, each ending in a newline.
     */
    public static String printDescription(String description) {
        if (description == null || description.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : description.split("\n", -1)) {
            sb.append("// ").append(line).append('\n');
        }
        return sb.toString();
    }

    private static String optionalMarker(NamedProperty property) {
        return property.required() ? "" : "?";
    }

    // =========================================================================
    // Constructor Lines
    // =========================================================================

    /**
     * The line in a generated constructor that assigns {@code property}, starting with a newline.
     *
     * @param override expression to assign instead of the descriptor value; {@code null} or empty falls back to
     *                 the property's own override value, then to the coerced descriptor value
     */
    public String constructorField(String currentPackage, NamedProperty property, String override) {
        String value = override != null && !override.isEmpty() ? override : property.overrideValue();
        if (value == null) {
            String source = "desc." + property.name();
            value = constructorExpression(currentPackage, property.type(), source);
            if (!property.required() && isArrayOfKubernetesObjects(property.type())) {
                value = "(" + source + " !== undefined) ? " + value + " : undefined";
            }
        }
        return "\nthis." + property.name() + " = " + value + ";";
    }

    /**
     * Expression converting the raw value {@code field} to {@code type}.
     *
     * <p>Only refs to Kubernetes objects, and arrays directly holding them, are constructed. Arrays of
     * arrays and map values are passed through untouched even when they hold Kubernetes objects.
     */
    public String constructorExpression(String currentPackage, Type type, String field) {
        return type.accept(new Type.Visitor<>() {
            @Override
            public String visitEmpty(EmptyType empty) {
                return field;
            }

            @Override
            public String visitPrimitive(PrimitiveType primitive) {
                return field;
            }

            @Override
            public String visitRef(Ref ref) {
                if (!refObjects.isKubernetesObject(ref)) {
                    return field;
                }
                if (ref.pkg().equals(currentPackage)) {
                    return "new " + ref.name() + "(" + field + ")";
                }
                return "new " + TypeScriptTypes.packageAlias(ref.pkg()) + "." + ref.name() + "(" + field + ")";
            }

            @Override
            public String visitArray(ArrayType array) {
                if (isArrayOfKubernetesObjects(array)) {
                    return field + ".map((i) => " + constructorExpression(currentPackage, array.items(), "i") + ")";
                }
                return field;
            }

            @Override
            public String visitMap(MapType map) {
                return field;
            }
        });
    }

    private boolean isArrayOfKubernetesObjects(Type type) {
        return type instanceof ArrayType array
            && array.items() instanceof Ref ref
            && refObjects.isKubernetesObject(ref);
    }
}
