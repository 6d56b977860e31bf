package dev.typegen.generators.typescript;

import dev.typegen.core.model.ArrayType;
import dev.typegen.core.model.EmptyType;
import dev.typegen.core.model.MapType;
import dev.typegen.core.model.PrimitiveKind;
import dev.typegen.core.model.PrimitiveType;
import dev.typegen.core.model.Ref;
import dev.typegen.core.model.Type;

/**
 * Maps schema types to TypeScript type expressions and packages to import aliases.
 */
public final class TypeScriptTypes {

    private TypeScriptTypes() {
    }

    // =========================================================================
    // Type Expressions
    // =========================================================================

    /**
     * Render {@code type} as seen from a file generated for {@code currentPackage}.
     *
     * <ul>
     *   <li>empty                → {@code object}</li>
     *   <li>boolean              → {@code boolean}</li>
     *   <li>integer, number      → {@code number}</li>
     *   <li>string               → {@code string}</li>
     *   <li>ref, same package    → {@code Name}</li>
     *   <li>ref, other package   → {@code apisMetaV1.Name}</li>
     *   <li>array of T           → {@code T[]}</li>
     *   <li>map of T             → {@code {[key: string]: T}}</li>
     * </ul>
     */
    public static String tsType(String currentPackage, Type type) {
        return type.accept(new Type.Visitor<>() {
            @Override
            public String visitEmpty(EmptyType empty) {
                return "object";
            }

            @Override
            public String visitPrimitive(PrimitiveType primitive) {
                return tsPrimitive(primitive.kind());
            }

            @Override
            public String visitRef(Ref ref) {
                // Two packages sharing their last three segments collide here and are not detected.
                if (ref.pkg().equals(currentPackage)) {
                    return ref.name();
                }
                return packageAlias(ref.pkg()) + "." + ref.name();
            }

            @Override
            public String visitArray(ArrayType array) {
                return tsType(currentPackage, array.items()) + "[]";
            }

            @Override
            public String visitMap(MapType map) {
                return "{[key: string]: " + tsType(currentPackage, map.values()) + "}";
            }
        });
    }

    static String tsPrimitive(PrimitiveKind kind) {
        return switch (kind) {
            case BOOLEAN -> "boolean";
            case INTEGER, NUMBER -> "number";
            case STRING -> "string";
        };
    }

    // =========================================================================
    // Package Aliases
    // =========================================================================

    /**
     * The identifier a package is imported as: its last three segments, every segment after the
     * first title-cased, concatenated.
     *
     * <p>Examples:
     * <ul>
     *   <li>{@code io.k8s.api.core.v1}                  → {@code apiCoreV1}</li>
     *   <li>{@code io.k8s.apimachinery.pkg.apis.meta.v1} → {@code apisMetaV1}</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the package has fewer than three segments
     */
    public static String packageAlias(String pkg) {
        String[] segments = pkg.split("\\.", -1);
        if (segments.length < 3) {
            throw new IllegalArgumentException(
                "Package '" + pkg + "' has fewer than three segments and cannot be aliased");
        }
        StringBuilder alias = new StringBuilder(segments[segments.length - 3]);
        alias.append(title(segments[segments.length - 2]));
        alias.append(title(segments[segments.length - 1]));
        return alias.toString();
    }

    /**
     * Title-case the first letter of every word. {@code v1beta1} → {@code V1beta1}, {@code foo-bar} → {@code Foo-Bar}.
     *
     * <p>In ASCII, words are separated by anything other than letters, digits and underscores. Outside
     * ASCII, only white space separates words, so {@code a·b} stays one word.
     */
    static String title(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean atWordStart = true;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            sb.appendCodePoint(atWordStart ? Character.toTitleCase(cp) : cp);
            atWordStart = isWordSeparator(cp);
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    private static boolean isWordSeparator(int cp) {
        if (cp <= 0x7F) {
            return !((cp >= '0' && cp <= '9') || (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '_');
        }
        if (Character.isLetterOrDigit(cp)) {
            return false;
        }
        // NEL is white space but not a Unicode space separator.
        return Character.isSpaceChar(cp) || cp == 0x85;
    }
}
