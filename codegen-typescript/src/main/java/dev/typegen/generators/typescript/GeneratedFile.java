package dev.typegen.generators.typescript;

/**
 * Contents of one generated source file, named relative to the output directory.
 */
public record GeneratedFile(String fileName, String contents) {
}
