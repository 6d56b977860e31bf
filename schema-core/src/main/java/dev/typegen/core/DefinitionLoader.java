package dev.typegen.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.typegen.core.model.Definition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a JSON snapshot of an already resolved model: an array of definitions.
 */
public final class DefinitionLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefinitionLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<Definition>> DEFINITIONS = new TypeReference<>() {};

  private DefinitionLoader() {
  }

  public static List<Definition> load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    List<Definition> definitions = JSON.readValue(bytes, DEFINITIONS);
    LOGGER.info("Loaded {} definitions from {}", definitions.size(), path);
    return definitions;
  }

  public static List<Definition> parse(String json) throws IOException {
    return JSON.readValue(json, DEFINITIONS);
  }
}
