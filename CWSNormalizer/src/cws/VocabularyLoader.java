package cws;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;

/**
 * Reads a {@link Vocabulary} from two JSON documents: a base vocabulary with {@code keywords} and
 * {@code triggers}, and a game vocabulary with {@code modifiers}, {@code effects}, {@code
 * triggers} and an optional {@code repeatable_keys}. Triggers from both are combined.
 */
public final class VocabularyLoader {
  private static final Logger LOG = LoggerFactory.getLogger(VocabularyLoader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_BASE_RESOURCE = "clausewitz.json";
  public static final String DEFAULT_GAME_RESOURCE = "hoi4.json";

  /** Loads the vocabularies bundled on the classpath. */
  public static Vocabulary loadDefaults() throws IOException {
    return load(
        DEFAULT_BASE_RESOURCE,
        resource(DEFAULT_BASE_RESOURCE),
        DEFAULT_GAME_RESOURCE,
        resource(DEFAULT_GAME_RESOURCE));
  }

  private static ByteSource resource(String name) {
    return Resources.asByteSource(Resources.getResource(VocabularyLoader.class, "/" + name));
  }

  public static Vocabulary load(File base, File game) throws IOException {
    return load(
        base.toString(), Files.asByteSource(base), game.toString(), Files.asByteSource(game));
  }

  public static Vocabulary load(String baseName, ByteSource base, String gameName, ByteSource game)
      throws IOException {
    JsonNode baseRoot = readObject(baseName, base);
    JsonNode gameRoot = readObject(gameName, game);

    Vocabulary vocabulary =
        Vocabulary.builder()
            .addKeywords(stringList(baseName, baseRoot, "keywords", true))
            .addTriggers(stringList(baseName, baseRoot, "triggers", true))
            .addModifiers(stringList(gameName, gameRoot, "modifiers", true))
            .addEffects(stringList(gameName, gameRoot, "effects", true))
            .addTriggers(stringList(gameName, gameRoot, "triggers", true))
            .addRepeatableKeys(stringList(gameName, gameRoot, "repeatable_keys", false))
            .build();
    LOG.debug(
        "Loaded vocabulary from {} and {}: {} keywords, {} modifiers, {} effects, {} triggers",
        baseName,
        gameName,
        vocabulary.keywords().size(),
        vocabulary.modifiers().size(),
        vocabulary.effects().size(),
        vocabulary.triggers().size());
    return vocabulary;
  }

  private static JsonNode readObject(String name, ByteSource source) throws IOException {
    JsonNode root;
    try (InputStream in = source.openStream()) {
      root = MAPPER.readTree(in);
    }
    if (root == null || !root.isObject()) {
      throw new IOException(name + ": vocabulary must be a JSON object");
    }
    return root;
  }

  private static ImmutableList<String> stringList(
      String name, JsonNode root, String field, boolean required) throws IOException {
    JsonNode node = root.get(field);
    if (node == null) {
      if (required) throw new IOException(String.format("%s: missing '%s'", name, field));
      return ImmutableList.of();
    }
    if (!node.isArray()) {
      throw new IOException(String.format("%s: '%s' must be an array of strings", name, field));
    }

    ImmutableList.Builder<String> words = ImmutableList.builder();
    for (JsonNode element : node) {
      if (!element.isTextual()) {
        throw new IOException(
            String.format("%s: '%s' contains a non-string entry %s", name, field, element));
      }
      words.add(element.asText());
    }
    return words.build();
  }

  private VocabularyLoader() {}
}
