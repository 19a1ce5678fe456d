package cws;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.google.common.io.ByteSource;
import com.google.common.io.CharSource;

public class VocabularyLoaderTest {

  private static final String BASE =
      "{\"keywords\": [\"if\", \"limit\"], \"triggers\": [\"always\"]}";

  private static ByteSource json(String text) {
    return CharSource.wrap(text).asByteSource(StandardCharsets.UTF_8);
  }

  private static Vocabulary load(String game) throws IOException {
    return VocabularyLoader.load("base.json", json(BASE), "game.json", json(game));
  }

  private static void assertErrors(String errorSubstr, String game) {
    IOException ex = assertThrows(IOException.class, () -> load(game));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void defaults() throws IOException {
    Vocabulary vocabulary = VocabularyLoader.loadDefaults();

    assertThat(vocabulary.keywords()).contains("modifier");
    assertThat(vocabulary.triggers()).containsAtLeast("allow", "has_war");
    assertThat(vocabulary.modifiers()).contains("research_speed_factor");
    assertThat(vocabulary.effects()).contains("add_ideas");
    assertThat(vocabulary.repeatableKeys()).containsExactly("path", "folder");
  }

  @Test
  public void triggersFromBothFilesAreCombined() throws IOException {
    Vocabulary vocabulary =
        load(
            "{\"modifiers\": [\"stability_factor\"], \"effects\": [\"add_stability\"],"
                + " \"triggers\": [\"has_war\"], \"repeatable_keys\": [\"path\"]}");

    assertThat(vocabulary.triggers()).containsExactly("always", "has_war");
    assertThat(vocabulary.classify("limit")).isEqualTo(Tokenizer.TokenType.KEYWORD);
    assertThat(vocabulary.classify("stability_factor")).isEqualTo(Tokenizer.TokenType.MODIFIER);
    assertThat(vocabulary.classify("add_stability")).isEqualTo(Tokenizer.TokenType.EFFECT);
    assertThat(vocabulary.classify("has_war")).isEqualTo(Tokenizer.TokenType.TRIGGER);
    assertThat(vocabulary.classify("tech")).isEqualTo(Tokenizer.TokenType.IDENTIFIER);
    assertThat(vocabulary.isRepeatable("path")).isTrue();
  }

  @Test
  public void repeatableKeysAreOptional() throws IOException {
    Vocabulary vocabulary = load("{\"modifiers\": [], \"effects\": [], \"triggers\": []}");

    assertThat(vocabulary.repeatableKeys()).isEmpty();
  }

  @Test
  public void malformedVocabularyErrors() {
    assertErrors("missing 'effects'", "{\"modifiers\": [], \"triggers\": []}");
    assertErrors(
        "'modifiers' must be an array of strings",
        "{\"modifiers\": \"x\", \"effects\": [], \"triggers\": []}");
    assertErrors(
        "'effects' contains a non-string entry 3",
        "{\"modifiers\": [], \"effects\": [3], \"triggers\": []}");
    assertErrors("game.json: vocabulary must be a JSON object", "[\"modifiers\"]");
  }

  @Test
  public void invalidJsonError() {
    assertThrows(IOException.class, () -> load("{\"modifiers\": ["));
  }
}
