package cws;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class NormalizedJsonWriterTest {

  private static Document normalize(String text) throws ScriptException {
    return new ScriptPipeline(
            Vocabulary.empty(), DocumentSchema.permissive(), FormatterOptions.defaults())
        .run("test.txt", text)
        .document();
  }

  @Test
  public void scalars() throws ScriptException {
    JsonNode json =
        NormalizedJsonWriter.toJson(
            normalize(
                "a = 1 f = 1.5 w = word q = \"text\" b = yes c = @k d = 1936.1.1 p = 50%").root());

    assertThat(json.get("a").asLong()).isEqualTo(1L);
    assertThat(json.get("f").asDouble()).isEqualTo(1.5);
    assertThat(json.get("w").asText()).isEqualTo("word");
    assertThat(json.get("q").asText()).isEqualTo("string(text)");
    assertThat(json.get("b").asBoolean()).isTrue();
    assertThat(json.get("c").asText()).isEqualTo("constant(@k)");
    assertThat(json.get("d").asText()).isEqualTo("date(1936.1.1)");
    assertThat(json.get("p").asText()).isEqualTo("percentage(50%)");
  }

  @Test
  public void containersAndComparisons() throws ScriptException {
    JsonNode json =
        NormalizedJsonWriter.toJson(
            normalize("l = { x y } m = { n > 5 } r = 1 r = 2").root());

    assertThat(json.get("l").isArray()).isTrue();
    assertThat(json.get("l").size()).isEqualTo(2);
    assertThat(json.get("m").get("n").asText()).isEqualTo("comparison(n > 5)");
    assertThat(json.get("r").get(1).asLong()).isEqualTo(2L);
  }

  @Test
  public void writeProducesParseableJson() throws IOException, ScriptException {
    String text = NormalizedJsonWriter.write(normalize("tech = { cost = 2 }"));

    assertThat(text).endsWith("\n");
    assertThat(new ObjectMapper().readTree(text).get("tech").get("cost").asInt()).isEqualTo(2);
  }
}
