package cws;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class NodeTransformerTest {

  private static final Vocabulary VOCABULARY =
      Vocabulary.builder()
          .addKeywords(ImmutableSet.of("limit"))
          .addTriggers(ImmutableSet.of("allow", "has_dlc"))
          .addRepeatableKeys(ImmutableSet.of("folder"))
          .build();

  private static Document normalize(DocumentSchema schema, String... lines)
      throws ScriptException {
    String content = Arrays.asList(lines).stream().collect(Collectors.joining("\n"));
    Node.Block root = new Parser(new Tokenizer("test.txt", content, VOCABULARY).tokenize()).parse();
    return new NodeTransformer(VOCABULARY, schema).normalize(root);
  }

  private static Value.Mapping normalize(String... lines) throws ScriptException {
    return normalize(DocumentSchema.permissive(), lines).root();
  }

  private static TransformException assertErrors(String errorSubstr, String... lines) {
    TransformException ex =
        assertThrows(
            TransformException.class, () -> normalize(Schemas.technologies(), lines));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
    assertThat(ex.stage()).isEqualTo(ScriptException.Stage.TRANSFORM);
    return ex;
  }

  @Test
  public void typedScalars() throws ScriptException {
    Value.Mapping root =
        normalize(
            "s = word",
            "q = \"quoted\"",
            "i = 3",
            "f = 1.5",
            "b = yes",
            "c = @k",
            "p = 10%",
            "d = 1936.1.1",
            "r = ROOT.owner");

    assertThat(root.get("s")).isEqualTo(Value.PlainString.of("word"));
    assertThat(root.get("q")).isEqualTo(Value.QuotedString.of("quoted"));
    assertThat(root.get("i")).isEqualTo(Value.IntegerValue.of(3));
    assertThat(root.get("f")).isEqualTo(Value.FloatValue.of(1.5));
    assertThat(root.get("b")).isEqualTo(Value.BooleanValue.of(true));
    assertThat(root.get("c")).isEqualTo(Value.ConstantRef.of("@k"));
    assertThat(root.get("p")).isEqualTo(Value.Percentage.of(0.1, "%"));
    assertThat(root.get("d")).isEqualTo(Value.DateValue.of("1936.1.1"));
    assertThat(root.get("r")).isEqualTo(Value.PlainString.of("ROOT.owner"));
  }

  @Test
  public void entriesKeepFirstOccurrenceOrder() throws ScriptException {
    Value.Mapping root = normalize("b = 1", "a = 2", "b = 3", "c = 4");

    assertThat(root.entries().keySet()).containsExactly("b", "a", "c").inOrder();
  }

  @Test
  public void repeatedKeysMerge() throws ScriptException {
    Value.Mapping root = normalize("a = 1", "a = 2", "b = 3");

    assertThat(root.get("a"))
        .isEqualTo(
            Value.Sequence.merged(
                ImmutableList.of(Value.IntegerValue.of(1), Value.IntegerValue.of(2))));
    assertThat(root.get("b")).isEqualTo(Value.IntegerValue.of(3));
  }

  @Test
  public void repeatableKeyAlwaysMerges() throws ScriptException {
    Value.Mapping root = normalize("folder = { name = a }");

    Value.Sequence folder = root.get("folder").cast();
    assertThat(folder.merged()).isTrue();
    assertThat(folder.size()).isEqualTo(1);
    assertThat(folder.get(0).type()).isEqualTo(Value.Type.MAPPING);
  }

  @Test
  public void listsBecomeSequences() throws ScriptException {
    Value.Mapping root = normalize("a = { x y }", "e = {}");

    assertThat(root.get("a"))
        .isEqualTo(
            Value.Sequence.literal(
                ImmutableList.of(Value.PlainString.of("x"), Value.PlainString.of("y"))));
    assertThat(root.get("e")).isEqualTo(Value.Sequence.literal(ImmutableList.of()));
  }

  @Test
  public void anonymousBlocksBecomeMappingsInASequence() throws ScriptException {
    Value.Sequence list = normalize("a = { { x = 1 } { y = 2 } }").get("a").cast();

    assertThat(list.size()).isEqualTo(2);
    assertThat(list.get(1).cast(Value.Mapping.class).get("y"))
        .isEqualTo(Value.IntegerValue.of(2));
  }

  @Test
  public void comparisonsAreKeyedByTheirLeftSide() throws ScriptException {
    Value.Mapping limit = normalize("limit = { num > 5 }").get("limit").cast();

    assertThat(limit.get("num"))
        .isEqualTo(
            Value.Comparison.of(Value.PlainString.of("num"), ">", Value.IntegerValue.of(5)));
  }

  @Test
  public void triggerAssignmentsBecomeComparisons() throws ScriptException {
    Value.Mapping allow = normalize("allow = { has_dlc = \"x\" }").get("allow").cast();

    assertThat(allow.get("has_dlc"))
        .isEqualTo(
            Value.Comparison.of(Value.PlainString.of("has_dlc"), "=", Value.QuotedString.of("x")));
  }

  @Test
  public void constantsGoUnderTheirOwnKey() throws ScriptException {
    Value.Mapping root = normalize("@k = 2", "a = @k");

    assertThat(root.entries().keySet()).containsExactly(Node.CONSTANTS_KEY, "a").inOrder();
    assertThat(root.get(Node.CONSTANTS_KEY).cast(Value.Mapping.class).get("@k"))
        .isEqualTo(Value.IntegerValue.of(2));
  }

  @Test
  public void quotedKeysAreUnquoted() throws ScriptException {
    assertThat(normalize("\"my key\" = 1").entries().keySet()).containsExactly("my key");
  }

  @Test
  public void quotedKeysAreRemembered() throws ScriptException {
    Value.Mapping root =
        normalize("\"yes\" = 1", "plain = 2", "\"plain\" = 3", "a = { \"b\" = c }");

    assertThat(root.quotedKeys()).containsExactly("yes");
    assertThat(root.get("a").cast(Value.Mapping.class).quotedKeys()).containsExactly("b");
  }

  @Test
  public void documentKeepsFileAndSchema() throws ScriptException {
    Document document = normalize(Schemas.technologies(), "technologies = { t = { } }");

    assertThat(document.file()).isEqualTo("test.txt");
    assertThat(document.schema()).isSameInstanceAs(Schemas.technologies());
  }

  @Test
  public void technologiesSchemaAcceptsATechnology() throws ScriptException {
    Document document =
        normalize(
            Schemas.technologies(),
            "technologies = {",
            "  t = {",
            "    path = { leads_to_tech = u }",
            "    categories = { a b }",
            "    research_cost = 1.5",
            "    ai_will_do = { factor = 1 }",
            "    custom = anything",
            "  }",
            "}");

    Value.Mapping tech =
        document.root().get("technologies").cast(Value.Mapping.class).get("t").cast();
    Value.Sequence path = tech.get("path").cast();
    assertThat(path.merged()).isTrue();
    assertThat(tech.get("categories").cast(Value.Sequence.class).merged()).isFalse();
  }

  @Test
  public void missingRootKeyError() {
    TransformException ex = assertErrors("root key 'technologies' not present", "other = 1");

    assertThat(ex.pos().line()).isEqualTo(0);
  }

  @Test
  public void rootKeyMustHoldABlockError() {
    assertErrors("'technologies' must hold a BLOCK, found INTEGER", "technologies = 1");
  }

  @Test
  public void wrongValueShapeError() {
    TransformException ex =
        assertErrors(
            "'technologies.t.research_cost' must hold a SCALAR, found MAPPING",
            "technologies = {",
            "  t = {",
            "    research_cost = { a = 1 }",
            "  }",
            "}");

    assertThat(ex.pos().line()).isEqualTo(3);
    assertThat(ex.pos().column()).isEqualTo(5);
  }

  @Test
  public void firstErrorInSourceOrder() {
    TransformException ex =
        assertErrors(
            "'technologies.t.categories' must hold a LIST",
            "technologies = {",
            "  t = {",
            "    categories = 5",
            "    start_year = { 1 2 }",
            "  }",
            "}");

    assertThat(ex.pos().line()).isEqualTo(3);
  }

  @Test
  public void rejectsNonRootBlocks() throws ScriptException {
    Node.Block root =
        new Parser(new Tokenizer("test.txt", "a = { b = 1 }", VOCABULARY).tokenize()).parse();
    Node.Block inner = root.children().get(0).cast();

    assertThrows(
        IllegalArgumentException.class,
        () -> new NodeTransformer(VOCABULARY, DocumentSchema.permissive()).normalize(inner));
  }
}
