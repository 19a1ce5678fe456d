package cws;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public class FormatterTest {

  private static final Vocabulary VOCABULARY =
      Vocabulary.builder()
          .addKeywords(ImmutableSet.of("limit"))
          .addTriggers(ImmutableSet.of("allow"))
          .build();

  private static Node.Block parse(String text) throws ScriptException {
    return new Parser(new Tokenizer("tree.txt", text, VOCABULARY).tokenize()).parse();
  }

  private static Value.Mapping mapping(String key, Value value) {
    return Value.Mapping.of(ImmutableMap.of(key, value));
  }

  private static Value.Mapping mapping(String k1, Value v1, String k2, Value v2) {
    return Value.Mapping.of(ImmutableMap.of(k1, v1, k2, v2));
  }

  private static Value.Sequence list(Value... elements) {
    return Value.Sequence.literal(Arrays.asList(elements));
  }

  private static Value word(String text) {
    return Value.PlainString.of(text);
  }

  private static Value number(long value) {
    return Value.IntegerValue.of(value);
  }

  private static Value.Sequence numbers(int count) {
    return Value.Sequence.literal(
        IntStream.rangeClosed(1, count)
            .mapToObj(Value.IntegerValue::of)
            .collect(Collectors.toList()));
  }

  private static String lines(String... lines) {
    return Arrays.asList(lines).stream().collect(Collectors.joining("\n", "", "\n"));
  }

  @Test
  public void scalars() {
    assertThat(Formatter.formatScalar(word("infantry"))).isEqualTo("infantry");
    assertThat(Formatter.formatScalar(word("has space"))).isEqualTo("\"has space\"");
    assertThat(Formatter.formatScalar(Value.QuotedString.of("a \"b\" \\")))
        .isEqualTo("\"a \\\"b\\\" \\\\\"");
    assertThat(Formatter.formatScalar(number(-3))).isEqualTo("-3");
    assertThat(Formatter.formatScalar(Value.FloatValue.of(2.0))).isEqualTo("2");
    assertThat(Formatter.formatScalar(Value.FloatValue.of(1.50))).isEqualTo("1.5");
    assertThat(Formatter.formatScalar(Value.FloatValue.of(-0.05))).isEqualTo("-0.05");
    assertThat(Formatter.formatScalar(Value.BooleanValue.of(false))).isEqualTo("no");
    assertThat(Formatter.formatScalar(Value.ConstantRef.of("@cost"))).isEqualTo("@cost");
    assertThat(Formatter.formatScalar(Value.Percentage.of(0.125, "%%"))).isEqualTo("12.5%%");
    assertThat(Formatter.formatScalar(Value.DateValue.of("1936.1.1"))).isEqualTo("1936.1.1");
  }

  @Test
  public void keys() {
    assertThat(Formatter.formatKey("event_target:foo")).isEqualTo("event_target:foo");
    assertThat(Formatter.formatKey("ROOT.owner")).isEqualTo("ROOT.owner");
    assertThat(Formatter.formatKey("my key")).isEqualTo("\"my key\"");
    assertThat(Formatter.formatKey("")).isEqualTo("\"\"");
    assertThat(Formatter.formatKey("1936.1.1")).isEqualTo("1936.1.1");
    assertThat(Formatter.formatKey("yes")).isEqualTo("\"yes\"");
    assertThat(Formatter.formatKey("1..2")).isEqualTo("\"1..2\"");
    assertThat(Formatter.formatKey("@foo")).isEqualTo("\"@foo\"");
    assertThat(Formatter.formatKey("a:")).isEqualTo("\"a:\"");
  }

  @Test
  public void quotedKeysStayQuoted() throws FormatException {
    Value.Mapping root =
        Value.Mapping.of(
            ImmutableMap.of("allow", mapping("a", word("b")), "plain", number(1)),
            ImmutableSet.of("allow"));

    assertThat(new Formatter().format(root))
        .isEqualTo(lines("\"allow\" = { a = b }", "plain = 1"));
  }

  @Test
  public void atSignOnTheLeftOfAComparison() throws FormatException {
    Value comparison = Value.Comparison.of(word("@c"), "=", number(1));

    assertThat(new Formatter().format(mapping("allow", mapping("@c", comparison))))
        .isEqualTo(lines("allow = {", "\t\"@c\" = 1", "}"));
  }

  @Test
  public void nestedDocument() throws FormatException {
    Value.Mapping tech =
        Value.Mapping.of(
            ImmutableMap.of(
                "cost",
                number(1),
                "categories",
                list(word("a"), word("b")),
                "path",
                Value.Sequence.merged(
                    ImmutableList.of(mapping("x", number(1)), mapping("x", number(2)))),
                "allow",
                mapping(
                    "has_dlc",
                    Value.Comparison.of(word("has_dlc"), "=", Value.QuotedString.of("x")))));

    assertThat(new Formatter().format(mapping("tech", tech)))
        .isEqualTo(
            lines(
                "tech = {",
                "\tcost = 1",
                "\tcategories = { a b }",
                "\tpath = { x = 1 }",
                "\tpath = { x = 2 }",
                "\tallow = {",
                "\t\thas_dlc = \"x\"",
                "\t}",
                "}"));
  }

  @Test
  public void inlineListBoundary() throws FormatException {
    assertThat(new Formatter().format(mapping("a", numbers(8))))
        .isEqualTo("a = { 1 2 3 4 5 6 7 8 }\n");
    assertThat(new Formatter().format(mapping("a", numbers(9))))
        .isEqualTo(
            lines(
                "a = {", "\t1", "\t2", "\t3", "\t4", "\t5", "\t6", "\t7", "\t8", "\t9", "}"));
  }

  @Test
  public void listOfBlocks() throws FormatException {
    Value.Sequence blocks = list(mapping("x", number(1)), mapping("y", number(2), "z", number(3)));

    assertThat(new Formatter().format(mapping("a", blocks)))
        .isEqualTo(
            lines("a = {", "\t{ x = 1 }", "\t{", "\t\ty = 2", "\t\tz = 3", "\t}", "}"));
  }

  @Test
  public void inlineBracesDisabled() throws FormatException {
    Formatter formatter =
        new Formatter(FormatterOptions.builder().setInlineBraces(false).setIndent("  ").build());

    assertThat(formatter.format(mapping("a", mapping("b", number(1)), "l", list(word("x")))))
        .isEqualTo(lines("a = {", "  b = 1", "}", "l = {", "  x", "}"));
  }

  @Test
  public void emptyBraces() throws FormatException {
    assertThat(new Formatter().format(mapping("a", Value.Mapping.empty(), "b", list())))
        .isEqualTo(lines("a = {}", "b = {}"));
  }

  @Test
  public void emptyDocument() throws FormatException {
    assertThat(new Formatter().format(Value.Mapping.empty())).isEmpty();
  }

  @Test
  public void constantsAreWrittenInline() throws FormatException {
    Value.Mapping root =
        mapping(
            Node.CONSTANTS_KEY,
            mapping("@cost", number(2)),
            "a",
            Value.ConstantRef.of("@cost"));

    assertThat(new Formatter().format(root)).isEqualTo(lines("@cost = 2", "a = @cost"));
  }

  @Test
  public void constantsHoldingABareWordGoLast() throws FormatException {
    Value.Mapping constants =
        Value.Mapping.of(
            ImmutableMap.of("@a", word("foo"), "@b", number(2), "@c", Value.FloatValue.of(1.5)));

    assertThat(new Formatter().format(mapping(Node.CONSTANTS_KEY, constants, "x", number(1))))
        .isEqualTo(lines("@b = 2", "@c = 1.5", "@a = foo", "x = 1"));
  }

  @Test
  public void parseTree() throws ScriptException {
    String text =
        lines(
            "@a = foo",
            "x = 2.0 # kept as written",
            "@b = 2",
            "b = { y = 2 }",
            "\"yes\" = { 1 2 }",
            "allow = { tag = GER }",
            "l = { { x = 1 } { y = 2 z = 3 } }",
            "e = {}",
            "limit = { n > 5 }",
            "x = 3");

    String formatted = new Formatter().format(parse(text));

    assertThat(formatted)
        .isEqualTo(
            lines(
                "@b = 2",
                "@a = foo",
                "x = 2.0",
                "b = { y = 2 }",
                "\"yes\" = { 1 2 }",
                "allow = {",
                "\ttag = GER",
                "}",
                "l = {",
                "\t{ x = 1 }",
                "\t{",
                "\t\ty = 2",
                "\t\tz = 3",
                "\t}",
                "}",
                "e = {}",
                "limit = {",
                "\tn > 5",
                "}",
                "x = 3"));
    assertThat(new Formatter().format(parse(formatted))).isEqualTo(formatted);
  }

  @Test
  public void parseTreeWithoutInlining() throws ScriptException {
    Formatter formatter =
        new Formatter(FormatterOptions.builder().setInlineBraces(false).setIndent("  ").build());

    assertThat(formatter.format(parse("a = { b = 1 } l = { x y }")))
        .isEqualTo(lines("a = {", "  b = 1", "}", "l = {", "  x", "  y", "}"));
  }

  @Test
  public void parseTreeKeepsUnhoistedAtSignKeys() throws ScriptException {
    String formatted = new Formatter().format(parse("x = foo\n@c = 1\nx = 5"));

    assertThat(formatted).isEqualTo(lines("x = foo", "@c = 1", "x = 5"));
    assertThat(new Formatter().format(parse(formatted))).isEqualTo(formatted);
  }

  @Test
  public void parseTreeMustBeARoot() throws ScriptException {
    Node.Block inner = parse("a = { b = 1 }").children().get(0).cast();

    assertThrows(IllegalArgumentException.class, () -> new Formatter().format(inner));
  }

  @Test
  public void comparisonsInAList() throws FormatException {
    Value.Sequence conditions =
        list(Value.Comparison.of(word("num"), ">=", number(5)), word("always"));

    assertThat(new Formatter().format(mapping("limit", conditions)))
        .isEqualTo(lines("limit = {", "\tnum >= 5", "\talways", "}"));
  }

  @Test
  public void nestedComparisonError() {
    Value nested =
        Value.Comparison.of(Value.Comparison.of(word("a"), "<", number(1)), "=", word("b"));
    Document document =
        Document.create("doc.txt", DocumentSchema.permissive(), mapping("a", nested));

    FormatException ex =
        assertThrows(FormatException.class, () -> new Formatter().format(document));
    assertThat(ex).hasMessageThat().contains("nested comparison on the left-hand side");
    assertThat(ex.pos().file()).isEqualTo("doc.txt");
    assertThat(ex.stage()).isEqualTo(ScriptException.Stage.FORMAT);
  }

  @Test
  public void containerInComparisonError() {
    Value comparison = Value.Comparison.of(word("a"), "=", list(word("b")));

    FormatException ex =
        assertThrows(
            FormatException.class, () -> new Formatter().format(mapping("a", comparison)));
    assertThat(ex).hasMessageThat().contains("SEQUENCE as the right-hand side");
  }

  @Test
  public void mergedTwiceError() {
    Value inner = Value.Sequence.merged(ImmutableList.of(word("x")));
    Value twice = Value.Sequence.merged(ImmutableList.of(inner));

    FormatException ex =
        assertThrows(FormatException.class, () -> new Formatter().format(mapping("a", twice)));
    assertThat(ex).hasMessageThat().contains("merged twice");
  }

  @Test
  public void indentMustBeWhitespace() {
    assertThrows(
        IllegalArgumentException.class, () -> FormatterOptions.builder().setIndent("--").build());
  }
}
