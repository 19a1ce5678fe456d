package cws;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Writes a normalized tree or a parse tree back out as script text, one entry per line. With
 * inlining enabled, a block holding a single scalar entry and a list of up to {@value
 * FormatterOptions#MAX_INLINE_LIST_SIZE} scalars are written on one line.
 */
public class Formatter {

  private final FormatterOptions options;

  public Formatter(FormatterOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public Formatter() {
    this(FormatterOptions.defaults());
  }

  public String format(Document document) throws FormatException {
    return new Writer(Tokenizer.Pos.unknown(document.file())).write(document.root());
  }

  public String format(Value.Mapping root) throws FormatException {
    return new Writer(Tokenizer.Pos.internal()).write(root);
  }

  /** Writes a parse tree in source order, with every token spelled as it was read. */
  public String format(Node.Block root) {
    Preconditions.checkArgument(root.kind() == Node.BlockKind.ROOT, "not a root block");
    TreeWriter writer = new TreeWriter();
    root.visitChildren(writer, 0);
    return join(writer.lines);
  }

  /** Renders one scalar the way it appears as a value. */
  public static String formatScalar(Value value) {
    Preconditions.checkArgument(value.isPlainScalar(), "Not a scalar: %s", value);
    switch (value.type()) {
      case STRING:
        {
          String text = value.cast(Value.PlainString.class).text();
          return Tokenizer.isBareWord(text) ? text : quote(text);
        }
      case QUOTED_STRING:
        return quote(value.cast(Value.QuotedString.class).text());
      case INTEGER:
        return Long.toString(value.cast(Value.IntegerValue.class).value());
      case FLOAT:
        return formatFloat(value.cast(Value.FloatValue.class).value());
      case BOOLEAN:
        return value.cast(Value.BooleanValue.class).value() ? "yes" : "no";
      case CONSTANT:
        return value.cast(Value.ConstantRef.class).name();
      case PERCENTAGE:
        return value.cast(Value.Percentage.class).text();
      case DATE:
        return value.cast(Value.DateValue.class).text();
      default:
        throw new AssertionError(value.type());
    }
  }

  /**
   * Keys are bare when they read back as the same word. A key starting with '@' is quoted, since
   * whether it reads back as a constant depends on the token before it.
   */
  public static String formatKey(String text) {
    return Tokenizer.isBareWord(text) && !text.startsWith("@") ? text : quote(text);
  }

  private static String formatKey(Value.Mapping mapping, String key) {
    return mapping.isQuoted(key) ? quote(key) : formatKey(key);
  }

  // 1.50 -> 1.5, 2.0 -> 2
  static String formatFloat(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  static String quote(String text) {
    return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private static boolean allPlainScalars(List<Value> values) {
    return values.stream().allMatch(Value::isPlainScalar);
  }

  private static boolean holdsIdentifier(Node node) {
    return node.type() == Node.Type.KEY_VALUE
        && node.cast(Node.KeyValue.class).value().token().is(Tokenizer.TokenType.IDENTIFIER);
  }

  private static String join(List<String> lines) {
    if (lines.isEmpty()) return "";
    return lines
            .stream()
            .map(CharMatcher.whitespace()::trimTrailingFrom)
            .collect(Collectors.joining("\n"))
        + "\n";
  }

  private String indented(int level, String text) {
    return Strings.repeat(options.indent(), level) + text;
  }

  /** Accumulates the output lines of one format call. */
  private final class Writer {
    private final Tokenizer.Pos pos;
    private final List<String> lines = new ArrayList<>();

    Writer(Tokenizer.Pos pos) {
      this.pos = pos;
    }

    String write(Value.Mapping root) throws FormatException {
      writeEntries(root, 0);
      return join(lines);
    }

    private void line(int level, String text) {
      lines.add(indented(level, text));
    }

    private void writeEntries(Value.Mapping mapping, int level) throws FormatException {
      for (Map.Entry<String, Value> entry : mapping.entries().entrySet()) {
        Value value = entry.getValue();
        if (entry.getKey().equals(Node.CONSTANTS_KEY) && value.type() == Value.Type.MAPPING) {
          writeConstants(value.cast(), level);
        } else {
          writeEntry(entry.getKey(), formatKey(mapping, entry.getKey()), value, level);
        }
      }
    }

    // Plain @name = value lines. A constant right after a bare word would read back as an
    // ordinary key, so constants holding a bare word go last.
    private void writeConstants(Value.Mapping constants, int level) throws FormatException {
      List<Map.Entry<String, Value>> ordered = new ArrayList<>(constants.entries().entrySet());
      ordered.sort(
          Comparator.comparing(
              (Map.Entry<String, Value> entry) -> entry.getValue().type() == Value.Type.STRING));
      for (Map.Entry<String, Value> entry : ordered) {
        writeEntry(entry.getKey(), entry.getKey(), entry.getValue(), level);
      }
    }

    private void writeEntry(String key, String writtenKey, Value value, int level)
        throws FormatException {
      String prefix = writtenKey + " = ";
      switch (value.type()) {
        case COMPARISON:
          line(level, formatComparison(value.cast()));
          return;
        case MAPPING:
          writeMapping(prefix, value.cast(), level);
          return;
        case SEQUENCE:
          {
            Value.Sequence sequence = value.cast();
            if (sequence.merged()) {
              for (Value element : sequence.elements()) {
                if (element.type() == Value.Type.SEQUENCE
                    && element.cast(Value.Sequence.class).merged()) {
                  throw new FormatException(pos, String.format("'%s' merged twice", key));
                }
                writeEntry(key, writtenKey, element, level);
              }
            } else {
              writeList(prefix, sequence, level);
            }
            return;
          }
        default:
          line(level, prefix + formatScalar(value));
      }
    }

    // An unkeyed element of a list.
    private void writeElement(Value value, int level) throws FormatException {
      switch (value.type()) {
        case COMPARISON:
          line(level, formatComparison(value.cast()));
          return;
        case MAPPING:
          writeMapping("", value.cast(), level);
          return;
        case SEQUENCE:
          {
            Value.Sequence sequence = value.cast();
            if (sequence.merged()) {
              throw new FormatException(pos, "repeated-key values outside a block");
            }
            writeList("", sequence, level);
            return;
          }
        default:
          line(level, formatScalar(value));
      }
    }

    private void writeMapping(String prefix, Value.Mapping mapping, int level)
        throws FormatException {
      if (mapping.isEmpty()) {
        line(level, prefix + "{}");
        return;
      }

      if (options.inlineBraces() && mapping.entries().size() == 1) {
        Map.Entry<String, Value> entry = mapping.entries().entrySet().iterator().next();
        if (entry.getValue().isPlainScalar()) {
          line(
              level,
              String.format(
                  "%s{ %s = %s }",
                  prefix,
                  formatKey(mapping, entry.getKey()),
                  formatScalar(entry.getValue())));
          return;
        }
      }

      line(level, prefix + "{");
      writeEntries(mapping, level + 1);
      line(level, "}");
    }

    private void writeList(String prefix, Value.Sequence sequence, int level)
        throws FormatException {
      if (sequence.size() == 0) {
        line(level, prefix + "{}");
        return;
      }

      if (options.inlineBraces()
          && sequence.size() <= FormatterOptions.MAX_INLINE_LIST_SIZE
          && allPlainScalars(sequence.elements())) {
        line(
            level,
            sequence
                .elements()
                .stream()
                .map(Formatter::formatScalar)
                .collect(Collectors.joining(" ", prefix + "{ ", " }")));
        return;
      }

      line(level, prefix + "{");
      for (Value element : sequence.elements()) {
        writeElement(element, level + 1);
      }
      line(level, "}");
    }

    private String formatComparison(Value.Comparison comparison) throws FormatException {
      return String.format(
          "%s %s %s",
          comparisonSide(comparison.left(), "left"),
          comparison.operator(),
          comparisonSide(comparison.right(), "right"));
    }

    private String comparisonSide(Value side, String which) throws FormatException {
      if (side.type() == Value.Type.COMPARISON) {
        throw new FormatException(pos, "nested comparison on the " + which + "-hand side");
      } else if (side.type().isContainer()) {
        throw new FormatException(
            pos, String.format("%s as the %s-hand side of a comparison", side.type(), which));
      } else if (which.equals("left") && side.type() == Value.Type.STRING) {
        // The left-hand side is the entry's key.
        return formatKey(side.cast(Value.PlainString.class).text());
      }
      return formatScalar(side);
    }
  }

  /** Writes a parse tree. The visited value is the nesting level. */
  private final class TreeWriter implements ASTVisitor<Integer> {
    private final List<String> lines = new ArrayList<>();

    private void line(int level, String text) {
      lines.add(indented(level, text));
    }

    private String prefix(Node node) {
      return node.key().map(key -> key.text() + " = ").orElse("");
    }

    @Override
    public Integer visit(Node.Scalar node, Integer level) {
      line(level, node.text());
      return level;
    }

    @Override
    public Integer visit(Node.KeyValue node, Integer level) {
      line(level, node.toString());
      return level;
    }

    @Override
    public Integer visit(Node.Comparison node, Integer level) {
      line(level, node.toString());
      return level;
    }

    @Override
    public Integer visit(Node.Block node, Integer level) {
      if (node.isConstants()) {
        // Same ordering as for a normalized tree: constants holding an identifier go last.
        List<Node> ordered = new ArrayList<>(node.children());
        ordered.sort(Comparator.comparing(Formatter::holdsIdentifier));
        return ASTNodeUtils.accept(ordered, this, level);
      }

      String prefix = prefix(node);
      if (node.children().isEmpty()) {
        line(level, prefix + "{}");
      } else if (options.inlineBraces()
          && node.children().size() == 1
          && node.children().get(0).type() == Node.Type.KEY_VALUE) {
        line(level, prefix + "{ " + node.children().get(0) + " }");
      } else {
        line(level, prefix + "{");
        node.visitChildren(this, level + 1);
        line(level, "}");
      }
      return level;
    }

    @Override
    public Integer visit(Node.Array node, Integer level) {
      String prefix = prefix(node);
      if (node.elements().isEmpty()) {
        line(level, prefix + "{}");
      } else if (options.inlineBraces()
          && node.elements().size() <= FormatterOptions.MAX_INLINE_LIST_SIZE
          && node.elements().stream().allMatch(e -> e.type() == Node.Type.SCALAR)) {
        line(
            level,
            node.elements()
                .stream()
                .map(Node::toString)
                .collect(Collectors.joining(" ", prefix + "{ ", " }")));
      } else {
        line(level, prefix + "{");
        node.visitChildren(this, level + 1);
        line(level, "}");
      }
      return level;
    }
  }
}
