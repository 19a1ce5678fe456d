package cws;

import com.google.common.base.Strings;

/**
 * Dumps a parse tree one node per line, indented by depth:
 *
 * <pre>
 * BLOCK ROOT @1:1
 *   BLOCK OBJECT technologies @1:16
 *     KEY_VALUE research_cost @2:3
 *       SCALAR NUMBER 1.5 @2:19
 * </pre>
 */
public final class ParseTreePrinter extends DefaultASTVisitor<StringBuilder> {
  private int depth = 0;

  private ParseTreePrinter() {}

  public static String print(Node node) {
    return node.accept(new ParseTreePrinter(), new StringBuilder()).toString();
  }

  private void line(StringBuilder out, Node node, String label) {
    out.append(Strings.repeat("  ", depth))
        .append(node.type())
        .append(' ')
        .append(label)
        .append(" @")
        .append(node.pos().line())
        .append(':')
        .append(node.pos().column())
        .append('\n');
  }

  private StringBuilder children(Node node, StringBuilder out) {
    depth++;
    node.visitChildren(this, out);
    depth--;
    return out;
  }

  private static String keyLabel(Node node) {
    return node.key().map(k -> " " + k.text()).orElse("");
  }

  @Override
  public StringBuilder visit(Node.Scalar node, StringBuilder out) {
    line(out, node, node.token().type() + " " + node.text());
    return out;
  }

  @Override
  public StringBuilder visit(Node.KeyValue node, StringBuilder out) {
    line(out, node, node.keyToken().text());
    return children(node, out);
  }

  @Override
  public StringBuilder visit(Node.Comparison node, StringBuilder out) {
    line(out, node, node.operator());
    return children(node, out);
  }

  @Override
  public StringBuilder visit(Node.Block node, StringBuilder out) {
    line(out, node, node.kind() + keyLabel(node));
    return children(node, out);
  }

  @Override
  public StringBuilder visit(Node.Array node, StringBuilder out) {
    line(out, node, "[" + node.elements().size() + "]" + keyLabel(node));
    return children(node, out);
  }
}
