package cws;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import cws.Tokenizer.Token;
import cws.Tokenizer.TokenType;

/**
 * Recursive descent parser over the token stream. The grammar decides between an object, a key
 * value pair, a comparison and a bare value by looking up to two tokens ahead, and decides
 * between a block and a list by scanning the braces for a top-level {@code =}.
 */
public class Parser {

  /** Single-owner cursor over the tokens of one document, comments removed. */
  static final class TokenReader {
    private final ImmutableList<Token> tokens;
    private int index = 0;

    TokenReader(List<Token> tokens) {
      this.tokens =
          tokens
              .stream()
              .filter(t -> t.type() != TokenType.COMMENT)
              .collect(ImmutableList.toImmutableList());
      Preconditions.checkArgument(
          !this.tokens.isEmpty() && Iterables.getLast(this.tokens).is(TokenType.EOF),
          "token stream must end with EOF");
    }

    Token peek() {
      return peek(0);
    }

    // Never runs past the EOF token.
    Token peek(int ahead) {
      return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    Token advance() {
      Token token = peek();
      if (!token.is(TokenType.EOF)) index++;
      return token;
    }

    boolean atEnd() {
      return peek().is(TokenType.EOF);
    }

    Token expect(TokenType type, String what) throws ParseException {
      Token token = peek();
      if (!token.is(type)) {
        throw new ParseException(token, String.format("expected %s, found %s", what, token));
      }
      return advance();
    }

    /**
     * Called just after an opening brace. Returns true if an {@code =} appears at this brace's
     * own depth before its matching close brace (or the end of input).
     */
    boolean hasTopLevelAssignment() {
      int depth = 0;
      for (int i = index; i < tokens.size(); i++) {
        Token token = tokens.get(i);
        switch (token.type()) {
          case OPEN_BRACE:
            depth++;
            break;
          case CLOSE_BRACE:
            if (depth == 0) return false;
            depth--;
            break;
          case OPERATOR:
            if (depth == 0 && token.text().equals("=")) return true;
            break;
          default:
            break;
        }
      }
      return false;
    }
  }

  private enum Construct {
    OBJECT,
    KEY_VALUE,
    COMPARISON,
    VALUE;
  }

  private final TokenReader reader;

  public Parser(List<Token> tokens) {
    this.reader = new TokenReader(tokens);
  }

  /** Parses the whole document into a ROOT block. */
  public Node.Block parse() throws ParseException {
    Token first = reader.peek();
    List<Node> children = new ArrayList<>();
    while (!reader.atEnd()) {
      Token token = reader.peek();
      if (token.is(TokenType.CLOSE_BRACE)) {
        throw new ParseException(token, "unmatched '}'");
      }
      children.add(parseStatement());
    }
    return finishBlock(Optional.empty(), Node.BlockKind.ROOT, children, first.pos());
  }

  private static boolean isKeyToken(Token token) {
    return token.type().isWord()
        || token.is(TokenType.NUMBER)
        || token.is(TokenType.DATE)
        || token.is(TokenType.STRING);
  }

  private static boolean isScalarToken(Token token) {
    return token.type().isWord() || token.type().isLiteral();
  }

  private static boolean isRelationalOperator(Token token) {
    return token.is(TokenType.OPERATOR)
        && Tokenizer.RELATIONAL_OPERATORS.contains(token.text())
        && !token.text().equals("=");
  }

  private Construct classify() {
    Token key = reader.peek(0);
    if (!isKeyToken(key)) return Construct.VALUE;

    Token next = reader.peek(1);
    if (next.is(TokenType.OPEN_BRACE)) {
      return Construct.OBJECT;
    } else if (next.isOperator("=")) {
      return reader.peek(2).is(TokenType.OPEN_BRACE) ? Construct.OBJECT : Construct.KEY_VALUE;
    } else if (isRelationalOperator(next)) {
      return Construct.COMPARISON;
    } else {
      return Construct.VALUE;
    }
  }

  // A keyed construct: object, key = value, or comparison.
  private Node parseStatement() throws ParseException {
    switch (classify()) {
      case OBJECT:
        return parseObject();
      case KEY_VALUE:
        return parseKeyValue();
      case COMPARISON:
        return parseComparison();
      case VALUE:
        {
          Token token = reader.peek();
          if (token.is(TokenType.OPEN_BRACE)) {
            throw new ParseException(token, "anonymous block where a key is required");
          }
          throw new ParseException(token, String.format("expected a key, found %s", token));
        }
    }
    throw new AssertionError("unreachable");
  }

  private Node parseObject() throws ParseException {
    Token key = reader.advance();
    if (reader.peek().isOperator("=")) reader.advance();
    Token open = reader.expect(TokenType.OPEN_BRACE, "'{'");
    return parseBraces(Optional.of(key), open);
  }

  private Node.KeyValue parseKeyValue() throws ParseException {
    Token key = reader.advance();
    reader.advance(); // '='
    return new Node.KeyValue(key, parseScalar("a value after '='"));
  }

  private Node.Comparison parseComparison() throws ParseException {
    Node.Scalar left = new Node.Scalar(reader.advance());
    Token op = reader.advance();
    Node.Scalar right = parseScalar(String.format("a value after '%s'", op.text()));
    return new Node.Comparison(left, op.text(), right);
  }

  private Node.Scalar parseScalar(String what) throws ParseException {
    Token token = reader.peek();
    if (!isScalarToken(token)) {
      throw new ParseException(token, String.format("expected %s, found %s", what, token));
    }
    return new Node.Scalar(reader.advance());
  }

  private Token checkNotEof(Token open) throws ParseException {
    Token token = reader.peek();
    if (token.is(TokenType.EOF)) {
      throw new ParseException(token, open.pos(), "unmatched '{'");
    }
    return token;
  }

  private Node parseBraces(Optional<Token> key, Token open) throws ParseException {
    if (reader.peek().is(TokenType.CLOSE_BRACE)) {
      reader.advance();
      return new Node.Array(key, ImmutableList.of(), open.pos());
    }

    Node.BlockKind kind = Node.BlockKind.forKey(key);
    if (reader.hasTopLevelAssignment()) {
      List<Node> children = new ArrayList<>();
      while (!checkNotEof(open).is(TokenType.CLOSE_BRACE)) {
        Token token = reader.peek();
        if (classify() == Construct.VALUE && !token.is(TokenType.OPEN_BRACE)) {
          throw new ParseException(
              token, String.format("bare value %s in a block of assignments", token));
        }
        children.add(parseStatement());
      }
      reader.advance();
      return finishBlock(key, kind, children, open.pos());
    }

    return parseList(key, kind, open);
  }

  // Brace content with no top-level '='.
  private Node parseList(Optional<Token> key, Node.BlockKind kind, Token open)
      throws ParseException {
    List<Node> elements = new ArrayList<>();
    Token firstKeyed = null;
    Token firstBare = null;
    while (!checkNotEof(open).is(TokenType.CLOSE_BRACE)) {
      Token token = reader.peek();
      switch (classify()) {
        case OBJECT:
          if (firstKeyed == null) firstKeyed = token;
          elements.add(parseObject());
          break;
        case COMPARISON:
          elements.add(parseComparison());
          break;
        case KEY_VALUE:
          // A top-level '=' would have selected a block.
          throw new VerifyException("key/value in list mode at " + token.pos());
        case VALUE:
          if (firstBare == null) firstBare = token;
          if (token.is(TokenType.OPEN_BRACE)) {
            elements.add(parseBraces(Optional.empty(), reader.advance()));
          } else {
            elements.add(parseScalar("a list element"));
          }
          break;
      }
    }
    reader.advance();

    if (firstKeyed != null && firstBare != null) {
      Token offender = firstKeyed.pos().compareTo(firstBare.pos()) > 0 ? firstKeyed : firstBare;
      throw new ParseException(offender, "cannot mix keyed blocks and bare values in one brace");
    } else if (firstBare == null) {
      return finishBlock(key, kind, elements, open.pos());
    } else {
      return new Node.Array(key, ImmutableList.copyOf(elements), open.pos());
    }
  }

  private Node.Block finishBlock(
      Optional<Token> key, Node.BlockKind kind, List<Node> children, Tokenizer.Pos pos) {
    List<Node> constants = new ArrayList<>();
    List<Node> rest = new ArrayList<>();
    for (Node child : children) {
      if (child.type() == Node.Type.KEY_VALUE
          && child.cast(Node.KeyValue.class).keyToken().is(TokenType.CONSTANT)) {
        constants.add(child);
      } else {
        rest.add(child);
      }
    }

    ImmutableList.Builder<Node> result = ImmutableList.builder();
    if (!constants.isEmpty()) {
      Tokenizer.Pos constantsPos = constants.get(0).pos();
      result.add(
          new Node.Block(
              Optional.of(
                  Token.create(TokenType.IDENTIFIER, Node.CONSTANTS_KEY, constantsPos)),
              Node.BlockKind.CONSTANTS,
              ImmutableList.copyOf(constants),
              constantsPos));
    }

    for (Node child : rest) {
      // Inside a trigger, `a = b` tests equality.
      if (kind == Node.BlockKind.TRIGGER && child.type() == Node.Type.KEY_VALUE) {
        Node.KeyValue keyValue = child.cast();
        result.add(
            new Node.Comparison(
                new Node.Scalar(keyValue.keyToken()), "=", keyValue.value()));
      } else {
        result.add(child);
      }
    }

    return new Node.Block(key, kind, result.build(), pos);
  }
}
