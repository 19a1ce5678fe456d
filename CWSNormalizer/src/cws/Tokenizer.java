package cws;

import java.util.Comparator;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Produces a tokenization of Clausewitz script text. */
public class Tokenizer {
  /** A 1-based source position. */
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", 0, 0);

    public static Pos internal() {
      return INTERNAL;
    }

    // For failures that concern a whole document rather than one token.
    public static Pos unknown(String file) {
      return new Pos(file, 0, 0);
    }

    private final String file;
    private final int line;
    private final int column;

    public Pos(String file, int line, int column) {
      this.file = file;
      this.line = line;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int line() {
      return line;
    }

    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::line)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos pos = (Pos) o;
      return file.equals(pos.file) && line == pos.line && column == pos.column;
    }

    @Override
    public int hashCode() {
      return (file.hashCode() * 31 + line) * 31 + column;
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, line, column);
    }
  }

  public enum TokenType {
    STRING,
    NUMBER,
    PERCENTAGE,
    DATE,
    BOOLEAN,
    OPERATOR,
    OPEN_BRACE,
    CLOSE_BRACE,
    COMMENT,
    IDENTIFIER,
    SCOPE,
    KEYWORD,
    MODIFIER,
    EFFECT,
    TRIGGER,
    CONSTANT,
    EOF;

    // Anything an identifier word can be classified as.
    public boolean isWord() {
      switch (this) {
        case IDENTIFIER:
        case SCOPE:
        case KEYWORD:
        case MODIFIER:
        case EFFECT:
        case TRIGGER:
        case CONSTANT:
          return true;
        default:
          return false;
      }
    }

    public boolean isLiteral() {
      return this == STRING
          || this == NUMBER
          || this == PERCENTAGE
          || this == DATE
          || this == BOOLEAN;
    }
  }

  /**
   * A classified token. {@code text} is the source text as written, quotes included; {@code
   * value} is its meaning: the unescaped contents of a string, a {@link Long} or {@link Double}
   * for a number, a {@link Boolean} for yes/no, and the text itself for everything else.
   */
  @AutoValue
  public abstract static class Token {
    public abstract TokenType type();

    public abstract String text();

    public abstract Object value();

    public abstract Pos pos();

    public static Token create(TokenType type, String text, Object value, Pos pos) {
      return new AutoValue_Tokenizer_Token(type, text, value, pos);
    }

    public static Token create(TokenType type, String text, Pos pos) {
      return create(type, text, text, pos);
    }

    public boolean is(TokenType type) {
      return type() == type;
    }

    public boolean isOperator(String op) {
      return type() == TokenType.OPERATOR && text().equals(op);
    }

    @Override
    public final String toString() {
      return type() == TokenType.EOF ? "end of input" : String.format("%s '%s'", type(), text());
    }
  }

  public static final ImmutableSet<String> OPERATORS =
      ImmutableSet.of(">=", "<=", "!=", ">", "<", "=", ":", "?");

  public static final ImmutableSet<String> RELATIONAL_OPERATORS =
      ImmutableSet.of(">", "<", ">=", "<=", "!=", "=");

  private static final Pattern DATE = Pattern.compile("\\d{1,4}\\.\\d{1,4}\\.\\d{1,4}");
  private static final Pattern PERCENTAGE = Pattern.compile("-?\\d+(\\.\\d+)?%%?");
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern FLOAT = Pattern.compile("-?\\d+\\.\\d+");
  private static final Pattern CLASSIFIABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

  private final String file;
  private final String content;
  private final Vocabulary vocabulary;

  private int offset = 0;
  private int line = 1;
  private int column = 1;

  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private Token previous = null;

  public Tokenizer(String file, String content, Vocabulary vocabulary) {
    this.file = Preconditions.checkNotNull(file);
    this.content = Preconditions.checkNotNull(content);
    this.vocabulary = Preconditions.checkNotNull(vocabulary);
  }

  /**
   * Tokenizes the whole input. The returned list always ends with exactly one {@link
   * TokenType#EOF} token.
   *
   * @throws LexException on the first character sequence that starts no token
   */
  public ImmutableList<Token> tokenize() throws LexException {
    Preconditions.checkState(offset == 0 && previous == null, "tokenize() already called");

    while (offset < content.length()) {
      char ch = peek(0);
      if (Character.isWhitespace(ch)) {
        advance();
      } else if (ch == '#') {
        readComment();
      } else if (ch == '{') {
        emitSingle(TokenType.OPEN_BRACE);
      } else if (ch == '}') {
        emitSingle(TokenType.CLOSE_BRACE);
      } else if (ch == '"' || ch == '\'') {
        readString(ch);
      } else if (isDigit(ch) || (ch == '-' && isDigit(peek(1)))) {
        readNumber();
      } else if (isOperatorStart(ch)) {
        readOperator();
      } else if (isIdentifierStart(ch)) {
        readIdentifier();
      } else {
        throw new LexException(pos(), String.format("unexpected character '%c'", ch));
      }
    }

    emit(Token.create(TokenType.EOF, "", pos()));
    return tokens.build();
  }

  private Pos pos() {
    return new Pos(file, line, column);
  }

  private char peek(int ahead) {
    int index = offset + ahead;
    return index < content.length() ? content.charAt(index) : '\0';
  }

  private char advance() {
    char ch = content.charAt(offset++);
    if (ch == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return ch;
  }

  private void emit(Token token) {
    previous = token;
    tokens.add(token);
  }

  private void emitSingle(TokenType type) {
    Pos start = pos();
    emit(Token.create(type, Character.toString(advance()), start));
  }

  private void readComment() {
    Pos start = pos();
    int begin = offset;
    while (offset < content.length() && peek(0) != '\n') advance();
    // A CRLF file keeps its '\r' out of the comment text.
    String text = content.substring(begin, offset);
    if (text.endsWith("\r")) text = text.substring(0, text.length() - 1);
    emit(Token.create(TokenType.COMMENT, text, start));
  }

  private void readString(char quote) throws LexException {
    Pos start = pos();
    int begin = offset;
    advance();

    StringBuilder value = new StringBuilder();
    while (true) {
      if (offset >= content.length()) {
        throw new LexException(start, "unterminated string");
      }

      char ch = advance();
      if (ch == quote) break;
      if (ch == '\\' && (peek(0) == quote || peek(0) == '\\')) {
        value.append(advance());
      } else {
        value.append(ch);
      }
    }

    emit(Token.create(TokenType.STRING, content.substring(begin, offset), value.toString(), start));
  }

  private void readNumber() throws LexException {
    Pos start = pos();
    int begin = offset;
    advance();
    while (isNumberPart(peek(0))) advance();

    // 1st_army, 10_percent_bonus: a word that merely starts with digits.
    if (Character.isLetter(peek(0)) || peek(0) == '_') {
      finishIdentifier(start, begin);
      return;
    }

    String text = content.substring(begin, offset);
    if (DATE.matcher(text).matches()) {
      emit(Token.create(TokenType.DATE, text, start));
    } else if (PERCENTAGE.matcher(text).matches()) {
      emit(Token.create(TokenType.PERCENTAGE, text, start));
    } else if (INTEGER.matcher(text).matches()) {
      Object value;
      try {
        value = Long.parseLong(text);
      } catch (NumberFormatException ex) {
        value = Double.parseDouble(text);
      }
      emit(Token.create(TokenType.NUMBER, text, value, start));
    } else if (FLOAT.matcher(text).matches()) {
      emit(Token.create(TokenType.NUMBER, text, Double.parseDouble(text), start));
    } else {
      throw new LexException(start, String.format("malformed number '%s'", text));
    }
  }

  private static boolean isOperatorStart(char ch) {
    return ch == '>' || ch == '<' || ch == '=' || ch == '!' || ch == ':' || ch == '?';
  }

  private void readOperator() throws LexException {
    Pos start = pos();
    String twoChars = new String(new char[] {peek(0), peek(1)});
    String op;
    if (OPERATORS.contains(twoChars)) {
      op = twoChars;
    } else if (OPERATORS.contains(Character.toString(peek(0)))) {
      op = Character.toString(peek(0));
    } else {
      throw new LexException(start, String.format("unexpected character '%c'", peek(0)));
    }

    for (int i = 0; i < op.length(); i++) advance();
    emit(Token.create(TokenType.OPERATOR, op, start));
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isIdentifierStart(char ch) {
    return Character.isLetter(ch) || ch == '_' || ch == '-' || ch == '.' || ch == '@';
  }

  private static boolean isIdentifierPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == '.';
  }

  /**
   * Whether {@code text} reads back as a single word, number or date token spelled exactly
   * {@code text}. Anything else has to be quoted to survive being written out.
   */
  public static boolean isBareWord(String text) {
    int length = text.length();
    if (length == 0) return false;

    char first = text.charAt(0);
    int i = 1;
    if (isDigit(first) || (first == '-' && length > 1 && isDigit(text.charAt(1)))) {
      while (i < length && isNumberPart(text.charAt(i))) i++;
      if (i == length) {
        return DATE.matcher(text).matches()
            || INTEGER.matcher(text).matches()
            || FLOAT.matcher(text).matches();
      } else if (!Character.isLetter(text.charAt(i)) && text.charAt(i) != '_') {
        return false;
      }
    } else if (first == '@') {
      if (length == 1 || !isIdentifierPart(text.charAt(1))) return false;
    } else if (!isIdentifierStart(first)) {
      return false;
    }

    for (; i < length; i++) {
      char ch = text.charAt(i);
      boolean scoped = ch == ':' && i + 1 < length && isIdentifierPart(text.charAt(i + 1));
      if (!isIdentifierPart(ch) && !scoped) return false;
    }
    return !text.equals("yes") && !text.equals("no");
  }

  private static boolean isNumberPart(char ch) {
    return isDigit(ch) || ch == '.' || ch == '%';
  }

  private void readIdentifier() throws LexException {
    Pos start = pos();
    int begin = offset;
    if (peek(0) == '@') {
      advance();
      if (!isIdentifierPart(peek(0))) {
        throw new LexException(start, "expected a constant name after '@'");
      }
    }
    finishIdentifier(start, begin);
  }

  private void finishIdentifier(Pos start, int begin) {
    while (true) {
      if (isIdentifierPart(peek(0))) {
        advance();
      } else if (peek(0) == ':' && isIdentifierPart(peek(1))) {
        // event_target:foo
        advance();
      } else {
        break;
      }
    }

    String text = content.substring(begin, offset);
    emit(classifyWord(text, start));
  }

  private Token classifyWord(String text, Pos start) {
    if (text.equals("yes") || text.equals("no")) {
      return Token.create(TokenType.BOOLEAN, text, text.equals("yes"), start);
    } else if (text.contains("@")) {
      // `var @target` style suffixes belong to the preceding identifier.
      if (previous != null && previous.type() == TokenType.IDENTIFIER) {
        return Token.create(TokenType.IDENTIFIER, text, start);
      }
      return Token.create(TokenType.CONSTANT, text, start);
    } else if (text.contains(".")) {
      return Token.create(TokenType.SCOPE, text, start);
    } else if (CLASSIFIABLE.matcher(text).matches()) {
      return Token.create(vocabulary.classify(text), text, start);
    } else {
      return Token.create(TokenType.IDENTIFIER, text, start);
    }
  }
}
