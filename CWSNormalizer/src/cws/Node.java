package cws;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import cws.processor.ASTChild;
import cws.processor.ASTNode;

/** Parse tree produced by {@link Parser}. Nodes are immutable. */
public abstract class Node implements ASTNodeInterface {

  public enum Type {
    SCALAR,
    KEY_VALUE,
    COMPARISON,
    BLOCK,
    ARRAY;
  }

  /** The context a block was opened in, taken from the class of its key token. */
  public enum BlockKind {
    ROOT,
    OBJECT,
    KEYWORD,
    MODIFIER,
    EFFECT,
    TRIGGER,
    CONSTANTS;

    public static BlockKind forKey(Optional<Tokenizer.Token> key) {
      if (!key.isPresent()) return OBJECT;
      switch (key.get().type()) {
        case KEYWORD:
          return KEYWORD;
        case MODIFIER:
          return MODIFIER;
        case EFFECT:
          return EFFECT;
        case TRIGGER:
          return TRIGGER;
        default:
          return OBJECT;
      }
    }
  }

  public static final String CONSTANTS_KEY = "_constants";

  private final Type type;
  private final Tokenizer.Pos pos;

  protected Node(Type type, Tokenizer.Pos pos) {
    this.type = Preconditions.checkNotNull(type);
    this.pos = Preconditions.checkNotNull(pos);
  }

  public final Type type() {
    return type;
  }

  public final Tokenizer.Pos pos() {
    return pos;
  }

  /** The key this node is stored under in its parent block, if any. */
  public Optional<Tokenizer.Token> key() {
    return Optional.empty();
  }

  @SuppressWarnings("unchecked")
  public <T extends Node> T cast() {
    return (T) this;
  }

  public <T extends Node> T cast(Class<T> clazz) {
    return cast();
  }

  @ASTNode
  public static final class Scalar extends Node implements Node_Scalar_ASTNode {
    private final Tokenizer.Token token;

    public Scalar(Tokenizer.Token token) {
      super(Type.SCALAR, token.pos());
      Preconditions.checkArgument(
          token.type().isLiteral() || token.type().isWord(), "Not a scalar: %s", token);
      this.token = token;
    }

    public Tokenizer.Token token() {
      return token;
    }

    public String text() {
      return token.text();
    }

    @Override
    public String toString() {
      return token.text();
    }
  }

  @ASTNode
  public static final class KeyValue extends Node implements Node_KeyValue_ASTNode {
    private final Tokenizer.Token key;
    private final Scalar value;

    public KeyValue(Tokenizer.Token key, Scalar value) {
      super(Type.KEY_VALUE, key.pos());
      this.key = key;
      this.value = value;
    }

    @Override
    public Optional<Tokenizer.Token> key() {
      return Optional.of(key);
    }

    public Tokenizer.Token keyToken() {
      return key;
    }

    @ASTChild
    @Override
    public Scalar value() {
      return value;
    }

    @Override
    public String toString() {
      return key.text() + " = " + value;
    }
  }

  @ASTNode
  public static final class Comparison extends Node implements Node_Comparison_ASTNode {
    private final Scalar left;
    private final String operator;
    private final Scalar right;

    public Comparison(Scalar left, String operator, Scalar right) {
      super(Type.COMPARISON, left.pos());
      Preconditions.checkArgument(
          Tokenizer.RELATIONAL_OPERATORS.contains(operator), "Bad operator: %s", operator);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    // Comparisons are stored under their left-hand side.
    @Override
    public Optional<Tokenizer.Token> key() {
      return Optional.of(left.token());
    }

    @ASTChild
    @Override
    public Scalar left() {
      return left;
    }

    public String operator() {
      return operator;
    }

    @ASTChild
    @Override
    public Scalar right() {
      return right;
    }

    @Override
    public String toString() {
      return left + " " + operator + " " + right;
    }
  }

  /** Keyed children between braces, or the whole document when {@code kind} is ROOT. */
  @ASTNode
  public static final class Block extends Node implements Node_Block_ASTNode {
    private final Optional<Tokenizer.Token> key;
    private final BlockKind kind;
    private final ImmutableList<Node> children;

    public Block(
        Optional<Tokenizer.Token> key,
        BlockKind kind,
        ImmutableList<Node> children,
        Tokenizer.Pos pos) {
      super(Type.BLOCK, pos);
      this.key = key;
      this.kind = kind;
      this.children = children;
    }

    @Override
    public Optional<Tokenizer.Token> key() {
      return key;
    }

    public BlockKind kind() {
      return kind;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> children() {
      return children;
    }

    public boolean isConstants() {
      return kind == BlockKind.CONSTANTS;
    }
  }

  /** Unkeyed elements between braces. */
  @ASTNode
  public static final class Array extends Node implements Node_Array_ASTNode {
    private final Optional<Tokenizer.Token> key;
    private final ImmutableList<Node> elements;

    public Array(Optional<Tokenizer.Token> key, ImmutableList<Node> elements, Tokenizer.Pos pos) {
      super(Type.ARRAY, pos);
      this.key = key;
      this.elements = elements;
    }

    @Override
    public Optional<Tokenizer.Token> key() {
      return key;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> elements() {
      return elements;
    }
  }
}
