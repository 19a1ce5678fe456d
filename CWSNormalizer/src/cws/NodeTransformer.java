package cws;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Converts a parse tree into the normalized tree: keyed children become mapping entries merged by
 * {@link KeyMergePolicy}, lists become sequences, and literal tokens become typed scalars. Values
 * are checked against the schema as they are stored. The parse tree is left untouched.
 */
public class NodeTransformer {
  private static final Logger LOG = LoggerFactory.getLogger(NodeTransformer.class);

  private final KeyMergePolicy mergePolicy;
  private final DocumentSchema schema;

  public NodeTransformer(ImmutableSet<String> repeatableKeys, DocumentSchema schema) {
    this.mergePolicy = new KeyMergePolicy(repeatableKeys);
    this.schema = Preconditions.checkNotNull(schema);
  }

  public NodeTransformer(Vocabulary vocabulary, DocumentSchema schema) {
    this(vocabulary.repeatableKeys(), schema);
  }

  /**
   * Normalizes a whole document.
   *
   * @throws TransformException for the first schema violation in source order
   */
  public Document normalize(Node.Block root) throws TransformException {
    Preconditions.checkArgument(root.kind() == Node.BlockKind.ROOT, "not a root block");

    Folder folder = new Folder();
    Scope scope = new Scope(ImmutableList.of(), true, true);
    root.visitChildren(folder, scope);
    Value.Mapping mapping = scope.toMapping();
    checkRootKey(folder, scope, mapping, root.pos().file());

    if (folder.hasErrors()) {
      folder.errors().forEach(ex -> LOG.debug("{}", ex.describe()));
    }
    folder.throwFirstError();
    return Document.create(root.pos().file(), schema, mapping);
  }

  private void checkRootKey(Folder folder, Scope scope, Value.Mapping mapping, String file) {
    if (!schema.rootKey().isPresent()) return;

    String rootKey = schema.rootKey().get();
    Value value = mapping.get(rootKey);
    if (value == null) {
      folder.logError(
          Tokenizer.Pos.unknown(file),
          String.format("root key '%s' not present in document", rootKey));
    } else if (value.type() != Value.Type.MAPPING) {
      folder.logError(
          scope.firstPos(rootKey),
          String.format("root key '%s' must hold a single block", rootKey));
    }
  }

  // The text a token contributes as a mapping key.
  static String keyText(Tokenizer.Token token) {
    return token.is(Tokenizer.TokenType.STRING) ? (String) token.value() : token.text();
  }

  static Value scalarValue(Tokenizer.Token token) {
    switch (token.type()) {
      case STRING:
        return Value.QuotedString.of((String) token.value());
      case NUMBER:
        if (token.value() instanceof Long) {
          return Value.IntegerValue.of((Long) token.value());
        }
        return Value.FloatValue.of((Double) token.value());
      case PERCENTAGE:
        return Value.Percentage.parse(token.text());
      case DATE:
        return Value.DateValue.of(token.text());
      case BOOLEAN:
        return Value.BooleanValue.of((Boolean) token.value());
      case CONSTANT:
        return Value.ConstantRef.of(token.text());
      default:
        Preconditions.checkArgument(token.type().isWord(), "Not a scalar: %s", token);
        return Value.PlainString.of(token.text());
    }
  }

  /** Collects the entries of one block, or the elements of one list. */
  private final class Scope {
    private final ImmutableList<String> path;
    private final boolean schemaChecked;
    private final boolean keyed;

    private final Map<String, List<Value>> entries = new LinkedHashMap<>();
    private final Map<String, Tokenizer.Pos> firstPos = new LinkedHashMap<>();
    private final Set<String> quotedKeys = new HashSet<>();
    private final List<Value> elements = new ArrayList<>();

    Scope(ImmutableList<String> path, boolean schemaChecked, boolean keyed) {
      this.path = path;
      this.schemaChecked = schemaChecked;
      this.keyed = keyed;
    }

    Optional<KeyRule> ruleFor(String key) {
      if (!schemaChecked || key.equals(Node.CONSTANTS_KEY)) return Optional.empty();
      return schema.ruleForPath(childPath(key));
    }

    ImmutableList<String> childPath(String key) {
      return ImmutableList.<String>builder().addAll(path).add(key).build();
    }

    Tokenizer.Pos firstPos(String key) {
      return firstPos.get(key);
    }

    void put(Folder folder, Tokenizer.Token keyToken, Value value, Tokenizer.Pos pos) {
      String key = keyText(keyToken);
      Preconditions.checkState(keyed, "keyed entry %s in a list", key);
      Optional<KeyRule> rule = ruleFor(key);
      if (rule.isPresent() && !rule.get().accepts(value)) {
        folder.logError(
            pos,
            String.format(
                "'%s' must hold a %s, found %s",
                String.join(".", childPath(key)),
                rule.get().kind(),
                value.type()));
      }

      if (!entries.containsKey(key) && keyToken.is(Tokenizer.TokenType.STRING)) {
        quotedKeys.add(key);
      }
      entries.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
      firstPos.putIfAbsent(key, pos);
    }

    void add(Value value) {
      Preconditions.checkState(!keyed, "list element in a block");
      elements.add(value);
    }

    Value.Mapping toMapping() {
      ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
      for (Map.Entry<String, List<Value>> entry : entries.entrySet()) {
        String key = entry.getKey();
        builder.put(key, mergePolicy.merge(key, entry.getValue(), ruleFor(key)));
      }
      return Value.Mapping.of(builder.build(), ImmutableSet.copyOf(quotedKeys));
    }

    Value.Sequence toSequence() {
      return Value.Sequence.literal(elements);
    }
  }

  /** Folds each node into the scope of its parent. Every node type has a case here. */
  private final class Folder extends ErrorCollectingVisitor<Scope> {

    @Override
    public Scope visit(Node.Scalar node, Scope scope) {
      scope.add(scalarValue(node.token()));
      return scope;
    }

    @Override
    public Scope visit(Node.KeyValue node, Scope scope) {
      scope.put(this, node.keyToken(), scalarValue(node.value().token()), node.pos());
      return scope;
    }

    @Override
    public Scope visit(Node.Comparison node, Scope scope) {
      Value.Comparison comparison =
          Value.Comparison.of(
              scalarValue(node.left().token()),
              node.operator(),
              scalarValue(node.right().token()));
      if (scope.keyed) {
        scope.put(this, node.left().token(), comparison, node.pos());
      } else {
        scope.add(comparison);
      }
      return scope;
    }

    @Override
    public Scope visit(Node.Block node, Scope scope) {
      Scope child;
      if (!node.key().isPresent() || node.isConstants()) {
        child = new Scope(ImmutableList.of(), false, true);
      } else {
        child = new Scope(scope.childPath(keyText(node.key().get())), scope.schemaChecked, true);
      }
      node.visitChildren(this, child);
      store(scope, node, child.toMapping());
      return scope;
    }

    @Override
    public Scope visit(Node.Array node, Scope scope) {
      Scope child = new Scope(ImmutableList.of(), false, false);
      node.visitChildren(this, child);
      store(scope, node, child.toSequence());
      return scope;
    }

    private void store(Scope scope, Node node, Value value) {
      if (node.key().isPresent()) {
        Tokenizer.Token key = node.key().get();
        scope.put(this, key, value, key.pos());
      } else {
        scope.add(value);
      }
    }
  }
}
