package cws;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** How one key of a document behaves: the shape of its value and whether it always merges. */
@AutoValue
public abstract class KeyRule {

  public enum Kind {
    SCALAR,
    BLOCK,
    LIST,
    COMPARISON,
    ANY;
  }

  /** Rule name matching any key that has no rule of its own. */
  public static final String WILDCARD = "*";

  public abstract String name();

  public abstract Kind kind();

  public abstract boolean repeatable();

  public abstract ImmutableMap<String, KeyRule> children();

  public abstract Optional<KeyRule> wildcard();

  public Optional<KeyRule> child(String key) {
    KeyRule rule = children().get(key);
    return rule != null ? Optional.of(rule) : wildcard();
  }

  /**
   * Whether a single occurrence of this key may hold {@code value}. An empty brace pair {@code
   * {}} is both an empty block and an empty list.
   */
  public boolean accepts(Value value) {
    switch (kind()) {
      case SCALAR:
        return value.isPlainScalar();
      case BLOCK:
        return value.type() == Value.Type.MAPPING || isEmptyList(value);
      case LIST:
        return value.type() == Value.Type.SEQUENCE && !value.cast(Value.Sequence.class).merged();
      case COMPARISON:
        return value.type() == Value.Type.COMPARISON;
      case ANY:
        return true;
    }
    throw new AssertionError(kind());
  }

  private static boolean isEmptyList(Value value) {
    return value.type() == Value.Type.SEQUENCE && value.cast(Value.Sequence.class).size() == 0;
  }

  public static Builder builder(String name, Kind kind) {
    return new AutoValue_KeyRule.Builder().setName(name).setKind(kind).setRepeatable(false);
  }

  public static KeyRule of(String name, Kind kind) {
    return builder(name, kind).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setKind(Kind kind);

    public abstract Builder setRepeatable(boolean repeatable);

    public abstract ImmutableMap.Builder<String, KeyRule> childrenBuilder();

    public abstract Builder setWildcard(KeyRule wildcard);

    // A child named "*" becomes the wildcard.
    public final Builder addChild(KeyRule child) {
      if (child.name().equals(WILDCARD)) {
        setWildcard(child);
      } else {
        childrenBuilder().put(child.name(), child);
      }
      return this;
    }

    public abstract KeyRule build();
  }
}
