package cws;

import java.math.BigDecimal;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The normalized tree built by {@link NodeTransformer}: mappings, sequences, comparisons and
 * typed scalars. Every value is immutable and compares by content.
 */
public abstract class Value {

  public enum Type {
    STRING,
    QUOTED_STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    CONSTANT,
    PERCENTAGE,
    DATE,
    COMPARISON,
    MAPPING,
    SEQUENCE;

    public boolean isContainer() {
      return this == MAPPING || this == SEQUENCE;
    }

    // Anything that is not a container or a comparison.
    public boolean isPlainScalar() {
      return !isContainer() && this != COMPARISON;
    }
  }

  Value() {}

  public abstract Type type();

  public final boolean isPlainScalar() {
    return type().isPlainScalar();
  }

  @SuppressWarnings("unchecked")
  public <T extends Value> T cast() {
    return (T) this;
  }

  public <T extends Value> T cast(Class<T> clazz) {
    return cast();
  }

  /** A bare word or number-like word that was not quoted. */
  @AutoValue
  public abstract static class PlainString extends Value {
    public abstract String text();

    @Override
    public final Type type() {
      return Type.STRING;
    }

    public static PlainString of(String text) {
      return new AutoValue_Value_PlainString(text);
    }
  }

  /** Unescaped contents of a quote-delimited string. */
  @AutoValue
  public abstract static class QuotedString extends Value {
    public abstract String text();

    @Override
    public final Type type() {
      return Type.QUOTED_STRING;
    }

    public static QuotedString of(String text) {
      return new AutoValue_Value_QuotedString(text);
    }
  }

  @AutoValue
  public abstract static class IntegerValue extends Value {
    public abstract long value();

    @Override
    public final Type type() {
      return Type.INTEGER;
    }

    public static IntegerValue of(long value) {
      return new AutoValue_Value_IntegerValue(value);
    }
  }

  @AutoValue
  public abstract static class FloatValue extends Value {
    public abstract double value();

    @Override
    public final Type type() {
      return Type.FLOAT;
    }

    public static FloatValue of(double value) {
      Preconditions.checkArgument(Double.isFinite(value), "Not finite: %s", value);
      return new AutoValue_Value_FloatValue(value);
    }
  }

  @AutoValue
  public abstract static class BooleanValue extends Value {
    public abstract boolean value();

    @Override
    public final Type type() {
      return Type.BOOLEAN;
    }

    public static BooleanValue of(boolean value) {
      return new AutoValue_Value_BooleanValue(value);
    }
  }

  /** A reference to a script constant, {@code @} included. */
  @AutoValue
  public abstract static class ConstantRef extends Value {
    public abstract String name();

    @Override
    public final Type type() {
      return Type.CONSTANT;
    }

    public static ConstantRef of(String name) {
      Preconditions.checkArgument(name.startsWith("@"), "Not a constant: %s", name);
      return new AutoValue_Value_ConstantRef(name);
    }
  }

  /**
   * A percentage held as a fraction, so {@code 50%} is 0.5. The sign is {@code %} or {@code %%}
   * and is written back unchanged.
   */
  @AutoValue
  public abstract static class Percentage extends Value {
    public abstract double fraction();

    public abstract String sign();

    @Override
    public final Type type() {
      return Type.PERCENTAGE;
    }

    public static Percentage of(double fraction, String sign) {
      Preconditions.checkArgument(sign.equals("%") || sign.equals("%%"), "Bad sign: %s", sign);
      return new AutoValue_Value_Percentage(fraction, sign);
    }

    public static Percentage parse(String text) {
      int signStart = text.indexOf('%');
      Preconditions.checkArgument(signStart > 0, "Not a percentage: %s", text);
      BigDecimal percent = new BigDecimal(text.substring(0, signStart));
      return of(percent.movePointLeft(2).doubleValue(), text.substring(signStart));
    }

    // 0.125, "%%" -> 12.5%%
    public String text() {
      return BigDecimal.valueOf(fraction()).movePointRight(2).stripTrailingZeros().toPlainString()
          + sign();
    }
  }

  /** A {@code y.m.d} literal, kept verbatim. */
  @AutoValue
  public abstract static class DateValue extends Value {
    public abstract String text();

    @Override
    public final Type type() {
      return Type.DATE;
    }

    public static DateValue of(String text) {
      return new AutoValue_Value_DateValue(text);
    }
  }

  @AutoValue
  public abstract static class Comparison extends Value {
    public abstract Value left();

    public abstract String operator();

    public abstract Value right();

    @Override
    public final Type type() {
      return Type.COMPARISON;
    }

    public static Comparison of(Value left, String operator, Value right) {
      Preconditions.checkArgument(
          Tokenizer.RELATIONAL_OPERATORS.contains(operator), "Bad operator: %s", operator);
      return new AutoValue_Value_Comparison(left, operator, right);
    }
  }

  /**
   * Keyed entries in first-occurrence order. A key whose first occurrence was written as a quoted
   * string is listed in {@link #quotedKeys()} so that it can be written back the same way.
   */
  @AutoValue
  public abstract static class Mapping extends Value {
    public abstract ImmutableMap<String, Value> entries();

    public abstract ImmutableSet<String> quotedKeys();

    @Override
    public final Type type() {
      return Type.MAPPING;
    }

    public Value get(String key) {
      return entries().get(key);
    }

    public boolean isEmpty() {
      return entries().isEmpty();
    }

    public boolean isQuoted(String key) {
      return quotedKeys().contains(key);
    }

    public static Mapping of(ImmutableMap<String, Value> entries) {
      return of(entries, ImmutableSet.of());
    }

    public static Mapping of(ImmutableMap<String, Value> entries, ImmutableSet<String> quotedKeys) {
      Preconditions.checkArgument(
          entries.keySet().containsAll(quotedKeys), "quoted keys %s not all present", quotedKeys);
      return new AutoValue_Value_Mapping(entries, quotedKeys);
    }

    public static Mapping empty() {
      return of(ImmutableMap.of());
    }
  }

  /**
   * Ordered values. A sequence either came from a brace list ({@code key = { a b }}) or was
   * merged from repeated keys ({@code key = a key = b}); {@link #merged()} tells them apart.
   */
  @AutoValue
  public abstract static class Sequence extends Value {
    public abstract ImmutableList<Value> elements();

    public abstract boolean merged();

    @Override
    public final Type type() {
      return Type.SEQUENCE;
    }

    public Value get(int index) {
      return elements().get(index);
    }

    public int size() {
      return elements().size();
    }

    public static Sequence literal(Iterable<? extends Value> elements) {
      return new AutoValue_Value_Sequence(ImmutableList.copyOf(elements), false);
    }

    public static Sequence merged(Iterable<? extends Value> elements) {
      ImmutableList<Value> list = ImmutableList.copyOf(elements);
      Preconditions.checkArgument(!list.isEmpty(), "a merged sequence needs an occurrence");
      return new AutoValue_Value_Sequence(list, true);
    }
  }
}
