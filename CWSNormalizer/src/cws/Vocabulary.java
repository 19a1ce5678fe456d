package cws;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/** Reserved word sets used to classify bare identifiers, plus the keys that always merge. */
@AutoValue
public abstract class Vocabulary {
  public abstract ImmutableSet<String> keywords();

  public abstract ImmutableSet<String> modifiers();

  public abstract ImmutableSet<String> effects();

  public abstract ImmutableSet<String> triggers();

  public abstract ImmutableSet<String> repeatableKeys();

  // keyword > modifier > effect > trigger > identifier
  public Tokenizer.TokenType classify(String word) {
    if (keywords().contains(word)) {
      return Tokenizer.TokenType.KEYWORD;
    } else if (modifiers().contains(word)) {
      return Tokenizer.TokenType.MODIFIER;
    } else if (effects().contains(word)) {
      return Tokenizer.TokenType.EFFECT;
    } else if (triggers().contains(word)) {
      return Tokenizer.TokenType.TRIGGER;
    } else {
      return Tokenizer.TokenType.IDENTIFIER;
    }
  }

  public boolean isRepeatable(String key) {
    return repeatableKeys().contains(key);
  }

  private static final Vocabulary EMPTY = builder().build();

  public static Vocabulary empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new AutoValue_Vocabulary.Builder();
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ImmutableSet.Builder<String> keywordsBuilder();

    public abstract ImmutableSet.Builder<String> modifiersBuilder();

    public abstract ImmutableSet.Builder<String> effectsBuilder();

    public abstract ImmutableSet.Builder<String> triggersBuilder();

    public abstract ImmutableSet.Builder<String> repeatableKeysBuilder();

    public final Builder addKeywords(Iterable<String> words) {
      keywordsBuilder().addAll(words);
      return this;
    }

    public final Builder addModifiers(Iterable<String> words) {
      modifiersBuilder().addAll(words);
      return this;
    }

    public final Builder addEffects(Iterable<String> words) {
      effectsBuilder().addAll(words);
      return this;
    }

    public final Builder addTriggers(Iterable<String> words) {
      triggersBuilder().addAll(words);
      return this;
    }

    public final Builder addRepeatableKeys(Iterable<String> keys) {
      repeatableKeysBuilder().addAll(keys);
      return this;
    }

    public abstract Vocabulary build();
  }
}
