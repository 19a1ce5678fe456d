package cws;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/**
 * The rules for one document type. When {@link #rootKey()} is present the document must consist
 * of that key holding a block, and {@link #rootRule()} describes that block. Otherwise {@link
 * #rootRule()} describes the document itself.
 */
@AutoValue
public abstract class DocumentSchema {
  public abstract String name();

  public abstract Optional<String> rootKey();

  public abstract KeyRule rootRule();

  /** The rule for the value stored under {@code path}, a list of keys from the document top. */
  public Optional<KeyRule> ruleForPath(List<String> path) {
    if (path.isEmpty()) return Optional.empty();

    Optional<KeyRule> rule;
    List<String> rest;
    if (rootKey().isPresent()) {
      if (!path.get(0).equals(rootKey().get())) return Optional.empty();
      rule = Optional.of(rootRule());
      rest = path.subList(1, path.size());
    } else {
      rule = Optional.of(rootRule());
      rest = path;
    }

    for (String key : rest) {
      if (!rule.isPresent()) break;
      rule = rule.get().child(key);
    }
    return rule;
  }

  public static DocumentSchema create(String name, Optional<String> rootKey, KeyRule rootRule) {
    return new AutoValue_DocumentSchema(name, rootKey, rootRule);
  }

  private static final DocumentSchema PERMISSIVE =
      create(
          "default",
          Optional.empty(),
          KeyRule.builder("<document>", KeyRule.Kind.BLOCK)
              .addChild(KeyRule.of(KeyRule.WILDCARD, KeyRule.Kind.ANY))
              .build());

  /** Accepts any document. */
  public static DocumentSchema permissive() {
    return PERMISSIVE;
  }
}
