package cws;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Decides how the occurrences of one key in one block combine. A repeatable key, flagged by the
 * vocabulary or by its schema rule, always becomes a merged sequence. Any other key stays as its
 * single value until it occurs a second time.
 */
final class KeyMergePolicy {
  private final ImmutableSet<String> repeatableKeys;

  KeyMergePolicy(ImmutableSet<String> repeatableKeys) {
    this.repeatableKeys = repeatableKeys;
  }

  boolean isRepeatable(String key, Optional<KeyRule> rule) {
    return repeatableKeys.contains(key) || rule.map(KeyRule::repeatable).orElse(false);
  }

  Value merge(String key, List<Value> occurrences, Optional<KeyRule> rule) {
    Preconditions.checkArgument(!occurrences.isEmpty(), "no occurrences of %s", key);
    if (occurrences.size() > 1 || isRepeatable(key, rule)) {
      return Value.Sequence.merged(occurrences);
    }
    return occurrences.get(0);
  }
}
