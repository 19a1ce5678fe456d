package cws;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class FormatterOptions {
  public static final int MAX_INLINE_LIST_SIZE = 8;

  /** Prefix repeated once per nesting level. */
  public abstract String indent();

  /** Whether short blocks and lists are written on one line. */
  public abstract boolean inlineBraces();

  public static FormatterOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_FormatterOptions.Builder().setIndent("\t").setInlineBraces(true);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndent(String indent);

    public abstract Builder setInlineBraces(boolean inlineBraces);

    @ForOverride
    abstract FormatterOptions autoBuild();

    public final FormatterOptions build() {
      FormatterOptions options = autoBuild();
      Preconditions.checkArgument(
          options.indent().chars().allMatch(c -> c == ' ' || c == '\t'),
          "indent must be spaces or tabs: '%s'",
          options.indent());
      return options;
    }
  }
}
