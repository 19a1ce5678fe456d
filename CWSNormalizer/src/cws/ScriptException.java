package cws;

/**
 * A failure of one pipeline stage on one document. Every failure carries the stage that raised
 * it and the source position it refers to.
 */
public class ScriptException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Stage {
    LEX,
    PARSE,
    TRANSFORM,
    FORMAT;
  }

  private final Stage stage;
  private final Tokenizer.Pos pos;
  private final String errorMsg;

  public ScriptException(Stage stage, Tokenizer.Pos pos, String errorMsg) {
    super(errorMsg);
    this.stage = stage;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Stage stage() {
    return stage;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  // ERROR[PARSE]: common/technologies/foo.txt@3:7 expected '}'
  public String describe() {
    return String.format(
        "ERROR[%s]: %s@%d:%d %s", stage, pos.file(), pos.line(), pos.column(), errorMsg);
  }

  @Override
  public String toString() {
    return describe();
  }
}
