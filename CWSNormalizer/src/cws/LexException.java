package cws;

/** Unexpected character, unterminated string or malformed number. */
public class LexException extends ScriptException {
  private static final long serialVersionUID = 1L;

  public LexException(Tokenizer.Pos pos, String errorMsg) {
    super(Stage.LEX, pos, errorMsg);
  }
}
