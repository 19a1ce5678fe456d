package cws;

/** A token of the wrong type or value where the grammar requires something else. */
public class ParseException extends ScriptException {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Token token;

  public ParseException(Tokenizer.Token token, String errorMsg) {
    this(token, token.pos(), errorMsg);
  }

  public ParseException(Tokenizer.Token token, Tokenizer.Pos pos, String errorMsg) {
    super(Stage.PARSE, pos, errorMsg);
    this.token = token;
  }

  public Tokenizer.Token token() {
    return token;
  }
}
