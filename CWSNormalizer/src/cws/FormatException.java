package cws;

/**
 * The normalized tree has a shape that cannot be written as script text. The transformer never
 * produces such a tree, so this signals a defect upstream rather than bad input.
 */
public class FormatException extends ScriptException {
  private static final long serialVersionUID = 1L;

  public FormatException(Tokenizer.Pos pos, String errorMsg) {
    super(Stage.FORMAT, pos, errorMsg);
  }
}
