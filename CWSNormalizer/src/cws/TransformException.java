package cws;

public class TransformException extends ScriptException {
  private static final long serialVersionUID = 1L;

  public TransformException(Tokenizer.Pos pos, String errorMsg) {
    super(Stage.TRANSFORM, pos, errorMsg);
  }
}
