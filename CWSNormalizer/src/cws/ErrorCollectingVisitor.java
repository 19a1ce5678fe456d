package cws;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A visitor that keeps going after a problem so that every problem in a document can be
 * reported. Subclasses must handle every node type.
 */
abstract class ErrorCollectingVisitor<V> implements ASTVisitor<V> {
  private final List<TransformException> errors = new ArrayList<>();

  protected ImmutableList<TransformException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Tokenizer.Pos pos, String msg) {
    logError(new TransformException(pos, msg));
  }

  protected void logError(TransformException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Throws the earliest error by source position, if there is one. */
  public void throwFirstError() throws TransformException {
    if (errors.isEmpty()) return;

    TransformException first = errors.get(0);
    for (TransformException ex : errors) {
      if (ex.pos().compareTo(first.pos()) < 0) first = ex;
    }
    throw first;
  }
}
