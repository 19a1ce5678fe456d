package cws;

import com.google.auto.value.AutoValue;

/** A normalized document: the root mapping plus the schema it was checked against. */
@AutoValue
public abstract class Document {
  public abstract String file();

  public abstract DocumentSchema schema();

  public abstract Value.Mapping root();

  public static Document create(String file, DocumentSchema schema, Value.Mapping root) {
    return new AutoValue_Document(file, schema, root);
  }
}
