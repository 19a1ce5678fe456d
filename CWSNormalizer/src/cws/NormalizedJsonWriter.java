package cws;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Exports a normalized tree as JSON for inspection. Mappings become objects and sequences become
 * arrays. Scalars with no JSON counterpart are written as tagged strings: {@code string(..)},
 * {@code constant(..)}, {@code date(..)}, {@code percentage(..)} and {@code comparison(..)}.
 */
public final class NormalizedJsonWriter {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  public static JsonNode toJson(Value value) {
    switch (value.type()) {
      case MAPPING:
        {
          ObjectNode object = NODES.objectNode();
          for (Map.Entry<String, Value> entry :
              value.cast(Value.Mapping.class).entries().entrySet()) {
            object.set(entry.getKey(), toJson(entry.getValue()));
          }
          return object;
        }
      case SEQUENCE:
        {
          ArrayNode array = NODES.arrayNode();
          for (Value element : value.cast(Value.Sequence.class).elements()) {
            array.add(toJson(element));
          }
          return array;
        }
      case STRING:
        return NODES.textNode(value.cast(Value.PlainString.class).text());
      case INTEGER:
        return NODES.numberNode(value.cast(Value.IntegerValue.class).value());
      case FLOAT:
        return NODES.numberNode(value.cast(Value.FloatValue.class).value());
      case BOOLEAN:
        return NODES.booleanNode(value.cast(Value.BooleanValue.class).value());
      case QUOTED_STRING:
        return tagged("string", value.cast(Value.QuotedString.class).text());
      case CONSTANT:
        return tagged("constant", value.cast(Value.ConstantRef.class).name());
      case DATE:
        return tagged("date", value.cast(Value.DateValue.class).text());
      case PERCENTAGE:
        return tagged("percentage", value.cast(Value.Percentage.class).text());
      case COMPARISON:
        {
          Value.Comparison comparison = value.cast();
          return tagged(
              "comparison",
              String.format(
                  "%s %s %s",
                  Formatter.formatScalar(comparison.left()),
                  comparison.operator(),
                  Formatter.formatScalar(comparison.right())));
        }
    }
    throw new AssertionError(value.type());
  }

  private static JsonNode tagged(String tag, String text) {
    return NODES.textNode(tag + "(" + text + ")");
  }

  /** Pretty-printed JSON for a whole document, newline terminated. */
  public static String write(Document document) throws JsonProcessingException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(document.root()))
        + "\n";
  }

  private NormalizedJsonWriter() {}
}
