package jobqueue.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder with no external dependencies.
 *
 * <p>Handles the subset of JSON that job payloads use: objects, arrays, strings,
 * numbers, booleans and {@code null}. Integral numbers decode as {@link Long},
 * everything else numeric as {@link Double}.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final int MAX_DEPTH = 32;

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> object) {
    if (object == null || object.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    writeValue(sb, object, 0);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Parser parser = new Parser(trimmed);
    Object value = parser.readValue(0);
    int end = skipWhitespace(trimmed, parser.index);
    if (end != trimmed.length()) {
      throw new IllegalArgumentException("Unexpected trailing content at index " + end);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) value;
    return result;
  }

  private static void writeValue(StringBuilder sb, Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("JSON nesting too deep");
    }
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Double d) {
      if (d.isNaN() || d.isInfinite()) {
        throw new IllegalArgumentException("JSON cannot represent " + d);
      }
      sb.append(d);
    } else if (value instanceof Float f) {
      writeValue(sb, f.doubleValue(), depth);
    } else if (value instanceof Number n) {
      sb.append(n);
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("JSON objects cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
        writeValue(sb, entry.getValue(), depth + 1);
      }
      sb.append('}');
    } else if (value instanceof Collection<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item, depth + 1);
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static final class Parser {
    private final String input;
    private int index;

    private Parser(String input) {
      this.input = input;
    }

    private Object readValue(int depth) {
      if (depth > MAX_DEPTH) {
        throw new IllegalArgumentException("JSON nesting too deep");
      }
      index = skipWhitespace(input, index);
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char ch = input.charAt(index);
      switch (ch) {
        case '{':
          return readObject(depth);
        case '[':
          return readArray(depth);
        case '"':
          return readString();
        case 't':
          return readLiteral("true", Boolean.TRUE);
        case 'f':
          return readLiteral("false", Boolean.FALSE);
        case 'n':
          return readLiteral("null", null);
        default:
          if (ch == '-' || (ch >= '0' && ch <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + ch + "' at index " + index);
      }
    }

    private Map<String, Object> readObject(int depth) {
      index++;
      Map<String, Object> result = new LinkedHashMap<>();
      index = skipWhitespace(input, index);
      if (index < input.length() && input.charAt(index) == '}') {
        index++;
        return result;
      }
      while (true) {
        index = skipWhitespace(input, index);
        if (index >= input.length() || input.charAt(index) != '"') {
          throw new IllegalArgumentException("Expected string key at index " + index);
        }
        String key = readString();
        index = skipWhitespace(input, index);
        if (index >= input.length() || input.charAt(index) != ':') {
          throw new IllegalArgumentException("Expected ':' after key");
        }
        index++;
        result.put(key, readValue(depth + 1));
        index = skipWhitespace(input, index);
        if (index >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char next = input.charAt(index++);
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}'");
        }
      }
    }

    private List<Object> readArray(int depth) {
      index++;
      List<Object> result = new ArrayList<>();
      index = skipWhitespace(input, index);
      if (index < input.length() && input.charAt(index) == ']') {
        index++;
        return result;
      }
      while (true) {
        result.add(readValue(depth + 1));
        index = skipWhitespace(input, index);
        if (index >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON array");
        }
        char next = input.charAt(index++);
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']'");
        }
      }
    }

    private Object readLiteral(String literal, Object value) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Invalid literal at index " + index);
      }
      index += literal.length();
      return value;
    }

    private Number readNumber() {
      int start = index;
      boolean fractional = false;
      if (input.charAt(index) == '-') {
        index++;
      }
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c >= '0' && c <= '9') {
          index++;
        } else if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
          fractional = true;
          index++;
        } else {
          break;
        }
      }
      String text = input.substring(start, index);
      try {
        if (!fractional) {
          return Long.parseLong(text);
        }
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      int i = index + 1;
      while (i < input.length()) {
        char c = input.charAt(i);
        if (c == '"') {
          index = i + 1;
          return sb.toString();
        }
        if (c == '\\') {
          if (i + 1 >= input.length()) {
            throw new IllegalArgumentException("Invalid escape sequence");
          }
          char next = input.charAt(i + 1);
          switch (next) {
            case '"':
            case '\\':
            case '/':
              sb.append(next);
              i += 2;
              break;
            case 'b':
              sb.append('\b');
              i += 2;
              break;
            case 'f':
              sb.append('\f');
              i += 2;
              break;
            case 'n':
              sb.append('\n');
              i += 2;
              break;
            case 'r':
              sb.append('\r');
              i += 2;
              break;
            case 't':
              sb.append('\t');
              i += 2;
              break;
            case 'u':
              if (i + 5 >= input.length()) {
                throw new IllegalArgumentException("Invalid unicode escape");
              }
              String hex = input.substring(i + 2, i + 6);
              try {
                sb.append((char) Integer.parseInt(hex, 16));
              } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid unicode escape", ex);
              }
              i += 6;
              break;
            default:
              throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
          }
        } else {
          sb.append(c);
          i++;
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }
}
