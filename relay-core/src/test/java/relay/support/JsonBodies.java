package relay.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the JSON objects the relay posts to webhooks back into maps. Nested objects
 * become maps, numbers become {@link Long} or {@link Double}.
 */
public final class JsonBodies {

  private JsonBodies() {
  }

  public static Map<String, Object> parse(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    Parser parser = new Parser(trimmed);
    Map<String, Object> result = parser.readObject();
    parser.skipWhitespace();
    if (parser.idx != trimmed.length()) {
      throw new IllegalArgumentException("Trailing characters after JSON object");
    }
    return result;
  }

  private static final class Parser {
    private final String input;
    private int idx;

    private Parser(String input) {
      this.input = input;
    }

    Map<String, Object> readObject() {
      skipWhitespace();
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        idx++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at " + idx);
        }
        idx++;
        String key = readString();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        idx++;
        if (next == ',') {
          continue;
        }
        if (next == '}') {
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or '}' at " + (idx - 1));
      }
    }

    private Object readValue() {
      char ch = peek();
      if (ch == '"') {
        idx++;
        return readString();
      }
      if (ch == '{') {
        return readObject();
      }
      if (input.startsWith("null", idx)) {
        idx += 4;
        return null;
      }
      if (input.startsWith("true", idx)) {
        idx += 4;
        return Boolean.TRUE;
      }
      if (input.startsWith("false", idx)) {
        idx += 5;
        return Boolean.FALSE;
      }
      if (ch == '-' || (ch >= '0' && ch <= '9')) {
        return readNumber();
      }
      throw new IllegalArgumentException("Unexpected character '" + ch + "' at " + idx);
    }

    private Object readNumber() {
      int start = idx;
      boolean decimal = false;
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == '.' || c == 'e' || c == 'E') {
          decimal = true;
        } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
          break;
        }
        idx++;
      }
      String text = input.substring(start, idx);
      try {
        return decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == '"') {
          idx++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          idx++;
          continue;
        }
        if (idx + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(idx + 1);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (idx + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(idx + 2, idx + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            idx += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        idx += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + idx);
      }
      idx++;
    }

    private char peek() {
      if (idx >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(idx);
    }

    void skipWhitespace() {
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        idx++;
      }
    }
  }
}
