/*
 * Copyright (C) 2012 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tether.scripts;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of a binding script into tokens. A {@code #} outside of a
 * string starts a comment that runs to the end of the line.
 */
final class Lexer {
  private final String source;
  private final int lineNumber;
  private final String line;
  private int pos;

  Lexer(String source, int lineNumber, String line) {
    this.source = source;
    this.lineNumber = lineNumber;
    this.line = line;
  }

  List<Token> tokenize() {
    List<Token> result = new ArrayList<Token>();
    while (true) {
      skipWhitespace();
      if (pos == line.length() || line.charAt(pos) == '#') {
        return result;
      }
      char c = line.charAt(pos);
      if (c == '"') {
        result.add(readString());
      } else if (c == '=') {
        pos++;
        result.add(new Token(Token.Kind.EQUALS, "=", null));
      } else if (c == '{') {
        pos++;
        result.add(new Token(Token.Kind.OPEN_BRACE, "{", null));
      } else if (c == '}') {
        pos++;
        result.add(new Token(Token.Kind.CLOSE_BRACE, "}", null));
      } else if (Character.isDigit(c) || (c == '-' && pos + 1 < line.length()
          && Character.isDigit(line.charAt(pos + 1)))) {
        result.add(readNumber());
      } else if (Character.isJavaIdentifierStart(c)) {
        result.add(readWord());
      } else {
        throw error("Unexpected character '" + c + "'");
      }
    }
  }

  private void skipWhitespace() {
    while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
      pos++;
    }
  }

  private Token readWord() {
    int start = pos;
    while (pos < line.length()) {
      char c = line.charAt(pos);
      if (Character.isJavaIdentifierPart(c) || c == '.') {
        pos++;
      } else {
        break;
      }
    }
    if (line.startsWith("<>", pos)) {
      pos += 2;
    }
    String word = line.substring(start, pos);
    if (word.endsWith(".") || word.contains("..")) {
      throw error("Malformed name '" + word + "'");
    }
    return new Token(Token.Kind.WORD, word, null);
  }

  private Token readNumber() {
    int start = pos;
    pos++; // Sign or first digit.
    boolean decimal = false;
    while (pos < line.length()) {
      char c = line.charAt(pos);
      if (Character.isDigit(c)) {
        pos++;
      } else if (c == '.' && !decimal) {
        decimal = true;
        pos++;
      } else {
        break;
      }
    }
    String text = line.substring(start, pos);
    try {
      if (decimal) {
        return new Token(Token.Kind.NUMBER, text, Double.valueOf(text));
      }
      long value = Long.parseLong(text);
      if (value == (int) value) {
        return new Token(Token.Kind.NUMBER, text, Integer.valueOf((int) value));
      }
      return new Token(Token.Kind.NUMBER, text, Long.valueOf(value));
    } catch (NumberFormatException e) {
      throw error("Malformed number " + text);
    }
  }

  private Token readString() {
    int start = pos;
    pos++; // Opening quote.
    StringBuilder value = new StringBuilder();
    while (pos < line.length()) {
      char c = line.charAt(pos++);
      if (c == '"') {
        return new Token(Token.Kind.STRING, line.substring(start, pos), value.toString());
      }
      if (c != '\\') {
        value.append(c);
        continue;
      }
      if (pos == line.length()) {
        break;
      }
      char escaped = line.charAt(pos++);
      switch (escaped) {
        case '"':
        case '\\':
          value.append(escaped);
          break;
        case 'n':
          value.append('\n');
          break;
        case 't':
          value.append('\t');
          break;
        default:
          throw error("Unknown escape sequence \\" + escaped);
      }
    }
    throw error("Unterminated string");
  }

  private BindingScriptException error(String message) {
    return new BindingScriptException(source, lineNumber, message);
  }
}
