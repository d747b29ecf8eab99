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

/** A lexical element of a binding script line. */
final class Token {
  enum Kind {
    /** A keyword or a type name, possibly dotted and possibly ending in {@code <>}. */
    WORD,
    STRING,
    NUMBER,
    EQUALS,
    OPEN_BRACE,
    CLOSE_BRACE
  }

  final Kind kind;
  final String text;
  /** The decoded value of STRING and NUMBER tokens. */
  final Object value;

  Token(Kind kind, String text, Object value) {
    this.kind = kind;
    this.text = text;
    this.value = value;
  }

  boolean is(String word) {
    return kind == Kind.WORD && text.equals(word);
  }

  @Override public String toString() {
    switch (kind) {
      case STRING:
        return "string " + text;
      case NUMBER:
        return "number " + text;
      default:
        return "'" + text + "'";
    }
  }
}
