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

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import tether.Scope;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses binding scripts. A script is a sequence of lines, each holding an
 * {@code import} statement, a {@code bind} statement or nothing:
 *
 * <pre>
 *   import tether.scripts.fakes
 *   bind Weapon to Sword named "sword"
 *   bind Weapon {
 *     to Shuriken
 *     when injected into Samurai
 *   }
 * </pre>
 */
final class BindingScriptParser {
  private static final Splitter LINES = Splitter.on('\n');

  private final String source;
  private final List<String> imports = new ArrayList<String>();
  private final List<BindingDeclaration> declarations = new ArrayList<BindingDeclaration>();

  /** The declaration whose block is open, or null. */
  private BindingDeclaration block;

  private List<Token> tokens;
  private int pos;
  private int lineNumber;

  private BindingScriptParser(String source) {
    this.source = source;
  }

  /**
   * Parses {@code text}, attributing errors to {@code source}.
   *
   * @throws BindingScriptException if {@code text} is malformed.
   */
  static BindingScript parse(String source, String text) {
    checkNotNull(source, "source");
    checkNotNull(text, "text");
    BindingScriptParser parser = new BindingScriptParser(source);
    for (String line : LINES.split(text)) {
      parser.lineNumber++;
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      parser.parseLine(line);
    }
    if (parser.block != null) {
      throw new BindingScriptException(source, parser.block.line, "Unclosed block");
    }
    return new BindingScript(source, parser.imports, parser.declarations);
  }

  private void parseLine(String line) {
    tokens = new Lexer(source, lineNumber, line).tokenize();
    pos = 0;
    if (tokens.isEmpty()) {
      return;
    }
    if (block != null) {
      if (peek().kind == Token.Kind.CLOSE_BRACE) {
        pos++;
        block = null;
        expectEndOfLine();
      } else {
        parseClauses(block);
      }
      return;
    }

    Token first = next();
    if (first.is("import")) {
      imports.add(type("import").toString());
      expectEndOfLine();
    } else if (first.is("bind")) {
      BindingDeclaration declaration = new BindingDeclaration(lineNumber, type("bind"));
      declarations.add(declaration);
      parseClauses(declaration);
    } else {
      throw error("Expected 'import' or 'bind' but was " + first);
    }
  }

  /** Parses clauses to the end of the line, opening a block if the line ends with '{'. */
  private void parseClauses(BindingDeclaration declaration) {
    while (pos < tokens.size()) {
      Token token = next();
      if (token.kind == Token.Kind.OPEN_BRACE && block == null) {
        block = declaration;
        expectEndOfLine();
        return;
      }
      if (token.is("to")) {
        parseTarget(declaration);
      } else if (token.is("named")) {
        if (declaration.name != null) {
          throw error("Name already specified");
        }
        declaration.name = string("named");
      } else if (token.is("in")) {
        declaration.scope = scope();
        expectWord("scope");
      } else if (token.is("with")) {
        Token kind = next();
        if (kind.is("metadata")) {
          String key = word("with metadata");
          expect(Token.Kind.EQUALS);
          declaration.metadata.put(key, literal());
        } else if (kind.is("argument")) {
          String name = word("with argument");
          expect(Token.Kind.EQUALS);
          declaration.arguments.put(name, literal());
        } else {
          throw error("Expected 'metadata' or 'argument' after 'with' but was " + kind);
        }
      } else if (token.is("when")) {
        parseCondition(declaration);
      } else {
        throw error("Unexpected " + token);
      }
    }
  }

  private void parseTarget(BindingDeclaration declaration) {
    if (declaration.targetDeclared) {
      throw error("Target already specified");
    }
    declaration.targetDeclared = true;
    Token target = peek();
    if (target.is("self")) {
      pos++;
      declaration.targetKind = BindingDeclaration.TargetKind.SELF;
    } else if (target.is("constant")) {
      pos++;
      declaration.targetKind = BindingDeclaration.TargetKind.CONSTANT;
      declaration.constant = literal();
    } else {
      declaration.targetKind = BindingDeclaration.TargetKind.TYPE;
      declaration.targetType = type("to");
    }
  }

  private void parseCondition(BindingDeclaration declaration) {
    Token token = next();
    BindingDeclaration.ConditionKind kind;
    if (token.is("injected")) {
      kind = BindingDeclaration.ConditionKind.INJECTED_INTO;
      if (peek().is("exactly")) {
        pos++;
        kind = BindingDeclaration.ConditionKind.INJECTED_EXACTLY_INTO;
      }
      expectWord("into");
    } else if (token.is("class")) {
      kind = BindingDeclaration.ConditionKind.CLASS_HAS;
      expectWord("has");
    } else if (token.is("target")) {
      kind = BindingDeclaration.ConditionKind.TARGET_HAS;
      expectWord("has");
    } else {
      throw error("Expected 'injected', 'class' or 'target' after 'when' but was " + token);
    }
    declaration.conditions.add(new BindingDeclaration.Condition(kind, type("when")));
  }

  private Scope scope() {
    Token token = next();
    if (token.is("singleton")) {
      return Scope.SINGLETON;
    } else if (token.is("transient")) {
      return Scope.TRANSIENT;
    } else if (token.is("thread")) {
      return Scope.THREAD;
    }
    throw error("Unknown scope " + token);
  }

  private Object literal() {
    Token token = next();
    switch (token.kind) {
      case STRING:
      case NUMBER:
        return token.value;
      case WORD:
        if (token.is("true")) {
          return Boolean.TRUE;
        } else if (token.is("false")) {
          return Boolean.FALSE;
        } else if (token.is("null")) {
          return null;
        }
        // Fall through.
      default:
        throw error("Expected a literal but was " + token);
    }
  }

  private BindingDeclaration.TypeName type(String after) {
    return new BindingDeclaration.TypeName(word(after));
  }

  private String word(String after) {
    Token token = next();
    if (token.kind != Token.Kind.WORD) {
      throw error("Expected a name after '" + after + "' but was " + token);
    }
    return token.text;
  }

  private String string(String after) {
    Token token = next();
    if (token.kind != Token.Kind.STRING) {
      throw error("Expected a string after '" + after + "' but was " + token);
    }
    return (String) token.value;
  }

  private void expectWord(String word) {
    Token token = next();
    if (!token.is(word)) {
      throw error("Expected '" + word + "' but was " + token);
    }
  }

  private void expect(Token.Kind kind) {
    Token token = next();
    if (token.kind != kind) {
      throw error("Expected " + kind + " but was " + token);
    }
  }

  private void expectEndOfLine() {
    if (pos < tokens.size()) {
      throw error("Unexpected " + tokens.get(pos));
    }
  }

  private Token peek() {
    if (pos == tokens.size()) {
      throw error("Unexpected end of line");
    }
    return tokens.get(pos);
  }

  private Token next() {
    Token result = peek();
    pos++;
    return result;
  }

  private BindingScriptException error(String message) {
    return new BindingScriptException(source, lineNumber, message);
  }
}
