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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import tether.Scope;

/**
 * One {@code bind} statement of a script, with its type names still
 * unresolved.
 */
final class BindingDeclaration {
  enum TargetKind {
    SELF, TYPE, CONSTANT
  }

  enum ConditionKind {
    INJECTED_INTO, INJECTED_EXACTLY_INTO, CLASS_HAS, TARGET_HAS
  }

  /** A type name as written, like {@code Weapon} or {@code Generic<>}. */
  static final class TypeName {
    final String name;
    final boolean openGeneric;

    TypeName(String written) {
      this.openGeneric = written.endsWith("<>");
      this.name = openGeneric ? written.substring(0, written.length() - 2) : written;
    }

    @Override public String toString() {
      return openGeneric ? name + "<>" : name;
    }
  }

  static final class Condition {
    final ConditionKind kind;
    final TypeName type;

    Condition(ConditionKind kind, TypeName type) {
      this.kind = kind;
      this.type = type;
    }
  }

  final int line;
  final TypeName service;

  boolean targetDeclared;
  TargetKind targetKind = TargetKind.SELF;
  TypeName targetType;
  Object constant;

  String name;
  Scope scope;
  final Map<String, Object> metadata = new LinkedHashMap<String, Object>();
  final Map<String, Object> arguments = new LinkedHashMap<String, Object>();
  final List<Condition> conditions = new ArrayList<Condition>();

  BindingDeclaration(int line, TypeName service) {
    this.line = line;
    this.service = service;
  }

  @Override public String toString() {
    return "bind " + service + " to "
        + (targetKind == TargetKind.TYPE ? targetType : targetKind.name().toLowerCase(Locale.US));
  }
}
