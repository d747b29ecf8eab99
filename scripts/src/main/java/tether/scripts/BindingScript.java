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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A parsed binding script: its imports and its declarations, in order. */
final class BindingScript {
  final String source;
  final ImmutableList<String> imports;
  final ImmutableList<BindingDeclaration> declarations;

  BindingScript(String source, List<String> imports, List<BindingDeclaration> declarations) {
    this.source = source;
    this.imports = ImmutableList.copyOf(imports);
    this.declarations = ImmutableList.copyOf(declarations);
  }

  @Override public String toString() {
    return "BindingScript[" + source + ", " + declarations.size() + " bindings]";
  }
}
