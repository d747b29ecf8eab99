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

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.Map;
import tether.Module;
import tether.syntax.BindingOptionsSyntax;
import tether.syntax.BindingToSyntax;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A module whose bindings are declared by a binding script. The module is
 * named after the script, and loading it applies the script's declarations
 * in order.
 */
public final class ScriptModule extends Module {
  private final BindingScript script;
  private final TypeNameResolver types;

  ScriptModule(BindingScript script, TypeNameResolver types) {
    this.script = script;
    this.types = types;
  }

  /**
   * Returns a module declared by {@code text}, with type names resolved by
   * {@code classLoader}.
   *
   * @param source names the module and locates errors in messages.
   * @throws BindingScriptException if {@code text} is malformed.
   */
  public static ScriptModule parse(String source, String text, ClassLoader classLoader) {
    checkNotNull(classLoader, "classLoader");
    return new ScriptModule(BindingScriptParser.parse(source, text),
        new TypeNameResolver(classLoader));
  }

  @Override public String name() {
    return script.source;
  }

  @Override protected void load() {
    for (BindingDeclaration declaration : script.declarations) {
      try {
        apply(declaration);
      } catch (IllegalArgumentException e) {
        throw new BindingScriptException(script.source, declaration.line, e.getMessage(), e);
      }
    }
  }

  private void apply(BindingDeclaration declaration) {
    int line = declaration.line;
    Class<?> service = resolveBound(line, declaration.service);
    BindingToSyntax<Object> to = bind((Type) service);

    BindingOptionsSyntax<Object> options;
    switch (declaration.targetKind) {
      case TYPE:
        options = to.to(resolveBound(line, declaration.targetType));
        break;
      case CONSTANT:
        if (declaration.constant == null) {
          throw new BindingScriptException(script.source, line, "Constants cannot be null");
        }
        options = to.toInstance(declaration.constant);
        break;
      default:
        options = to.toSelf();
    }

    if (declaration.name != null) {
      options.named(declaration.name);
    }
    if (declaration.scope != null) {
      options.inScope(declaration.scope);
    }
    for (Map.Entry<String, Object> entry : declaration.metadata.entrySet()) {
      options.withMetadata(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, Object> entry : declaration.arguments.entrySet()) {
      options.withConstructorArgument(entry.getKey(), entry.getValue());
    }
    for (BindingDeclaration.Condition condition : declaration.conditions) {
      Class<?> type = resolve(line, condition.type);
      switch (condition.kind) {
        case INJECTED_INTO:
          options.whenInjectedInto(type);
          break;
        case INJECTED_EXACTLY_INTO:
          options.whenInjectedExactlyInto(type);
          break;
        case CLASS_HAS:
          options.whenClassHas(annotation(line, type));
          break;
        case TARGET_HAS:
          options.whenTargetHas(annotation(line, type));
          break;
        default:
          throw new AssertionError(condition.kind);
      }
    }
  }

  private Class<?> resolve(int line, BindingDeclaration.TypeName typeName) {
    Class<?> result = types.resolve(typeName.name, script.imports);
    if (result == null) {
      throw new BindingScriptException(script.source, line, "Unknown type " + typeName.name);
    }
    boolean generic = result.getTypeParameters().length > 0;
    if (typeName.openGeneric && !generic) {
      throw new BindingScriptException(script.source, line,
          result.getName() + " has no type parameters");
    }
    return result;
  }

  /** Resolves a service or target type, whose type parameters must be marked open. */
  private Class<?> resolveBound(int line, BindingDeclaration.TypeName typeName) {
    Class<?> result = resolve(line, typeName);
    if (!typeName.openGeneric && result.getTypeParameters().length > 0) {
      throw new BindingScriptException(script.source, line,
          result.getName() + " is generic; write " + typeName.name + "<>");
    }
    return result;
  }

  private Class<? extends Annotation> annotation(int line, Class<?> type) {
    if (!type.isAnnotation()) {
      throw new BindingScriptException(script.source, line,
          type.getName() + " is not an annotation");
    }
    return type.asSubclass(Annotation.class);
  }
}
