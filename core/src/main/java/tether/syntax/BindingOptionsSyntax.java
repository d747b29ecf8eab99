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
package tether.syntax;

import java.lang.annotation.Annotation;
import java.util.function.Consumer;
import java.util.function.Predicate;
import tether.Request;
import tether.Scope;

/**
 * Names, constrains and scopes a binding once its target is chosen. Every
 * method returns the same builder so that options can be chained.
 */
public interface BindingOptionsSyntax<T> {
  BindingOptionsSyntax<T> named(String name);

  BindingOptionsSyntax<T> withMetadata(String key, Object value);

  /** Passes {@code value} to the constructor parameter called {@code name}. */
  BindingOptionsSyntax<T> withConstructorArgument(String name, Object value);

  /** Passes {@code value} to the first constructor parameter of type {@code type}. */
  BindingOptionsSyntax<T> withConstructorArgument(Class<?> type, Object value);

  /**
   * Applies this binding only to requests accepted by {@code condition}.
   * Repeated conditions must all hold.
   */
  BindingOptionsSyntax<T> when(Predicate<? super Request> condition);

  /** Applies when the dependency is injected into {@code type} or one of its subclasses. */
  BindingOptionsSyntax<T> whenInjectedInto(Class<?> type);

  /** Applies when the dependency is injected into exactly {@code type}. */
  BindingOptionsSyntax<T> whenInjectedExactlyInto(Class<?> type);

  /** Applies when the class receiving the dependency carries {@code annotation}. */
  BindingOptionsSyntax<T> whenClassHas(Class<? extends Annotation> annotation);

  /** Applies when the parameter or field receiving the dependency carries {@code annotation}. */
  BindingOptionsSyntax<T> whenTargetHas(Class<? extends Annotation> annotation);

  BindingOptionsSyntax<T> inSingletonScope();

  BindingOptionsSyntax<T> inTransientScope();

  BindingOptionsSyntax<T> inThreadScope();

  BindingOptionsSyntax<T> inScope(Scope scope);

  /** Runs {@code action} on every instance this binding creates, after injection. */
  BindingOptionsSyntax<T> onActivation(Consumer<? super T> action);
}
