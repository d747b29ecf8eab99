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

import java.util.function.Function;
import javax.inject.Provider;
import tether.Request;

/**
 * Chooses what a binding's service resolves to. A binding left without a
 * target resolves to the service class itself.
 */
public interface BindingToSyntax<T> {
  /**
   * Resolves the service by constructing {@code implementation}. When the
   * service is an open generic class the implementation must be one too; it
   * is closed over the requested type arguments.
   */
  BindingOptionsSyntax<T> to(Class<? extends T> implementation);

  /** Resolves the service by constructing the service class itself. */
  BindingOptionsSyntax<T> toSelf();

  /** Resolves the service to {@code instance}. Constant bindings are always singletons. */
  BindingOptionsSyntax<T> toInstance(T instance);

  /** Resolves the service by calling {@code provider}. */
  BindingOptionsSyntax<T> toProvider(Provider<? extends T> provider);

  /** Resolves the service by calling {@code method} with the current request. */
  BindingOptionsSyntax<T> toMethod(Function<? super Request, ? extends T> method);
}
