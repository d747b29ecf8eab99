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
package tether.internal;

import java.lang.annotation.Annotation;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.inject.Provider;
import tether.Request;
import tether.Scope;
import tether.syntax.BindingOptionsSyntax;
import tether.syntax.BindingToSyntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Configures a single {@link Binding} through the fluent binding syntax.
 */
public final class BindingBuilder<T> implements BindingToSyntax<T>, BindingOptionsSyntax<T> {
  private final Binding<T> binding;

  private BindingBuilder(Binding<T> binding) {
    this.binding = binding;
  }

  /**
   * Returns a builder for a new binding of {@code service}, initially bound to
   * itself.
   *
   * @param owner the name of the declaring module, or null.
   */
  public static <T> BindingBuilder<T> create(Type service, String owner) {
    Keys.get(service); // Fail fast on wildcards and type variables.
    return new BindingBuilder<T>(new Binding<T>(service, owner, false));
  }

  public Binding<T> binding() {
    return binding;
  }

  @Override public BindingOptionsSyntax<T> to(Class<? extends T> implementation) {
    checkNotNull(implementation, "implementation");
    Class<?> rawService = Keys.rawType(binding.service);
    checkArgument(rawService.isAssignableFrom(implementation),
        "%s is not assignable to %s", implementation.getName(), binding.key);
    checkConstructible(implementation);
    if (binding.isOpenGeneric()) {
      checkArgument(implementation.getTypeParameters().length > 0,
          "%s is open generic and must be bound to an open generic implementation, not %s",
          binding.key, implementation.getName());
    }
    binding.setType(implementation);
    return this;
  }

  @Override public BindingOptionsSyntax<T> toSelf() {
    checkConstructible(Keys.rawType(binding.service));
    binding.setSelf();
    return this;
  }

  @Override public BindingOptionsSyntax<T> toInstance(T instance) {
    checkNotNull(instance, "instance");
    checkArgument(!binding.isOpenGeneric(), "Open generic %s cannot be bound to an instance",
        binding.key);
    checkArgument(Keys.rawType(binding.service).isInstance(instance),
        "%s is not an instance of %s", instance, binding.key);
    binding.setInstance(instance);
    return this;
  }

  @Override public BindingOptionsSyntax<T> toProvider(Provider<? extends T> provider) {
    binding.setProvider(checkNotNull(provider, "provider"));
    return this;
  }

  @Override public BindingOptionsSyntax<T> toMethod(Function<? super Request, ? extends T> method) {
    binding.setMethod(checkNotNull(method, "method"));
    return this;
  }

  @Override public BindingOptionsSyntax<T> named(String name) {
    binding.metadata().setName(checkNotNull(name, "name"));
    return this;
  }

  @Override public BindingOptionsSyntax<T> withMetadata(String key, Object value) {
    binding.metadata().set(checkNotNull(key, "key"), value);
    return this;
  }

  @Override public BindingOptionsSyntax<T> withConstructorArgument(String name, Object value) {
    binding.addConstructorArgument(
        Binding.ConstructorArgument.named(checkNotNull(name, "name"), value));
    return this;
  }

  @Override public BindingOptionsSyntax<T> withConstructorArgument(Class<?> type, Object value) {
    binding.addConstructorArgument(
        Binding.ConstructorArgument.typed(checkNotNull(type, "type"), value));
    return this;
  }

  @Override public BindingOptionsSyntax<T> when(Predicate<? super Request> condition) {
    binding.addCondition(checkNotNull(condition, "condition"));
    return this;
  }

  @Override public BindingOptionsSyntax<T> whenInjectedInto(final Class<?> type) {
    checkNotNull(type, "type");
    return when(new Predicate<Request>() {
      @Override public boolean test(Request request) {
        return request.injectedInto() != null && type.isAssignableFrom(request.injectedInto());
      }
      @Override public String toString() {
        return "injected into " + type.getName();
      }
    });
  }

  @Override public BindingOptionsSyntax<T> whenInjectedExactlyInto(final Class<?> type) {
    checkNotNull(type, "type");
    return when(new Predicate<Request>() {
      @Override public boolean test(Request request) {
        return request.injectedInto() == type;
      }
      @Override public String toString() {
        return "injected exactly into " + type.getName();
      }
    });
  }

  @Override public BindingOptionsSyntax<T> whenClassHas(
      final Class<? extends Annotation> annotation) {
    checkNotNull(annotation, "annotation");
    return when(new Predicate<Request>() {
      @Override public boolean test(Request request) {
        return request.injectedInto() != null
            && request.injectedInto().isAnnotationPresent(annotation);
      }
    });
  }

  @Override public BindingOptionsSyntax<T> whenTargetHas(
      final Class<? extends Annotation> annotation) {
    checkNotNull(annotation, "annotation");
    return when(new Predicate<Request>() {
      @Override public boolean test(Request request) {
        return request.target() != null && request.target().isAnnotationPresent(annotation);
      }
    });
  }

  @Override public BindingOptionsSyntax<T> inSingletonScope() {
    return inScope(Scope.SINGLETON);
  }

  @Override public BindingOptionsSyntax<T> inTransientScope() {
    return inScope(Scope.TRANSIENT);
  }

  @Override public BindingOptionsSyntax<T> inThreadScope() {
    return inScope(Scope.THREAD);
  }

  @Override public BindingOptionsSyntax<T> inScope(Scope scope) {
    binding.setScope(checkNotNull(scope, "scope"));
    return this;
  }

  @Override public BindingOptionsSyntax<T> onActivation(Consumer<? super T> action) {
    binding.addActivationAction(checkNotNull(action, "action"));
    return this;
  }

  private static void checkConstructible(Class<?> type) {
    checkArgument(!type.isInterface() && !Modifier.isAbstract(type.getModifiers()),
        "%s is abstract and cannot be constructed", type.getName());
  }
}
