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

import com.google.common.primitives.Primitives;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.inject.Provider;
import javax.inject.Singleton;
import tether.BindingMetadata;
import tether.InjectionPoint;
import tether.Request;
import tether.Scope;

/**
 * Maps a service to the thing that produces its instances, along with the
 * metadata, condition and scope that decide when and how often it applies.
 */
public final class Binding<T> {
  /** What a binding resolves its service to. */
  public enum Target {
    SELF, TYPE, INSTANCE, PROVIDER, METHOD
  }

  /** The service as bound: a class, a parameterized type or an open generic class. */
  public final Type service;

  /** The key this binding is registered under. */
  public final String key;

  /** The module that declared this binding, or null for bindings made on the kernel. */
  public final String owner;

  private final boolean implicit;
  private final BindingMetadata metadata = new BindingMetadata();
  private final List<ConstructorArgument> constructorArguments =
      new ArrayList<ConstructorArgument>();
  private final List<Consumer<? super T>> activationActions =
      new ArrayList<Consumer<? super T>>();

  private Target target = Target.SELF;
  private Class<? extends T> implementation;
  private T instance;
  private Provider<? extends T> provider;
  private Function<? super Request, ? extends T> method;
  private Scope scope;
  private Predicate<? super Request> condition;

  Binding(Type service, String owner, boolean implicit) {
    if (service == null) throw new NullPointerException("service");
    this.service = service;
    this.key = Keys.get(service);
    this.owner = owner;
    this.implicit = implicit;
  }

  /** Returns a binding of {@code service} to itself, created on demand by the kernel. */
  static <T> Binding<T> implicitSelfBinding(Class<T> service) {
    return new Binding<T>(service, null, true);
  }

  public Target target() {
    return target;
  }

  /** Returns the class constructed by {@code SELF} and {@code TYPE} bindings, or null. */
  public Class<?> implementation() {
    switch (target) {
      case SELF:
        return Keys.rawType(service);
      case TYPE:
        return implementation;
      default:
        return null;
    }
  }

  public boolean isOpenGeneric() {
    return Keys.isOpenGeneric(service);
  }

  public boolean isImplicit() {
    return implicit;
  }

  public boolean isConditional() {
    return condition != null;
  }

  public BindingMetadata metadata() {
    return metadata;
  }

  /**
   * Returns the scope chosen for this binding. Without an explicit choice,
   * constants are singletons, classes annotated {@code @Singleton} are
   * singletons, and everything else is transient.
   */
  public Scope scope() {
    if (scope != null) {
      return scope;
    }
    if (target == Target.INSTANCE) {
      return Scope.SINGLETON;
    }
    Class<?> type = implementation();
    if (type != null && type.isAnnotationPresent(Singleton.class)) {
      return Scope.SINGLETON;
    }
    return Scope.TRANSIENT;
  }

  /** Returns true if this binding's metadata and condition both accept {@code request}. */
  public boolean matches(Request request) {
    return request.matches(metadata) && (condition == null || condition.test(request));
  }

  /** Returns the constructor argument for {@code point}, or null if none applies. */
  public ConstructorArgument constructorArgument(InjectionPoint point) {
    for (ConstructorArgument argument : constructorArguments) {
      if (argument.matches(point)) {
        return argument;
      }
    }
    return null;
  }

  T instance() {
    return instance;
  }

  Provider<? extends T> provider() {
    return provider;
  }

  Function<? super Request, ? extends T> method() {
    return method;
  }

  List<Consumer<? super T>> activationActions() {
    return Collections.unmodifiableList(activationActions);
  }

  void setType(Class<? extends T> implementation) {
    this.target = Target.TYPE;
    this.implementation = implementation;
  }

  void setSelf() {
    this.target = Target.SELF;
    this.implementation = null;
  }

  void setInstance(T instance) {
    this.target = Target.INSTANCE;
    this.instance = instance;
  }

  void setProvider(Provider<? extends T> provider) {
    this.target = Target.PROVIDER;
    this.provider = provider;
  }

  void setMethod(Function<? super Request, ? extends T> method) {
    this.target = Target.METHOD;
    this.method = method;
  }

  void setScope(Scope scope) {
    this.scope = scope;
  }

  @SuppressWarnings("unchecked") // Conditions only read the request.
  void addCondition(final Predicate<? super Request> added) {
    if (condition == null) {
      condition = added;
    } else {
      condition = ((Predicate<Request>) condition).and(added);
    }
  }

  void addConstructorArgument(ConstructorArgument argument) {
    constructorArguments.add(argument);
  }

  void addActivationAction(Consumer<? super T> action) {
    activationActions.add(action);
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder()
        .append(implicit ? "ImplicitBinding[" : "Binding[")
        .append(key);
    switch (target) {
      case TYPE:
        result.append(" to ").append(implementation.getName());
        break;
      case SELF:
        result.append(" to self");
        break;
      default:
        result.append(" to ").append(target.name().toLowerCase(Locale.US));
    }
    if (metadata.name() != null) {
      result.append(" named \"").append(metadata.name()).append('"');
    }
    if (condition != null) {
      result.append(" (conditional)");
    }
    return result.append(']').toString();
  }

  /** A value passed to a constructor parameter chosen by name or by type. */
  public static final class ConstructorArgument {
    private final String name;
    private final Class<?> type;
    public final Object value;

    private ConstructorArgument(String name, Class<?> type, Object value) {
      this.name = name;
      this.type = type;
      this.value = value;
    }

    public static ConstructorArgument named(String name, Object value) {
      return new ConstructorArgument(name, null, value);
    }

    public static ConstructorArgument typed(Class<?> type, Object value) {
      return new ConstructorArgument(null, Keys.rawType(type), value);
    }

    boolean matches(InjectionPoint point) {
      if (name != null) {
        return name.equals(point.name());
      }
      return type == Keys.rawType(point.type());
    }

    /** Returns true if {@code value} can be passed to the parameter at {@code point}. */
    boolean fits(InjectionPoint point) {
      Class<?> parameterType;
      try {
        parameterType = Keys.rawType(point.type());
      } catch (UnsupportedOperationException e) {
        return true; // An unresolved type variable; checked on invocation.
      }
      if (value == null) {
        return !parameterType.isPrimitive();
      }
      return Primitives.wrap(parameterType).isInstance(value);
    }

    @Override public String toString() {
      return (name != null ? name : type.getName()) + "=" + value;
    }
  }
}
