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

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.inject.Provider;
import tether.ActivationException;
import tether.BindingMetadata;
import tether.InjectionPoint;
import tether.Request;

/**
 * Resolves requests to bindings and activates instances of them.
 *
 * <p>Single resolution prefers the first conditional binding whose condition
 * holds, then the first unconditional binding, in registration order. When no
 * explicit binding matches an unconstrained request for a concrete class, an
 * implicit binding of that class to itself is used.
 */
public final class Resolver {
  private static final Logger logger = Logger.getLogger(Resolver.class.getName());

  private final BindingRegistry registry;
  private final boolean allowNullInjection;
  private final InstanceCache cache = new InstanceCache();
  private final ConcurrentMap<String, Binding<?>> implicitBindings =
      new ConcurrentHashMap<String, Binding<?>>();
  private final Memoizer<Class<?>, ConstructorInjector<?>> injectors;
  private final Memoizer<Class<?>, ConstructorInjector<?>> membersInjectors;

  /** The activations in progress on each thread, outermost first. */
  private final ThreadLocal<List<Activation>> activations = new ThreadLocal<List<Activation>>() {
    @Override protected List<Activation> initialValue() {
      return new ArrayList<Activation>();
    }
  };

  public Resolver(BindingRegistry registry, final boolean injectNonPublic,
      boolean allowNullInjection) {
    if (registry == null) throw new NullPointerException("registry");
    this.registry = registry;
    this.allowNullInjection = allowNullInjection;
    this.injectors = new Memoizer<Class<?>, ConstructorInjector<?>>() {
      @Override protected ConstructorInjector<?> create(Class<?> type) {
        return ConstructorInjector.create(type, injectNonPublic);
      }
    };
    this.membersInjectors = new Memoizer<Class<?>, ConstructorInjector<?>>() {
      @Override protected ConstructorInjector<?> create(Class<?> type) {
        return ConstructorInjector.forMembers(type, injectNonPublic);
      }
    };
  }

  /**
   * Returns the explicit bindings that satisfy {@code request}: those
   * registered for the requested type, followed by open generic bindings of
   * its raw type.
   */
  public List<Binding<?>> matchingBindings(Request request) {
    List<Binding<?>> result = new ArrayList<Binding<?>>();
    for (Binding<?> binding : registry.get(Keys.get(request.service()))) {
      if (binding.matches(request)) {
        result.add(binding);
      }
    }
    if (request.service() instanceof ParameterizedType) {
      for (Binding<?> binding : registry.get(Keys.rawKey(request.service()))) {
        if (binding.isOpenGeneric() && binding.matches(request)) {
          result.add(binding);
        }
      }
    }
    return result;
  }

  /** Returns the binding that single resolution of {@code request} uses, or null. */
  public Binding<?> select(Request request) {
    List<Binding<?>> matches = matchingBindings(request);
    for (Binding<?> binding : matches) {
      if (binding.isConditional()) {
        return binding;
      }
    }
    if (!matches.isEmpty()) {
      return matches.get(0);
    }
    return implicitBinding(request);
  }

  public boolean canResolve(Request request) {
    return !matchingBindings(request).isEmpty() || isSelfBindable(request);
  }

  /**
   * Returns an instance for {@code request}, or null if it is optional and
   * nothing matches.
   *
   * @throws ActivationException if a required request cannot be satisfied.
   */
  public Object resolve(Request request) {
    Binding<?> binding = select(request);
    if (binding == null) {
      if (request.isOptional()) {
        return null;
      }
      throw new ActivationException(missingBindingMessage(request));
    }
    return activate(binding, request);
  }

  /** Returns an instance of every binding that satisfies {@code request}, in order. */
  public List<Object> resolveAll(Request request) {
    List<Binding<?>> matches = matchingBindings(request);
    if (matches.isEmpty()) {
      Binding<?> implicit = implicitBinding(request);
      if (implicit != null) {
        matches = Collections.<Binding<?>>singletonList(implicit);
      }
    }
    List<Object> result = new ArrayList<Object>(matches.size());
    for (Binding<?> binding : matches) {
      result.add(activate(binding, request));
    }
    return result;
  }

  /** Injects the {@code @Inject}-annotated fields of an instance created elsewhere. */
  public void injectMembers(Object instance) {
    Class<?> type = instance.getClass();
    Request request = Request.create(type, null, false);
    injectMembers(injector(membersInjectors, type, request), instance, request);
  }

  private <T> void injectMembers(ConstructorInjector<T> injector, Object instance,
      Request request) {
    Class<?> type = instance.getClass();
    @SuppressWarnings("unchecked") // The injector was created for the instance's class.
    T typed = (T) instance;
    injector.injectMembers(typed, ClosedType.of(type), Binding.implicitSelfBinding(type), request,
        this);
  }

  /**
   * Returns the instance of {@code binding} for {@code request}, honoring the
   * binding's scope.
   *
   * @throws ActivationException if the binding is already being activated for
   *     the same service on this thread.
   */
  public Object activate(final Binding<?> binding, final Request request) {
    String serviceKey = Keys.get(request.service());
    List<Activation> stack = activations.get();
    Activation activation = new Activation(binding, serviceKey);
    int index = stack.indexOf(activation);
    if (index != -1) {
      throw new ActivationException(cycleMessage(stack, index));
    }
    stack.add(activation);
    try {
      return cache.get(binding, binding.scope(), serviceKey, new Provider<Object>() {
        @Override public Object get() {
          return create(binding, request);
        }
      });
    } finally {
      stack.remove(stack.size() - 1);
    }
  }

  /** Drops cached instances of {@code binding} and any implicit binding of the same key. */
  public void release(Binding<?> binding) {
    cache.release(binding);
    forgetImplicitBinding(binding.key);
  }

  /** Forgets the implicit binding for {@code key}, if any, so that explicit bindings take over. */
  public void forgetImplicitBinding(String key) {
    Binding<?> removed = implicitBindings.remove(key);
    if (removed != null) {
      cache.release(removed);
    }
  }

  private <T> T create(Binding<T> binding, Request request) {
    T instance;
    switch (binding.target()) {
      case INSTANCE:
        instance = binding.instance();
        break;
      case PROVIDER:
        instance = binding.provider().get();
        break;
      case METHOD:
        instance = binding.method().apply(request);
        break;
      case SELF:
      case TYPE:
        Class<?> implementation = binding.implementation();
        ClosedType closedType = binding.isOpenGeneric()
            ? ClosedType.of(implementation, Keys.rawType(binding.service), request.service())
            : ClosedType.of(implementation);
        @SuppressWarnings("unchecked") // The implementation is assignable to T.
        ConstructorInjector<? extends T> injector =
            (ConstructorInjector<? extends T>) injector(injectors, implementation, request);
        instance = injector.construct(closedType, binding, request, this);
        break;
      default:
        throw new AssertionError(binding.target());
    }
    if (instance == null) {
      if (!allowNullInjection) {
        throw new ActivationException("Error activating " + Keys.get(request.service())
            + "\n" + binding + " produced null" + activationPath(request));
      }
      return null;
    }
    for (Consumer<? super T> action : binding.activationActions()) {
      action.accept(instance);
    }
    return instance;
  }

  private static ConstructorInjector<?> injector(
      Memoizer<Class<?>, ConstructorInjector<?>> injectors, Class<?> type, Request request) {
    try {
      return injectors.get(type);
    } catch (IllegalStateException e) {
      throw new ActivationException("Error activating " + Keys.get(request.service()) + "\n"
          + e.getMessage() + activationPath(request), e);
    }
  }

  /**
   * Returns true if every one of {@code points} has a value available when
   * activating {@code binding} for {@code request}.
   */
  boolean canSatisfy(InjectionPoint[] points, Binding<?> binding, Request request,
      Class<?> injectedInto) {
    for (InjectionPoint point : points) {
      Binding.ConstructorArgument argument = binding.constructorArgument(point);
      if (argument != null) {
        if (!argument.fits(point)) {
          return false;
        }
        continue;
      }
      if (allowNullInjection) {
        continue;
      }
      Class<?> raw;
      try {
        raw = Keys.rawType(point.type());
      } catch (UnsupportedOperationException e) {
        return false; // An unresolved type variable; this constructor can't be used.
      }
      if (raw == Provider.class || isCollection(raw)) {
        continue;
      }
      Request child = request.createChild(point.type(), constraintFor(point), injectedInto, point,
          false);
      if (!canResolve(child)) {
        return false;
      }
    }
    return true;
  }

  /** Returns the value for {@code point} while activating {@code binding}. */
  Object resolveDependency(InjectionPoint point, Binding<?> binding, Request request,
      Class<?> injectedInto) {
    if (point.member() instanceof Constructor) {
      Binding.ConstructorArgument argument = binding.constructorArgument(point);
      if (argument != null) {
        return argument.value;
      }
    }
    Type type = point.type();
    Class<?> raw = Keys.rawType(type);
    Predicate<BindingMetadata> constraint = constraintFor(point);
    if (raw == Provider.class) {
      final Request child = request.createChild(elementType(point), constraint, injectedInto,
          point, allowNullInjection);
      return new Provider<Object>() {
        @Override public Object get() {
          return resolve(child);
        }
        @Override public String toString() {
          return "Provider<" + Keys.get(child.service()) + ">";
        }
      };
    }
    if (isCollection(raw)) {
      Request child = request.createChild(elementType(point), constraint, injectedInto, point,
          false);
      return Collections.unmodifiableList(resolveAll(child));
    }
    return resolve(request.createChild(type, constraint, injectedInto, point,
        allowNullInjection));
  }

  private Binding<?> implicitBinding(Request request) {
    if (!isSelfBindable(request)) {
      return null;
    }
    Class<?> type = request.rawService();
    String key = Keys.get(type);
    Binding<?> binding = implicitBindings.get(key);
    if (binding == null) {
      Binding<?> created = Binding.implicitSelfBinding(type);
      binding = implicitBindings.putIfAbsent(key, created);
      if (binding == null) {
        binding = created;
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Created implicit self binding for " + key);
        }
      }
    }
    return binding;
  }

  private static boolean isSelfBindable(Request request) {
    return !request.hasConstraint() && Keys.isSelfBindable(request.rawService());
  }

  private static boolean isCollection(Class<?> raw) {
    return raw == List.class || raw == Collection.class || raw == Iterable.class;
  }

  private static Type elementType(InjectionPoint point) {
    if (!(point.type() instanceof ParameterizedType)) {
      throw new ActivationException("Can't inject raw " + Keys.rawType(point.type()).getName()
          + " into " + point + "; add a type argument");
    }
    return ((ParameterizedType) point.type()).getActualTypeArguments()[0];
  }

  /** Returns a constraint matching the {@code @Named} qualifier on {@code point}, or null. */
  private static Predicate<BindingMetadata> constraintFor(InjectionPoint point) {
    final String name = point.qualifierName();
    if (name == null) {
      return null;
    }
    return new Predicate<BindingMetadata>() {
      @Override public boolean test(BindingMetadata metadata) {
        return name.equals(metadata.name());
      }
      @Override public String toString() {
        return "@Named(\"" + name + "\")";
      }
    };
  }

  static String missingBindingMessage(Request request) {
    StringBuilder message = new StringBuilder()
        .append("Error activating ").append(Keys.get(request.service()));
    if (request.hasConstraint()) {
      message.append("\nNo matching bindings are available for the constraint ")
          .append(request.constraint());
    } else {
      message.append("\nNo matching bindings are available, and the type is not self-bindable.");
    }
    return message.append(activationPath(request)).toString();
  }

  /** Returns the chain of requests leading to {@code request}, innermost first. */
  static String activationPath(Request request) {
    StringBuilder path = new StringBuilder("\nActivation path:");
    for (Request r = request; r != null; r = r.parent()) {
      path.append("\n  ").append(r.depth() + 1).append(") ");
      if (r.parent() == null) {
        path.append("Request for ").append(Keys.get(r.service()));
      } else {
        path.append("Injection of dependency ").append(Keys.get(r.service()));
        if (r.target() != null) {
          path.append(" into ").append(r.target());
        }
      }
    }
    return path.toString();
  }

  private static String cycleMessage(List<Activation> stack, int index) {
    StringBuilder message = new StringBuilder().append("Dependency cycle:");
    for (int i = index; i < stack.size(); i++) {
      Activation activation = stack.get(i);
      message.append("\n    ").append(i - index).append(". ")
          .append(activation.serviceKey).append(" bound by ").append(activation.binding);
    }
    message.append("\n    ").append(0).append(". ").append(stack.get(index).serviceKey);
    return message.toString();
  }

  /** A binding being activated for a particular service. */
  private static final class Activation {
    final Binding<?> binding;
    final String serviceKey;

    Activation(Binding<?> binding, String serviceKey) {
      this.binding = binding;
      this.serviceKey = serviceKey;
    }

    @Override public boolean equals(Object o) {
      if (!(o instanceof Activation)) {
        return false;
      }
      Activation that = (Activation) o;
      return binding == that.binding && serviceKey.equals(that.serviceKey);
    }

    @Override public int hashCode() {
      return 31 * System.identityHashCode(binding) + serviceKey.hashCode();
    }
  }
}
