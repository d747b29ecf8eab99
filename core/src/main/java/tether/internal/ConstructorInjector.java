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
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import javax.inject.Inject;
import tether.ActivationException;
import tether.InjectionPoint;
import tether.Request;

/**
 * Constructs instances of a class and injects its {@code @Inject}-annotated
 * fields using reflection.
 *
 * <p>A class with a single {@code @Inject}-annotated constructor is always
 * built with it. Otherwise the constructor with the most parameters that can
 * all be satisfied for the current request is used, so the choice may differ
 * from one request to the next.
 */
final class ConstructorInjector<T> {
  private final Class<T> type;
  private final Field[] fields;
  private final Constructor<T> injectConstructor;
  private final List<Constructor<T>> candidates;

  private ConstructorInjector(Class<T> type, Field[] fields, Constructor<T> injectConstructor,
      List<Constructor<T>> candidates) {
    this.type = type;
    this.fields = fields;
    this.injectConstructor = injectConstructor;
    this.candidates = candidates;
  }

  static <T> ConstructorInjector<T> create(Class<T> type, boolean injectNonPublic) {
    if (type.getEnclosingClass() != null && !Modifier.isStatic(type.getModifiers())) {
      throw new IllegalStateException("Can't inject inner class: " + type.getName());
    }
    Field[] fields = injectableFields(type, injectNonPublic);

    Constructor<T> injectConstructor = null;
    List<Constructor<T>> candidates = new ArrayList<Constructor<T>>();
    for (Constructor<T> constructor : getConstructorsForType(type)) {
      boolean isPrivate = Modifier.isPrivate(constructor.getModifiers());
      if (constructor.isAnnotationPresent(Inject.class)) {
        if (injectConstructor != null) {
          throw new IllegalStateException(type.getName() + " has too many injectable constructors");
        }
        if (isPrivate && !injectNonPublic) {
          throw new IllegalStateException("Can't inject private constructor: " + constructor);
        }
        injectConstructor = constructor;
      } else if (!isPrivate || injectNonPublic) {
        candidates.add(constructor);
      }
    }
    if (injectConstructor != null) {
      injectConstructor.setAccessible(true);
      candidates = Collections.emptyList();
    } else {
      for (Constructor<T> candidate : candidates) {
        candidate.setAccessible(true);
      }
      Collections.sort(candidates, new Comparator<Constructor<T>>() {
        @Override public int compare(Constructor<T> a, Constructor<T> b) {
          return b.getParameterTypes().length - a.getParameterTypes().length;
        }
      });
    }

    return new ConstructorInjector<T>(type, fields, injectConstructor, candidates);
  }

  /**
   * Returns an injector that only injects the fields of instances created
   * elsewhere. Its constructors are never inspected.
   */
  static <T> ConstructorInjector<T> forMembers(Class<T> type, boolean injectNonPublic) {
    return new ConstructorInjector<T>(type, injectableFields(type, injectNonPublic), null,
        Collections.<Constructor<T>>emptyList());
  }

  private static Field[] injectableFields(Class<?> type, boolean injectNonPublic) {
    // Superclass fields first, so that subclasses observe their parents' dependencies.
    List<Class<?>> hierarchy = new ArrayList<Class<?>>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.add(0, c);
    }
    List<Field> result = new ArrayList<Field>();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        if (!field.isAnnotationPresent(Inject.class) || Modifier.isStatic(field.getModifiers())) {
          continue;
        }
        if (Modifier.isPrivate(field.getModifiers()) && !injectNonPublic) {
          throw new IllegalStateException("Can't inject private field: " + field);
        }
        if (Modifier.isFinal(field.getModifiers())) {
          throw new IllegalStateException("Can't inject final field: " + field);
        }
        field.setAccessible(true);
        result.add(field);
      }
    }
    return result.toArray(new Field[0]);
  }

  /**
   * Returns a new instance, with its constructor parameters and fields
   * resolved by {@code resolver} on behalf of {@code request}.
   */
  T construct(ClosedType closedType, Binding<?> binding, Request request, Resolver resolver) {
    Constructor<T> constructor = injectConstructor;
    InjectionPoint[] points = null;
    if (constructor != null) {
      points = injectionPoints(constructor, closedType);
    } else {
      for (Constructor<T> candidate : candidates) {
        InjectionPoint[] candidatePoints = injectionPoints(candidate, closedType);
        if (resolver.canSatisfy(candidatePoints, binding, request, type)) {
          constructor = candidate;
          points = candidatePoints;
          break;
        }
      }
      if (constructor == null) {
        throw new ActivationException("Error activating " + Keys.get(request.service())
            + "\n" + type.getName() + " has no constructor whose parameters can all be resolved"
            + Resolver.activationPath(request));
      }
    }

    Object[] args = new Object[points.length];
    for (int i = 0; i < points.length; i++) {
      args[i] = resolver.resolveDependency(points[i], binding, request, type);
    }
    T result;
    try {
      result = constructor.newInstance(args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new ActivationException("Error activating " + type.getName()
          + ": constructor threw " + cause + Resolver.activationPath(request), cause);
    } catch (IllegalArgumentException e) {
      throw new ActivationException("Error activating " + type.getName()
          + ": arguments don't match " + constructor + ", got " + Arrays.toString(args)
          + Resolver.activationPath(request), e);
    } catch (IllegalAccessException e) {
      throw new AssertionError(e);
    } catch (InstantiationException e) {
      throw new ActivationException("Error activating " + type.getName() + ": " + e
          + Resolver.activationPath(request), e);
    }
    injectMembers(result, closedType, binding, request, resolver);
    return result;
  }

  /** Injects the {@code @Inject}-annotated fields of {@code instance}. */
  void injectMembers(T instance, ClosedType closedType, Binding<?> binding, Request request,
      Resolver resolver) {
    try {
      for (Field field : fields) {
        InjectionPoint point =
            InjectionPoint.forField(field, closedType.resolve(field.getGenericType()));
        field.set(instance, resolver.resolveDependency(point, binding, request, type));
      }
    } catch (IllegalAccessException e) {
      throw new AssertionError(e);
    }
  }

  private static InjectionPoint[] injectionPoints(Constructor<?> constructor,
      ClosedType closedType) {
    Type[] types = constructor.getGenericParameterTypes();
    InjectionPoint[] points = new InjectionPoint[types.length];
    for (int i = 0; i < types.length; i++) {
      points[i] = InjectionPoint.forParameter(constructor, i, closedType.resolve(types[i]));
    }
    return points;
  }

  @SuppressWarnings("unchecked") // Class.getDeclaredConstructors is an unsafe API.
  private static <T> Constructor<T>[] getConstructorsForType(Class<T> type) {
    return (Constructor<T>[]) type.getDeclaredConstructors();
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "[" + type.getName() + ", fields="
        + Arrays.toString(fields) + "]";
  }
}
