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
package tether;

import java.lang.reflect.Type;
import java.util.function.Predicate;
import tether.internal.Keys;

/**
 * A request to resolve a service. Requests made while activating another
 * instance form a chain through {@link #parent()}; binding conditions inspect
 * this chain to decide whether they apply.
 */
public final class Request {
  private final Type service;
  private final Predicate<BindingMetadata> constraint;
  private final Request parent;
  private final Class<?> injectedInto;
  private final InjectionPoint target;
  private final boolean optional;
  private final int depth;

  private Request(Type service, Predicate<BindingMetadata> constraint, Request parent,
      Class<?> injectedInto, InjectionPoint target, boolean optional) {
    if (service == null) throw new NullPointerException("service");
    this.service = service;
    this.constraint = constraint;
    this.parent = parent;
    this.injectedInto = injectedInto;
    this.target = target;
    this.optional = optional;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /** Returns a top-level request, as made by {@link Kernel#get}. */
  public static Request create(Type service, Predicate<BindingMetadata> constraint,
      boolean optional) {
    return new Request(service, constraint, null, null, null, optional);
  }

  /**
   * Returns a request for a dependency of the instance this request is
   * activating.
   *
   * @param injectedInto the concrete class being activated that needs the dependency.
   * @param target the parameter or field receiving the value, or null.
   */
  public Request createChild(Type service, Predicate<BindingMetadata> constraint,
      Class<?> injectedInto, InjectionPoint target, boolean optional) {
    return new Request(service, constraint, this, injectedInto, target, optional);
  }

  public Type service() {
    return service;
  }

  public Class<?> rawService() {
    return Keys.rawType(service);
  }

  /** Returns the metadata constraint, or null if any binding is acceptable. */
  public Predicate<BindingMetadata> constraint() {
    return constraint;
  }

  public boolean hasConstraint() {
    return constraint != null;
  }

  /** Returns true if {@code metadata} satisfies this request's constraint. */
  public boolean matches(BindingMetadata metadata) {
    return constraint == null || constraint.test(metadata);
  }

  /** Returns the request whose activation needs this one, or null at the top level. */
  public Request parent() {
    return parent;
  }

  /** Returns the concrete class that receives this dependency, or null at the top level. */
  public Class<?> injectedInto() {
    return injectedInto;
  }

  /** Returns the parameter or field receiving the value, or null. */
  public InjectionPoint target() {
    return target;
  }

  public boolean isOptional() {
    return optional;
  }

  /** Zero for top-level requests, and one more than the parent's depth otherwise. */
  public int depth() {
    return depth;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder().append(Keys.get(service));
    if (target != null) {
      result.append(" for ").append(target);
    }
    return result.toString();
  }
}
