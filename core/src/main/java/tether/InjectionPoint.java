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

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import javax.inject.Named;

/**
 * A constructor parameter or field that receives an injected value.
 */
public final class InjectionPoint {
  private final Member member;
  private final String name;
  private final Type type;
  private final Annotation[] annotations;

  private InjectionPoint(Member member, String name, Type type, Annotation[] annotations) {
    this.member = member;
    this.name = name;
    this.type = type;
    this.annotations = annotations;
  }

  /**
   * Returns the injection point for parameter {@code index} of {@code constructor}.
   * {@code type} is the parameter's type with any type variables already resolved.
   */
  public static InjectionPoint forParameter(Constructor<?> constructor, int index, Type type) {
    Parameter parameter = constructor.getParameters()[index];
    return new InjectionPoint(constructor, parameter.getName(), type, parameter.getAnnotations());
  }

  /** Returns the injection point for {@code field}, whose type resolves to {@code type}. */
  public static InjectionPoint forField(Field field, Type type) {
    return new InjectionPoint(field, field.getName(), type, field.getAnnotations());
  }

  /**
   * Returns the parameter or field name. Parameter names are only available when
   * the declaring class was compiled with {@code -parameters}; otherwise they
   * read {@code arg0}, {@code arg1} and so on.
   */
  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  /** The constructor or field being injected. */
  public Member member() {
    return member;
  }

  public Class<?> declaringClass() {
    return member.getDeclaringClass();
  }

  public boolean isAnnotationPresent(Class<? extends Annotation> annotationType) {
    return getAnnotation(annotationType) != null;
  }

  public <A extends Annotation> A getAnnotation(Class<A> annotationType) {
    for (Annotation annotation : annotations) {
      if (annotation.annotationType() == annotationType) {
        return annotationType.cast(annotation);
      }
    }
    return null;
  }

  /** Returns the value of the {@code @Named} qualifier on this point, or null. */
  public String qualifierName() {
    Named named = getAnnotation(Named.class);
    return named != null ? named.value() : null;
  }

  @Override public String toString() {
    return (member instanceof Field ? "field " : "parameter ") + name + " of "
        + declaringClass().getName();
  }
}
