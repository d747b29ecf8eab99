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

import com.google.common.reflect.TypeResolver;
import com.google.common.reflect.TypeToken;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * A class to construct, along with the type arguments it is closed over. Member
 * types declared in terms of type variables are resolved against both the
 * class hierarchy and the type arguments of the requested service.
 */
final class ClosedType {
  final Class<?> rawType;
  private final TypeToken<?> token;
  private final TypeResolver arguments;

  private ClosedType(Class<?> rawType, TypeResolver arguments) {
    this.rawType = rawType;
    this.token = TypeToken.of(rawType);
    this.arguments = arguments;
  }

  /** Returns {@code type} with no type arguments to apply. */
  static ClosedType of(Class<?> type) {
    return new ClosedType(type, new TypeResolver());
  }

  /**
   * Returns {@code implementation} closed over the type arguments of
   * {@code requested}, a parameterization of the supertype {@code service}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"}) // getSupertype needs a Class<? super T>.
  static ClosedType of(Class<?> implementation, Class<?> service, Type requested) {
    if (!(requested instanceof ParameterizedType)) {
      return of(implementation);
    }
    Type formal = TypeToken.of(implementation).getSupertype((Class) service).getType();
    return new ClosedType(implementation, new TypeResolver().where(formal, requested));
  }

  /**
   * Returns the concrete type of a member declared as {@code generic} in this
   * class or one of its supertypes.
   */
  Type resolve(Type generic) {
    return arguments.resolveType(token.resolveType(generic).getType());
  }

  @Override public String toString() {
    return rawType.getName();
  }
}
