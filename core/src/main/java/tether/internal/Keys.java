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

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Formats strings that identify a service. Keys are of one of two forms:
 * <ol>
 *   <li>{@code com.square.Foo}: a plain class, or an open generic class like
 *       {@code com.square.Repository} bound without type arguments.
 *   <li>{@code com.square.Repository<java.lang.String>}: a parameterized type.
 * </ol>
 * Primitive types are boxed so that {@code int} and {@code Integer} share a key.
 */
public final class Keys {
  Keys() {
  }

  /** Returns a key for {@code type}. */
  public static String get(Type type) {
    type = boxIfPrimitive(type);
    if (type instanceof Class && !((Class<?>) type).isArray()) {
      return ((Class<?>) type).getName();
    }
    StringBuilder result = new StringBuilder();
    typeToString(type, result, true);
    return result.toString();
  }

  /** Returns the key of the raw class of {@code type}. */
  public static String rawKey(Type type) {
    return get(rawType(type));
  }

  /** Returns true if {@code type} is a class declaring type parameters, named without arguments. */
  public static boolean isOpenGeneric(Type type) {
    return type instanceof Class && ((Class<?>) type).getTypeParameters().length > 0;
  }

  /** Returns the raw class of {@code type}. */
  public static Class<?> rawType(Type type) {
    type = boxIfPrimitive(type);
    if (type instanceof Class) {
      return (Class<?>) type;
    } else if (type instanceof ParameterizedType) {
      return (Class<?>) ((ParameterizedType) type).getRawType();
    } else if (type instanceof GenericArrayType) {
      Class<?> component = rawType(((GenericArrayType) type).getGenericComponentType());
      return java.lang.reflect.Array.newInstance(component, 0).getClass();
    }
    throw new UnsupportedOperationException("Uninjectable type " + type);
  }

  /**
   * Returns true if the kernel may construct {@code type} without an explicit
   * binding: concrete, non-platform classes only.
   */
  public static boolean isSelfBindable(Class<?> type) {
    return !type.isInterface()
        && !type.isPrimitive()
        && !type.isArray()
        && !type.isEnum()
        && !type.isAnnotation()
        && !Modifier.isAbstract(type.getModifiers())
        && !isPlatformType(type.getName());
  }

  /** Returns true if {@code name} is the name of a platform-provided class. */
  public static boolean isPlatformType(String name) {
    return name.startsWith("java.") || name.startsWith("javax.");
  }

  /**
   * @param topLevel true if this is a top-level type where primitive types
   *     like 'int' are forbidden. Recursive calls pass 'false' to support
   *     arrays like {@code int[]}.
   */
  private static void typeToString(Type type, StringBuilder result, boolean topLevel) {
    if (type instanceof Class) {
      Class<?> c = (Class<?>) type;
      if (c.isArray()) {
        typeToString(c.getComponentType(), result, false);
        result.append("[]");
      } else if (c.isPrimitive() && topLevel) {
        throw new UnsupportedOperationException("Uninjectable type " + c.getName());
      } else {
        result.append(c.getName());
      }
    } else if (type instanceof ParameterizedType) {
      ParameterizedType parameterizedType = (ParameterizedType) type;
      typeToString(parameterizedType.getRawType(), result, true);
      Type[] arguments = parameterizedType.getActualTypeArguments();
      result.append("<");
      for (int i = 0; i < arguments.length; i++) {
        if (i != 0) {
          result.append(", ");
        }
        typeToString(boxIfPrimitive(arguments[i]), result, true);
      }
      result.append(">");
    } else if (type instanceof GenericArrayType) {
      GenericArrayType genericArrayType = (GenericArrayType) type;
      typeToString(genericArrayType.getGenericComponentType(), result, false);
      result.append("[]");
    } else {
      // Wildcards and type variables never name a concrete service.
      throw new UnsupportedOperationException("Uninjectable type " + type);
    }
  }

  static Type boxIfPrimitive(Type type) {
    if (type == byte.class) return Byte.class;
    if (type == short.class) return Short.class;
    if (type == int.class) return Integer.class;
    if (type == long.class) return Long.class;
    if (type == char.class) return Character.class;
    if (type == boolean.class) return Boolean.class;
    if (type == float.class) return Float.class;
    if (type == double.class) return Double.class;
    if (type == void.class) return Void.class;
    return type;
  }
}
