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
package tether.scripts;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import tether.internal.Memoizer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves the type names written in scripts to classes. Names are tried as
 * fully qualified names, then against single-class imports, then against
 * package imports in order, and finally in {@code java.lang}. Nested classes
 * are written {@code Outer.Inner}.
 *
 * <p>Class lookups are cached, failures included.
 */
final class TypeNameResolver {
  private static final Logger logger = Logger.getLogger(TypeNameResolver.class.getName());

  private final ClassLoader classLoader;

  /** Maps binary class names to classes, or to {@code Void.class} if there is no such class. */
  private final Memoizer<String, Class<?>> classes = new Memoizer<String, Class<?>>() {
    @Override protected Class<?> create(String name) {
      try {
        return Class.forName(name, false, classLoader);
      } catch (ClassNotFoundException e) {
        return Void.class;
      } catch (LinkageError e) {
        if (logger.isLoggable(Level.FINE)) {
          logger.log(Level.FINE, "Unable to load " + name, e);
        }
        return Void.class;
      }
    }
  };

  TypeNameResolver(ClassLoader classLoader) {
    this.classLoader = checkNotNull(classLoader, "classLoader");
  }

  /** Returns the class named {@code name} in a script with {@code imports}, or null. */
  Class<?> resolve(String name, List<String> imports) {
    if (name.indexOf('.') != -1) {
      Class<?> qualified = loadQualified(name);
      if (qualified != null) {
        return qualified;
      }
    }

    int dot = name.indexOf('.');
    String first = dot == -1 ? name : name.substring(0, dot);
    String rest = dot == -1 ? "" : name.substring(dot);
    for (String imported : imports) {
      if (imported.equals(first) || imported.endsWith("." + first)) {
        if (loadQualified(imported) != null) {
          Class<?> result = loadQualified(imported + rest);
          if (result != null) {
            return result;
          }
        }
      }
    }

    for (String imported : imports) {
      if (loadQualified(imported) == null) {
        Class<?> result = loadQualified(imported + "." + name);
        if (result != null) {
          return result;
        }
      }
    }

    return loadQualified("java.lang." + name);
  }

  /**
   * Loads a class by its canonical name, trying each trailing segment as a
   * nested class name in turn.
   */
  private Class<?> loadQualified(String canonicalName) {
    String name = canonicalName;
    while (true) {
      Class<?> result = classes.get(name);
      if (result != Void.class) {
        return result;
      }
      int dot = name.lastIndexOf('.');
      if (dot == -1) {
        return null;
      }
      name = name.substring(0, dot) + '$' + name.substring(dot + 1);
    }
  }
}
