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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The name and key/value pairs attached to a binding. Constraints passed to
 * {@link Kernel#get(Class, java.util.function.Predicate)} and friends are evaluated
 * against this.
 */
public final class BindingMetadata {
  private volatile String name;
  private final Map<String, Object> values = new LinkedHashMap<String, Object>();

  /** Returns the binding's name, or null if it is unnamed. */
  public String name() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public synchronized boolean has(String key) {
    return values.containsKey(key);
  }

  /** Returns the value stored under {@code key}, or null. */
  public synchronized Object get(String key) {
    return values.get(key);
  }

  /**
   * Returns the value stored under {@code key}, or null if absent.
   *
   * @throws ClassCastException if the value is not a {@code type}.
   */
  public <T> T get(String key, Class<T> type) {
    Object value = get(key);
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new ClassCastException("Metadata '" + key + "' is a " + value.getClass().getName()
          + ", not a " + type.getName());
    }
    return type.cast(value);
  }

  public synchronized void set(String key, Object value) {
    values.put(key, value);
  }

  public synchronized Map<String, Object> asMap() {
    return Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
  }

  @Override public synchronized String toString() {
    return (name != null ? "name=\"" + name + "\" " : "") + values;
  }
}
