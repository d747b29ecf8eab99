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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The components a kernel is assembled from, such as its module loader and
 * module loader plugins. Components are registered against the type they
 * serve; several components may share a type.
 */
public final class Components {
  private final ListMultimap<Class<?>, Object> components =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  public synchronized <T> void add(Class<T> service, T component) {
    checkNotNull(service, "service");
    checkArgument(service.isInstance(component), "%s is not a %s", component, service.getName());
    components.put(service, component);
  }

  /**
   * Returns the first component registered for {@code service}.
   *
   * @throws IllegalStateException if there is none.
   */
  public synchronized <T> T get(Class<T> service) {
    List<Object> registered = components.get(service);
    if (registered.isEmpty()) {
      throw new IllegalStateException("No component registered for " + service.getName());
    }
    return service.cast(registered.get(0));
  }

  /** Returns every component registered for {@code service}, in registration order. */
  public synchronized <T> ImmutableList<T> getAll(Class<T> service) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Object component : components.get(service)) {
      result.add(service.cast(component));
    }
    return result.build();
  }

  public synchronized boolean has(Class<?> service) {
    return components.containsKey(service);
  }

  public synchronized void removeAll(Class<?> service) {
    components.removeAll(service);
  }

  @Override public synchronized String toString() {
    return "Components" + components;
  }
}
