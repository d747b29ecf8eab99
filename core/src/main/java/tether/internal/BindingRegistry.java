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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.List;

/**
 * The explicit bindings of a kernel, grouped by key. Bindings for the same key
 * are kept in registration order, which is the order multiple resolution
 * returns them in and the order single resolution prefers them in.
 */
public final class BindingRegistry {
  private final ListMultimap<String, Binding<?>> bindings =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  public synchronized void add(Binding<?> binding) {
    if (binding.isImplicit()) {
      throw new IllegalArgumentException("Implicit bindings are not registered: " + binding);
    }
    bindings.put(binding.key, binding);
  }

  /** Returns the bindings registered under {@code key}, in registration order. */
  public synchronized ImmutableList<Binding<?>> get(String key) {
    return ImmutableList.copyOf(bindings.get(key));
  }

  /** Removes and returns every binding registered under {@code key}. */
  public synchronized List<Binding<?>> removeAll(String key) {
    return bindings.removeAll(key);
  }

  public synchronized boolean remove(Binding<?> binding) {
    return bindings.remove(binding.key, binding);
  }

  public synchronized ImmutableList<Binding<?>> all() {
    return ImmutableList.copyOf(bindings.values());
  }

  @Override public synchronized String toString() {
    return getClass().getSimpleName() + bindings;
  }
}
