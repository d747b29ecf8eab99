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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.inject.Provider;
import tether.Scope;

/**
 * Holds the instances of singleton and thread scoped bindings. Instances are
 * keyed by binding and by the closed service key, so an open generic binding
 * keeps one instance per set of type arguments.
 */
final class InstanceCache {
  private static final Object UNINITIALIZED = new Object();

  private final ConcurrentMap<Binding<?>, ConcurrentMap<String, ScopedInstance>> singletons =
      new ConcurrentHashMap<Binding<?>, ConcurrentMap<String, ScopedInstance>>();

  private final ThreadLocal<Map<Binding<?>, Map<String, Object>>> perThread =
      new ThreadLocal<Map<Binding<?>, Map<String, Object>>>() {
        @Override protected Map<Binding<?>, Map<String, Object>> initialValue() {
          return new HashMap<Binding<?>, Map<String, Object>>();
        }
      };

  /**
   * Returns the instance cached for {@code binding} and {@code serviceKey} in
   * {@code scope}, calling {@code factory} to create it first if necessary.
   */
  Object get(Binding<?> binding, Scope scope, String serviceKey, Provider<Object> factory) {
    switch (scope) {
      case TRANSIENT:
        return factory.get();
      case SINGLETON:
        ConcurrentMap<String, ScopedInstance> instances = singletons.get(binding);
        if (instances == null) {
          ConcurrentMap<String, ScopedInstance> created =
              new ConcurrentHashMap<String, ScopedInstance>();
          instances = singletons.putIfAbsent(binding, created);
          if (instances == null) {
            instances = created;
          }
        }
        ScopedInstance instance = instances.get(serviceKey);
        if (instance == null) {
          ScopedInstance created = new ScopedInstance();
          instance = instances.putIfAbsent(serviceKey, created);
          if (instance == null) {
            instance = created;
          }
        }
        return instance.get(factory);
      case THREAD:
        Map<String, Object> threadInstances = perThread.get().get(binding);
        if (threadInstances == null) {
          threadInstances = new HashMap<String, Object>();
          perThread.get().put(binding, threadInstances);
        }
        if (threadInstances.containsKey(serviceKey)) {
          return threadInstances.get(serviceKey);
        }
        Object created = factory.get();
        threadInstances.put(serviceKey, created);
        return created;
      default:
        throw new AssertionError(scope);
    }
  }

  /**
   * Drops every instance cached for {@code binding}. Thread scoped instances
   * held by other threads are not reachable from here and stay cached.
   */
  void release(Binding<?> binding) {
    singletons.remove(binding);
    perThread.get().remove(binding);
  }

  /** A single lazily created instance, guarded by double-checked locking. */
  private static final class ScopedInstance {
    private volatile Object onlyInstance = UNINITIALIZED;

    Object get(Provider<Object> factory) {
      Object result = onlyInstance;
      if (result == UNINITIALIZED) {
        synchronized (this) {
          result = onlyInstance;
          if (result == UNINITIALIZED) {
            result = factory.get();
            onlyInstance = result;
          }
        }
      }
      return result;
    }
  }
}
