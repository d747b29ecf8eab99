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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Caches the results of {@link #create}. Concurrent callers may race to create
 * a value for the same key; the last one written wins and every caller
 * observes a valid value.
 */
public abstract class Memoizer<K, V> {
  private final Map<K, V> values = new LinkedHashMap<K, V>();
  private final Lock readLock;
  private final Lock writeLock;

  protected Memoizer() {
    ReadWriteLock lock = new ReentrantReadWriteLock();
    this.readLock = lock.readLock();
    this.writeLock = lock.writeLock();
  }

  public final V get(K key) {
    if (key == null) {
      throw new NullPointerException("key == null");
    }

    readLock.lock();
    try {
      V cached = values.get(key);
      if (cached != null) {
        return cached;
      }
    } finally {
      readLock.unlock();
    }

    V created = create(key);
    if (created == null) {
      throw new NullPointerException("create returned null for " + key);
    }

    writeLock.lock();
    try {
      values.put(key, created);
    } finally {
      writeLock.unlock();
    }
    return created;
  }

  /** Returns the value for {@code key}. Must not return null. */
  protected abstract V create(K key);

  @Override public final String toString() {
    readLock.lock();
    try {
      return getClass().getSimpleName() + values.keySet();
    } finally {
      readLock.unlock();
    }
  }
}
