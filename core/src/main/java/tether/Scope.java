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

/**
 * Controls how long an activated instance is reused.
 */
public enum Scope {
  /** A new instance for every request. */
  TRANSIENT,
  /** One instance per binding (and per closed generic type) for the life of the kernel. */
  SINGLETON,
  /** One instance per binding for each thread. */
  THREAD
}
