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

import com.google.common.reflect.TypeToken;
import java.lang.reflect.Type;
import tether.syntax.BindingToSyntax;

/**
 * A unit of configuration that declares bindings when loaded into a kernel.
 * Subclasses declare their bindings in {@link #load()}:
 *
 * <pre>   {@code
 *   public final class WeaponsModule extends Module {
 *     @Override protected void load() {
 *       bind(Weapon.class).to(Sword.class);
 *       bind(Weapon.class).to(Shuriken.class).whenInjectedInto(Ninja.class);
 *     }
 *   }}</pre>
 *
 * <p>The kernel remembers which bindings a module declared and removes them
 * when the module is unloaded.
 */
public abstract class Module {
  private Kernel kernel;

  /** Returns the name this module is registered under. Defaults to the class name. */
  public String name() {
    return getClass().getName();
  }

  /**
   * Returns the kernel this module is loaded into.
   *
   * @throws IllegalStateException if the module is not loaded.
   */
  public final Kernel kernel() {
    if (kernel == null) {
      throw new IllegalStateException("Module " + name() + " is not loaded");
    }
    return kernel;
  }

  public final boolean isLoaded() {
    return kernel != null;
  }

  /** Declares this module's bindings. */
  protected abstract void load();

  /** Called before this module's bindings are removed from the kernel. */
  protected void unload() {
  }

  protected final <T> BindingToSyntax<T> bind(Class<T> service) {
    return kernel().bind(service, name());
  }

  protected final <T> BindingToSyntax<T> bind(TypeToken<T> service) {
    return kernel().bind(service.getType(), name());
  }

  /** Declares a binding for a service known only at runtime. */
  protected final <T> BindingToSyntax<T> bind(Type service) {
    return kernel().bind(service, name());
  }

  protected final <T> BindingToSyntax<T> rebind(Class<T> service) {
    kernel().unbind(service);
    return bind(service);
  }

  protected final void unbind(Class<?> service) {
    kernel().unbind(service);
  }

  final void onLoad(Kernel kernel) {
    if (this.kernel != null) {
      throw new IllegalStateException("Module " + name() + " is already loaded");
    }
    this.kernel = kernel;
    try {
      load();
    } catch (RuntimeException e) {
      this.kernel = null;
      throw e;
    }
  }

  final void onUnload() {
    try {
      unload();
    } finally {
      kernel = null;
    }
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "[" + name() + "]";
  }
}
