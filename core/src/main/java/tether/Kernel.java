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
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import tether.syntax.BindingToSyntax;

/**
 * A container of bindings that resolves services to instances, constructing
 * them and their dependencies as needed.
 *
 * <p>The following features are supported:
 * <ul>
 *   <li>Constructor injection. A class may have a single
 *       {@code @Inject}-annotated constructor. Classes without one are built
 *       with the constructor that has the most parameters the kernel can
 *       satisfy.
 *   <li>Field injection of {@code @Inject}-annotated fields.
 *   <li>Named bindings, selected by {@link #get(Class, String)} or by a
 *       {@code @Named} qualifier on the injected parameter or field.
 *   <li>Bindings with arbitrary metadata, selected by a constraint.
 *   <li>Conditional bindings, which apply only to requests their condition
 *       accepts, such as dependencies of a particular class.
 *   <li>Open generic bindings, closed over the requested type arguments.
 *   <li>Injection of {@code Provider}s and of {@code List}s of every match.
 *   <li>Singleton, thread and transient scopes, and {@code @Singleton} classes.
 *   <li>Modules, loaded directly or discovered on disk by module loader plugins.
 * </ul>
 *
 * <p>The following features are not supported:
 * <ul>
 *   <li>Method injection.</li>
 *   <li>Circular dependencies.</li>
 * </ul>
 */
public abstract class Kernel {
  Kernel() {
  }

  /** Returns a new kernel with default settings, loading {@code modules}. */
  public static Kernel create(Module... modules) {
    return new StandardKernel(modules);
  }

  /** Returns a new kernel configured by {@code settings}, loading {@code modules}. */
  public static Kernel create(KernelSettings settings, Module... modules) {
    return new StandardKernel(settings, modules);
  }

  public abstract KernelSettings settings();

  /** Returns the components this kernel is assembled from. */
  public abstract Components components();

  /**
   * Declares a new binding for {@code service}. The binding takes effect
   * immediately and is completed through the returned syntax. An open generic
   * class like {@code Repository.class} binds every parameterization of it.
   */
  public <T> BindingToSyntax<T> bind(Class<T> service) {
    return bind(service, null);
  }

  /** Declares a new binding for the parameterized type {@code service}. */
  public <T> BindingToSyntax<T> bind(TypeToken<T> service) {
    return bind(service.getType(), null);
  }

  /** Removes existing bindings for {@code service} and declares a new one. */
  public <T> BindingToSyntax<T> rebind(Class<T> service) {
    unbind(service);
    return bind(service);
  }

  public <T> BindingToSyntax<T> rebind(TypeToken<T> service) {
    unbind(service.getType());
    return bind(service);
  }

  /** Removes every binding for {@code service}, including those declared by modules. */
  public void unbind(Class<?> service) {
    unbind((Type) service);
  }

  public void unbind(TypeToken<?> service) {
    unbind(service.getType());
  }

  abstract <T> BindingToSyntax<T> bind(Type service, String owner);

  abstract void unbind(Type service);

  /**
   * Loads {@code modules}, in order.
   *
   * @throws IllegalStateException if a module with the same name is already loaded.
   */
  public abstract void load(Module... modules);

  /** Loads {@code modules}, in order. */
  public abstract void load(Iterable<? extends Module> modules);

  /**
   * Unloads the module named {@code name} and removes the bindings it declared.
   *
   * @throws IllegalArgumentException if no such module is loaded.
   */
  public abstract void unload(String name);

  public abstract boolean hasModule(String name);

  /** Returns the loaded modules, in load order. */
  public abstract List<Module> getModules();

  /**
   * Loads the modules found in the files directly inside {@code path} by the
   * registered module loader plugins. A leading {@code ~} stands for
   * {@link KernelSettings#moduleBaseDirectory()}.
   */
  public abstract void autoLoadModules(String path);

  public abstract void autoLoadModules(Path directory);

  /** Like {@link #autoLoadModules(String)}, also searching every subdirectory. */
  public abstract void autoLoadModulesRecursively(String path);

  public abstract void autoLoadModulesRecursively(Path directory);

  /**
   * Returns an instance of {@code type}.
   *
   * @throws ActivationException if {@code type} cannot be resolved.
   */
  public abstract <T> T get(Class<T> type);

  /** Returns an instance of {@code type} from the binding named {@code name}. */
  public abstract <T> T get(Class<T> type, String name);

  /**
   * Returns an instance of {@code type} from a binding whose metadata
   * satisfies {@code constraint}.
   */
  public abstract <T> T get(Class<T> type, Predicate<BindingMetadata> constraint);

  /** Returns an instance of the parameterized {@code type}. */
  public abstract <T> T get(TypeToken<T> type);

  /** Returns an instance of every binding of {@code type}, in registration order. */
  public abstract <T> List<T> getAll(Class<T> type);

  public abstract <T> List<T> getAll(Class<T> type, String name);

  public abstract <T> List<T> getAll(TypeToken<T> type);

  /** Returns an instance of {@code type}, or null if it cannot be resolved. */
  public abstract <T> T tryGet(Class<T> type);

  public abstract <T> T tryGet(Class<T> type, String name);

  /** Returns true if a request for {@code type} would find a binding. */
  public abstract boolean canResolve(Class<?> type);

  public abstract boolean canResolve(Class<?> type, String name);

  /**
   * Injects the {@code @Inject}-annotated fields of {@code instance},
   * including those inherited from its supertypes.
   */
  public abstract <T> T inject(T instance);
}
