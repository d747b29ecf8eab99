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
import com.google.common.reflect.TypeToken;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import tether.internal.Binding;
import tether.internal.BindingBuilder;
import tether.internal.BindingRegistry;
import tether.internal.Keys;
import tether.internal.Resolver;
import tether.modules.JarModuleLoaderPlugin;
import tether.modules.ModuleLoader;
import tether.modules.ModuleLoaderPlugin;
import tether.syntax.BindingToSyntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The standard kernel. It binds {@link Kernel} to itself, and is assembled
 * from a {@link ModuleLoader}, a {@link JarModuleLoaderPlugin} and, unless
 * {@link KernelSettings#loadExtensions()} is off, every
 * {@link ModuleLoaderPlugin} registered with {@link ServiceLoader}.
 */
public class StandardKernel extends Kernel {
  private static final Logger logger = Logger.getLogger(StandardKernel.class.getName());

  private final KernelSettings settings;
  private final BindingRegistry registry = new BindingRegistry();
  private final Resolver resolver;
  private final Components components = new Components();
  private final Map<String, Module> modules = new LinkedHashMap<String, Module>();

  public StandardKernel(Module... modules) {
    this(KernelSettings.defaults(), modules);
  }

  public StandardKernel(KernelSettings settings, Module... modules) {
    this.settings = checkNotNull(settings, "settings");
    this.resolver =
        new Resolver(registry, settings.injectNonPublic(), settings.allowNullInjection());
    addComponents(components);
    bind(Kernel.class).toInstance(this);
    load(modules);
  }

  /**
   * Registers the components this kernel is assembled from. Called once from
   * the constructor; subclasses may add or remove components after calling
   * the superclass implementation.
   */
  protected void addComponents(Components components) {
    components.add(ModuleLoader.class, new ModuleLoader(this));
    components.add(ModuleLoaderPlugin.class, new JarModuleLoaderPlugin());
    if (settings.loadExtensions()) {
      ClassLoader classLoader = StandardKernel.class.getClassLoader();
      for (ModuleLoaderPlugin plugin : ServiceLoader.load(ModuleLoaderPlugin.class, classLoader)) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Registering extension " + plugin.getClass().getName());
        }
        components.add(ModuleLoaderPlugin.class, plugin);
      }
    }
  }

  @Override public KernelSettings settings() {
    return settings;
  }

  @Override public Components components() {
    return components;
  }

  @Override <T> BindingToSyntax<T> bind(Type service, String owner) {
    checkNotNull(service, "service");
    BindingBuilder<T> builder = BindingBuilder.create(service, owner);
    registry.add(builder.binding());
    resolver.forgetImplicitBinding(builder.binding().key);
    return builder;
  }

  @Override void unbind(Type service) {
    checkNotNull(service, "service");
    String key = Keys.get(service);
    for (Binding<?> binding : registry.removeAll(key)) {
      resolver.release(binding);
    }
    resolver.forgetImplicitBinding(key);
  }

  @Override public void load(Module... modules) {
    load(Arrays.asList(modules));
  }

  /**
   * Loads {@code toLoad} in order. If any module fails to load, the modules
   * this call already loaded are unloaded again before the failure propagates.
   */
  @Override public void load(Iterable<? extends Module> toLoad) {
    List<Module> loaded = new ArrayList<Module>();
    try {
      for (Module module : toLoad) {
        checkNotNull(module, "module");
        loadModule(module);
        loaded.add(module);
      }
    } catch (RuntimeException e) {
      for (int i = loaded.size() - 1; i >= 0; i--) {
        rollBack(loaded.get(i), e);
      }
      throw e;
    }
  }

  private void loadModule(Module module) {
    String name = module.name();
    synchronized (modules) {
      if (modules.containsKey(name)) {
        throw new IllegalStateException("A module named " + name + " is already loaded");
      }
      try {
        module.onLoad(this);
      } catch (RuntimeException e) {
        removeBindingsOwnedBy(name);
        throw e;
      }
      modules.put(name, module);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Loaded module " + name);
    }
  }

  private void rollBack(Module module, RuntimeException failure) {
    String name = module.name();
    synchronized (modules) {
      modules.remove(name);
    }
    try {
      module.onUnload();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    } finally {
      removeBindingsOwnedBy(name);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Rolled back module " + name);
    }
  }

  @Override public void unload(String name) {
    Module module;
    synchronized (modules) {
      module = modules.remove(name);
    }
    checkArgument(module != null, "No module named %s is loaded", name);
    try {
      module.onUnload();
    } finally {
      removeBindingsOwnedBy(name);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Unloaded module " + name);
    }
  }

  private void removeBindingsOwnedBy(String owner) {
    for (Binding<?> binding : registry.all()) {
      if (owner.equals(binding.owner) && registry.remove(binding)) {
        resolver.release(binding);
      }
    }
  }

  @Override public boolean hasModule(String name) {
    synchronized (modules) {
      return modules.containsKey(name);
    }
  }

  @Override public List<Module> getModules() {
    synchronized (modules) {
      return ImmutableList.copyOf(modules.values());
    }
  }

  @Override public void autoLoadModules(String path) {
    components.get(ModuleLoader.class).loadModules(path, false);
  }

  @Override public void autoLoadModules(Path directory) {
    components.get(ModuleLoader.class).loadModules(directory, false);
  }

  @Override public void autoLoadModulesRecursively(String path) {
    components.get(ModuleLoader.class).loadModules(path, true);
  }

  @Override public void autoLoadModulesRecursively(Path directory) {
    components.get(ModuleLoader.class).loadModules(directory, true);
  }

  @Override public <T> T get(Class<T> type) {
    return get(type, (Predicate<BindingMetadata>) null);
  }

  @Override public <T> T get(Class<T> type, String name) {
    return get(type, named(name));
  }

  @Override public <T> T get(Class<T> type, Predicate<BindingMetadata> constraint) {
    checkNotNull(type, "type");
    return cast(type, resolver.resolve(Request.create(type, constraint, false)));
  }

  @SuppressWarnings("unchecked") // The resolver only produces instances of the requested type.
  @Override public <T> T get(TypeToken<T> type) {
    checkNotNull(type, "type");
    return (T) resolver.resolve(Request.create(type.getType(), null, false));
  }

  @Override public <T> List<T> getAll(Class<T> type) {
    return getAll(type, (String) null);
  }

  @Override public <T> List<T> getAll(Class<T> type, String name) {
    checkNotNull(type, "type");
    List<Object> instances = resolver.resolveAll(Request.create(type, named(name), false));
    List<T> result = new ArrayList<T>(instances.size());
    for (Object instance : instances) {
      result.add(cast(type, instance));
    }
    return result;
  }

  @SuppressWarnings("unchecked") // The resolver only produces instances of the requested type.
  @Override public <T> List<T> getAll(TypeToken<T> type) {
    checkNotNull(type, "type");
    return (List<T>) (List<?>) resolver.resolveAll(Request.create(type.getType(), null, false));
  }

  @Override public <T> T tryGet(Class<T> type) {
    return tryGet(type, null);
  }

  @Override public <T> T tryGet(Class<T> type, String name) {
    checkNotNull(type, "type");
    return cast(type, resolver.resolve(Request.create(type, named(name), true)));
  }

  @Override public boolean canResolve(Class<?> type) {
    return canResolve(type, null);
  }

  @Override public boolean canResolve(Class<?> type, String name) {
    checkNotNull(type, "type");
    return resolver.canResolve(Request.create(type, named(name), false));
  }

  @Override public <T> T inject(T instance) {
    checkNotNull(instance, "instance");
    resolver.injectMembers(instance);
    return instance;
  }

  /** Returns a constraint accepting bindings named {@code name}, or null if {@code name} is. */
  private static Predicate<BindingMetadata> named(final String name) {
    if (name == null) {
      return null;
    }
    return new Predicate<BindingMetadata>() {
      @Override public boolean test(BindingMetadata metadata) {
        return name.equals(metadata.name());
      }
      @Override public String toString() {
        return "named \"" + name + "\"";
      }
    };
  }

  @SuppressWarnings("unchecked") // Primitive requests produce their boxed type.
  private static <T> T cast(Class<T> type, Object instance) {
    return type.isPrimitive() ? (T) instance : type.cast(instance);
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "[modules=" + getModules().size()
        + ", bindings=" + registry.all().size() + "]";
  }
}
