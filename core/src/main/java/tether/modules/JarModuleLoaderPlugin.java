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
package tether.modules;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Level;
import java.util.logging.Logger;
import tether.Module;
import tether.internal.ThrowingErrorHandler;

/**
 * Loads the modules packaged in jar files. A jar lists its modules in
 * {@code META-INF/services/tether.Module}, one class name per line, and each
 * listed class must have a public no-arguments constructor.
 *
 * <p>Each jar gets its own class loader, a child of the loader that loaded
 * this plugin. It stays open for as long as the jar's modules are in use,
 * and is closed at once when the jar yields no module.
 */
public final class JarModuleLoaderPlugin extends ModuleLoaderPlugin {
  private static final Logger logger = Logger.getLogger(JarModuleLoaderPlugin.class.getName());

  static final String SERVICES_ENTRY = "META-INF/services/" + Module.class.getName();

  private final ClassLoader parent;

  public JarModuleLoaderPlugin() {
    this(JarModuleLoaderPlugin.class.getClassLoader());
  }

  public JarModuleLoaderPlugin(ClassLoader parent) {
    super("*.jar");
    this.parent = parent;
  }

  @Override public List<Module> loadModules(List<Path> files) {
    List<Module> result = new ArrayList<Module>();
    List<String> errors = new ArrayList<String>();
    List<URLClassLoader> loaders = new ArrayList<URLClassLoader>();
    List<URLClassLoader> unused = new ArrayList<URLClassLoader>();
    for (Path jar : files) {
      List<String> classNames;
      try {
        classNames = readModuleClassNames(jar);
      } catch (IOException e) {
        errors.add(jar + ": " + e);
        continue;
      }
      if (classNames.isEmpty()) {
        logger.fine(jar + " declares no modules");
        continue;
      }
      URLClassLoader loader;
      try {
        loader = new URLClassLoader(new URL[] { jar.toUri().toURL() }, parent);
      } catch (IOException e) {
        errors.add(jar + ": " + e);
        continue;
      }
      loaders.add(loader);
      int found = 0;
      for (String className : classNames) {
        try {
          result.add(instantiate(loader, className));
          found++;
          if (logger.isLoggable(Level.FINE)) {
            logger.fine("Found module " + className + " in " + jar);
          }
        } catch (ReflectiveOperationException e) {
          errors.add(jar + ": failed to instantiate " + className + ": " + e);
        } catch (LinkageError e) {
          errors.add(jar + ": failed to load " + className + ": " + e);
        } catch (ClassCastException e) {
          errors.add(jar + ": " + className + " is not a " + Module.class.getName());
        }
      }
      if (found == 0) {
        unused.add(loader);
      }
    }
    // A failed call returns no modules, so none of its loaders stay in use.
    close(errors.isEmpty() ? unused : loaders);
    new ThrowingErrorHandler("Errors loading jar modules:").handleErrors(errors);
    return result;
  }

  private static void close(List<URLClassLoader> loaders) {
    for (URLClassLoader loader : loaders) {
      try {
        loader.close();
      } catch (IOException e) {
        logger.log(Level.WARNING, "Unable to close " + loader, e);
      }
    }
  }

  private static Module instantiate(ClassLoader loader, String className)
      throws ReflectiveOperationException {
    Class<? extends Module> moduleClass =
        Class.forName(className, true, loader).asSubclass(Module.class);
    return moduleClass.getConstructor().newInstance();
  }

  /** Returns the module class names listed in {@code jar}'s services entry. */
  static List<String> readModuleClassNames(Path jar) throws IOException {
    List<String> result = new ArrayList<String>();
    try (JarFile jarFile = new JarFile(jar.toFile())) {
      JarEntry entry = jarFile.getJarEntry(SERVICES_ENTRY);
      if (entry == null) {
        return result;
      }
      try (InputStream in = jarFile.getInputStream(entry);
          BufferedReader reader =
              new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        for (String line; (line = reader.readLine()) != null; ) {
          int comment = line.indexOf('#');
          if (comment != -1) {
            line = line.substring(0, comment);
          }
          line = line.trim();
          if (!line.isEmpty()) {
            result.add(line);
          }
        }
      }
    }
    return result;
  }
}
