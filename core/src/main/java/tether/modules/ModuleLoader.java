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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import tether.Kernel;
import tether.Module;
import tether.ModuleLoadException;
import tether.internal.ErrorHandler;
import tether.internal.ThrowingErrorHandler;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Finds module files in a directory and loads the modules that the kernel's
 * {@link ModuleLoaderPlugin}s make of them. Files are visited in path order,
 * so modules load in a stable order.
 */
public final class ModuleLoader {
  private static final Logger logger = Logger.getLogger(ModuleLoader.class.getName());

  private final Kernel kernel;
  private final ErrorHandler errorHandler;

  public ModuleLoader(Kernel kernel) {
    this(kernel, new ThrowingErrorHandler());
  }

  public ModuleLoader(Kernel kernel, ErrorHandler errorHandler) {
    this.kernel = checkNotNull(kernel, "kernel");
    this.errorHandler = checkNotNull(errorHandler, "errorHandler");
  }

  /**
   * Loads the modules under {@code path}, where a leading {@code ~} stands for
   * the kernel's module base directory.
   */
  public void loadModules(String path, boolean recursive) {
    loadModules(expand(path), recursive);
  }

  public void loadModules(Path directory, boolean recursive) {
    checkNotNull(directory, "directory");
    if (!Files.isDirectory(directory)) {
      throw new ModuleLoadException("Module directory " + directory + " does not exist");
    }
    List<Path> files = listFiles(directory, recursive);

    List<Module> found = new ArrayList<Module>();
    List<String> errors = new ArrayList<String>();
    for (ModuleLoaderPlugin plugin : kernel.components().getAll(ModuleLoaderPlugin.class)) {
      List<Path> supported = new ArrayList<Path>();
      for (Path file : files) {
        if (plugin.supports(file)) {
          supported.add(file);
        }
      }
      if (supported.isEmpty()) {
        continue;
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(plugin + " loading " + supported);
      }
      try {
        found.addAll(plugin.loadModules(supported));
      } catch (ModuleLoadException e) {
        errors.add(e.getMessage());
      }
    }
    errorHandler.handleErrors(errors);

    if (found.isEmpty()) {
      logger.fine("No modules found in " + directory);
    }
    kernel.load(found);
  }

  /** Returns {@code path} with a leading {@code ~} replaced by the module base directory. */
  Path expand(String path) {
    checkNotNull(path, "path");
    if (!path.startsWith("~")) {
      return Paths.get(path);
    }
    Path base = kernel.settings().moduleBaseDirectory();
    String rest = path.substring(1);
    while (rest.startsWith("/") || rest.startsWith("\\")) {
      rest = rest.substring(1);
    }
    return rest.isEmpty() ? base : base.resolve(rest);
  }

  private static List<Path> listFiles(Path directory, boolean recursive) {
    try (Stream<Path> paths = Files.walk(directory, recursive ? Integer.MAX_VALUE : 1)) {
      List<Path> files = paths.filter(Files::isRegularFile).collect(Collectors.toList());
      Collections.sort(files);
      return files;
    } catch (IOException e) {
      throw new ModuleLoadException("Unable to list " + directory, e);
    }
  }
}
