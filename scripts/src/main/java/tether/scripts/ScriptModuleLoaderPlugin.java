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
package tether.scripts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import tether.Module;
import tether.internal.ThrowingErrorHandler;
import tether.modules.ModuleLoaderPlugin;

/**
 * Loads binding scripts, by default the files named {@code *.bindings}. Each
 * script becomes one {@link ScriptModule}, named after the script's path.
 * Scripts are read as UTF-8.
 */
public final class ScriptModuleLoaderPlugin extends ModuleLoaderPlugin {
  private static final Logger logger =
      Logger.getLogger(ScriptModuleLoaderPlugin.class.getName());

  private final TypeNameResolver types;

  public ScriptModuleLoaderPlugin() {
    this(defaultClassLoader());
  }

  /** @param classLoader loads the classes that scripts name. */
  public ScriptModuleLoaderPlugin(ClassLoader classLoader) {
    super("*.bindings");
    this.types = new TypeNameResolver(classLoader);
  }

  @Override public List<Module> loadModules(List<Path> files) {
    List<Module> result = new ArrayList<Module>();
    List<String> errors = new ArrayList<String>();
    for (Path file : files) {
      String source = file.toString();
      try {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        result.add(new ScriptModule(BindingScriptParser.parse(source, text), types));
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Parsed binding script " + source);
        }
      } catch (IOException e) {
        errors.add(source + ": " + e);
      } catch (BindingScriptException e) {
        errors.add(e.getMessage());
      }
    }
    new ThrowingErrorHandler("Errors loading binding scripts:").handleErrors(errors);
    return result;
  }

  private static ClassLoader defaultClassLoader() {
    ClassLoader context = Thread.currentThread().getContextClassLoader();
    return context != null ? context : ScriptModuleLoaderPlugin.class.getClassLoader();
  }
}
