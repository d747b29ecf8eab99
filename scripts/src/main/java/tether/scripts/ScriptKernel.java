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

import tether.Components;
import tether.KernelSettings;
import tether.Module;
import tether.StandardKernel;
import tether.modules.ModuleLoaderPlugin;

/**
 * A kernel that loads binding scripts as well as jars. Unlike a
 * {@link StandardKernel}, it carries a {@link ScriptModuleLoaderPlugin} even
 * when extensions are not loaded.
 */
public class ScriptKernel extends StandardKernel {
  public ScriptKernel(Module... modules) {
    super(modules);
  }

  public ScriptKernel(KernelSettings settings, Module... modules) {
    super(settings, modules);
  }

  @Override protected void addComponents(Components components) {
    super.addComponents(components);
    for (ModuleLoaderPlugin plugin : components.getAll(ModuleLoaderPlugin.class)) {
      if (plugin instanceof ScriptModuleLoaderPlugin) {
        return;
      }
    }
    components.add(ModuleLoaderPlugin.class, new ScriptModuleLoaderPlugin());
  }
}
