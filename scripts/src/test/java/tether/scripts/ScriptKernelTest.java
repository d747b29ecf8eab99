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

import com.google.common.reflect.TypeToken;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import tether.Kernel;
import tether.KernelSettings;
import tether.modules.ModuleLoaderPlugin;
import tether.scripts.fakes.Generic;
import tether.scripts.fakes.GenericService;
import tether.scripts.fakes.GenericService2;
import tether.scripts.fakes.Knife;
import tether.scripts.fakes.Samurai;
import tether.scripts.fakes.Shuriken;
import tether.scripts.fakes.Sword;
import tether.scripts.fakes.Warrior;
import tether.scripts.fakes.Weapon;

import static com.google.common.truth.Truth.assertThat;

@RunWith(JUnit4.class)
public final class ScriptKernelTest {
  private Kernel kernel;

  @Before public void setUp() throws URISyntaxException {
    Path scripts = Paths.get(ScriptKernelTest.class.getResource("/scripts").toURI());
    kernel = new ScriptKernel(KernelSettings.builder().moduleBaseDirectory(scripts).build());
  }

  /** Restricts the script plugins to the file {@code name}, then loads the scripts. */
  private void load(String name) {
    for (ModuleLoaderPlugin plugin : kernel.components().getAll(ModuleLoaderPlugin.class)) {
      if (plugin instanceof ScriptModuleLoaderPlugin) {
        plugin.setSupportedPatterns(name);
      }
    }
    kernel.autoLoadModulesRecursively("~");
  }

  @Test public void scriptPluginIsRegisteredOnce() {
    int count = 0;
    for (ModuleLoaderPlugin plugin : kernel.components().getAll(ModuleLoaderPlugin.class)) {
      if (plugin instanceof ScriptModuleLoaderPlugin) {
        count++;
      }
    }
    assertThat(count).isEqualTo(1);
  }

  @Test public void scriptPluginIsPresentWithoutExtensions() {
    Kernel bare = new ScriptKernel(KernelSettings.builder().loadExtensions(false).build());
    List<ModuleLoaderPlugin> plugins = bare.components().getAll(ModuleLoaderPlugin.class);
    assertThat(plugins).hasSize(2);
    assertThat(plugins.get(1)).isInstanceOf(ScriptModuleLoaderPlugin.class);
  }

  @Test public void singleInstanceIsReturnedWhenOneBindingIsRegistered() {
    load("config_single.bindings");

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
  }

  @Test public void firstInstanceIsReturnedWhenMultipleBindingsAreRegistered() {
    load("config_double.bindings");

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
  }

  @Test public void dependenciesAreInjectedViaConstructor() {
    load("config_two_types.bindings");

    Warrior warrior = kernel.get(Warrior.class);
    assertThat(warrior).isInstanceOf(Samurai.class);
    assertThat(warrior.weapon()).isInstanceOf(Sword.class);
  }

  @Test public void selfBindingIsResolved() {
    load("config_to_self.bindings");

    assertThat(kernel.get(Sword.class)).isInstanceOf(Sword.class);
    assertThat(kernel.getModules()).hasSize(1);
  }

  @Test public void selfBindingDependenciesAreInjectedViaConstructor() {
    load("config_two_types_to_self.bindings");

    Samurai samurai = kernel.get(Samurai.class);
    assertThat(samurai.weapon()).isInstanceOf(Sword.class);
  }

  @Test public void genericParametersAreInferred() {
    load("config_open_generics.bindings");

    List<Generic<Integer>> services = kernel.getAll(new TypeToken<Generic<Integer>>() {});
    assertThat(services).hasSize(2);
    assertThat(services.get(0)).isInstanceOf(GenericService.class);
    assertThat(services.get(1)).isInstanceOf(GenericService2.class);
  }

  @Test public void returnsServiceRegisteredViaBindingWithSpecifiedName() {
    load("config_named.bindings");

    assertThat(kernel.get(Weapon.class, "sword")).isInstanceOf(Sword.class);
  }

  @Test public void returnsServiceRegisteredViaBindingThatMatchesPredicate() {
    load("config_metadata.bindings");

    Weapon weapon = kernel.get(Weapon.class, m -> "melee".equals(m.get("type", String.class)));
    assertThat(weapon).isInstanceOf(Sword.class);
    Weapon heavy = kernel.get(Weapon.class, m -> Integer.valueOf(3).equals(m.get("weight")));
    assertThat(heavy).isInstanceOf(Sword.class);
  }

  @Test public void constructorArgumentsAreApplied() {
    load("config_constructor_arguments.bindings");

    Weapon weapon = kernel.get(Weapon.class);
    assertThat(weapon).isInstanceOf(Knife.class);
    assertThat(weapon.name()).isEqualTo("Blunt knife");
  }

  @Test public void constructorArgumentsAreAppliedInBlockForm() {
    load("config_constructor_arguments_dsl.bindings");

    Weapon weapon = kernel.get(Weapon.class);
    assertThat(weapon).isInstanceOf(Knife.class);
    assertThat(weapon.name()).isEqualTo("Blunt knife");
  }

  @Test public void resolvesTheCorrectTypeAccordingToCondition() {
    load("config_when.bindings");

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
    assertThat(kernel.get(Warrior.class).weapon()).isInstanceOf(Shuriken.class);
  }

  @Test public void resolvesTheCorrectTypeAccordingToConditionInBlockForm() {
    load("config_when_dsl.bindings");

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
    Warrior warrior = kernel.get(Warrior.class);
    assertThat(warrior.weapon()).isInstanceOf(Shuriken.class);
    assertThat(kernel.get(Warrior.class)).isSameInstanceAs(warrior);
  }

  @Test public void unloadingScriptRemovesItsBindings() {
    load("config_single.bindings");
    String name = kernel.getModules().get(0).name();
    assertThat(name).endsWith("config_single.bindings");

    kernel.unload(name);

    assertThat(kernel.canResolve(Weapon.class)).isFalse();
  }
}
