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
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public final class KernelTest {
  private final Kernel kernel = Kernel.create();

  interface Weapon {
    String name();
  }

  static class Sword implements Weapon {
    @Override public String name() {
      return "sword";
    }
  }

  static class Shuriken implements Weapon {
    @Override public String name() {
      return "shuriken";
    }
  }

  static class Knife implements Weapon {
    private final String name;

    Knife(String name) {
      this.name = name;
    }

    @Override public String name() {
      return name;
    }
  }

  interface Warrior {
    Weapon weapon();
  }

  static class Samurai implements Warrior {
    private final Weapon weapon;

    Samurai(Weapon weapon) {
      this.weapon = weapon;
    }

    @Override public Weapon weapon() {
      return weapon;
    }
  }

  static class Ninja implements Warrior {
    private final Weapon weapon;

    @Inject Ninja(Weapon weapon) {
      this.weapon = weapon;
    }

    @Override public Weapon weapon() {
      return weapon;
    }
  }

  @Test public void singleInstanceIsReturnedWhenOneBindingIsRegistered() {
    kernel.bind(Weapon.class).to(Sword.class);

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
  }

  @Test public void firstInstanceIsReturnedWhenMultipleBindingsAreRegistered() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class);

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
  }

  @Test public void dependenciesAreInjectedViaConstructor() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Warrior.class).to(Samurai.class);

    Warrior warrior = kernel.get(Warrior.class);
    assertThat(warrior).isInstanceOf(Samurai.class);
    assertThat(warrior.weapon()).isInstanceOf(Sword.class);
  }

  @Test public void selfBindingResolvesDependencies() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Samurai.class).toSelf();

    assertThat(kernel.get(Samurai.class).weapon()).isInstanceOf(Sword.class);
  }

  @Test public void concreteClassesAreBoundImplicitly() {
    assertThat(kernel.get(Sword.class)).isNotNull();
    assertThat(kernel.canResolve(Sword.class)).isTrue();
    assertThat(kernel.canResolve(Weapon.class)).isFalse();
  }

  @Test public void kernelIsBoundToItself() {
    assertThat(kernel.get(Kernel.class)).isSameInstanceAs(kernel);
  }

  @Test public void namedBindingIsSelectedByName() {
    kernel.bind(Weapon.class).to(Shuriken.class).named("shuriken");
    kernel.bind(Weapon.class).to(Sword.class).named("sword");

    assertThat(kernel.get(Weapon.class, "sword")).isInstanceOf(Sword.class);
    assertThat(kernel.get(Weapon.class, "shuriken")).isInstanceOf(Shuriken.class);
  }

  @Test public void metadataConstraintSelectsBinding() {
    kernel.bind(Weapon.class).to(Shuriken.class).withMetadata("type", "ranged");
    kernel.bind(Weapon.class).to(Sword.class).withMetadata("type", "melee");

    Weapon weapon = kernel.get(Weapon.class, m -> "melee".equals(m.get("type", String.class)));
    assertThat(weapon).isInstanceOf(Sword.class);
  }

  @Test public void constrainedRequestDoesNotFallBackToImplicitBinding() {
    try {
      kernel.get(Sword.class, "sword");
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("No matching bindings are available");
    }
  }

  @Test public void constructorArgumentsAreMatchedByName() {
    kernel.bind(Weapon.class).to(Knife.class).withConstructorArgument("name", "Blunt knife");

    Weapon weapon = kernel.get(Weapon.class);
    assertThat(weapon).isInstanceOf(Knife.class);
    assertThat(weapon.name()).isEqualTo("Blunt knife");
  }

  @Test public void constructorArgumentsAreMatchedByType() {
    kernel.bind(Weapon.class).to(Knife.class).withConstructorArgument(String.class, "Steak knife");

    assertThat(kernel.get(Weapon.class).name()).isEqualTo("Steak knife");
  }

  @Test public void constructorArgumentOfWrongTypeIsRejected() {
    kernel.bind(Weapon.class).to(Knife.class).withConstructorArgument("name", 5);

    try {
      kernel.get(Weapon.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat()
          .contains("has no constructor whose parameters can all be resolved");
      assertThat(expected).hasMessageThat().contains("Activation path:");
    }
  }

  @Test public void constructorArgumentOfWrongTypeForInjectConstructor() {
    kernel.bind(Warrior.class).to(Ninja.class).withConstructorArgument("weapon", "sword");

    try {
      kernel.get(Warrior.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("arguments don't match");
      assertThat(expected).hasMessageThat().contains("Activation path:");
    }
  }

  @Test public void conditionalBindingAppliesToMatchingTarget() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class).whenInjectedInto(Samurai.class);
    kernel.bind(Warrior.class).to(Samurai.class);

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Sword.class);
    assertThat(kernel.get(Warrior.class).weapon()).isInstanceOf(Shuriken.class);
  }

  @Test public void injectedExactlyIntoIgnoresOtherClasses() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class).whenInjectedExactlyInto(Ninja.class);

    assertThat(kernel.get(Ninja.class).weapon()).isInstanceOf(Shuriken.class);
    assertThat(kernel.get(Samurai.class).weapon()).isInstanceOf(Sword.class);
  }

  @Retention(RetentionPolicy.RUNTIME)
  @interface Elite {
  }

  @Elite
  static class EliteSamurai extends Samurai {
    EliteSamurai(Weapon weapon) {
      super(weapon);
    }
  }

  static class Armory {
    @Inject @Elite Weapon special;
    @Inject Weapon standard;
  }

  @Test public void classAnnotationCondition() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class).whenClassHas(Elite.class);

    assertThat(kernel.get(EliteSamurai.class).weapon()).isInstanceOf(Shuriken.class);
    assertThat(kernel.get(Samurai.class).weapon()).isInstanceOf(Sword.class);
  }

  @Test public void targetAnnotationCondition() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class).whenTargetHas(Elite.class);

    Armory armory = kernel.get(Armory.class);
    assertThat(armory.special).isInstanceOf(Shuriken.class);
    assertThat(armory.standard).isInstanceOf(Sword.class);
  }

  interface Generic<T> {
    T value();
  }

  static class GenericService<T> implements Generic<T> {
    @Override public T value() {
      return null;
    }
  }

  static class GenericService2<T> implements Generic<T> {
    @Override public T value() {
      return null;
    }
  }

  static class StringService implements Generic<String> {
    @Override public String value() {
      return "value";
    }
  }

  static class Holder<T> {
    final T value;

    Holder(T value) {
      this.value = value;
    }
  }

  @Test public void openGenericBindingsAreClosedOverTypeArguments() {
    kernel.bind(Generic.class).to(GenericService.class);
    kernel.bind(Generic.class).to(GenericService2.class);

    List<Generic<Integer>> services = kernel.getAll(new TypeToken<Generic<Integer>>() {});
    assertThat(services).hasSize(2);
    assertThat(services.get(0)).isInstanceOf(GenericService.class);
    assertThat(services.get(1)).isInstanceOf(GenericService2.class);
  }

  @Test public void closedGenericBindingPrecedesOpenGenericBinding() {
    kernel.bind(Generic.class).to(GenericService.class);
    kernel.bind(new TypeToken<Generic<String>>() {}).to(StringService.class);

    assertThat(kernel.get(new TypeToken<Generic<String>>() {}))
        .isInstanceOf(StringService.class);
    assertThat(kernel.get(new TypeToken<Generic<Long>>() {}))
        .isInstanceOf(GenericService.class);
  }

  @Test public void openGenericSelfBindingResolvesTypeArgumentDependencies() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Holder.class).toSelf();

    Holder<Weapon> holder = kernel.get(new TypeToken<Holder<Weapon>>() {});
    assertThat(holder.value).isInstanceOf(Sword.class);
  }

  @Test public void getAllReturnsEveryBindingInOrder() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.bind(Weapon.class).to(Shuriken.class);

    List<Weapon> weapons = kernel.getAll(Weapon.class);
    assertThat(weapons).hasSize(2);
    assertThat(weapons.get(0)).isInstanceOf(Sword.class);
    assertThat(weapons.get(1)).isInstanceOf(Shuriken.class);
  }

  @Test public void getAllOfUnboundInterfaceIsEmpty() {
    assertThat(kernel.getAll(Weapon.class)).isEmpty();
  }

  @Test public void transientBindingsCreateNewInstances() {
    kernel.bind(Weapon.class).to(Sword.class);

    assertThat(kernel.get(Weapon.class)).isNotSameInstanceAs(kernel.get(Weapon.class));
  }

  @Test public void singletonBindingsShareOneInstance() {
    kernel.bind(Weapon.class).to(Sword.class).inSingletonScope();

    assertThat(kernel.get(Weapon.class)).isSameInstanceAs(kernel.get(Weapon.class));
  }

  @Singleton
  static class Dojo {
  }

  @Test public void singletonAnnotationImpliesSingletonScope() {
    assertThat(kernel.get(Dojo.class)).isSameInstanceAs(kernel.get(Dojo.class));
  }

  @Test public void constantsAreReturnedAsIs() {
    Sword sword = new Sword();
    kernel.bind(Weapon.class).toInstance(sword);

    assertThat(kernel.get(Weapon.class)).isSameInstanceAs(sword);
  }

  @Test public void threadScopeKeepsOneInstancePerThread() throws Exception {
    kernel.bind(Weapon.class).to(Sword.class).inThreadScope();
    Weapon first = kernel.get(Weapon.class);
    assertThat(kernel.get(Weapon.class)).isSameInstanceAs(first);

    final AtomicReference<Weapon> other = new AtomicReference<Weapon>();
    Thread thread = new Thread(new Runnable() {
      @Override public void run() {
        other.set(kernel.get(Weapon.class));
      }
    });
    thread.start();
    thread.join();
    assertThat(other.get()).isInstanceOf(Sword.class);
    assertThat(other.get()).isNotSameInstanceAs(first);
  }

  @Test public void providerAndMethodBindings() {
    final AtomicInteger count = new AtomicInteger();
    kernel.bind(Weapon.class).toProvider(new Provider<Weapon>() {
      @Override public Weapon get() {
        count.incrementAndGet();
        return new Shuriken();
      }
    });
    kernel.bind(Warrior.class).toMethod(request -> new Samurai(new Sword()));

    assertThat(kernel.get(Weapon.class)).isInstanceOf(Shuriken.class);
    assertThat(count.get()).isEqualTo(1);
    assertThat(kernel.get(Warrior.class).weapon()).isInstanceOf(Sword.class);
  }

  @Test public void activationActionsRunOnNewInstances() {
    final List<Weapon> activated = new ArrayList<Weapon>();
    kernel.bind(Weapon.class).to(Sword.class).inSingletonScope().onActivation(activated::add);

    Weapon weapon = kernel.get(Weapon.class);
    kernel.get(Weapon.class);
    assertThat(activated).containsExactly(weapon);
  }

  static class Quartermaster {
    @Inject Provider<Weapon> weapons;
    @Inject List<Weapon> all;
    @Inject @Named("sword") Weapon sword;
  }

  @Test public void providersListsAndNamedDependenciesAreInjected() {
    kernel.bind(Weapon.class).to(Shuriken.class);
    kernel.bind(Weapon.class).to(Sword.class).named("sword");

    Quartermaster quartermaster = kernel.get(Quartermaster.class);
    assertThat(quartermaster.weapons.get()).isInstanceOf(Shuriken.class);
    assertThat(quartermaster.all).hasSize(2);
    assertThat(quartermaster.sword).isInstanceOf(Sword.class);
  }

  static class Longbow implements Weapon {
    Longbow() {
    }

    Longbow(Warrior archer) {
    }

    @Override public String name() {
      return "longbow";
    }
  }

  @Test public void constructorWithMostSatisfiableParametersIsChosen() {
    kernel.bind(Weapon.class).to(Longbow.class);
    assertThat(kernel.get(Weapon.class)).isInstanceOf(Longbow.class);
  }

  static class Chicken {
    Chicken(Egg egg) {
    }
  }

  static class Egg {
    Egg(Chicken chicken) {
    }
  }

  @Test public void cyclesAreReported() {
    try {
      kernel.get(Chicken.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("Dependency cycle:");
      assertThat(expected).hasMessageThat().contains(Chicken.class.getName());
    }
  }

  @Test public void missingBindingReportsActivationPath() {
    kernel.bind(Warrior.class).to(Ninja.class);
    try {
      kernel.get(Warrior.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("Error activating " + Weapon.class.getName());
      assertThat(expected).hasMessageThat().contains("Activation path:");
      assertThat(expected).hasMessageThat()
          .contains("Request for " + Warrior.class.getName());
    }
  }

  @Test public void tryGetReturnsNullWhenUnresolvable() {
    assertThat(kernel.tryGet(Weapon.class)).isNull();
    kernel.bind(Weapon.class).to(Sword.class);
    assertThat(kernel.tryGet(Weapon.class)).isInstanceOf(Sword.class);
    assertThat(kernel.tryGet(Weapon.class, "missing")).isNull();
  }

  @Test public void unbindAndRebind() {
    kernel.bind(Weapon.class).to(Sword.class);
    kernel.rebind(Weapon.class).to(Shuriken.class);
    assertThat(kernel.getAll(Weapon.class)).hasSize(1);
    assertThat(kernel.get(Weapon.class)).isInstanceOf(Shuriken.class);

    kernel.unbind(Weapon.class);
    assertThat(kernel.canResolve(Weapon.class)).isFalse();
  }

  @Test public void explicitBindingReplacesImplicitBinding() {
    assertThat(kernel.get(Sword.class)).isInstanceOf(Sword.class);
    Sword sword = new Sword();
    kernel.bind(Sword.class).toInstance(sword);
    assertThat(kernel.get(Sword.class)).isSameInstanceAs(sword);
  }

  @Test public void injectPopulatesFieldsOfExistingInstance() {
    kernel.bind(Weapon.class).to(Sword.class);
    Armory armory = kernel.inject(new Armory());

    assertThat(armory.standard).isInstanceOf(Sword.class);
    assertThat(armory.special).isInstanceOf(Sword.class);
  }

  @Test public void bindingToAbstractClassFails() {
    try {
      kernel.bind(Weapon.class).to(Weapon.class);
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  class Inner {
  }

  @Test public void innerClassesAreNotInjectable() {
    try {
      kernel.get(Inner.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("Can't inject inner class");
    }
  }

  class Scabbard {
    @Inject Weapon weapon;
  }

  @Test public void injectIgnoresConstructorsOfExistingInstance() {
    kernel.bind(Weapon.class).to(Sword.class);

    assertThat(kernel.inject(new Inner())).isNotNull();
    assertThat(kernel.inject(new Vault())).isNotNull();
    assertThat(kernel.inject(new Scabbard()).weapon).isInstanceOf(Sword.class);
  }

  static class Vault {
    private Vault() {
    }
  }

  @Test public void privateConstructorsRequireInjectNonPublic() {
    try {
      kernel.get(Vault.class);
      fail();
    } catch (ActivationException expected) {
    }

    Kernel permissive = Kernel.create(KernelSettings.builder().injectNonPublic(true).build());
    assertThat(permissive.get(Vault.class)).isNotNull();
  }

  @Test public void nullsAreRejectedUnlessAllowed() {
    kernel.bind(Weapon.class).toProvider(() -> null);
    try {
      kernel.get(Weapon.class);
      fail();
    } catch (ActivationException expected) {
      assertThat(expected).hasMessageThat().contains("produced null");
    }

    Kernel lenient = Kernel.create(KernelSettings.builder().allowNullInjection(true).build());
    lenient.bind(Weapon.class).toProvider(() -> null);
    assertThat(lenient.get(Samurai.class).weapon()).isNull();
  }
}
