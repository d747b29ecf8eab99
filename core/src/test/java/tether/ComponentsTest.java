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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public final class ComponentsTest {
  private final Components components = new Components();

  @Test public void componentsAreReturnedInRegistrationOrder() {
    components.add(CharSequence.class, "first");
    components.add(CharSequence.class, new StringBuilder("second"));

    assertThat(components.get(CharSequence.class)).isEqualTo("first");
    ImmutableList<CharSequence> all = components.getAll(CharSequence.class);
    assertThat(all).hasSize(2);
    assertThat(all.get(1).toString()).isEqualTo("second");
  }

  @Test public void missingComponentFails() {
    assertThat(components.has(Runnable.class)).isFalse();
    assertThat(components.getAll(Runnable.class)).isEmpty();
    try {
      components.get(Runnable.class);
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  @Test public void removeAll() {
    components.add(String.class, "a");
    components.removeAll(String.class);

    assertThat(components.has(String.class)).isFalse();
  }
}
