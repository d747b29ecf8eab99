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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public final class BindingMetadataTest {
  @Test public void valuesAreKeptInInsertionOrder() {
    BindingMetadata metadata = new BindingMetadata();
    metadata.setName("sword");
    metadata.set("type", "melee");
    metadata.set("weight", 3);

    assertThat(metadata.name()).isEqualTo("sword");
    assertThat(metadata.has("type")).isTrue();
    assertThat(metadata.has("color")).isFalse();
    assertThat(metadata.asMap()).containsExactly("type", "melee", "weight", 3).inOrder();
    assertThat(metadata.get("weight", Integer.class)).isEqualTo(3);
    assertThat(metadata.get("color", String.class)).isNull();
  }

  @Test public void typedGetRejectsOtherTypes() {
    BindingMetadata metadata = new BindingMetadata();
    metadata.set("weight", 3);
    try {
      metadata.get("weight", String.class);
      fail();
    } catch (ClassCastException expected) {
      assertThat(expected).hasMessageThat().contains("weight");
    }
  }
}
